package com.gt.studyplanner.model;

public record StudyParameters(double dailyHours,
                              int sessionLengthMinutes,
                              int sessionsPerDay,
                              int studyDaysPerWeek,
                              DifficultyAdaptation difficultyAdaptation,
                              int reviewFrequencyDays,
                              int breakFrequencyMinutes) {

    public double weeklyHours() {
        return dailyHours * studyDaysPerWeek;
    }

    public StudyParameters withDifficultyAdaptation(DifficultyAdaptation newDifficultyAdaptation) {
        return new StudyParameters(dailyHours, sessionLengthMinutes, sessionsPerDay, studyDaysPerWeek,
                newDifficultyAdaptation, reviewFrequencyDays, breakFrequencyMinutes);
    }

    public StudyParameters withReviewFrequencyDays(int newReviewFrequencyDays) {
        return new StudyParameters(dailyHours, sessionLengthMinutes, sessionsPerDay, studyDaysPerWeek,
                difficultyAdaptation, newReviewFrequencyDays, breakFrequencyMinutes);
    }

    public StudyParameters withSessionLengthMinutes(int newSessionLengthMinutes) {
        return new StudyParameters(dailyHours, newSessionLengthMinutes, sessionsPerDay, studyDaysPerWeek,
                difficultyAdaptation, reviewFrequencyDays, breakFrequencyMinutes);
    }
}
