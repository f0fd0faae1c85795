package com.gt.studyplanner.plan;

import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.LoadDistribution;
import com.gt.studyplanner.model.SessionStatus;
import com.gt.studyplanner.model.StudySession;
import com.gt.studyplanner.model.StudyTask;
import com.gt.studyplanner.model.TaskType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds study sessions and keeps their cognitive load current. A session's load is the weighted task time
 * relative to fullLoadHours of plain medium work, on a 0-100 scale. Every session of a day whose summed load passes
 * the daily ceiling is flagged as overloaded.
 */
@Component
public class CognitiveLoadEstimator {

    private final double fullLoadHours;
    private final double dailyLoadCeiling;

    public CognitiveLoadEstimator(@Value("${planner.plan.fullLoadHours:3.0}") double fullLoadHours,
                                  @Value("${planner.plan.dailyLoadCeiling:85}") double dailyLoadCeiling) {
        this.fullLoadHours = fullLoadHours;
        this.dailyLoadCeiling = dailyLoadCeiling;
    }

    public double estimate(List<StudyTask> tasks) {
        double weightedHours = 0;
        for (StudyTask task : tasks) {
            weightedHours += task.durationMinutes() / 60.0 * difficultyMultiplier(task.difficulty()) * typeMultiplier(task.type());
        }

        double load = weightedHours / fullLoadHours * 100;
        return Math.round(Math.min(100, load) * 10) / 10.0;
    }

    public StudySession newSession(String slotId, int weekNumber, LocalDate date, LocalTime startTime,
                                   int durationMinutes, String focus, List<StudyTask> tasks) {
        return new StudySession(slotId, slotId, 0, weekNumber, date, startTime, durationMinutes, focus,
                List.copyOf(tasks), estimate(tasks), false, SessionStatus.Scheduled);
    }

    // Next revision of an open session; the previous revision is left for the caller to supersede
    public StudySession revise(StudySession previous, LocalDate date, LocalTime startTime, int durationMinutes, List<StudyTask> tasks) {
        int revision = previous.revision() + 1;
        return new StudySession(StudySession.revisionId(previous.slotId(), revision), previous.slotId(), revision,
                previous.weekNumber(), date, startTime, durationMinutes, previous.focus(), List.copyOf(tasks),
                estimate(tasks), false, SessionStatus.Scheduled);
    }

    /**
     * Recomputes the overloaded flag of every session. Only open sessions count towards a day's load.
     */
    public List<StudySession> flagOverloadedDays(List<StudySession> sessions) {
        Map<LocalDate, Double> dailyLoads = dailyLoads(sessions);

        List<StudySession> flagged = new ArrayList<>(sessions.size());
        for (StudySession session : sessions) {
            boolean overloaded = session.isOpen() && dailyLoads.getOrDefault(session.date(), 0.0) > dailyLoadCeiling;
            flagged.add(session.overloaded() == overloaded ? session : session.withOverloaded(overloaded));
        }
        return flagged;
    }

    public LoadDistribution loadDistribution(List<StudySession> sessions) {
        Map<LocalDate, Double> dailyLoads = dailyLoads(sessions);
        if (dailyLoads.isEmpty()) {
            return new LoadDistribution(0, 0, 0, 0);
        }

        double total = 0;
        double max = 0;
        double min = Double.MAX_VALUE;
        int overloadedDays = 0;
        for (double load : dailyLoads.values()) {
            total += load;
            max = Math.max(max, load);
            min = Math.min(min, load);
            if (load > dailyLoadCeiling) {
                overloadedDays++;
            }
        }

        return new LoadDistribution(round(total / dailyLoads.size()), round(max), round(min), overloadedDays);
    }

    Map<LocalDate, Double> dailyLoads(List<StudySession> sessions) {
        Map<LocalDate, Double> dailyLoads = new TreeMap<>();
        for (StudySession session : sessions) {
            if (session.isOpen()) {
                dailyLoads.merge(session.date(), session.cognitiveLoad(), Double::sum);
            }
        }
        return dailyLoads;
    }

    static double difficultyMultiplier(Difficulty difficulty) {
        if (difficulty == null) {
            return 1.0;
        }

        switch (difficulty) {
            case Easy:
                return 0.8;
            case Hard:
                return 1.3;
            case Medium:
            default:
                return 1.0;
        }
    }

    static double typeMultiplier(TaskType type) {
        if (type == null) {
            return 1.0;
        }

        switch (type) {
            case Reading:
                return 0.9;
            case Practice:
                return 1.1;
            case Quiz:
                return 1.2;
            case Project:
                return 1.4;
            case Review:
            case Challenge:
            default:
                return 1.0;
        }
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
