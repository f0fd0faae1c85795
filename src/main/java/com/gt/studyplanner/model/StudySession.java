package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * One scheduled block of study. slotId stays the same across revisions of a session, id is unique per revision.
 * cognitiveLoad and overloaded are derived from the tasks and the rest of the day's sessions when the session is
 * built; see {@link com.gt.studyplanner.plan.CognitiveLoadEstimator}.
 */
public record StudySession(String id,
                           String slotId,
                           int revision,
                           int weekNumber,
                           LocalDate date,
                           LocalTime startTime,
                           int durationMinutes,
                           String focus,
                           List<StudyTask> tasks,
                           double cognitiveLoad,
                           boolean overloaded,
                           SessionStatus status) {

    public static String revisionId(String slotId, int revision) {
        return revision == 0 ? slotId : slotId + "-r" + revision;
    }

    @JsonIgnore
    public boolean isOpen() {
        return status == SessionStatus.Scheduled;
    }

    public StudySession withStatus(SessionStatus newStatus) {
        return new StudySession(id, slotId, revision, weekNumber, date, startTime, durationMinutes, focus, tasks,
                cognitiveLoad, overloaded, newStatus);
    }

    public StudySession withOverloaded(boolean newOverloaded) {
        return new StudySession(id, slotId, revision, weekNumber, date, startTime, durationMinutes, focus, tasks,
                cognitiveLoad, newOverloaded, status);
    }
}
