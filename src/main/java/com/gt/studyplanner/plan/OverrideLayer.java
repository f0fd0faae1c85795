package com.gt.studyplanner.plan;

import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.DifficultyAdaptation;
import com.gt.studyplanner.model.OverrideResult;
import com.gt.studyplanner.model.OverrideType;
import com.gt.studyplanner.model.PlanOverride;
import com.gt.studyplanner.model.SessionStatus;
import com.gt.studyplanner.model.StudyParameters;
import com.gt.studyplanner.model.StudyPlan;
import com.gt.studyplanner.model.StudySession;
import com.gt.studyplanner.model.StudyTask;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies manual overrides to a plan. Each accepted override is kept on the plan as its own record. Malformed
 * requests (missing the data their type needs) are rejected with an IllegalArgumentException; well formed requests
 * that cannot be honored come back with accepted = false.
 */
@Component
public class OverrideLayer {

    static final int MAX_DIFFICULTY_ADJUSTMENT = 2;
    static final int MAX_REVIEW_FREQUENCY_DAYS = 30;

    private final CognitiveLoadEstimator cognitiveLoadEstimator;

    @Autowired
    public OverrideLayer(CognitiveLoadEstimator cognitiveLoadEstimator) {
        this.cognitiveLoadEstimator = cognitiveLoadEstimator;
    }

    public OverrideOutcome apply(StudyPlan plan, OverrideType type, OverrideRequest request, String overrideId, Instant now) {
        validate(type, request);

        if (!plan.isActive()) {
            return OverrideOutcome.rejected(plan, "Plan " + plan.id() + " is " + plan.status().getWireName());
        }

        switch (type) {
            case Schedule:
                return moveSession(plan, request, overrideId, now);
            case DifficultyAdjustment:
                return adjustDifficulty(plan, request, overrideId, now);
            case ReviewFrequency:
                return setReviewFrequency(plan, request, overrideId, now);
            default:
                throw new IllegalArgumentException("Unsupported override type " + type);
        }
    }

    private static void validate(OverrideType type, OverrideRequest request) {
        if (type == null || request == null) {
            throw new IllegalArgumentException("Override type and data are required");
        }

        switch (type) {
            case Schedule:
                if (request.sessionId() == null || request.sessionId().isBlank()
                        || (request.newDate() == null && request.newTime() == null)) {
                    throw new IllegalArgumentException("A schedule override needs a session id and a new date or time");
                }
                break;
            case DifficultyAdjustment:
                if (request.difficultyAdjustment() == null) {
                    throw new IllegalArgumentException("A difficulty override needs a difficulty adjustment");
                }
                break;
            case ReviewFrequency:
                if (request.reviewFrequencyDays() == null) {
                    throw new IllegalArgumentException("A review frequency override needs a frequency in days");
                }
                break;
            default:
                break;
        }
    }

    private OverrideOutcome moveSession(StudyPlan plan, OverrideRequest request, String overrideId, Instant now) {
        Optional<StudySession> found = plan.sessions().stream()
                .filter(session -> session.id().equals(request.sessionId()) || session.slotId().equals(request.sessionId()))
                .findFirst();
        if (found.isEmpty()) {
            return OverrideOutcome.rejected(plan, "Session " + request.sessionId() + " is not part of plan " + plan.id());
        }

        StudySession session = found.get();
        if (!session.isOpen()) {
            return OverrideOutcome.rejected(plan, "Session " + session.id() + " is already " + session.status().getWireName());
        }

        LocalDate newDate = request.newDate() != null ? request.newDate() : session.date();
        LocalTime newTime = request.newTime() != null ? request.newTime() : session.startTime();
        if (newDate.isBefore(LocalDate.ofInstant(now, ZoneOffset.UTC))) {
            return OverrideOutcome.rejected(plan, "Sessions cannot be moved into the past");
        }
        if (newDate.isAfter(plan.endDate())) {
            return OverrideOutcome.rejected(plan, "Sessions cannot be moved past the plan end date " + plan.endDate());
        }
        if (newTime.toSecondOfDay() / 60 + session.durationMinutes() >= 24 * 60) {
            return OverrideOutcome.rejected(plan, "Session would run past midnight");
        }

        StudySession moved = cognitiveLoadEstimator.revise(session, newDate, newTime, session.durationMinutes(), session.tasks());

        List<StudySession> sessions = new ArrayList<>(plan.sessions());
        sessions.set(sessions.indexOf(session), moved);
        sessions.sort(PlanAdapter.sessionOrder());

        List<StudySession> superseded = new ArrayList<>(plan.supersededSessions());
        superseded.add(session.withStatus(SessionStatus.Superseded));

        PlanOverride override = PlanOverride.schedule(overrideId, session.slotId(), newDate, newTime, request.reason(), now);
        StudyPlan updated = withOverride(plan, plan.parameters(), cognitiveLoadEstimator.flagOverloadedDays(sessions), superseded, override, now);

        return OverrideOutcome.accepted(updated, override, "Session " + session.slotId() + " moved to " + newDate + " " + newTime);
    }

    private OverrideOutcome adjustDifficulty(StudyPlan plan, OverrideRequest request, String overrideId, Instant now) {
        int adjustment = request.difficultyAdjustment();
        if (Math.abs(adjustment) > MAX_DIFFICULTY_ADJUSTMENT) {
            return OverrideOutcome.rejected(plan, "Difficulty adjustment must be between -2 and 2");
        }

        DifficultyAdaptation difficultyAdaptation;
        if (adjustment < 0) {
            difficultyAdaptation = DifficultyAdaptation.Easier;
        } else if (adjustment > 0) {
            difficultyAdaptation = DifficultyAdaptation.Harder;
        } else {
            difficultyAdaptation = DifficultyAdaptation.Maintain;
        }

        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        List<StudySession> sessions = new ArrayList<>(plan.sessions().size());
        List<StudySession> superseded = new ArrayList<>(plan.supersededSessions());
        for (StudySession session : plan.sessions()) {
            if (adjustment != 0 && session.isOpen() && !session.date().isBefore(today)) {
                List<StudyTask> tasks = session.tasks().stream()
                        .map(task -> new StudyTask(task.topicId(), task.title(), task.type(),
                                shift(task.difficulty(), adjustment), task.durationMinutes(), task.optional()))
                        .toList();
                sessions.add(cognitiveLoadEstimator.revise(session, session.date(), session.startTime(), session.durationMinutes(), tasks));
                superseded.add(session.withStatus(SessionStatus.Superseded));
            } else {
                sessions.add(session);
            }
        }

        PlanOverride override = PlanOverride.difficulty(overrideId, adjustment, request.reason(), now);
        StudyPlan updated = withOverride(plan, plan.parameters().withDifficultyAdaptation(difficultyAdaptation),
                cognitiveLoadEstimator.flagOverloadedDays(sessions), superseded, override, now);

        return OverrideOutcome.accepted(updated, override, "Difficulty set to " + difficultyAdaptation.getWireName());
    }

    private OverrideOutcome setReviewFrequency(StudyPlan plan, OverrideRequest request, String overrideId, Instant now) {
        int frequencyDays = request.reviewFrequencyDays();
        if (frequencyDays < 1 || frequencyDays > MAX_REVIEW_FREQUENCY_DAYS) {
            return OverrideOutcome.rejected(plan, "Review frequency must be between 1 and " + MAX_REVIEW_FREQUENCY_DAYS + " days");
        }

        PlanOverride override = PlanOverride.reviewFrequency(overrideId, frequencyDays, request.reason(), now);
        StudyParameters parameters = plan.parameters().withReviewFrequencyDays(frequencyDays);
        StudyPlan updated = withOverride(plan, parameters, plan.sessions(), plan.supersededSessions(), override, now);

        return OverrideOutcome.accepted(updated, override, "Review frequency set to every " + frequencyDays + " days");
    }

    static Difficulty shift(Difficulty difficulty, int steps) {
        Difficulty[] levels = Difficulty.values();
        int current = difficulty != null ? difficulty.ordinal() : Difficulty.Medium.ordinal();
        return levels[Math.max(0, Math.min(levels.length - 1, current + steps))];
    }

    private static StudyPlan withOverride(StudyPlan plan, StudyParameters parameters, List<StudySession> sessions,
                                          List<StudySession> superseded, PlanOverride override, Instant now) {
        List<PlanOverride> overrides = new ArrayList<>(plan.overrides());
        overrides.add(override);

        return new StudyPlan(plan.id(), plan.learnerId(), plan.courseId(), plan.planType(), plan.status(),
                plan.startDate(), plan.endDate(), plan.totalWeeks(), parameters,
                sessions, superseded, plan.adaptationHistory(), overrides,
                plan.baselineSnapshot(), plan.lastEvaluatedSnapshot(), plan.createdAt(), now, plan.version());
    }

    public record OverrideOutcome(StudyPlan plan, OverrideResult result) {

        static OverrideOutcome accepted(StudyPlan plan, PlanOverride override, String message) {
            return new OverrideOutcome(plan, new OverrideResult(true, message, override));
        }

        static OverrideOutcome rejected(StudyPlan plan, String message) {
            return new OverrideOutcome(plan, OverrideResult.rejected(message));
        }
    }
}
