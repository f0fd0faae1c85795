package com.gt.studyplanner.plan;

import com.gt.studyplanner.analysis.PerformanceAnalyzer;
import com.gt.studyplanner.model.AdaptationType;
import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.OverrideType;
import com.gt.studyplanner.model.PerformanceSnapshot;
import com.gt.studyplanner.model.PlanAdaptation;
import com.gt.studyplanner.model.SessionStatus;
import com.gt.studyplanner.model.StudyPlan;
import com.gt.studyplanner.model.StudySession;
import com.gt.studyplanner.model.StudyTask;
import com.gt.studyplanner.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Adjusts an active plan's remaining sessions to a fresh performance snapshot.
 *
 * <p>Score changes are measured against the snapshot the plan was generated from. Every trigger fires on the pass
 * where its condition starts to hold, not on every pass it keeps holding. Only open sessions dated today or later are touched; each change supersedes the old revision.
 * Fields pinned by a manual override are left alone.
 */
@Component
public class PlanAdapter {

    private static final Logger log = LoggerFactory.getLogger(PlanAdapter.class);

    static final double SCORE_CHANGE_THRESHOLD = 15;
    static final double LOW_COMPLETION_RATE = 70;
    static final double LOW_VELOCITY = 0.5;

    private static final int MIN_SESSION_MINUTES = 15;
    private static final int MIN_TASK_MINUTES = 5;
    private static final int MAX_SESSION_MINUTES = 180;
    private static final int CHALLENGE_TASK_MINUTES = 15;
    private static final int REVIEW_SESSION_MINUTES = 20;
    private static final int REVIEW_SESSION_BREAK_MINUTES = 15;
    private static final int SESSIONS_PER_REVIEW = 3;

    public static final String REVIEW_SLOT_SUFFIX = "-review";

    private final PerformanceAnalyzer performanceAnalyzer;
    private final CognitiveLoadEstimator cognitiveLoadEstimator;

    @Autowired
    public PlanAdapter(PerformanceAnalyzer performanceAnalyzer, CognitiveLoadEstimator cognitiveLoadEstimator) {
        this.performanceAnalyzer = performanceAnalyzer;
        this.cognitiveLoadEstimator = cognitiveLoadEstimator;
    }

    public AdaptedPlan adapt(StudyPlan plan, PerformanceSnapshot snapshot, Instant now) {
        if (!plan.isActive() || snapshot.sameSignalsAs(plan.lastEvaluatedSnapshot())) {
            return AdaptedPlan.unchanged(plan);
        }

        List<AdaptationType> triggered = triggeredAdaptations(plan, snapshot);
        PlanState state = new PlanState(plan.sessions(), plan.supersededSessions());
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);

        List<PlanAdaptation> applied = new ArrayList<>();
        for (AdaptationType type : triggered) {
            PlanAdaptation adaptation = apply(type, state, today, now);
            if (!adaptation.newSessionIds().isEmpty()) {
                applied.add(adaptation);
            }
        }

        List<StudySession> sessions = cognitiveLoadEstimator.flagOverloadedDays(state.sessions);

        List<PlanAdaptation> history = new ArrayList<>(plan.adaptationHistory());
        history.addAll(applied);

        if (!applied.isEmpty()) {
            log.info("Adapted plan {}: {}", plan.id(), applied.stream().map(adaptation -> adaptation.type().getWireName()).toList());
        }

        StudyPlan adapted = new StudyPlan(plan.id(), plan.learnerId(), plan.courseId(), plan.planType(), plan.status(),
                plan.startDate(), plan.endDate(), plan.totalWeeks(), plan.parameters(),
                sessions, state.superseded, history, plan.overrides(),
                plan.baselineSnapshot(), snapshot, plan.createdAt(), now, plan.version());

        return new AdaptedPlan(adapted, applied, true);
    }

    List<AdaptationType> triggeredAdaptations(StudyPlan plan, PerformanceSnapshot snapshot) {
        PerformanceSnapshot previous = plan.lastEvaluatedSnapshot();
        PerformanceSnapshot baseline = plan.baselineSnapshot();

        boolean difficultyPinned = hasOverride(plan, OverrideType.DifficultyAdjustment);
        boolean reviewFrequencyPinned = hasOverride(plan, OverrideType.ReviewFrequency);

        List<AdaptationType> triggered = new ArrayList<>();

        AdaptationType scoreAdaptation = scoreAdaptation(baseline, snapshot);
        if (!difficultyPinned && scoreAdaptation != null && scoreAdaptation != scoreAdaptation(baseline, previous)) {
            triggered.add(scoreAdaptation);
        }

        if (lowCompletion(snapshot) && !lowCompletion(previous)) {
            triggered.add(AdaptationType.ReduceSessionLength);
        }

        if (!reviewFrequencyPinned && lowVelocity(snapshot) && !lowVelocity(previous)) {
            triggered.add(AdaptationType.AddReviewSessions);
        }

        return triggered;
    }

    private AdaptationType scoreAdaptation(PerformanceSnapshot baseline, PerformanceSnapshot snapshot) {
        if (baseline == null || baseline.isEmpty() || snapshot == null || snapshot.isEmpty()) {
            return null;
        }

        double scoreChange = performanceAnalyzer.overallScore(snapshot) - performanceAnalyzer.overallScore(baseline);
        if (scoreChange < -SCORE_CHANGE_THRESHOLD) {
            return AdaptationType.ReduceDifficulty;
        } else if (scoreChange > SCORE_CHANGE_THRESHOLD) {
            return AdaptationType.IncreaseChallenge;
        }
        return null;
    }

    private static boolean lowCompletion(PerformanceSnapshot snapshot) {
        return snapshot != null && snapshot.hasSessionData() && snapshot.completionRate() < LOW_COMPLETION_RATE;
    }

    private static boolean lowVelocity(PerformanceSnapshot snapshot) {
        return snapshot != null && snapshot.hasProgressData() && snapshot.learningVelocity() < LOW_VELOCITY;
    }

    private static boolean hasOverride(StudyPlan plan, OverrideType type) {
        return plan.overrides().stream().anyMatch(override -> override.type() == type);
    }

    private PlanAdaptation apply(AdaptationType type, PlanState state, LocalDate today, Instant now) {
        switch (type) {
            case ReduceDifficulty:
                return reviseEach(state, today, now, type, "Performance dropped more than 15 points",
                        session -> cognitiveLoadEstimator.revise(session, session.date(), session.startTime(),
                                Math.max(MIN_SESSION_MINUTES, (int) (session.durationMinutes() * 0.75)),
                                session.tasks().stream()
                                        .map(task -> task.withDurationMinutes(Math.max(MIN_TASK_MINUTES, (int) (task.durationMinutes() * 0.75))))
                                        .map(task -> task.difficulty() == Difficulty.Hard ? task.asOptional() : task)
                                        .toList()));
            case IncreaseChallenge:
                return reviseEach(state, today, now, type, "Performance rose more than 15 points",
                        session -> {
                            List<StudyTask> tasks = new ArrayList<>(session.tasks());
                            tasks.add(new StudyTask(firstTopicId(session), "Challenge: " + session.focus(),
                                    TaskType.Challenge, Difficulty.Hard, CHALLENGE_TASK_MINUTES, true));
                            return cognitiveLoadEstimator.revise(session, session.date(), session.startTime(),
                                    Math.min(MAX_SESSION_MINUTES, (int) Math.round(session.durationMinutes() * 1.25)), tasks);
                        });
            case ReduceSessionLength:
                return reviseEach(state, today, now, type, "Session completion rate fell below 70%",
                        session -> cognitiveLoadEstimator.revise(session, session.date(), session.startTime(),
                                Math.max(MIN_SESSION_MINUTES, (int) (session.durationMinutes() * 0.7)),
                                session.tasks().stream()
                                        .map(task -> task.withDurationMinutes(Math.max(MIN_TASK_MINUTES, (int) (task.durationMinutes() * 0.7))))
                                        .toList()));
            case AddReviewSessions:
                return addReviewSessions(state, today, now);
            default:
                throw new IllegalArgumentException("Unknown adaptation type " + type);
        }
    }

    private static PlanAdaptation reviseEach(PlanState state, LocalDate today, Instant now, AdaptationType type,
                                             String reason, Function<StudySession, StudySession> revise) {
        List<String> supersededIds = new ArrayList<>();
        List<String> newIds = new ArrayList<>();

        List<StudySession> sessions = new ArrayList<>(state.sessions.size());
        for (StudySession session : state.sessions) {
            if (adaptable(session, today)) {
                StudySession revised = revise.apply(session);
                state.superseded.add(session.withStatus(SessionStatus.Superseded));
                supersededIds.add(session.id());
                newIds.add(revised.id());
                sessions.add(revised);
            } else {
                sessions.add(session);
            }
        }
        state.sessions = sessions;

        return new PlanAdaptation(type, reason, now, supersededIds, newIds);
    }

    private PlanAdaptation addReviewSessions(PlanState state, LocalDate today, Instant now) {
        Set<String> existingSlots = new HashSet<>();
        state.sessions.forEach(session -> existingSlots.add(session.slotId()));
        state.superseded.forEach(session -> existingSlots.add(session.slotId()));

        List<StudySession> ordered = state.sessions.stream()
                .filter(session -> adaptable(session, today) && !session.slotId().endsWith(REVIEW_SLOT_SUFFIX))
                .sorted(sessionOrder())
                .toList();

        List<StudySession> added = new ArrayList<>();
        for (int i = SESSIONS_PER_REVIEW - 1; i < ordered.size(); i += SESSIONS_PER_REVIEW) {
            StudySession anchor = ordered.get(i);
            String slotId = anchor.slotId() + REVIEW_SLOT_SUFFIX;

            int start = anchor.startTime().toSecondOfDay() / 60 + anchor.durationMinutes() + REVIEW_SESSION_BREAK_MINUTES;
            if (existingSlots.contains(slotId) || start + REVIEW_SESSION_MINUTES >= 24 * 60) {
                continue;
            }

            StudyTask review = new StudyTask(firstTopicId(anchor), "Review: " + anchor.focus(), TaskType.Review,
                    Difficulty.Easy, REVIEW_SESSION_MINUTES, false);
            added.add(cognitiveLoadEstimator.newSession(slotId, anchor.weekNumber(), anchor.date(),
                    LocalTime.of(start / 60, start % 60), REVIEW_SESSION_MINUTES, "Review: " + anchor.focus(), List.of(review)));
        }

        List<StudySession> sessions = new ArrayList<>(state.sessions);
        sessions.addAll(added);
        sessions.sort(sessionOrder());
        state.sessions = sessions;

        return new PlanAdaptation(AdaptationType.AddReviewSessions, "Learning velocity fell below 0.5 topics per week",
                now, List.of(), added.stream().map(StudySession::id).toList());
    }

    private static boolean adaptable(StudySession session, LocalDate today) {
        return session.isOpen() && !session.date().isBefore(today);
    }

    private static String firstTopicId(StudySession session) {
        return session.tasks().isEmpty() ? null : session.tasks().get(0).topicId();
    }

    static Comparator<StudySession> sessionOrder() {
        return Comparator.comparing(StudySession::date).thenComparing(StudySession::startTime).thenComparing(StudySession::slotId);
    }

    private static class PlanState {
        private List<StudySession> sessions;
        private final List<StudySession> superseded;

        private PlanState(List<StudySession> sessions, List<StudySession> superseded) {
            this.sessions = new ArrayList<>(sessions);
            this.superseded = new ArrayList<>(superseded);
        }
    }

    public record AdaptedPlan(StudyPlan plan, List<PlanAdaptation> adaptations, boolean changed) {

        static AdaptedPlan unchanged(StudyPlan plan) {
            return new AdaptedPlan(plan, List.of(), false);
        }
    }
}
