package com.gt.studyplanner.plan;

import com.gt.studyplanner.analysis.PerformanceAnalyzer;
import com.gt.studyplanner.course.CourseDao;
import com.gt.studyplanner.exception.ConflictException;
import com.gt.studyplanner.exception.NotFoundException;
import com.gt.studyplanner.metrics.SnapshotService;
import com.gt.studyplanner.model.ActivityFeedback;
import com.gt.studyplanner.model.AdaptationResult;
import com.gt.studyplanner.model.Course;
import com.gt.studyplanner.model.GeneratedPlan;
import com.gt.studyplanner.model.OverrideResult;
import com.gt.studyplanner.model.OverrideType;
import com.gt.studyplanner.model.PerformanceSnapshot;
import com.gt.studyplanner.model.PlanStatus;
import com.gt.studyplanner.model.PlanType;
import com.gt.studyplanner.model.RecentActivity;
import com.gt.studyplanner.model.SessionStatus;
import com.gt.studyplanner.model.StudyPlan;
import com.gt.studyplanner.model.StudyPreferences;
import com.gt.studyplanner.model.StudySession;
import com.gt.studyplanner.timeslot.ProductivityProfile;
import com.gt.studyplanner.timeslot.TimeSlotOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Entry point for everything that reads or changes a stored plan. Every change is a read-modify-write guarded by
 * the plan version: when the stored plan changed in between, the change is recomputed once from the fresh plan
 * and a second lost race ends in a ConflictException.
 */
@Component
public class StudyPlanService {

    private static final Logger log = LoggerFactory.getLogger(StudyPlanService.class);

    private static final int MAX_WRITE_ATTEMPTS = 2;
    private static final String OVERRIDE_ID_PREFIX = "ovr-";

    private final StudyPlanDao studyPlanDao;
    private final CourseDao courseDao;
    private final SnapshotService snapshotService;
    private final TimeSlotOptimizer timeSlotOptimizer;
    private final StudyPlanGenerator studyPlanGenerator;
    private final PlanAdapter planAdapter;
    private final OverrideLayer overrideLayer;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final int windowDays;

    @Autowired
    public StudyPlanService(StudyPlanDao studyPlanDao,
                            CourseDao courseDao,
                            SnapshotService snapshotService,
                            TimeSlotOptimizer timeSlotOptimizer,
                            StudyPlanGenerator studyPlanGenerator,
                            PlanAdapter planAdapter,
                            OverrideLayer overrideLayer,
                            PerformanceAnalyzer performanceAnalyzer,
                            @Value("${planner.metrics.defaultWindowDays:30}") int windowDays) {
        this.studyPlanDao = studyPlanDao;
        this.courseDao = courseDao;
        this.snapshotService = snapshotService;
        this.timeSlotOptimizer = timeSlotOptimizer;
        this.studyPlanGenerator = studyPlanGenerator;
        this.planAdapter = planAdapter;
        this.overrideLayer = overrideLayer;
        this.performanceAnalyzer = performanceAnalyzer;
        this.windowDays = windowDays;
    }

    /**
     * Generates and stores a new active plan. A plan that was active for the same learner and course is paused.
     */
    public GeneratedPlan generatePlan(String learnerId, String courseId, PlanType planType, LocalDate targetDate,
                                      StudyPreferences preferences, Instant now) {
        if (!courseDao.learnerExists(learnerId)) {
            throw new NotFoundException("Learner " + learnerId + " does not exist");
        }
        Course course = courseDao.loadCourse(courseId)
                .orElseThrow(() -> new NotFoundException("Course " + courseId + " does not exist"));

        StudyPreferences prefs = preferences != null ? preferences : StudyPreferences.defaults();
        PerformanceSnapshot snapshot = snapshotService.getSnapshot(learnerId, Optional.of(courseId), windowDays, now);
        ProductivityProfile productivityProfile = timeSlotOptimizer.productivityProfile(learnerId, prefs.preferredHours(), now);

        GeneratedPlan generated = studyPlanGenerator.generate(UUID.randomUUID().toString(), learnerId, course, planType,
                targetDate, prefs, snapshot, productivityProfile, now);

        studyPlanDao.loadActivePlan(learnerId, courseId)
                .ifPresent(active -> pausePlan(active.id(), now));
        studyPlanDao.createPlan(generated.plan());

        return generated;
    }

    public StudyPlan getPlan(String planId) {
        return loadPlanOrThrow(planId);
    }

    /**
     * Runs one adaptation pass over the plan with a fresh snapshot. Running it again without new history changes
     * nothing.
     */
    public AdaptationResult adaptPlan(String planId, RecentActivity recentActivity, Instant now) {
        StudyPlan plan = loadPlanOrThrow(planId);
        PerformanceSnapshot snapshot = snapshotService.getSnapshot(plan.learnerId(), Optional.of(plan.courseId()), windowDays, now);

        PlanAdapter.AdaptedPlan adapted = updateWithRetry(planId, current -> {
            PlanAdapter.AdaptedPlan result = planAdapter.adapt(current, snapshot, now);
            return new PlanUpdate<>(result.changed() ? result.plan() : null, result);
        });

        ActivityFeedback feedback = recentActivity != null
                ? performanceAnalyzer.activityFeedback(recentActivity, snapshot)
                : null;

        return new AdaptationResult(planId, adapted.adaptations(), adapted.plan().sessions(), feedback);
    }

    public OverrideResult applyOverride(String planId, OverrideRequest request, Instant now) {
        if (request == null || request.overrideType() == null) {
            throw new IllegalArgumentException("An override type is required");
        }
        OverrideType type = OverrideType.fromWireName(request.overrideType());

        OverrideResult result = updateWithRetry(planId, current -> {
            String overrideId = OVERRIDE_ID_PREFIX + (current.overrides().size() + 1);
            OverrideLayer.OverrideOutcome outcome = overrideLayer.apply(current, type, request, overrideId, now);
            return new PlanUpdate<>(outcome.result().accepted() ? outcome.plan() : null, outcome.result());
        });

        if (result.accepted()) {
            log.info("Applied {} override to plan {}: {}", type.getWireName(), planId, result.message());
        } else {
            log.info("Rejected {} override to plan {}: {}", type.getWireName(), planId, result.message());
        }
        return result;
    }

    /**
     * Marks a session completed or skipped. Once no session is left open the plan itself is completed.
     */
    public StudyPlan completeSession(String planId, String sessionId, SessionStatus status, Instant now) {
        if (status != SessionStatus.Completed && status != SessionStatus.Skipped) {
            throw new IllegalArgumentException("A session can only be marked completed or skipped, not " + status);
        }

        return updateWithRetry(planId, current -> {
            StudySession session = current.sessions().stream()
                    .filter(candidate -> candidate.id().equals(sessionId) || candidate.slotId().equals(sessionId))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Session " + sessionId + " is not part of plan " + planId));
            if (session.status() == status) {
                return new PlanUpdate<>(null, current);
            }
            if (!session.isOpen()) {
                throw new IllegalArgumentException("Session " + sessionId + " is already " + session.status().getWireName());
            }

            List<StudySession> sessions = new ArrayList<>(current.sessions());
            sessions.set(sessions.indexOf(session), session.withStatus(status));

            StudyPlan updated = current.withSessions(sessions, now);
            if (current.isActive() && sessions.stream().noneMatch(StudySession::isOpen)) {
                updated = updated.withStatus(PlanStatus.Completed, now);
                log.info("All sessions of plan {} are finished, plan completed", planId);
            }
            return new PlanUpdate<>(updated, updated.withVersion(current.version() + 1));
        });
    }

    /**
     * Pauses, resumes or cancels a plan. Resuming a plan pauses whichever other plan is active for the same
     * learner and course. Completed and cancelled plans can no longer change.
     */
    public StudyPlan changeStatus(String planId, PlanStatus status, Instant now) {
        StudyPlan plan = loadPlanOrThrow(planId);
        if (plan.isTerminal()) {
            throw new IllegalArgumentException("Plan " + planId + " is already " + plan.status().getWireName());
        }

        if (status == PlanStatus.Active) {
            studyPlanDao.loadActivePlan(plan.learnerId(), plan.courseId())
                    .filter(active -> !active.id().equals(planId))
                    .ifPresent(active -> pausePlan(active.id(), now));
        }

        return updateWithRetry(planId, current -> {
            if (current.status() == status) {
                return new PlanUpdate<>(null, current);
            }
            if (current.isTerminal()) {
                throw new IllegalArgumentException("Plan " + planId + " is already " + current.status().getWireName());
            }

            StudyPlan updated = current.withStatus(status, now);
            log.info("Plan {} changed from {} to {}", planId, current.status(), status);
            return new PlanUpdate<>(updated, updated.withVersion(current.version() + 1));
        });
    }

    public List<String> getActivePlanIds() {
        return studyPlanDao.loadActivePlanIds();
    }

    private void pausePlan(String planId, Instant now) {
        boolean paused = this.<Boolean>updateWithRetry(planId, current -> current.isActive()
                ? new PlanUpdate<>(current.withStatus(PlanStatus.Paused, now), true)
                : new PlanUpdate<>(null, false));
        if (paused) {
            log.info("Paused plan {} in favor of a newer plan", planId);
        }
    }

    private StudyPlan loadPlanOrThrow(String planId) {
        return studyPlanDao.loadPlan(planId)
                .orElseThrow(() -> new NotFoundException("Study plan " + planId + " does not exist"));
    }

    // Applies change to the stored plan. A PlanUpdate without a plan means there is nothing to write.
    private <T> T updateWithRetry(String planId, Function<StudyPlan, PlanUpdate<T>> change) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            StudyPlan current = loadPlanOrThrow(planId);
            PlanUpdate<T> update = change.apply(current);
            if (update.plan() == null) {
                return update.result();
            }

            if (studyPlanDao.savePlan(update.plan().withVersion(current.version() + 1), current.version())) {
                return update.result();
            }

            log.warn("Plan {} changed concurrently (attempt {})", planId, attempt);
        }

        throw new ConflictException("Unable to update plan " + planId + " due to concurrent updates");
    }

    private record PlanUpdate<T>(StudyPlan plan, T result) { }
}
