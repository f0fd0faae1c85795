package com.gt.studyplanner.plan;

import com.gt.studyplanner.history.PerformanceHistoryDao;
import com.gt.studyplanner.model.Course;
import com.gt.studyplanner.model.CourseTopic;
import com.gt.studyplanner.model.Difficulty;
import com.gt.studyplanner.model.DifficultyAdaptation;
import com.gt.studyplanner.model.GeneratedPlan;
import com.gt.studyplanner.model.PerformanceSnapshot;
import com.gt.studyplanner.model.PlanStatus;
import com.gt.studyplanner.model.PlanType;
import com.gt.studyplanner.model.StudyParameters;
import com.gt.studyplanner.model.StudyPlan;
import com.gt.studyplanner.model.StudyPreferences;
import com.gt.studyplanner.model.StudySession;
import com.gt.studyplanner.model.StudyTask;
import com.gt.studyplanner.model.TaskType;
import com.gt.studyplanner.timeslot.ProductivityProfile;
import com.gt.studyplanner.timeslot.TimeSlotOptimizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.gt.studyplanner.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class StudyPlanGeneratorTests {

    private static final String TEST_PLAN_ID = "plan-1";
    private static final Instant TEST_NOW = Instant.parse("2024-03-04T10:00:00Z");
    private static final LocalDate TEST_TODAY = LocalDate.of(2024, 3, 4);

    private static final Course TEST_COURSE = new Course(TEST_COURSE_ID, "Calculus", List.of(
            new CourseTopic("topic-1", "Limits", Difficulty.Easy),
            new CourseTopic("topic-2", "Derivatives", Difficulty.Medium),
            new CourseTopic("topic-3", "Integrals", Difficulty.Hard),
            new CourseTopic("topic-4", "Series", Difficulty.Hard)));
    private static final ProductivityProfile TEST_PROFILE = new ProductivityProfile(List.of(9, 14), Map.of(9, 4.5, 14, 4.0), 45, true);

    @Mock private PerformanceHistoryDao performanceHistoryDao;

    private CognitiveLoadEstimator cognitiveLoadEstimator;
    private StudyPlanGenerator studyPlanGenerator;

    @BeforeEach
    public void before() {
        cognitiveLoadEstimator = new CognitiveLoadEstimator(3.0, 85);
        studyPlanGenerator = new StudyPlanGenerator(getTestAnalyzer(), new TimeSlotOptimizer(performanceHistoryDao, 90, 30),
                cognitiveLoadEstimator, 2.0, 12);
    }

    @Test
    public void testDeriveParametersLowPerformance() {
        StudyParameters parameters = studyPlanGenerator.deriveParameters(40, getUniformSnapshot(40, TEST_NOW),
                StudyPreferences.defaults(), TEST_PROFILE);

        assertEquals(2.6, parameters.dailyHours(), 0.001);
        assertEquals(36, parameters.sessionLengthMinutes());
        assertEquals(3, parameters.sessionsPerDay());
        assertEquals(5, parameters.studyDaysPerWeek());
        assertEquals(DifficultyAdaptation.Easier, parameters.difficultyAdaptation());
        assertEquals(1, parameters.reviewFrequencyDays());
        assertEquals(25, parameters.breakFrequencyMinutes());
    }

    @Test
    public void testDeriveParametersHighPerformance() {
        StudyParameters parameters = studyPlanGenerator.deriveParameters(95, getUniformSnapshot(95, TEST_NOW),
                new StudyPreferences(null, null, false, true, List.of()), TEST_PROFILE);

        assertEquals(1.8, parameters.dailyHours(), 0.001);
        assertEquals(54, parameters.sessionLengthMinutes());
        assertEquals(1, parameters.sessionsPerDay());
        assertEquals(7, parameters.studyDaysPerWeek());
        assertEquals(DifficultyAdaptation.Harder, parameters.difficultyAdaptation());
        assertEquals(3, parameters.reviewFrequencyDays());
    }

    @Test
    public void testDeriveParametersAreClamped() {
        ProductivityProfile longSessions = new ProductivityProfile(List.of(9), Map.of(), 200, true);

        StudyParameters parameters = studyPlanGenerator.deriveParameters(75, getUniformSnapshot(75, TEST_NOW),
                new StudyPreferences(10.0, 2.0, false, false, List.of()), longSessions);

        assertEquals(6.0, parameters.dailyHours(), 0.001);
        assertEquals(120, parameters.sessionLengthMinutes());
        assertEquals(15, parameters.breakFrequencyMinutes());
        assertEquals(2, parameters.reviewFrequencyDays());

        StudyParameters shortSessions = studyPlanGenerator.deriveParameters(75, getUniformSnapshot(75, TEST_NOW),
                new StudyPreferences(0.1, null, true, false, List.of()), new ProductivityProfile(List.of(9), Map.of(), 10, false));

        assertEquals(0.5, shortSessions.dailyHours(), 0.001);
        assertEquals(15, shortSessions.sessionLengthMinutes());
        assertEquals(3, shortSessions.sessionsPerDay());
        assertEquals(0, shortSessions.breakFrequencyMinutes());
    }

    @Test
    public void testGenerate() {
        PerformanceSnapshot snapshot = getUniformSnapshot(75, TEST_NOW);

        GeneratedPlan generated = studyPlanGenerator.generate(TEST_PLAN_ID, TEST_LEARNER_ID, TEST_COURSE, PlanType.Weekly,
                TEST_TODAY.plusDays(13), StudyPreferences.defaults(), snapshot, TEST_PROFILE, TEST_NOW);
        StudyPlan plan = generated.plan();

        assertEquals(TEST_PLAN_ID, plan.id());
        assertEquals(PlanStatus.Active, plan.status());
        assertEquals(0, plan.version());
        assertEquals(2, plan.totalWeeks());
        assertEquals(TEST_TODAY, plan.startDate());
        assertEquals(TEST_TODAY.plusDays(13), plan.endDate());
        assertEquals(snapshot, plan.baselineSnapshot());
        assertNull(plan.lastEvaluatedSnapshot());
        assertTrue(plan.supersededSessions().isEmpty());
        assertTrue(plan.adaptationHistory().isEmpty());

        // 2 hours a day in 45 minute sessions, at most 2 a day, on 5 weekdays
        assertEquals(20, plan.sessions().size());
        assertEquals("w1-s1", plan.sessions().get(0).id());

        Set<String> ids = new HashSet<>();
        Set<String> topicIds = new HashSet<>();
        StudySession previous = null;
        for (StudySession session : plan.sessions()) {
            assertTrue(ids.add(session.id()));
            assertFalse(session.date().isBefore(plan.startDate()));
            assertFalse(session.date().isAfter(plan.endDate()));
            assertNotEquals(DayOfWeek.SATURDAY, session.date().getDayOfWeek());
            assertNotEquals(DayOfWeek.SUNDAY, session.date().getDayOfWeek());
            assertEquals(cognitiveLoadEstimator.estimate(session.tasks()), session.cognitiveLoad());
            if (previous != null) {
                assertFalse(session.date().isBefore(previous.date()));
            }
            session.tasks().stream().map(StudyTask::topicId).filter(id -> id != null).forEach(topicIds::add);
            previous = session;
        }
        assertEquals(Set.of("topic-1", "topic-2", "topic-3", "topic-4"), topicIds);

        assertEquals(generated.plan().sessions().get(generated.plan().sessions().size() - 1).date(), generated.estimatedCompletion());
        assertTrue(generated.recommendations().contains("Schedule your most challenging topics around 9:00"));
    }

    @Test
    public void testGenerateIsDeterministic() {
        PerformanceSnapshot snapshot = getUniformSnapshot(75, TEST_NOW);

        GeneratedPlan first = studyPlanGenerator.generate(TEST_PLAN_ID, TEST_LEARNER_ID, TEST_COURSE, PlanType.Weekly,
                null, StudyPreferences.defaults(), snapshot, TEST_PROFILE, TEST_NOW);
        GeneratedPlan second = studyPlanGenerator.generate(TEST_PLAN_ID, TEST_LEARNER_ID, TEST_COURSE, PlanType.Weekly,
                null, StudyPreferences.defaults(), snapshot, TEST_PROFILE, TEST_NOW);

        assertEquals(first, second);
        assertEquals(12, first.plan().totalWeeks());
        assertEquals(TEST_TODAY.plusWeeks(12).minusDays(1), first.plan().endDate());
    }

    @Test
    public void testGenerateWithoutContent() {
        Course emptyCourse = new Course("course-2", "Empty", List.of());

        GeneratedPlan generated = studyPlanGenerator.generate(TEST_PLAN_ID, TEST_LEARNER_ID, emptyCourse, PlanType.Monthly,
                TEST_TODAY.plusDays(6), StudyPreferences.defaults(), getUniformSnapshot(40, TEST_NOW), TEST_PROFILE, TEST_NOW);

        assertFalse(generated.plan().sessions().isEmpty());
        for (StudySession session : generated.plan().sessions()) {
            assertEquals(1, session.tasks().size());
            assertEquals(TaskType.Review, session.tasks().get(0).type());
            assertEquals(session.durationMinutes(), session.tasks().get(0).durationMinutes());
        }
        assertTrue(generated.recommendations().contains("Consider scheduling shorter, more frequent study sessions"));
    }

    @Test
    public void testGenerateExamPrepNeedsTargetDate() {
        assertThrows(IllegalArgumentException.class, () -> studyPlanGenerator.generate(TEST_PLAN_ID, TEST_LEARNER_ID,
                TEST_COURSE, PlanType.ExamPrep, null, StudyPreferences.defaults(), getUniformSnapshot(75, TEST_NOW),
                TEST_PROFILE, TEST_NOW));
    }

    @Test
    public void testTasksFor() {
        List<StudyTask> tasks = StudyPlanGenerator.tasksFor(List.of(new CourseTopic("topic-1", "Limits", Difficulty.Medium)),
                45, DifficultyAdaptation.Harder);

        assertEquals(2, tasks.size());
        assertEquals(TaskType.Reading, tasks.get(0).type());
        assertEquals(Difficulty.Medium, tasks.get(0).difficulty());
        assertFalse(tasks.get(0).optional());
        assertEquals(TaskType.Practice, tasks.get(1).type());
        assertEquals(Difficulty.Hard, tasks.get(1).difficulty());
        assertTrue(tasks.get(1).optional());
    }

    @Test
    public void testShiftAndPartition() {
        assertEquals(Difficulty.Easy, StudyPlanGenerator.shift(Difficulty.Medium, DifficultyAdaptation.Easier));
        assertEquals(Difficulty.Medium, StudyPlanGenerator.shift(Difficulty.Hard, DifficultyAdaptation.Easier));
        assertEquals(Difficulty.Medium, StudyPlanGenerator.shift(Difficulty.Easy, DifficultyAdaptation.Harder));
        assertEquals(Difficulty.Hard, StudyPlanGenerator.shift(Difficulty.Hard, DifficultyAdaptation.Maintain));

        List<Integer> items = List.of(1, 2, 3, 4, 5);
        assertEquals(List.of(1, 2), StudyPlanGenerator.partition(items, 0, 2));
        assertEquals(List.of(3, 4, 5), StudyPlanGenerator.partition(items, 1, 2));
        assertEquals(List.of(), StudyPlanGenerator.partition(items, 0, 0));
    }
}
