package com.gt.studyplanner.task;

import com.gt.studyplanner.exception.ConflictException;
import com.gt.studyplanner.model.ActivityFeedback;
import com.gt.studyplanner.model.AdaptationResult;
import com.gt.studyplanner.model.AdaptationType;
import com.gt.studyplanner.model.PlanAdaptation;
import com.gt.studyplanner.plan.StudyPlanService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class PlanAdaptationTaskTests {

    private static final Instant TEST_NOW = Instant.parse("2024-03-04T02:30:00Z");

    private static final ActivityFeedback TEST_FEEDBACK = new ActivityFeedback("general", "on_track", "Keep it up", List.of());

    @Mock private StudyPlanService studyPlanService;

    private PlanAdaptationTask planAdaptationTask;

    @BeforeEach
    public void before() {
        planAdaptationTask = new PlanAdaptationTask(studyPlanService);
    }

    @Test
    public void testAdaptActivePlans() {
        when(studyPlanService.getActivePlanIds()).thenReturn(List.of("plan-1", "plan-2", "plan-3"));
        when(studyPlanService.adaptPlan("plan-1", null, TEST_NOW)).thenReturn(adapted("plan-1"));
        when(studyPlanService.adaptPlan("plan-2", null, TEST_NOW)).thenReturn(unchanged("plan-2"));
        when(studyPlanService.adaptPlan("plan-3", null, TEST_NOW)).thenReturn(adapted("plan-3"));

        assertEquals(2, planAdaptationTask.adaptActivePlans(TEST_NOW));
    }

    @Test
    public void testAdaptActivePlansContinuesPastFailures() {
        when(studyPlanService.getActivePlanIds()).thenReturn(List.of("plan-1", "plan-2", "plan-3"));
        when(studyPlanService.adaptPlan("plan-1", null, TEST_NOW)).thenThrow(new ConflictException("Plan plan-1 was modified concurrently"));
        when(studyPlanService.adaptPlan("plan-2", null, TEST_NOW)).thenThrow(new IllegalStateException("Bad row"));
        when(studyPlanService.adaptPlan("plan-3", null, TEST_NOW)).thenReturn(adapted("plan-3"));

        assertEquals(1, planAdaptationTask.adaptActivePlans(TEST_NOW));

        verify(studyPlanService, times(1)).adaptPlan("plan-3", null, TEST_NOW);
    }

    @Test
    public void testAdaptActivePlansWithNoActivePlans() {
        when(studyPlanService.getActivePlanIds()).thenReturn(List.of());

        assertEquals(0, planAdaptationTask.adaptActivePlans(TEST_NOW));

        verify(studyPlanService, never()).adaptPlan(anyString(), any(), any());
    }

    private static AdaptationResult adapted(String planId) {
        PlanAdaptation adaptation = new PlanAdaptation(AdaptationType.ReduceDifficulty, "Score dropped", TEST_NOW, List.of(), List.of());
        return new AdaptationResult(planId, List.of(adaptation), List.of(), TEST_FEEDBACK);
    }

    private static AdaptationResult unchanged(String planId) {
        return new AdaptationResult(planId, List.of(), List.of(), TEST_FEEDBACK);
    }
}
