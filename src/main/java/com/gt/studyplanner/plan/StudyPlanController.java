package com.gt.studyplanner.plan;

import com.gt.studyplanner.model.AdaptationResult;
import com.gt.studyplanner.model.GeneratedPlan;
import com.gt.studyplanner.model.OverrideResult;
import com.gt.studyplanner.model.PlanStatus;
import com.gt.studyplanner.model.PlanType;
import com.gt.studyplanner.model.RecentActivity;
import com.gt.studyplanner.model.SessionStatus;
import com.gt.studyplanner.model.StudyPlan;
import com.gt.studyplanner.model.StudyPreferences;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;

@RestController
@RequestMapping("/rest/plan")
public class StudyPlanController {

    private final StudyPlanService studyPlanService;

    @Autowired
    public StudyPlanController(StudyPlanService studyPlanService) {
        this.studyPlanService = studyPlanService;
    }

    @PostMapping(value = "/generate", consumes = "application/json", produces = "application/json")
    public GeneratedPlan generatePlan(@RequestBody GeneratePlanRequest request) {
        PlanType planType = request.planType() == null ? PlanType.Weekly : PlanType.fromWireName(request.planType());

        return studyPlanService.generatePlan(request.learnerId(), request.courseId(), planType, request.targetDate(),
                request.preferences(), Instant.now());
    }

    @GetMapping(value = "/plan", produces = "application/json")
    public StudyPlan getPlan(@RequestParam(value = "planId") String planId) {
        return studyPlanService.getPlan(planId);
    }

    @PostMapping(value = "/adapt", consumes = "application/json", produces = "application/json")
    public AdaptationResult adaptPlan(@RequestBody AdaptPlanRequest request) {
        return studyPlanService.adaptPlan(request.planId(), request.recentActivity(), Instant.now());
    }

    @PostMapping(value = "/override", consumes = "application/json", produces = "application/json")
    public OverrideResult applyOverride(@RequestParam(value = "planId") String planId,
                                        @RequestBody OverrideRequest request) {
        return studyPlanService.applyOverride(planId, request, Instant.now());
    }

    @PostMapping(value = "/completeSession", consumes = "application/json", produces = "application/json")
    public StudyPlan completeSession(@RequestBody CompleteSessionRequest request) {
        return studyPlanService.completeSession(request.planId(), request.sessionId(),
                SessionStatus.fromWireName(request.status()), Instant.now());
    }

    @PostMapping(value = "/changeStatus", consumes = "application/json", produces = "application/json")
    public StudyPlan changeStatus(@RequestBody ChangeStatusRequest request) {
        return studyPlanService.changeStatus(request.planId(), PlanStatus.fromWireName(request.status()), Instant.now());
    }

    private record GeneratePlanRequest(String learnerId, String courseId, String planType, LocalDate targetDate, StudyPreferences preferences) { }
    private record AdaptPlanRequest(String planId, RecentActivity recentActivity) { }
    private record CompleteSessionRequest(String planId, String sessionId, String status) { }
    private record ChangeStatusRequest(String planId, String status) { }
}
