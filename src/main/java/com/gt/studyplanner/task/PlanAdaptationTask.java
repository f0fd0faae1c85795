package com.gt.studyplanner.task;

import com.gt.studyplanner.model.AdaptationResult;
import com.gt.studyplanner.plan.StudyPlanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
public class PlanAdaptationTask {

    private static final Logger log = LoggerFactory.getLogger(PlanAdaptationTask.class);

    private final StudyPlanService studyPlanService;

    @Autowired
    public PlanAdaptationTask(StudyPlanService studyPlanService) {
        this.studyPlanService = studyPlanService;
    }

    @Scheduled(cron = "${planner.plan.adaptationCron:0 30 2 * * *}")
    public void adaptActivePlans() {
        adaptActivePlans(Instant.now());
    }

    // A plan that fails is logged and skipped so that it does not hold up the rest
    int adaptActivePlans(Instant now) {
        List<String> planIds = studyPlanService.getActivePlanIds();

        int adapted = 0;
        int failed = 0;
        for (String planId : planIds) {
            try {
                AdaptationResult result = studyPlanService.adaptPlan(planId, null, now);
                if (!result.adaptations().isEmpty()) {
                    adapted++;
                }
            } catch (RuntimeException ex) {
                failed++;
                log.error("Nightly adaptation of plan {} failed", planId, ex);
            }
        }

        log.info("Nightly adaptation checked {} active plans: {} adapted, {} failed.", planIds.size(), adapted, failed);
        return adapted;
    }
}
