package com.gt.studyplanner.analysis;

import com.gt.studyplanner.model.ActivityFeedback;
import com.gt.studyplanner.model.AnalysisResult;
import com.gt.studyplanner.model.RecentActivity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Optional;

@RestController
@RequestMapping("/rest/analysis")
public class AnalysisController {

    private final PerformanceAnalysisService performanceAnalysisService;

    @Autowired
    public AnalysisController(PerformanceAnalysisService performanceAnalysisService) {
        this.performanceAnalysisService = performanceAnalysisService;
    }

    @GetMapping(value = "/performance", produces = "application/json")
    public AnalysisResult analyzePerformance(@RequestParam(value = "learnerId") String learnerId,
                                             @RequestParam(value = "courseId") Optional<String> courseId,
                                             @RequestParam(value = "windowDays") Optional<Integer> windowDays) {
        return performanceAnalysisService.analyzePerformance(learnerId, courseId, windowDays.orElse(null), Instant.now());
    }

    @PostMapping(value = "/activityFeedback", consumes = "application/json", produces = "application/json")
    public ActivityFeedback analyzeActivity(@RequestBody ActivityFeedbackRequest request) {
        return performanceAnalysisService.analyzeActivity(request.learnerId(), Optional.ofNullable(request.courseId()),
                request.activity(), Instant.now());
    }

    private record ActivityFeedbackRequest(String learnerId, String courseId, RecentActivity activity) { }
}
