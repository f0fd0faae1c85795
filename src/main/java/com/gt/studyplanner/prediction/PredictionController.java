package com.gt.studyplanner.prediction;

import com.gt.studyplanner.model.CompletionPrediction;
import com.gt.studyplanner.model.ScheduleFeasibility;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;

@RestController
@RequestMapping("/rest/prediction")
public class PredictionController {

    private final ProgressPredictor progressPredictor;

    @Autowired
    public PredictionController(ProgressPredictor progressPredictor) {
        this.progressPredictor = progressPredictor;
    }

    @GetMapping(value = "/completion", produces = "application/json")
    public CompletionPrediction predictCompletion(@RequestParam(value = "learnerId") String learnerId,
                                                  @RequestParam(value = "courseId") String courseId,
                                                  @RequestParam(value = "targetMasteryLevel", defaultValue = "4") int targetMasteryLevel) {
        return progressPredictor.predictCompletion(learnerId, courseId, targetMasteryLevel, Instant.now());
    }

    @GetMapping(value = "/feasibility", produces = "application/json")
    public ScheduleFeasibility assessScheduleFeasibility(@RequestParam(value = "learnerId") String learnerId,
                                                         @RequestParam(value = "courseId") String courseId,
                                                         @RequestParam(value = "targetDate") LocalDate targetDate,
                                                         @RequestParam(value = "weeklyHours") double weeklyHours) {
        return progressPredictor.assessScheduleFeasibility(learnerId, courseId, targetDate, weeklyHours, Instant.now());
    }
}
