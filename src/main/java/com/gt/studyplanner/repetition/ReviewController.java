package com.gt.studyplanner.repetition;

import com.gt.studyplanner.model.Recommendation;
import com.gt.studyplanner.model.ReviewItem;
import com.gt.studyplanner.model.ReviewState;
import com.gt.studyplanner.model.StudyLoad;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/review")
public class ReviewController {

    private final ReviewService reviewService;

    @Autowired
    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @PostMapping(value = "/reviewItem", consumes = "application/json", produces = "application/json")
    public ReviewState reviewItem(@RequestBody ReviewItemRequest request) {
        return reviewService.reviewItem(request.cardId(), request.quality(),
                request.responseTimeSeconds() == null ? 0 : request.responseTimeSeconds(), Instant.now());
    }

    @GetMapping(value = "/dueItems", produces = "application/json")
    public List<ReviewItem> getDueItems(@RequestParam(value = "learnerId") String learnerId,
                                        @RequestParam(value = "courseId") String courseId,
                                        @RequestParam(value = "limit", defaultValue = "0") int limit) {
        return reviewService.dueItems(learnerId, courseId, limit, Instant.now());
    }

    @GetMapping(value = "/studyLoad", produces = "application/json")
    public StudyLoad getStudyLoad(@RequestParam(value = "learnerId") String learnerId,
                                  @RequestParam(value = "courseId") String courseId) {
        return reviewService.getStudyLoad(learnerId, courseId, Instant.now());
    }

    @GetMapping(value = "/recommendations", produces = "application/json")
    public List<Recommendation> getReviewRecommendations(@RequestParam(value = "learnerId") String learnerId,
                                                         @RequestParam(value = "courseId") String courseId) {
        return reviewService.getReviewRecommendations(learnerId, courseId, Instant.now());
    }

    @GetMapping(value = "/optimalBatchSize", produces = "application/json")
    public int getOptimalBatchSize(@RequestParam(value = "learnerId") String learnerId,
                                   @RequestParam(value = "courseId") String courseId,
                                   @RequestParam(value = "availableMinutes") int availableMinutes) {
        return reviewService.getOptimalBatchSize(learnerId, courseId, availableMinutes, Instant.now());
    }

    private record ReviewItemRequest(String cardId, int quality, Double responseTimeSeconds) { }
}
