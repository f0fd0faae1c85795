package com.gt.studyplanner.analysis;

import com.gt.studyplanner.course.CourseDao;
import com.gt.studyplanner.exception.NotFoundException;
import com.gt.studyplanner.metrics.SnapshotService;
import com.gt.studyplanner.model.ActivityFeedback;
import com.gt.studyplanner.model.AnalysisResult;
import com.gt.studyplanner.model.PerformanceSnapshot;
import com.gt.studyplanner.model.RecentActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
public class PerformanceAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(PerformanceAnalysisService.class);

    private final CourseDao courseDao;
    private final SnapshotService snapshotService;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final int trendPoints;
    private final int defaultWindowDays;

    @Autowired
    public PerformanceAnalysisService(CourseDao courseDao,
                                      SnapshotService snapshotService,
                                      PerformanceAnalyzer performanceAnalyzer,
                                      @Value("${planner.analysis.trendPoints:4}") int trendPoints,
                                      @Value("${planner.metrics.defaultWindowDays:30}") int defaultWindowDays) {
        this.courseDao = courseDao;
        this.snapshotService = snapshotService;
        this.performanceAnalyzer = performanceAnalyzer;
        this.trendPoints = trendPoints;
        this.defaultWindowDays = defaultWindowDays;
    }

    public AnalysisResult analyzePerformance(String learnerId, Optional<String> courseId, Integer windowDays, Instant now) {
        verifyLearnerAndCourse(learnerId, courseId);

        int window = windowDays == null || windowDays <= 0 ? defaultWindowDays : windowDays;
        List<PerformanceSnapshot> series = snapshotService.getSnapshotSeries(learnerId, courseId, window, trendPoints, now);
        AnalysisResult result = performanceAnalyzer.analyze(series);

        log.debug("Analyzed learner {} course {} over {} days: score {} ({})",
                learnerId, courseId.orElse("*"), window, result.overallScore(), result.category());

        return result;
    }

    public ActivityFeedback analyzeActivity(String learnerId, Optional<String> courseId, RecentActivity activity, Instant now) {
        verifyLearnerAndCourse(learnerId, courseId);

        PerformanceSnapshot current = snapshotService.getSnapshot(learnerId, courseId, defaultWindowDays, now);
        return performanceAnalyzer.activityFeedback(activity, current);
    }

    private void verifyLearnerAndCourse(String learnerId, Optional<String> courseId) {
        if (!courseDao.learnerExists(learnerId)) {
            throw new NotFoundException("Learner " + learnerId + " does not exist");
        }
        if (courseId.isPresent() && courseDao.loadCourse(courseId.get()).isEmpty()) {
            throw new NotFoundException("Course " + courseId.get() + " does not exist");
        }
    }
}
