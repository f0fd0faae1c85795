package com.gt.studyplanner.metrics;

import com.gt.studyplanner.conf.CachingConfig;
import com.gt.studyplanner.exception.DaoException;
import com.gt.studyplanner.model.PerformanceSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class SnapshotServiceTests {

    private static final String TEST_LEARNER_ID = "learner-1";
    private static final Optional<String> TEST_COURSE_ID = Optional.of("course-1");
    private static final Instant TEST_NOW = Instant.parse("2024-03-04T10:00:00Z");
    private static final long TEST_TIMEOUT_MS = 100;

    private static final PerformanceSnapshot TEST_SNAPSHOT =
            PerformanceSnapshot.empty(TEST_LEARNER_ID, "course-1", 30, TEST_NOW).withGeneratedAt(TEST_NOW.minusSeconds(60));

    @Mock private MetricsAggregator metricsAggregator;

    private final CountDownLatch releaseLoads = new CountDownLatch(1);
    private ExecutorService executor;
    private SnapshotService snapshotService;

    @BeforeEach
    public void before() {
        executor = Executors.newCachedThreadPool();
        snapshotService = new SnapshotService(metricsAggregator, new ConcurrentMapCacheManager(CachingConfig.SNAPSHOTS),
                executor, TEST_TIMEOUT_MS);
    }

    @AfterEach
    public void after() {
        releaseLoads.countDown();
        executor.shutdownNow();
    }

    @Test
    public void testGetSnapshot() {
        when(metricsAggregator.aggregate(TEST_LEARNER_ID, TEST_COURSE_ID, 30, TEST_NOW)).thenReturn(TEST_SNAPSHOT);

        assertEquals(TEST_SNAPSHOT, snapshotService.getSnapshot(TEST_LEARNER_ID, TEST_COURSE_ID, 30, TEST_NOW));
    }

    @Test
    public void testGetSnapshotTimeoutUsesCachedSnapshot() {
        when(metricsAggregator.aggregate(TEST_LEARNER_ID, TEST_COURSE_ID, 30, TEST_NOW))
                .thenReturn(TEST_SNAPSHOT)
                .thenAnswer(invocation -> blockedLoad());

        snapshotService.getSnapshot(TEST_LEARNER_ID, TEST_COURSE_ID, 30, TEST_NOW);
        PerformanceSnapshot snapshot = snapshotService.getSnapshot(TEST_LEARNER_ID, TEST_COURSE_ID, 30, TEST_NOW);

        assertEquals(TEST_SNAPSHOT, snapshot);
    }

    @Test
    public void testGetSnapshotTimeoutWithoutCacheIsEmpty() {
        when(metricsAggregator.aggregate(TEST_LEARNER_ID, TEST_COURSE_ID, 30, TEST_NOW)).thenAnswer(invocation -> blockedLoad());

        PerformanceSnapshot snapshot = snapshotService.getSnapshot(TEST_LEARNER_ID, TEST_COURSE_ID, 30, TEST_NOW);

        assertTrue(snapshot.isEmpty());
        assertEquals(TEST_LEARNER_ID, snapshot.learnerId());
        assertEquals("course-1", snapshot.courseId());
        assertEquals(TEST_NOW, snapshot.generatedAt());
    }

    @Test
    public void testGetSnapshotSeriesTimeoutWithoutCacheIsEmpty() {
        when(metricsAggregator.aggregateSeries(TEST_LEARNER_ID, TEST_COURSE_ID, 30, 4, TEST_NOW)).thenAnswer(invocation -> blockedLoad());

        List<PerformanceSnapshot> series = snapshotService.getSnapshotSeries(TEST_LEARNER_ID, TEST_COURSE_ID, 30, 4, TEST_NOW);

        assertEquals(4, series.size());
        assertTrue(series.stream().allMatch(PerformanceSnapshot::isEmpty));
    }

    @Test
    public void testGetSnapshotPassesLoadErrorsThrough() {
        when(metricsAggregator.aggregate(TEST_LEARNER_ID, TEST_COURSE_ID, 30, TEST_NOW)).thenThrow(new DaoException("connection refused"));

        assertThrows(DaoException.class, () -> snapshotService.getSnapshot(TEST_LEARNER_ID, TEST_COURSE_ID, 30, TEST_NOW));
    }

    private Object blockedLoad() throws InterruptedException {
        releaseLoads.await();
        return null;
    }
}
