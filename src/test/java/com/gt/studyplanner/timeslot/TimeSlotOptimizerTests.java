package com.gt.studyplanner.timeslot;

import com.gt.studyplanner.history.PerformanceHistoryDao;
import com.gt.studyplanner.model.SessionRecord;
import com.gt.studyplanner.model.SessionStatus;
import com.gt.studyplanner.model.TimeSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class TimeSlotOptimizerTests {

    private static final String TEST_LEARNER_ID = "learner-1";
    private static final Instant TEST_NOW = Instant.parse("2024-03-04T10:00:00Z");

    @Mock private PerformanceHistoryDao performanceHistoryDao;

    private TimeSlotOptimizer timeSlotOptimizer;

    @BeforeEach
    public void before() {
        timeSlotOptimizer = new TimeSlotOptimizer(performanceHistoryDao, 90, 30);
    }

    @Test
    public void testOptimalSlotsWithoutHistory() {
        when(performanceHistoryDao.fetchStudySessions(TEST_LEARNER_ID, Optional.empty(), TEST_NOW.minus(Duration.ofDays(90)))).thenReturn(List.of());

        List<TimeSlot> slots = timeSlotOptimizer.optimalSlots(TEST_LEARNER_ID, 1.5, List.of(DayOfWeek.WEDNESDAY, DayOfWeek.MONDAY), TEST_NOW);

        assertEquals(2, slots.size());
        assertEquals(DayOfWeek.MONDAY, slots.get(0).day());
        assertEquals(DayOfWeek.WEDNESDAY, slots.get(1).day());
        for (TimeSlot slot : slots) {
            assertEquals(LocalTime.of(TimeSlotOptimizer.DEFAULT_HOUR, 0), slot.startTime());
            assertEquals(TimeSlotOptimizer.DEFAULT_SESSION_LENGTH, slot.durationMinutes());
        }
    }

    @Test
    public void testProductivityProfileRanksHours() {
        List<SessionRecord> sessions = List.of(
                ratedSession("2024-03-01T14:00:00Z", 40, 5),
                ratedSession("2024-03-01T09:00:00Z", 40, 3),
                ratedSession("2024-03-02T19:00:00Z", 40, 4),
                ratedSession("2024-03-02T07:00:00Z", 40, 2),
                ratedSession("2024-03-03T14:30:00Z", 40, 4));

        ProductivityProfile profile = timeSlotOptimizer.productivityProfile(sessions, List.of());

        assertEquals(List.of(14, 19, 9), profile.rankedHours());
        assertEquals(14, profile.peakHour());
        assertEquals(4.5, profile.productivityAt(14), 0.0001);
        assertEquals(0, profile.productivityAt(3));
        assertTrue(profile.fromHistory());
    }

    @Test
    public void testProductivityProfilePreferredHours() {
        List<SessionRecord> sessions = List.of(ratedSession("2024-03-01T14:00:00Z", 40, 5));

        ProductivityProfile profile = timeSlotOptimizer.productivityProfile(sessions, List.of(18, 7, 18, 31));

        assertEquals(List.of(18, 7), profile.rankedHours());
        assertTrue(profile.fromHistory());
    }

    @Test
    public void testOptimalSlotsNeverOverlap() {
        ProductivityProfile profile = new ProductivityProfile(List.of(9), Map.of(9, 4.0), 45, true);

        List<TimeSlot> slots = timeSlotOptimizer.optimalSlots(profile, 3, List.of(DayOfWeek.MONDAY), 45, 10);

        assertEquals(List.of(LocalTime.of(9, 0), LocalTime.of(10, 15), LocalTime.of(11, 30), LocalTime.of(12, 45)),
                slots.stream().map(TimeSlot::startTime).toList());
        assertEquals(4.0, slots.get(0).productivityScore());
        for (int i = 1; i < slots.size(); i++) {
            LocalTime previousEnd = slots.get(i - 1).startTime().plusMinutes(slots.get(i - 1).durationMinutes());
            assertFalse(slots.get(i).startTime().isBefore(previousEnd.plusMinutes(30)));
        }
    }

    @Test
    public void testOptimalSlotsRespectsSessionsPerDay() {
        ProductivityProfile profile = new ProductivityProfile(List.of(10, 16), Map.of(), 60, false);

        List<TimeSlot> slots = timeSlotOptimizer.optimalSlots(profile, 20, List.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY), 60, 2);

        assertEquals(4, slots.size());
        assertEquals(List.of(LocalTime.of(10, 0), LocalTime.of(16, 0), LocalTime.of(10, 0), LocalTime.of(16, 0)),
                slots.stream().map(TimeSlot::startTime).toList());
    }

    @Test
    public void testOptimalSlotsNeverCrossMidnight() {
        ProductivityProfile profile = new ProductivityProfile(List.of(23), Map.of(), 90, false);

        assertTrue(timeSlotOptimizer.optimalSlots(profile, 1.5, List.of(DayOfWeek.FRIDAY), 90, 1).isEmpty());
        assertTrue(timeSlotOptimizer.optimalSlots(profile, 0, List.of(DayOfWeek.FRIDAY), 45, 1).isEmpty());
        assertTrue(timeSlotOptimizer.optimalSlots(profile, 2, List.of(), 45, 1).isEmpty());
    }

    @Test
    public void testBestSessionLength() {
        List<SessionRecord> sessions = List.of(
                ratedSession("2024-03-01T09:00:00Z", 25, 5),
                ratedSession("2024-03-02T09:00:00Z", 50, 3),
                ratedSession("2024-03-03T09:00:00Z", 100, 2));

        assertEquals(25, TimeSlotOptimizer.bestSessionLength(sessions));
        assertEquals(TimeSlotOptimizer.DEFAULT_SESSION_LENGTH, TimeSlotOptimizer.bestSessionLength(List.of()));
    }

    @Test
    public void testBestSessionLengthBreaksTiesInFixedOrder() {
        SessionRecord longSession = ratedSession("2024-03-01T09:00:00Z", 100, 4);
        SessionRecord shortSession = ratedSession("2024-03-02T09:00:00Z", 20, 4);
        SessionRecord mediumSession = ratedSession("2024-03-03T09:00:00Z", 50, 4);

        assertEquals(45, TimeSlotOptimizer.bestSessionLength(List.of(longSession, shortSession, mediumSession)));
        assertEquals(45, TimeSlotOptimizer.bestSessionLength(List.of(mediumSession, shortSession, longSession)));
        assertEquals(25, TimeSlotOptimizer.bestSessionLength(List.of(longSession, shortSession)));
        assertEquals(25, TimeSlotOptimizer.bestSessionLength(List.of(shortSession, longSession)));
    }

    private static SessionRecord ratedSession(String start, int minutes, int rating) {
        Instant startedAt = Instant.parse(start);
        Instant endedAt = startedAt.plus(Duration.ofMinutes(minutes));
        return new SessionRecord(startedAt, endedAt, startedAt, endedAt, SessionStatus.Completed, rating);
    }
}
