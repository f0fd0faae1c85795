package com.gt.studyplanner.timeslot;

import com.gt.studyplanner.history.PerformanceHistoryDao;
import com.gt.studyplanner.metrics.Statistics;
import com.gt.studyplanner.model.SessionRecord;
import com.gt.studyplanner.model.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Picks study hours and session lengths from the productivity ratings of past sessions.
 */
@Component
public class TimeSlotOptimizer {

    private static final Logger log = LoggerFactory.getLogger(TimeSlotOptimizer.class);

    public static final int DEFAULT_HOUR = 9;
    public static final int DEFAULT_SESSION_LENGTH = 45;

    private static final int TOP_HOURS = 3;
    private static final int MINUTES_PER_DAY = 24 * 60;

    private static final int SHORT_BUCKET_MAX = 30;
    private static final int MEDIUM_BUCKET_MAX = 60;
    private static final int SHORT_SESSION_LENGTH = 25;
    private static final int LONG_SESSION_LENGTH = 90;
    private static final int[] SESSION_LENGTH_PREFERENCE = {DEFAULT_SESSION_LENGTH, SHORT_SESSION_LENGTH, LONG_SESSION_LENGTH};

    private final PerformanceHistoryDao performanceHistoryDao;
    private final int historyDays;
    private final int minBreakMinutes;

    @Autowired
    public TimeSlotOptimizer(PerformanceHistoryDao performanceHistoryDao,
                             @Value("${planner.timeslot.historyDays:90}") int historyDays,
                             @Value("${planner.timeslot.minBreakMinutes:30}") int minBreakMinutes) {
        this.performanceHistoryDao = performanceHistoryDao;
        this.historyDays = historyDays;
        this.minBreakMinutes = minBreakMinutes;
    }

    /**
     * Slots covering hoursNeeded, spread round-robin over daysAvailable, using the learner's own history.
     */
    public List<TimeSlot> optimalSlots(String learnerId, double hoursNeeded, List<DayOfWeek> daysAvailable, Instant now) {
        ProductivityProfile profile = productivityProfile(learnerId, List.of(), now);
        return optimalSlots(profile, hoursNeeded, daysAvailable, profile.sessionLengthMinutes(), Integer.MAX_VALUE);
    }

    public ProductivityProfile productivityProfile(String learnerId, List<Integer> preferredHours, Instant now) {
        List<SessionRecord> sessions = performanceHistoryDao.fetchStudySessions(
                learnerId, Optional.empty(), now.minus(Duration.ofDays(historyDays)));

        ProductivityProfile profile = productivityProfile(sessions, preferredHours);
        log.debug("Productivity profile for learner {}: hours {}, session length {}",
                learnerId, profile.rankedHours(), profile.sessionLengthMinutes());

        return profile;
    }

    public ProductivityProfile productivityProfile(List<SessionRecord> sessions, List<Integer> preferredHours) {
        Map<Integer, List<Double>> ratingsByHour = new TreeMap<>();
        for (SessionRecord session : sessions) {
            if (session.productivityRating() != null && session.effectiveStart() != null) {
                int hour = session.effectiveStart().atZone(ZoneOffset.UTC).getHour();
                ratingsByHour.computeIfAbsent(hour, key -> new ArrayList<>()).add((double) session.productivityRating());
            }
        }

        Map<Integer, Double> hourlyProductivity = new LinkedHashMap<>();
        for (Map.Entry<Integer, List<Double>> entry : ratingsByHour.entrySet()) {
            hourlyProductivity.put(entry.getKey(), Statistics.mean(entry.getValue()));
        }

        List<Integer> rankedHours;
        List<Integer> validPreferredHours = preferredHours == null ? List.of() : preferredHours.stream()
                .filter(hour -> hour != null && hour >= 0 && hour < 24)
                .distinct()
                .toList();
        if (!validPreferredHours.isEmpty()) {
            rankedHours = validPreferredHours;
        } else if (!hourlyProductivity.isEmpty()) {
            // ties keep the earlier hour first
            rankedHours = hourlyProductivity.entrySet().stream()
                    .sorted(Map.Entry.<Integer, Double>comparingByValue().reversed())
                    .limit(TOP_HOURS)
                    .map(Map.Entry::getKey)
                    .toList();
        } else {
            rankedHours = List.of(DEFAULT_HOUR);
        }

        return new ProductivityProfile(rankedHours, hourlyProductivity, bestSessionLength(sessions), !hourlyProductivity.isEmpty());
    }

    /**
     * Turns hoursNeeded into sessions of sessionLengthMinutes and places them round-robin over daysAvailable, at most
     * maxSessionsPerDay per day. The n-th session of a day gets the n-th ranked hour, cycling through the ranking.
     * Sessions of one day never overlap; a session whose hour is taken starts after the previous one plus a break.
     * Slots are returned ordered by day, then start time.
     */
    public List<TimeSlot> optimalSlots(ProductivityProfile profile,
                                       double hoursNeeded,
                                       List<DayOfWeek> daysAvailable,
                                       int sessionLengthMinutes,
                                       int maxSessionsPerDay) {
        if (daysAvailable == null || daysAvailable.isEmpty() || hoursNeeded <= 0) {
            return List.of();
        }

        int sessionLength = sessionLengthMinutes > 0 ? sessionLengthMinutes : profile.sessionLengthMinutes();
        int perDay = Math.max(1, maxSessionsPerDay);
        long sessionCount = Math.max(1, Math.round(hoursNeeded * 60 / sessionLength));
        sessionCount = Math.min(sessionCount, (long) daysAvailable.size() * perDay);

        Map<DayOfWeek, List<TimeSlot>> slotsByDay = new EnumMap<>(DayOfWeek.class);
        for (int i = 0; i < sessionCount; i++) {
            DayOfWeek day = daysAvailable.get(i % daysAvailable.size());
            List<TimeSlot> daySlots = slotsByDay.computeIfAbsent(day, key -> new ArrayList<>());

            int hour = profile.rankedHours().get(daySlots.size() % profile.rankedHours().size());
            Optional<Integer> start = freeStart(daySlots, hour * 60, sessionLength);
            if (start.isEmpty()) {
                log.debug("No room left on {} for another {} minute session", day, sessionLength);
                continue;
            }

            LocalTime startTime = LocalTime.of(start.get() / 60, start.get() % 60);
            daySlots.add(new TimeSlot(day, startTime, sessionLength, profile.productivityAt(startTime.getHour())));
        }

        List<TimeSlot> slots = new ArrayList<>();
        for (List<TimeSlot> daySlots : slotsByDay.values()) {
            slots.addAll(daySlots);
        }
        slots.sort(Comparator.comparing(TimeSlot::day).thenComparing(TimeSlot::startTime));

        return slots;
    }

    private Optional<Integer> freeStart(List<TimeSlot> daySlots, int preferredStart, int duration) {
        if (fits(daySlots, preferredStart, duration, 0)) {
            return Optional.of(preferredStart);
        }

        List<Integer> ends = daySlots.stream()
                .map(slot -> minuteOfDay(slot.startTime()) + slot.durationMinutes())
                .sorted()
                .toList();

        for (int end : ends) {
            if (fits(daySlots, end + minBreakMinutes, duration, minBreakMinutes)) {
                return Optional.of(end + minBreakMinutes);
            }
        }
        for (int end : ends) {
            if (fits(daySlots, end, duration, 0)) {
                return Optional.of(end);
            }
        }

        return Optional.empty();
    }

    private static boolean fits(List<TimeSlot> daySlots, int start, int duration, int requiredBreak) {
        if (start < 0 || start + duration > MINUTES_PER_DAY - 1) {
            return false;
        }

        for (TimeSlot slot : daySlots) {
            int slotStart = minuteOfDay(slot.startTime());
            int slotEnd = slotStart + slot.durationMinutes();
            if (start < slotEnd + requiredBreak && slotStart < start + duration + requiredBreak) {
                return false;
            }
        }
        return true;
    }

    private static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    // Session length of the duration bucket with the best mean rating: short (<= 30 min), medium (<= 60) or long.
    // Ties go to medium, then short.
    static int bestSessionLength(List<SessionRecord> sessions) {
        Map<Integer, List<Double>> ratingsByLength = new LinkedHashMap<>();
        for (SessionRecord session : sessions) {
            long minutes = session.actualDuration().toMinutes();
            if (session.productivityRating() == null || minutes <= 0) {
                continue;
            }

            int length;
            if (minutes <= SHORT_BUCKET_MAX) {
                length = SHORT_SESSION_LENGTH;
            } else if (minutes <= MEDIUM_BUCKET_MAX) {
                length = DEFAULT_SESSION_LENGTH;
            } else {
                length = LONG_SESSION_LENGTH;
            }
            ratingsByLength.computeIfAbsent(length, key -> new ArrayList<>()).add((double) session.productivityRating());
        }

        int bestLength = DEFAULT_SESSION_LENGTH;
        double bestProductivity = -1;
        for (int length : SESSION_LENGTH_PREFERENCE) {
            List<Double> ratings = ratingsByLength.get(length);
            if (ratings == null) {
                continue;
            }

            double productivity = Statistics.mean(ratings);
            if (productivity > bestProductivity) {
                bestProductivity = productivity;
                bestLength = length;
            }
        }
        return bestLength;
    }
}
