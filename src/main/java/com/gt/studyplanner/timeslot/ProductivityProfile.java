package com.gt.studyplanner.timeslot;

import java.util.List;
import java.util.Map;

/**
 * When a learner studies best. rankedHours lists hours of the day, best first, and is never empty;
 * hourlyProductivity holds the mean self rating (1-5) of every hour with rated history.
 */
public record ProductivityProfile(List<Integer> rankedHours,
                                  Map<Integer, Double> hourlyProductivity,
                                  int sessionLengthMinutes,
                                  boolean fromHistory) {

    public int peakHour() {
        return rankedHours.get(0);
    }

    public double productivityAt(int hour) {
        return hourlyProductivity.getOrDefault(hour, 0.0);
    }
}
