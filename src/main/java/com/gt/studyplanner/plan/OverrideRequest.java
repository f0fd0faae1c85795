package com.gt.studyplanner.plan;

import java.time.LocalDate;
import java.time.LocalTime;

// Raw override data as submitted. overrideType is one of schedule, difficulty or review_frequency.
public record OverrideRequest(String overrideType,
                              String sessionId,
                              LocalDate newDate,
                              LocalTime newTime,
                              Integer difficultyAdjustment,
                              Integer reviewFrequencyDays,
                              String reason) { }
