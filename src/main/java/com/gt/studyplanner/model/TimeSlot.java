package com.gt.studyplanner.model;

import java.time.DayOfWeek;
import java.time.LocalTime;

public record TimeSlot(DayOfWeek day,
                       LocalTime startTime,
                       int durationMinutes,
                       double productivityScore) { }
