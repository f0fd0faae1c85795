package com.gt.studyplanner.model;

public record LoadDistribution(double averageDailyLoad,
                               double maxDailyLoad,
                               double minDailyLoad,
                               int overloadedDays) { }
