package com.gt.studyplanner.model;

import java.time.LocalDate;
import java.util.List;

public record ScheduleFeasibility(LocalDate targetDate,
                                  double remainingWorkHours,
                                  double availableHours,
                                  double feasibilityRatio,
                                  Feasibility overallFeasibility,
                                  double requiredDailyHours,
                                  Feasibility dailyFeasibility,
                                  double successProbability,
                                  List<String> recommendations) { }
