package com.gt.studyplanner.model;

import java.util.List;

// strength is strong, moderate, concerning or stable
public record TrajectoryForecast(Trend direction,
                                 String strength,
                                 List<String> riskFactors,
                                 List<String> warnings,
                                 List<Recommendation> interventions) { }
