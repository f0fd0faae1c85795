package com.gt.studyplanner.model;

import java.time.LocalDate;

public record CompletionScenario(String name,
                                 double velocity,
                                 double weeks,
                                 LocalDate estimatedDate,
                                 double probability) { }
