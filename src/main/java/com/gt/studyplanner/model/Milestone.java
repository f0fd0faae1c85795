package com.gt.studyplanner.model;

import java.time.LocalDate;

public record Milestone(int percentage,
                        int topics,
                        double weeks,
                        LocalDate estimatedDate,
                        double confidence) { }
