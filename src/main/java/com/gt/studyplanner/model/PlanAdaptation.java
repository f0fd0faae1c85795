package com.gt.studyplanner.model;

import java.time.Instant;
import java.util.List;

public record PlanAdaptation(AdaptationType type,
                             String reason,
                             Instant appliedAt,
                             List<String> supersededSessionIds,
                             List<String> newSessionIds) { }
