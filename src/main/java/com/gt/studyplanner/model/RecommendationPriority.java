package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum RecommendationPriority implements WireNamed {
    High("high"),
    Medium("medium"),
    Low("low");

    private final String wireName;

    RecommendationPriority(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static RecommendationPriority fromWireName(String wireName) {
        return WireNamed.fromWireName(RecommendationPriority.class, wireName);
    }
}
