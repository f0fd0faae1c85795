package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum PerformanceCategory implements WireNamed {
    Excellent("Excellent"),
    Good("Good"),
    Average("Average"),
    NeedsImprovement("Needs Improvement"),
    Poor("Poor");

    private final String wireName;

    PerformanceCategory(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static PerformanceCategory fromWireName(String wireName) {
        return WireNamed.fromWireName(PerformanceCategory.class, wireName);
    }
}
