package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum OverrideType implements WireNamed {
    Schedule("schedule"),
    DifficultyAdjustment("difficulty"),
    ReviewFrequency("review_frequency");

    private final String wireName;

    OverrideType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static OverrideType fromWireName(String wireName) {
        return WireNamed.fromWireName(OverrideType.class, wireName);
    }
}
