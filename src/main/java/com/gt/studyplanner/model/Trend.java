package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum Trend implements WireNamed {
    Improving("improving"),
    Stable("stable"),
    Declining("declining"),
    InsufficientData("insufficient_data");

    private final String wireName;

    Trend(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Trend fromWireName(String wireName) {
        return WireNamed.fromWireName(Trend.class, wireName);
    }
}
