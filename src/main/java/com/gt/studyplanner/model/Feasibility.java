package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum Feasibility implements WireNamed {
    High("high"),
    Medium("medium"),
    Low("low"),
    VeryLow("very_low");

    private final String wireName;

    Feasibility(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Feasibility fromWireName(String wireName) {
        return WireNamed.fromWireName(Feasibility.class, wireName);
    }
}
