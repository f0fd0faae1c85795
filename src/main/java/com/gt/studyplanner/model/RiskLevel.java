package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum RiskLevel implements WireNamed {
    Low("low"),
    Medium("medium"),
    High("high");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static RiskLevel fromWireName(String wireName) {
        return WireNamed.fromWireName(RiskLevel.class, wireName);
    }
}
