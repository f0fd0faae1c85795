package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum PlanStatus implements WireNamed {
    Active("active"),
    Paused("paused"),
    Completed("completed"),
    Cancelled("cancelled");

    private final String wireName;

    PlanStatus(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static PlanStatus fromWireName(String wireName) {
        return WireNamed.fromWireName(PlanStatus.class, wireName);
    }
}
