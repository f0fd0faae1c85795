package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum PlanType implements WireNamed {
    Weekly("weekly"),
    Monthly("monthly"),
    ExamPrep("exam_prep"),
    Custom("custom");

    private final String wireName;

    PlanType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static PlanType fromWireName(String wireName) {
        return WireNamed.fromWireName(PlanType.class, wireName);
    }
}
