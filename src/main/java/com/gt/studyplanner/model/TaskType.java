package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum TaskType implements WireNamed {
    Reading("reading"),
    Practice("practice"),
    Quiz("quiz"),
    Project("project"),
    Review("review"),
    Challenge("challenge");

    private final String wireName;

    TaskType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static TaskType fromWireName(String wireName) {
        return WireNamed.fromWireName(TaskType.class, wireName);
    }
}
