package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

// Shared by logged history sessions and planned sessions; Superseded only applies to planned ones
@JsonSerialize(using = WireNameSerializer.class)
public enum SessionStatus implements WireNamed {
    Scheduled("scheduled"),
    InProgress("in_progress"),
    Completed("completed"),
    Skipped("skipped"),
    Cancelled("cancelled"),
    Superseded("superseded");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SessionStatus fromWireName(String wireName) {
        return WireNamed.fromWireName(SessionStatus.class, wireName);
    }
}
