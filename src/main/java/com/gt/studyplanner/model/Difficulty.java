package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum Difficulty implements WireNamed {
    Easy("easy"),
    Medium("medium"),
    Hard("hard");

    private final String wireName;

    Difficulty(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Difficulty fromWireName(String wireName) {
        return WireNamed.fromWireName(Difficulty.class, wireName);
    }
}
