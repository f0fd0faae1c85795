package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum DifficultyAdaptation implements WireNamed {
    Easier("easier"),
    Maintain("maintain"),
    Harder("harder");

    private final String wireName;

    DifficultyAdaptation(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static DifficultyAdaptation fromWireName(String wireName) {
        return WireNamed.fromWireName(DifficultyAdaptation.class, wireName);
    }
}
