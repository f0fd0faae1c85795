package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum LearningProfile implements WireNamed {
    HighPerformer("high_performer"),
    SteadyLearner("steady_learner"),
    NeedsMotivation("needs_motivation"),
    NeedsRepetition("needs_repetition"),
    Developing("developing");

    private final String wireName;

    LearningProfile(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static LearningProfile fromWireName(String wireName) {
        return WireNamed.fromWireName(LearningProfile.class, wireName);
    }
}
