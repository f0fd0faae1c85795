package com.gt.studyplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyplanner.serialization.WireNameSerializer;

@JsonSerialize(using = WireNameSerializer.class)
public enum AdaptationType implements WireNamed {
    ReduceDifficulty("reduce_difficulty"),
    IncreaseChallenge("increase_challenge"),
    ReduceSessionLength("reduce_session_length"),
    AddReviewSessions("add_review_sessions");

    private final String wireName;

    AdaptationType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static AdaptationType fromWireName(String wireName) {
        return WireNamed.fromWireName(AdaptationType.class, wireName);
    }
}
