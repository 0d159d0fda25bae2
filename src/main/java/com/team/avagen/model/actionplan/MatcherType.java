package com.team.avagen.model.actionplan;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Node attributes a matcher can target, with the lookup call that produces each one
 * and the mode used when the call's argument is a plain literal.
 */
public enum MatcherType {

    ID("id", "withId", MatchMode.EQUALS_IGNORE_CASE),
    TEXT("text", "withText", MatchMode.CONTAINS_IGNORE_CASE),
    CONTENT_DESCRIPTION("contentDescription", "withContentDescription", MatchMode.CONTAINS_IGNORE_CASE),
    CLASS_NAME("className", "withClassName", MatchMode.CONTAINS_IGNORE_CASE);

    private final String wireName;
    private final String callName;
    private final MatchMode defaultMode;

    MatcherType(String wireName, String callName, MatchMode defaultMode) {
        this.wireName = wireName;
        this.callName = callName;
        this.defaultMode = defaultMode;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getCallName() {
        return callName;
    }

    public MatchMode getDefaultMode() {
        return defaultMode;
    }
}
