package com.team.avagen.model.actionplan;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the replaying device compares a matcher value against a node attribute.
 */
public enum MatchMode {

    EQUALS_IGNORE_CASE("equalsIgnoreCase"),
    CONTAINS_IGNORE_CASE("containsIgnoreCase"),
    CONTAINS("contains"),
    STARTS_WITH_IGNORE_CASE("startsWithIgnoreCase"),
    ENDS_WITH_IGNORE_CASE("endsWithIgnoreCase"),
    EQUALS("equals");

    private final String wireName;

    MatchMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
