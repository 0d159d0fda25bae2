package com.team.avagen.model;

/**
 * A single-line Espresso statement such as {@code onView(withId(R.id.x)).perform(click());},
 * joined from one or more source lines.
 */
public record NormalizedCall(String statement, SourceDialect dialect) {

    @Override
    public String toString() {
        return statement;
    }
}
