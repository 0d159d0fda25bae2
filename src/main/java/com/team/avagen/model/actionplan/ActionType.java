package com.team.avagen.model.actionplan;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Replayable action kinds written to the action plan JSON.
 */
public enum ActionType {

    CLICK("click"),
    INPUT("input"),
    SWIPE_LEFT("swipeLeft"),
    SWIPE_RIGHT("swipeRight"),
    SWIPE_LEFT_ON_NODE("swipeLeftOnNode"),
    SWIPE_RIGHT_ON_NODE("swipeRightOnNode"),
    SCROLL_DOWN("scrollDown"),
    SCROLL_UP("scrollUp"),
    SWIPE_LEFT_50_PERCENT("swipeLeft50Percent"),
    SWIPE_RIGHT_50_PERCENT("swipeRight50Percent"),
    PRESS_BACK("pressBack"),
    CLOSE_SOFT_KEYBOARD("closeSoftKeyboard"),
    SLEEP("sleep");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
