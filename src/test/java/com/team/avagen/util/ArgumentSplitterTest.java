package com.team.avagen.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgumentSplitterTest {

    private final ArgumentSplitter splitter = new ArgumentSplitter();

    @Test
    void splitsOnlyOnTopLevelCommas() {
        List<String> parts = splitter.split(
                "findNode(withId(\"AmountEditText\"), withParent(withId(\"Amount\"), hasDescendant(withId(\"TaType\")))), \"20\"");

        assertEquals(List.of(
                "findNode(withId(\"AmountEditText\"), withParent(withId(\"Amount\"), hasDescendant(withId(\"TaType\"))))",
                "\"20\""), parts);
    }

    @Test
    void ignoresCommasAndParenthesesInsideStrings() {
        List<String> parts = splitter.split("withText(\"a, (b\"), withId(\"c\")");

        assertEquals(List.of("withText(\"a, (b\")", "withId(\"c\")"), parts);
    }

    @Test
    void handlesEscapedQuotes() {
        List<String> parts = splitter.split("\"say \\\"hi, there\\\"\", x");

        assertEquals(List.of("\"say \\\"hi, there\\\"\"", "x"), parts);
    }

    @Test
    void emptyInputHasNoParts() {
        assertTrue(splitter.split("").isEmpty());
        assertTrue(splitter.split("   ").isEmpty());
    }

    @Test
    void parenBalanceSkipsStringLiterals() {
        assertEquals(0, ArgumentSplitter.parenBalance("onView(withText(\"(\")).perform(click());"));
        assertEquals(2, ArgumentSplitter.parenBalance("onView(allOf(withId(R.id.x),"));
        assertEquals(-2, ArgumentSplitter.parenBalance("withText(\")\")))"));
    }
}
