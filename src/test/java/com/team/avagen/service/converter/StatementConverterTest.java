package com.team.avagen.service.converter;

import com.team.avagen.PipelineFixtures;
import com.team.avagen.exception.ConversionFormatException;
import com.team.avagen.exception.UnsupportedActionException;
import com.team.avagen.exception.UnsupportedMatcherException;
import com.team.avagen.model.ConversionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatementConverterTest {

    private final StatementConverter converter = PipelineFixtures.converter();

    private String convert(String statement) {
        ConversionResult result = converter.convert(statement);
        assertTrue(result.isConverted(), () -> "not converted: " + result.statement());
        return result.statement();
    }

    @Test
    @DisplayName("click on a resource id becomes performClick(findNode(withId(\"...\")))")
    void clickOnResourceId() {
        assertEquals("performClick(findNode(withId(\"button\")));",
                convert("onView(withId(R.id.button)).perform(click());"));
    }

    @Test
    void unsupportedActionCarriesItsName() {
        UnsupportedActionException e = assertThrows(UnsupportedActionException.class,
                () -> converter.convert("onView(withId(R.id.button)).perform(doubleClick());"));

        assertEquals(List.of("doubleClick"), e.getActions());
        assertEquals("Unsupported Espresso action(s): doubleClick", e.getMessage());
    }

    @Test
    void rootSwipesBecomeBareCalls() {
        assertEquals("performSwipeLeft();", convert("onView(isRoot()).perform(swipeLeft());"));
        assertEquals("performSwipeRight();", convert("onView(isRoot()).perform(swipeRight());"));
    }

    @Test
    void otherRootActionsUseGenericWrapper() {
        assertEquals("performOnRoot(click());", convert("onView(isRoot()).perform(click());"));
    }

    @Test
    void conjunctionIsFlattenedAndIdsInlined() {
        assertEquals("performClick(findNode(withId(\"medicinesFragment\"), withContentDescription(\"Medicine\")));",
                convert("onView(allOf(ViewMatchers.withId(R.id.medicinesFragment), withContentDescription(\"Medicine\"))).perform(click());"));
    }

    @Test
    void nestedConjunctionsAreFlattenedCompletely() {
        assertEquals("performClick(findNode(withId(\"a\"), withText(\"b\"), withContentDescription(\"c\")));",
                convert("onView(allOf(withId(R.id.a), allOf(withText(\"b\"), withContentDescription(\"c\")))).perform(click());"));
    }

    @Test
    void androidResourceIdsAreInlined() {
        assertEquals("performClick(findNode(withId(\"button1\"), withText(\"OK\")));",
                convert("onView(allOf(withId(android.R.id.button1), withText(\"OK\"))).perform(click());"));
    }

    @Test
    void ignorableMatchersAreRemovedWhereverTheyAppear() {
        assertEquals("performClick(findNode(withContentDescription(\"Open drawer\")));",
                convert("onView(allOf(withContentDescription(\"Open drawer\"), isDisplayed())).perform(click());"));
        assertEquals("performClick(findNode(withId(\"a\")));",
                convert("onView(allOf(isDisplayed(), withId(R.id.a))).perform(click());"));
    }

    @Test
    void textInputPassesArgumentThroughVerbatim() {
        assertEquals("performInput(findNode(withId(\"category_name\")), param3);",
                convert("onView(allOf(withId(R.id.category_name), isDisplayed())).perform(replaceText(param3));"));
        assertEquals("performInput(findNode(withClassName(containsStringIgnoringCase(\"EditText\"))), \"Claritin\");",
                convert("onView(withClassName(containsStringIgnoringCase(\"EditText\"))).perform(typeText(\"Claritin\"));"));
    }

    @Test
    void scrollIntoViewDegradesToScrollDown() {
        assertEquals("performScrollDown();", convert("onView(withId(R.id.save)).perform(scrollTo());"));
    }

    @Test
    void nodeSwipesWrapTheLookup() {
        assertEquals("performSwipeLeftOnNode(findNode(withId(\"text\"), withText(heelo)));",
                convert("onView(allOf(withId(R.id.text), withText(heelo))).perform(swipeLeft());"));
        assertEquals("performSwipeRightOnNode(findNode(withId(\"pager\")));",
                convert("onView(withId(R.id.pager)).perform(swipeRight());"));
    }

    @Test
    void structuralMatchersAreKept() {
        assertEquals("performClick(findNode(withId(\"button_edit\"), withParent(withParent(hasDescendant(withText(containsStringIgnoringCase(\"Blueberry\")))))));",
                convert("onView(allOf(withId(R.id.button_edit), withParent(withParent(hasDescendant(withText(containsStringIgnoringCase(\"Blueberry\"))))))).perform(click());"));
    }

    @Test
    void unknownActionFallsBackToPerformOnLookup() {
        assertEquals("findNode(withId(\"item\")).perform(longClick());",
                convert("onView(withId(R.id.item)).perform(longClick());"));
    }

    @Test
    void unsupportedMatchersAreReported() {
        UnsupportedMatcherException e = assertThrows(UnsupportedMatcherException.class,
                () -> converter.convert("onView(allOf(withText(\"Press\"), unsupportedMatcher())).perform(click());"));
        assertEquals(List.of("unsupportedMatcher"), e.getMatchers());

        UnsupportedMatcherException data = assertThrows(UnsupportedMatcherException.class,
                () -> converter.convert("onData(anything()).perform(click());"));
        assertEquals(List.of("onData", "anything"), data.getMatchers());
    }

    @Test
    void stringHelpersDoNotFailValidation() {
        assertDoesNotThrow(() -> converter.validate(
                "onView(allOf(withId(android.R.id.button1), withText(equalsIgnoreCase(\"Save\")))).perform(click());"));
    }

    @Test
    void assertionsChainedAfterPerformAreRejected() {
        UnsupportedActionException e = assertThrows(UnsupportedActionException.class,
                () -> converter.convert("onView(withId(R.id.x)).perform(click()).check(matches(isDisplayed()));"));
        assertEquals(List.of("check", "matches", "isDisplayed"), e.getActions());
    }

    @Test
    void malformedStatementFailsValidationButNotRewriting() {
        assertThrows(ConversionFormatException.class, () -> converter.convert("pressBack();"));

        ConversionResult result = converter.toInternalForm("pressBack();");
        assertFalse(result.isConverted());
        assertEquals(ConversionResult.Status.FORMAT_ERROR, result.status());
        assertTrue(result.statement().startsWith("Error: Invalid Espresso input format"));
    }

    @Test
    void conversionIsDeterministic() {
        String statement = "onView(allOf(withText(\"7 days\"), withId(android.R.id.text1), "
                + "withClassName(containsStringIgnoringCase(\"CheckedTextView\")))).perform(click());";

        String first = convert(statement);
        assertEquals(first, convert(statement));
        assertEquals(first, converter.toInternalForm(statement).statement());
    }
}
