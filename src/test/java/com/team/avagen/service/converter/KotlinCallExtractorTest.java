package com.team.avagen.service.converter;

import com.team.avagen.PipelineFixtures;
import com.team.avagen.model.NormalizedCall;
import com.team.avagen.model.SourceDialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KotlinCallExtractorTest {

    private final CallExtractor extractor = PipelineFixtures.extractors().forDialect(SourceDialect.KOTLIN);

    private List<String> statements(String source) {
        return extractor.extract(source).stream().map(NormalizedCall::statement).toList();
    }

    @Test
    void completesWithoutTerminator() {
        String source = """
                onView(withText("Settings"))
                    .perform(click())
                onView(withContentDescription("More options")).perform(click())
                """;

        assertEquals(List.of(
                "onView(withText(\"Settings\")).perform(click());",
                "onView(withContentDescription(\"More options\")).perform(click());"),
                statements(source));
    }

    @Test
    void joinsDeeplyWrappedLookup() {
        String source = """
                onView(
                    allOf(
                        withId(R.id.overviewFragment),
                        withContentDescription("Overview")
                    )
                ).perform(click())
                """;

        List<String> statements = statements(source);
        assertEquals(1, statements.size());
        assertTrue(statements.get(0).startsWith("onView( allOf( withId(R.id.overviewFragment),"));
        assertTrue(statements.get(0).endsWith(").perform(click());"));
    }

    @Test
    void assertionIsDiscarded() {
        String source = """
                onView(allOf(withId(R.id.medicineName), withText("Claritin")))
                    .check(matches(isDisplayed()))
                onView(withId(R.id.save))
                    .perform(click())
                """;

        assertEquals(List.of("onView(withId(R.id.save)).perform(click());"), statements(source));
    }

    @Test
    void unbalancedLookupIsDropped() {
        String source = """
                onView(withId(R.id.ok)).perform(click())
                onView(
                    allOf(
                        withId(R.id.cancel),
                        withText("Cancel")
                    ).perform(click())
                """;

        assertEquals(List.of("onView(withId(R.id.ok)).perform(click());"), statements(source));
    }

    @Test
    void extractsEveryActionFromFixture() {
        List<NormalizedCall> calls = extractor.extract(PipelineFixtures.resource("/fixtures/medtimer/testclass2.kt"));

        assertEquals(9, calls.size());
        assertTrue(calls.stream().allMatch(c -> c.dialect() == SourceDialect.KOTLIN));
        assertTrue(calls.stream().noneMatch(c -> c.statement().contains(".check(")));
    }

    @Test
    void convertsWrappedLookupLikeJava() {
        StatementConverter converter = PipelineFixtures.converter();
        String source = """
                onView(
                    allOf(
                        ViewMatchers.withId(R.id.medicinesFragment),
                        withContentDescription("Medicine")
                    )
                ).perform(click())
                """;

        NormalizedCall call = extractor.extract(source).get(0);
        assertEquals("performClick(findNode(withId(\"medicinesFragment\"), withContentDescription(\"Medicine\")));",
                converter.convert(call).statement());
    }
}
