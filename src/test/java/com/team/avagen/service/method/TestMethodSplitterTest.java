package com.team.avagen.service.method;

import com.team.avagen.PipelineFixtures;
import com.team.avagen.model.SourceDialect;
import com.team.avagen.model.TestMethodBlock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestMethodSplitterTest {

    private final TestMethodSplitter splitter = new TestMethodSplitter();

    @Test
    void splitsJavaFixtureInSourceOrder() {
        Map<String, TestMethodBlock> methods = splitter.split(
                PipelineFixtures.resource("/fixtures/medtimer/testclass1.java"), SourceDialect.JAVA);

        assertEquals(List.of("addNewMedicineTest", "updateOverviewDisplayEventsTest"), List.copyOf(methods.keySet()));

        TestMethodBlock first = methods.get("addNewMedicineTest");
        assertEquals("    @Test", first.lines().get(0));
        assertEquals("    public void addNewMedicineTest() {", first.lines().get(1));
        assertEquals("    }", first.lines().get(first.lines().size() - 1));
        assertEquals(SourceDialect.JAVA, first.dialect());
    }

    @Test
    void splitsKotlinFixture() {
        Map<String, TestMethodBlock> methods = splitter.split(
                PipelineFixtures.resource("/fixtures/medtimer/testclass2.kt"), SourceDialect.KOTLIN);

        assertEquals(List.of("addNewMedicineTest2", "updateOverviewDisplayEventsTest2"), List.copyOf(methods.keySet()));
        assertTrue(methods.get("updateOverviewDisplayEventsTest2").source().contains(".check(matches(isDisplayed()))"));
    }

    @Test
    void nestedBracesStayInsideMethod() {
        String source = """
                @Test
                public void loopTest() {
                    for (int i = 0; i < 2; i++) {
                        onView(withId(R.id.next)).perform(click());
                    }
                    onView(withId(R.id.done)).perform(click());
                }

                @Test
                public void otherTest() {
                }
                """;

        Map<String, TestMethodBlock> methods = splitter.split(source, SourceDialect.JAVA);

        assertEquals(7, methods.get("loopTest").lines().size());
        assertTrue(methods.get("loopTest").source().contains("R.id.done"));
        assertTrue(methods.containsKey("otherTest"));
    }

    @Test
    void repeatedNameKeepsLastBlock() {
        String source = """
                @Test
                public void sameTest() {
                    first();
                }
                @Test
                public void sameTest() {
                    second();
                }
                """;

        Map<String, TestMethodBlock> methods = splitter.split(source, SourceDialect.JAVA);

        assertEquals(1, methods.size());
        assertTrue(methods.get("sameTest").source().contains("second();"));
    }

    @Test
    void unrecognizedHeaderIsSkipped() {
        String source = """
                @Test
                private void hiddenTest() {
                }
                @Test
                public void visibleTest() {
                }
                """;

        assertEquals(List.of("visibleTest"), List.copyOf(splitter.split(source, SourceDialect.JAVA).keySet()));
    }

    @Test
    void noTestsYieldsEmptyMap() {
        assertTrue(splitter.split("class Empty {\n}\n", SourceDialect.JAVA).isEmpty());
    }
}
