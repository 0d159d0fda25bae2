package com.team.avagen.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.avagen.PipelineFixtures;
import com.team.avagen.service.actionplan.ActionPlanStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class AvaGenCommandRunnerTest {

    @TempDir
    static Path workspace;

    @DynamicPropertySource
    static void workspaceRoot(DynamicPropertyRegistry registry) {
        registry.add("avagen.workspace.root", () -> workspace.toString());
    }

    @Autowired
    private AvaGenCommandRunner runner;

    @Autowired
    private ActionPlanStore store;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void pipelineProducesActionPlansForPreparedSources() throws IOException {
        Path source = workspace.resolve("startSleepTest.java");
        Files.writeString(source, PipelineFixtures.resource("/fixtures/startSleepTest.java"));

        assertEquals(0, runner.execute(List.of("prepare", "timer", source.toString())));
        assertEquals(0, runner.execute(List.of("pipeline", "timer")));

        Path planFile = workspace.resolve("actionplan").resolve("timer_actionplan.json");
        JsonNode steps = objectMapper.readTree(planFile.toFile()).get("action_plans").get("startSleep").get("steps");
        assertEquals(3, steps.size());
        assertEquals("sleep", steps.get(0).get("action").asText());
        assertEquals("click", steps.get(1).get("action").asText());
        assertEquals("start_stop_text", steps.get(1).get("matchers").get(0).get("value").asText());

        store.evict("timer");
        assertTrue(store.methodsFor("timer").contains("startSleep"));
    }

    @Test
    void extractAndGenerateVaAreAliases() throws IOException {
        Path input = workspace.resolve("alias").resolve("input");
        Files.createDirectories(input);
        Files.writeString(input.resolve("testclass1.java"), PipelineFixtures.resource("/fixtures/medtimer/testclass1.java"));

        assertEquals(0, runner.execute(List.of("extract", "alias")));
        assertEquals(0, runner.execute(List.of("generate-va", "alias")));
        assertTrue(Files.isRegularFile(workspace.resolve("alias").resolve("va_methods").resolve("addNewMedicine.java")));
    }

    @Test
    void missingWorkspaceFails() {
        assertEquals(AvaGenCommandRunner.EXIT_FAILURE, runner.execute(List.of("actionplan", "nobody")));
        assertEquals(AvaGenCommandRunner.EXIT_FAILURE, runner.execute(List.of("extract", "nobody")));
    }

    @Test
    void badInvocationsReturnUsageCode() {
        assertEquals(AvaGenCommandRunner.EXIT_USAGE, runner.execute(List.of("pipeline")));
        assertEquals(AvaGenCommandRunner.EXIT_USAGE, runner.execute(List.of("deploy", "app")));
        assertEquals(AvaGenCommandRunner.EXIT_USAGE, runner.execute(List.of("prepare", "app")));
        assertEquals(AvaGenCommandRunner.EXIT_FAILURE,
                runner.execute(List.of("prepare", "app", workspace.resolve("absent.java").toString())));
    }
}
