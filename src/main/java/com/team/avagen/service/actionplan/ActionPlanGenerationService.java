package com.team.avagen.service.actionplan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.avagen.config.WorkspaceConfig;
import com.team.avagen.exception.WorkspaceNotFoundException;
import com.team.avagen.model.SourceDialect;
import com.team.avagen.model.actionplan.ActionPlan;
import com.team.avagen.model.actionplan.ActionStep;
import com.team.avagen.model.actionplan.AppActionPlans;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Builds an app's action plan document from its synthesized methods and writes it as JSON.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ActionPlanGenerationService {

    private final WorkspaceConfig workspaceConfig;
    private final ActionPlanParser parser;
    private final ActionPlanMerger merger;
    private final ObjectMapper objectMapper;

    /**
     * Parse every synthesized method of the app and write
     * {@code {root}/actionplan/{appId}_actionplan.json}.
     *
     * @throws WorkspaceNotFoundException if the app has no synthesized methods directory
     */
    public AppActionPlans generateForApp(String appId) {
        Path methodsDir = workspaceConfig.synthesizedPath(appId);
        if (!Files.isDirectory(methodsDir)) {
            throw new WorkspaceNotFoundException(appId, methodsDir);
        }

        Map<String, ActionPlan> plans = new LinkedHashMap<>();
        for (Path file : listMethodFiles(methodsDir)) {
            ActionPlan plan = parser.parse(read(file));
            plans = merger.merge(plans, plan).plans();
            logPlan(plan);
        }

        AppActionPlans document = AppActionPlans.builder()
                .appId(appId)
                .actionPlans(new LinkedHashMap<>(plans))
                .build();
        write(workspaceConfig.actionPlanFile(appId), document);
        return document;
    }

    private List<Path> listMethodFiles(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> SourceDialect.fromPath(p).isPresent())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    private void logPlan(ActionPlan plan) {
        log.info("Parsed method '{}' with {} steps", plan.getMethodName(), plan.getSteps().size());
        List<ActionStep> steps = plan.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            ActionStep step = steps.get(i);
            log.debug("  [STEP {}] action={} text={} node_query={} matchers={}",
                    i, step.getAction().getWireName(), step.getText(), step.getNodeQuery(), step.getMatchers().size());
        }
    }

    private String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private void write(Path target, AppActionPlans document) {
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writeValue(target.toFile(), document);
            log.info("Action plans for {} written to {}", document.getAppId(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }
}
