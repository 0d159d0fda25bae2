package com.team.avagen.service.actionplan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.avagen.config.WorkspaceConfig;
import com.team.avagen.exception.WorkspaceNotFoundException;
import com.team.avagen.model.actionplan.ActionPlan;
import com.team.avagen.model.actionplan.AppActionPlans;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only access to generated action plan documents, cached per app.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ActionPlanStore {

    private final WorkspaceConfig workspaceConfig;
    private final ObjectMapper objectMapper;

    private final Map<String, AppActionPlans> cache = new ConcurrentHashMap<>();

    /**
     * @throws WorkspaceNotFoundException if no document has been generated for the app
     * @throws IllegalStateException      if the document belongs to another app or has no plans
     */
    public AppActionPlans load(String appId) {
        return cache.computeIfAbsent(appId, this::readDocument);
    }

    public Optional<ActionPlan> find(String appId, String methodName) {
        return Optional.ofNullable(load(appId).getActionPlans().get(methodName));
    }

    public Set<String> methodsFor(String appId) {
        return load(appId).getActionPlans().keySet();
    }

    /** Drop the cached document so the next read goes to disk. */
    public void evict(String appId) {
        cache.remove(appId);
    }

    private AppActionPlans readDocument(String appId) {
        Path file = workspaceConfig.actionPlanFile(appId);
        if (!Files.isRegularFile(file)) {
            throw new WorkspaceNotFoundException(appId, file);
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            JsonNode fileAppId = root.get("app_id");
            if (fileAppId != null && !fileAppId.isNull() && !appId.equals(fileAppId.asText())) {
                throw new IllegalStateException("Action plan file " + file + " belongs to app '"
                        + fileAppId.asText() + "', expected '" + appId + "'");
            }
            if (!root.has("action_plans")) {
                throw new IllegalStateException("Action plan file " + file + " has no action_plans");
            }
            AppActionPlans document = objectMapper.treeToValue(root, AppActionPlans.class);
            document.setAppId(appId);
            log.info("Loaded {} action plans for {}", document.getActionPlans().size(), appId);
            return document;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
