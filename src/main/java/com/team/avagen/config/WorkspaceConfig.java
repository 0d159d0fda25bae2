package com.team.avagen.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Workspace layout:
 * <pre>
 * {root}/{appId}/input/                   raw test classes
 * {root}/{appId}/extracted_tests/         one file per test method
 * {root}/{appId}/va_methods/              one synthesized method per file
 * {root}/actionplan/{appId}_actionplan.json
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "avagen.workspace")
@Getter
@Setter
public class WorkspaceConfig {

    private String root = "workspace";
    private String inputDir = "input";
    private String extractedDir = "extracted_tests";
    private String synthesizedDir = "va_methods";
    private String actionPlanDir = "actionplan";

    /** Optional app description kept next to the inputs, not a test source */
    private String appIntroductionFile = "app_introduction.txt";

    public Path appRoot(String appId) {
        return Path.of(root).resolve(appId);
    }

    public Path inputPath(String appId) {
        return appRoot(appId).resolve(inputDir);
    }

    public Path extractedPath(String appId) {
        return appRoot(appId).resolve(extractedDir);
    }

    public Path synthesizedPath(String appId) {
        return appRoot(appId).resolve(synthesizedDir);
    }

    public Path actionPlanFile(String appId) {
        return Path.of(root).resolve(actionPlanDir).resolve(appId + "_actionplan.json");
    }
}
