package com.team.avagen.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Raised when an app's required workspace directory is missing. Aborts processing of that app only.
 */
@Getter
public class WorkspaceNotFoundException extends RuntimeException {

    private final String appId;
    private final Path missingPath;

    public WorkspaceNotFoundException(String appId, Path missingPath) {
        super("Workspace directory not found for app '" + appId + "': " + missingPath);
        this.appId = appId;
        this.missingPath = missingPath;
    }
}
