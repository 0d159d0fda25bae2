package com.team.avagen.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of one app's synthesis run.
 */
public record SynthesisReport(String appId,
                              int filesRead,
                              List<Path> extractedFiles,
                              List<Path> synthesizedFiles) {

    public SynthesisReport {
        extractedFiles = List.copyOf(extractedFiles);
        synthesizedFiles = List.copyOf(synthesizedFiles);
    }
}
