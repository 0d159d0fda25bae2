package com.team.avagen.model;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Test source dialects accepted by the pipeline. Each dialect knows its file
 * extension and how its test method headers look.
 */
public enum SourceDialect {

    JAVA(".java",
            Pattern.compile("public\\s+void\\s+(\\w+)\\s*\\("),
            Pattern.compile("(public\\s+void\\s+)(\\w+)(\\s*\\()")),

    KOTLIN(".kt",
            Pattern.compile("fun\\s+(\\w+)\\s*\\("),
            Pattern.compile("(fun\\s+)(\\w+)(\\s*\\()"));

    private final String extension;
    private final Pattern headerPattern;
    private final Pattern renamePattern;

    SourceDialect(String extension, Pattern headerPattern, Pattern renamePattern) {
        this.extension = extension;
        this.headerPattern = headerPattern;
        this.renamePattern = renamePattern;
    }

    public String getExtension() {
        return extension;
    }

    /** Pattern whose first group captures the method name of a header line. */
    public Pattern getHeaderPattern() {
        return headerPattern;
    }

    /** Pattern with three groups: the header prefix, the method name and the opening parenthesis. */
    public Pattern getRenamePattern() {
        return renamePattern;
    }

    public static Optional<SourceDialect> fromFileName(String fileName) {
        return Arrays.stream(values())
                .filter(d -> fileName.endsWith(d.extension))
                .findFirst();
    }

    public static Optional<SourceDialect> fromPath(Path path) {
        return fromFileName(path.getFileName().toString());
    }
}
