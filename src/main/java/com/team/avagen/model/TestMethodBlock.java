package com.team.avagen.model;

import java.util.List;

/**
 * One annotated test method as it appears in the source file, annotation line included.
 */
public record TestMethodBlock(String methodName, List<String> lines, SourceDialect dialect) {

    public TestMethodBlock {
        lines = List.copyOf(lines);
    }

    public String source() {
        return String.join("\n", lines);
    }
}
