package com.team.avagen.exception;

import lombok.Getter;

/**
 * Raised when two synthesized methods of one app produce the same plan name
 * and duplicate names are configured to fail.
 */
@Getter
public class DuplicateActionPlanException extends RuntimeException {

    private final String methodName;

    public DuplicateActionPlanException(String methodName) {
        super("Duplicate action plan for method: " + methodName);
        this.methodName = methodName;
    }
}
