package com.team.avagen.service.converter;

import com.team.avagen.dsl.EspressoVocabulary;
import com.team.avagen.model.SourceDialect;
import org.springframework.stereotype.Component;

/**
 * Kotlin statements usually have no terminator. A statement is complete once
 * {@code .perform(} was seen and parentheses are balanced.
 */
@Component
public class KotlinCallExtractor extends CallExtractor {

    public KotlinCallExtractor(EspressoVocabulary vocabulary) {
        super(vocabulary);
    }

    @Override
    public SourceDialect dialect() {
        return SourceDialect.KOTLIN;
    }

    @Override
    protected boolean isComplete(String joined, int balance, boolean marker) {
        return marker && balance <= 0;
    }

    @Override
    protected boolean isFinishedWithoutAction(String joined, int balance, boolean marker) {
        return !marker && balance <= 0 && joined.contains(".check(");
    }
}
