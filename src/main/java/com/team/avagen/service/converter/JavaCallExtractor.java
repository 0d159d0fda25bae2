package com.team.avagen.service.converter;

import com.team.avagen.dsl.EspressoVocabulary;
import com.team.avagen.model.SourceDialect;
import org.springframework.stereotype.Component;

/**
 * Java statements end with {@code );}, so completion also requires the terminator.
 */
@Component
public class JavaCallExtractor extends CallExtractor {

    public JavaCallExtractor(EspressoVocabulary vocabulary) {
        super(vocabulary);
    }

    @Override
    public SourceDialect dialect() {
        return SourceDialect.JAVA;
    }

    @Override
    protected boolean isComplete(String joined, int balance, boolean marker) {
        return marker && joined.endsWith(");") && balance <= 0;
    }

    @Override
    protected boolean isFinishedWithoutAction(String joined, int balance, boolean marker) {
        return !marker && joined.endsWith(";") && balance <= 0;
    }
}
