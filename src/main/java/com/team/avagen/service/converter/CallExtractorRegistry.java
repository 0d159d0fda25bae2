package com.team.avagen.service.converter;

import com.team.avagen.model.SourceDialect;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the extractor for a source dialect.
 */
@Component
public class CallExtractorRegistry {

    private final Map<SourceDialect, CallExtractor> extractors = new EnumMap<>(SourceDialect.class);

    public CallExtractorRegistry(List<CallExtractor> extractors) {
        extractors.forEach(e -> this.extractors.put(e.dialect(), e));
    }

    public CallExtractor forDialect(SourceDialect dialect) {
        CallExtractor extractor = extractors.get(dialect);
        if (extractor == null) {
            throw new IllegalStateException("No call extractor registered for " + dialect);
        }
        return extractor;
    }
}
