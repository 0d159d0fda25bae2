package com.team.avagen;

import com.team.avagen.dsl.EspressoVocabulary;
import com.team.avagen.dsl.FluentCallParser;
import com.team.avagen.service.actionplan.ActionPlanParser;
import com.team.avagen.service.actionplan.NodeQueryParser;
import com.team.avagen.service.converter.CallExtractorRegistry;
import com.team.avagen.service.converter.JavaCallExtractor;
import com.team.avagen.service.converter.KotlinCallExtractor;
import com.team.avagen.service.converter.LookupRewriter;
import com.team.avagen.service.converter.StatementConverter;
import com.team.avagen.service.converter.StatementValidator;
import com.team.avagen.service.method.MethodAssembler;
import com.team.avagen.util.ArgumentSplitter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Hand-wired pipeline components for unit tests.
 */
public final class PipelineFixtures {

    private static final EspressoVocabulary VOCABULARY = EspressoVocabulary.defaults();

    private PipelineFixtures() {
    }

    public static EspressoVocabulary vocabulary() {
        return VOCABULARY;
    }

    public static FluentCallParser parser() {
        return new FluentCallParser(VOCABULARY);
    }

    public static StatementConverter converter() {
        FluentCallParser parser = parser();
        return new StatementConverter(new StatementValidator(parser, VOCABULARY), parser, new LookupRewriter(VOCABULARY));
    }

    public static CallExtractorRegistry extractors() {
        return new CallExtractorRegistry(List.of(new JavaCallExtractor(VOCABULARY), new KotlinCallExtractor(VOCABULARY)));
    }

    public static MethodAssembler assembler() {
        return new MethodAssembler(extractors(), converter(), VOCABULARY);
    }

    public static ActionPlanParser actionPlanParser() {
        ArgumentSplitter splitter = new ArgumentSplitter();
        return new ActionPlanParser(new NodeQueryParser(splitter, VOCABULARY), splitter);
    }

    public static String resource(String path) {
        try (InputStream in = PipelineFixtures.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
