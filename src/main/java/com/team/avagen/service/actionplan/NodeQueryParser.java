package com.team.avagen.service.actionplan;

import com.team.avagen.dsl.EspressoVocabulary;
import com.team.avagen.model.actionplan.MatchMode;
import com.team.avagen.model.actionplan.MatcherType;
import com.team.avagen.model.actionplan.StepMatcher;
import com.team.avagen.util.ArgumentSplitter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads a {@code findNode(...)} call into flat matchers plus the verbatim query text.
 */
@Component
public class NodeQueryParser {

    static final String LOOKUP_PREFIX = "findNode(";

    private static final Pattern LOOKUP_OPEN = Pattern.compile("^findNode\\s*\\(");
    private static final Pattern LOOKUP_CLOSE = Pattern.compile("\\)\\s*;?\\s*$");
    private static final Pattern HELPER_CALL = Pattern.compile("(\\w+)\\(\\s*\"([^\"]+)\"\\s*\\)$");
    private static final Pattern STRING_LITERAL = Pattern.compile("^\"([^\"]+)\"");

    private final ArgumentSplitter splitter;
    private final EspressoVocabulary vocabulary;
    private final Pattern structuralCall;

    public NodeQueryParser(ArgumentSplitter splitter, EspressoVocabulary vocabulary) {
        this.splitter = splitter;
        this.vocabulary = vocabulary;
        this.structuralCall = structuralCallPattern(vocabulary);
    }

    /**
     * Matchers found in a node lookup, and the lookup's arguments as written.
     * {@code matchers} is empty when the query is structural.
     */
    public record NodeQuery(List<StepMatcher> matchers, String query) {
    }

    public boolean isLookup(String expression) {
        return expression.startsWith(LOOKUP_PREFIX);
    }

    public NodeQuery parse(String lookupCall) {
        String inner = LOOKUP_OPEN.matcher(lookupCall.strip()).replaceFirst("");
        inner = LOOKUP_CLOSE.matcher(inner).replaceFirst("").strip();

        if (isStructural(inner)) {
            return new NodeQuery(List.of(), inner);
        }

        List<StepMatcher> matchers = new ArrayList<>();
        for (String part : splitter.split(inner)) {
            toMatcher(part).ifPresent(matchers::add);
        }
        return new NodeQuery(matchers, inner);
    }

    /** Whether any structural matcher call, e.g. {@code withParent(}, occurs in the query. */
    boolean isStructural(String query) {
        return structuralCall != null && structuralCall.matcher(query).find();
    }

    /** {@code \b(?:withParent|withChild|...)\s*\(}, or {@code null} when there are no structural matchers. */
    private static Pattern structuralCallPattern(EspressoVocabulary vocabulary) {
        if (vocabulary.getStructuralMatchers().isEmpty()) {
            return null;
        }
        String names = vocabulary.getStructuralMatchers().stream()
                .sorted()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + names + ")\\s*\\(");
    }

    private Optional<StepMatcher> toMatcher(String part) {
        for (MatcherType type : MatcherType.values()) {
            String prefix = type.getCallName() + "(";
            if (part.startsWith(prefix) && part.endsWith(")")) {
                String argument = part.substring(prefix.length(), part.length() - 1);
                return Optional.of(stringMatch(type, argument));
            }
        }
        return Optional.empty();
    }

    /**
     * Value and mode of a matcher argument: {@code "Save"} uses the type's default mode,
     * {@code equalsIgnoreCase("Save")} uses the helper's mode, anything else is kept raw.
     */
    StepMatcher stringMatch(MatcherType type, String argument) {
        String expr = argument.strip();

        Matcher helper = HELPER_CALL.matcher(expr);
        if (helper.matches()) {
            Optional<MatchMode> mode = vocabulary.helperMode(helper.group(1));
            if (mode.isPresent()) {
                return new StepMatcher(type, helper.group(2), mode.get());
            }
        }

        Matcher literal = STRING_LITERAL.matcher(expr);
        if (literal.find()) {
            return new StepMatcher(type, literal.group(1), type.getDefaultMode());
        }
        return new StepMatcher(type, expr, type.getDefaultMode());
    }
}
