package com.team.avagen.service.converter;

import com.team.avagen.dsl.EspressoVocabulary;
import com.team.avagen.dsl.FluentCallParser;
import com.team.avagen.dsl.FluentStatement;
import com.team.avagen.exception.UnsupportedActionException;
import com.team.avagen.exception.UnsupportedMatcherException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks a statement's call names against the matcher and action allow-lists.
 */
@Component
@RequiredArgsConstructor
public class StatementValidator {

    private final FluentCallParser parser;
    private final EspressoVocabulary vocabulary;

    /**
     * Parse and validate one statement.
     *
     * @return the parsed statement
     * @throws com.team.avagen.exception.ConversionFormatException if it is not shaped {@code entry(...).perform(...);}
     * @throws UnsupportedMatcherException if the lookup part uses unknown matchers
     * @throws UnsupportedActionException  if the perform part uses unknown actions
     */
    public FluentStatement validate(String statement) {
        FluentStatement parsed = parser.parse(statement.strip());

        List<String> badMatchers = parsed.matcherNames().stream()
                .filter(name -> !vocabulary.isSupportedMatcher(name) && !vocabulary.isStringHelper(name))
                .distinct()
                .toList();
        if (!badMatchers.isEmpty()) {
            throw new UnsupportedMatcherException(badMatchers);
        }

        List<String> badActions = parsed.actionNames().stream()
                .filter(name -> !vocabulary.isSupportedAction(name))
                .distinct()
                .toList();
        if (!badActions.isEmpty()) {
            throw new UnsupportedActionException(badActions);
        }
        return parsed;
    }
}
