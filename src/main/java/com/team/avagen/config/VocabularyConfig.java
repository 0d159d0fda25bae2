package com.team.avagen.config;

import com.team.avagen.dsl.EspressoVocabulary;
import com.team.avagen.model.actionplan.MatchMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Espresso vocabulary accepted by the converter. Defaults cover the matchers and actions
 * the replaying client understands; extend them here when the client learns new ones.
 */
@Configuration
@ConfigurationProperties(prefix = "avagen.vocabulary")
@Getter
@Setter
public class VocabularyConfig {

    /** Calls that open an Espresso statement, without the parenthesis */
    private List<String> entryPoints = new ArrayList<>(EspressoVocabulary.DEFAULT_ENTRY_POINTS);

    private Set<String> supportedMatchers = new HashSet<>(EspressoVocabulary.DEFAULT_SUPPORTED_MATCHERS);

    /** Zero-argument matchers removed from lookups (visibility and state checks) */
    private Set<String> ignorableMatchers = new HashSet<>(EspressoVocabulary.DEFAULT_IGNORABLE_MATCHERS);

    /** Nested string helpers and the match mode each one maps to */
    private Map<String, MatchMode> stringHelpers = new LinkedHashMap<>(EspressoVocabulary.DEFAULT_STRING_HELPERS);

    private Set<String> supportedActions = new HashSet<>(EspressoVocabulary.DEFAULT_SUPPORTED_ACTIONS);

    /** Qualifiers dropped from matcher calls, e.g. ViewMatchers.withId */
    private Set<String> namespaces = new HashSet<>(EspressoVocabulary.DEFAULT_NAMESPACES);

    /** Matchers describing a parent/child/descendant relation */
    private Set<String> structuralMatchers = new HashSet<>(EspressoVocabulary.DEFAULT_STRUCTURAL_MATCHERS);

    private Set<String> helperStatements = new HashSet<>(EspressoVocabulary.DEFAULT_HELPER_STATEMENTS);

    private List<String> assertionMarkers = new ArrayList<>(EspressoVocabulary.DEFAULT_ASSERTION_MARKERS);

    @Bean
    public EspressoVocabulary espressoVocabulary() {
        return EspressoVocabulary.builder()
                .entryPoints(entryPoints)
                .supportedMatchers(supportedMatchers)
                .ignorableMatchers(ignorableMatchers)
                .stringHelpers(stringHelpers)
                .supportedActions(supportedActions)
                .namespaces(namespaces)
                .structuralMatchers(structuralMatchers)
                .helperStatements(helperStatements)
                .assertionMarkers(assertionMarkers)
                .build();
    }
}
