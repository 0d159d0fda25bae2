package com.team.avagen.dsl;

import com.team.avagen.model.SourceDialect;
import com.team.avagen.model.actionplan.MatchMode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Closed allow-lists that decide which Espresso statements the pipeline accepts.
 */
@Getter
@Builder
public class EspressoVocabulary {

    public static final List<String> DEFAULT_ENTRY_POINTS = List.of("onView", "onData", "onWebView");

    public static final Set<String> DEFAULT_IGNORABLE_MATCHERS = Set.of(
            "isDisplayed", "isNotChecked", "isChecked", "isEnabled", "isNotEnabled", "containsString");

    public static final Set<String> DEFAULT_SUPPORTED_MATCHERS = Set.of(
            "onView", "allOf", "withId", "withText", "withContentDescription", "withClassName",
            "withParent", "withParentIndex", "hasDescendant", "isRoot", "containsStringIgnoringCase");

    public static final Set<String> DEFAULT_SUPPORTED_ACTIONS = Set.of(
            "click", "swipeLeft", "swipeRight", "replaceText", "typeText", "longClick", "scrollTo");

    public static final Map<String, MatchMode> DEFAULT_STRING_HELPERS = defaultStringHelpers();

    public static final Set<String> DEFAULT_NAMESPACES = Set.of("ViewMatchers", "Matchers", "CoreMatchers");

    public static final Set<String> DEFAULT_STRUCTURAL_MATCHERS = Set.of("withParent", "withChild", "hasDescendant");

    public static final Set<String> DEFAULT_HELPER_STATEMENTS = Set.of(
            "closeSoftKeyboard()", "closeSoftKeyboard();", "pressBack()", "pressBack();");

    public static final List<String> DEFAULT_ASSERTION_MARKERS = List.of("check(", "matches(");

    private static final Pattern JAVA_SLEEP = Pattern.compile("\\s*Thread\\.sleep\\(\\d+\\);\\s*");
    private static final Pattern KOTLIN_SLEEP = Pattern.compile("\\s*Thread\\.sleep\\(\\d+\\);?\\s*");

    @Singular
    private final List<String> entryPoints;
    @Singular
    private final Set<String> supportedMatchers;
    @Singular
    private final Set<String> ignorableMatchers;
    @Singular
    private final Map<String, MatchMode> stringHelpers;
    @Singular
    private final Set<String> supportedActions;
    @Singular
    private final Set<String> namespaces;
    @Singular
    private final Set<String> structuralMatchers;
    @Singular
    private final Set<String> helperStatements;
    @Singular
    private final List<String> assertionMarkers;

    public static EspressoVocabulary defaults() {
        return EspressoVocabulary.builder()
                .entryPoints(DEFAULT_ENTRY_POINTS)
                .supportedMatchers(DEFAULT_SUPPORTED_MATCHERS)
                .ignorableMatchers(DEFAULT_IGNORABLE_MATCHERS)
                .stringHelpers(DEFAULT_STRING_HELPERS)
                .supportedActions(DEFAULT_SUPPORTED_ACTIONS)
                .namespaces(DEFAULT_NAMESPACES)
                .structuralMatchers(DEFAULT_STRUCTURAL_MATCHERS)
                .helperStatements(DEFAULT_HELPER_STATEMENTS)
                .assertionMarkers(DEFAULT_ASSERTION_MARKERS)
                .build();
    }

    private static Map<String, MatchMode> defaultStringHelpers() {
        Map<String, MatchMode> helpers = new LinkedHashMap<>();
        helpers.put("equalsIgnoreCase", MatchMode.EQUALS_IGNORE_CASE);
        helpers.put("equals", MatchMode.EQUALS);
        helpers.put("containsIgnoreCase", MatchMode.CONTAINS_IGNORE_CASE);
        helpers.put("containsStringIgnoringCase", MatchMode.CONTAINS_IGNORE_CASE);
        helpers.put("contains", MatchMode.CONTAINS);
        helpers.put("startsWithIgnoreCase", MatchMode.STARTS_WITH_IGNORE_CASE);
        helpers.put("endsWithIgnoreCase", MatchMode.ENDS_WITH_IGNORE_CASE);
        return Map.copyOf(helpers);
    }

    /** Whether the line contains one of the entry calls, e.g. {@code onView(}. */
    public boolean startsCall(String line) {
        return entryPoints.stream().anyMatch(entry -> line.contains(entry + "("));
    }

    /** Supported matchers include the ignorable ones, which are stripped later. */
    public boolean isSupportedMatcher(String name) {
        return supportedMatchers.contains(name) || ignorableMatchers.contains(name);
    }

    public boolean isIgnorable(String name) {
        return ignorableMatchers.contains(name);
    }

    public boolean isStringHelper(String name) {
        return stringHelpers.containsKey(name);
    }

    public Optional<MatchMode> helperMode(String name) {
        return Optional.ofNullable(stringHelpers.get(name));
    }

    public boolean isSupportedAction(String name) {
        return supportedActions.contains(name);
    }

    public boolean isNamespace(String qualifier) {
        return qualifier != null && namespaces.contains(qualifier);
    }

    public boolean isStructural(String name) {
        return structuralMatchers.contains(name);
    }

    public boolean isAssertion(String line) {
        return assertionMarkers.stream().anyMatch(line::contains);
    }

    /**
     * Non-interactive statements copied into synthesized methods unchanged:
     * keyboard and back helpers and {@code Thread.sleep(<int>)}.
     * Kotlin statements may omit the semicolon.
     */
    public boolean isHelperStatement(String stripped, SourceDialect dialect) {
        if (helperStatements.contains(stripped)) {
            return true;
        }
        Pattern sleep = dialect == SourceDialect.KOTLIN ? KOTLIN_SLEEP : JAVA_SLEEP;
        return sleep.matcher(stripped).matches();
    }
}
