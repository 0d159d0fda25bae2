package com.team.avagen.service.converter;

import com.team.avagen.dsl.EspressoVocabulary;
import com.team.avagen.dsl.FluentExpr;
import com.team.avagen.dsl.FluentExpr.Literal;
import com.team.avagen.dsl.FluentExpr.MatcherCall;
import com.team.avagen.dsl.FluentExpr.NestedHelperCall;
import com.team.avagen.dsl.FluentExpr.Reference;
import com.team.avagen.dsl.FluentStatement;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Tree rewrites that turn an Espresso lookup into a {@code findNode(...)} lookup.
 */
@Component
@RequiredArgsConstructor
public class LookupRewriter {

    static final String LOOKUP_CALL = "findNode";
    static final String ROOT_MATCHER = "isRoot";
    static final String ALL_OF = "allOf";
    static final String WITH_ID = "withId";

    private final EspressoVocabulary vocabulary;

    /**
     * Apply every lookup rewrite in order: drop ignorable matchers, drop namespace qualifiers,
     * inline resource ids, flatten conjunctions, rename the entry call.
     */
    public FluentStatement rewrite(FluentStatement statement) {
        MatcherCall entry = statement.entry();
        List<MatcherCall> modifiers = statement.modifiers();

        for (UnaryOperator<MatcherCall> step : List.<UnaryOperator<MatcherCall>>of(
                this::stripIgnorable, this::stripNamespaces, this::inlineResourceIds, this::flattenAllOf)) {
            entry = step.apply(entry);
            modifiers = modifiers.stream().map(step).toList();
        }
        return statement.withLookup(entry.withoutQualifier().renamed(LOOKUP_CALL), modifiers);
    }

    /** Whether a zero-argument {@code isRoot()} occurs anywhere in the lookup. */
    public boolean targetsRoot(FluentStatement statement) {
        if (containsRoot(statement.entry())) {
            return true;
        }
        return statement.modifiers().stream().anyMatch(this::containsRoot);
    }

    public MatcherCall stripIgnorable(MatcherCall call) {
        return (MatcherCall) rewriteCalls(call,
                c -> c.withArgs(c.args().stream()
                        .filter(arg -> !isIgnorable(arg))
                        .toList()),
                UnaryOperator.identity());
    }

    public MatcherCall stripNamespaces(MatcherCall call) {
        return (MatcherCall) rewriteCalls(call,
                c -> vocabulary.isNamespace(c.qualifier()) ? c.withoutQualifier() : c,
                h -> vocabulary.isNamespace(h.qualifier()) ? new NestedHelperCall(null, h.name(), h.args()) : h);
    }

    /** {@code withId(R.id.x)} and {@code withId(android.R.id.x)} become {@code withId("x")}. */
    public MatcherCall inlineResourceIds(MatcherCall call) {
        return (MatcherCall) rewriteCalls(call,
                c -> WITH_ID.equals(c.name()) && c.qualifier() == null
                        ? c.withArgs(c.args().stream().map(this::inlineResourceId).toList())
                        : c,
                UnaryOperator.identity());
    }

    /**
     * Replace every {@code allOf(a, b)} argument with {@code a, b}, innermost first,
     * so no conjunction remains. A lookup without conjunctions is returned unchanged.
     */
    public MatcherCall flattenAllOf(MatcherCall call) {
        return (MatcherCall) rewriteCalls(call,
                c -> c.withArgs(c.args().stream()
                        .flatMap(arg -> isAllOf(arg) ? ((MatcherCall) arg).args().stream() : Stream.of(arg))
                        .toList()),
                UnaryOperator.identity());
    }

    private FluentExpr rewriteCalls(FluentExpr expr,
                                    UnaryOperator<MatcherCall> matcherOp,
                                    UnaryOperator<NestedHelperCall> helperOp) {
        if (expr instanceof MatcherCall call) {
            List<FluentExpr> args = call.args().stream()
                    .map(arg -> rewriteCalls(arg, matcherOp, helperOp))
                    .toList();
            return matcherOp.apply(call.withArgs(args));
        }
        if (expr instanceof NestedHelperCall helper) {
            List<FluentExpr> args = helper.args().stream()
                    .map(arg -> rewriteCalls(arg, matcherOp, helperOp))
                    .toList();
            return helperOp.apply(new NestedHelperCall(helper.qualifier(), helper.name(), args));
        }
        return expr;
    }

    private FluentExpr inlineResourceId(FluentExpr arg) {
        if (arg instanceof Reference ref) {
            List<String> path = ref.path();
            boolean appId = path.size() == 3 && path.get(0).equals("R") && path.get(1).equals("id");
            boolean androidId = path.size() == 4 && path.get(0).equals("android")
                    && path.get(1).equals("R") && path.get(2).equals("id");
            if (appId || androidId) {
                return Literal.quoted(ref.lastSegment());
            }
        }
        return arg;
    }

    private boolean isIgnorable(FluentExpr arg) {
        return arg instanceof MatcherCall call && call.hasNoArgs() && vocabulary.isIgnorable(call.name());
    }

    private boolean isAllOf(FluentExpr arg) {
        return arg instanceof MatcherCall call && ALL_OF.equals(call.name()) && call.qualifier() == null;
    }

    private boolean containsRoot(FluentExpr expr) {
        if (expr instanceof MatcherCall call) {
            if (ROOT_MATCHER.equals(call.name()) && call.hasNoArgs()) {
                return true;
            }
            return call.args().stream().anyMatch(this::containsRoot);
        }
        if (expr instanceof NestedHelperCall helper) {
            return helper.args().stream().anyMatch(this::containsRoot);
        }
        return false;
    }
}
