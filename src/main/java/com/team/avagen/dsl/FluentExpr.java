package com.team.avagen.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Expression tree for one Espresso statement. Calls are tagged by the part of the
 * statement they occur in: matcher calls before {@code perform}, nested string helpers
 * inside matchers, action calls inside and after {@code perform}.
 */
public sealed interface FluentExpr
        permits FluentExpr.MatcherCall, FluentExpr.NestedHelperCall, FluentExpr.ActionCall,
        FluentExpr.Literal, FluentExpr.Reference, FluentExpr.RawExpr {

    /** Canonical source form: no space inside parentheses, {@code ", "} between arguments. */
    String render();

    /** Names of every call in this subtree, outermost first. */
    List<String> callNames();

    /** Common shape of the three call variants. */
    interface Call {

        String qualifier();

        String name();

        List<FluentExpr> args();

        default boolean hasNoArgs() {
            return args().isEmpty();
        }

        default String renderCall() {
            String prefix = qualifier() == null ? "" : qualifier() + ".";
            return prefix + name() + "(" + FluentExpr.renderArgs(args()) + ")";
        }

        default List<String> collectCallNames() {
            List<String> names = new ArrayList<>();
            names.add(name());
            args().forEach(arg -> names.addAll(arg.callNames()));
            return names;
        }
    }

    record MatcherCall(String qualifier, String name, List<FluentExpr> args) implements FluentExpr, Call {

        public MatcherCall {
            args = List.copyOf(args);
        }

        public MatcherCall withArgs(List<FluentExpr> newArgs) {
            return new MatcherCall(qualifier, name, newArgs);
        }

        public MatcherCall withoutQualifier() {
            return new MatcherCall(null, name, args);
        }

        public MatcherCall renamed(String newName) {
            return new MatcherCall(qualifier, newName, args);
        }

        @Override
        public String render() {
            return renderCall();
        }

        @Override
        public List<String> callNames() {
            return collectCallNames();
        }
    }

    record NestedHelperCall(String qualifier, String name, List<FluentExpr> args) implements FluentExpr, Call {

        public NestedHelperCall {
            args = List.copyOf(args);
        }

        @Override
        public String render() {
            return renderCall();
        }

        @Override
        public List<String> callNames() {
            return collectCallNames();
        }
    }

    record ActionCall(String qualifier, String name, List<FluentExpr> args) implements FluentExpr, Call {

        public ActionCall {
            args = List.copyOf(args);
        }

        @Override
        public String render() {
            return renderCall();
        }

        @Override
        public List<String> callNames() {
            return collectCallNames();
        }
    }

    /** String, char or number literal, kept exactly as written (quotes included). */
    record Literal(String text) implements FluentExpr {

        public static Literal quoted(String value) {
            return new Literal("\"" + value + "\"");
        }

        public boolean isString() {
            return text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"");
        }

        @Override
        public String render() {
            return text;
        }

        @Override
        public List<String> callNames() {
            return List.of();
        }
    }

    /** Dotted name such as {@code R.id.button} or a local variable. */
    record Reference(List<String> path) implements FluentExpr {

        public Reference {
            path = List.copyOf(path);
        }

        public String lastSegment() {
            return path.get(path.size() - 1);
        }

        @Override
        public String render() {
            return String.join(".", path);
        }

        @Override
        public List<String> callNames() {
            return List.of();
        }
    }

    /**
     * Argument the grammar does not model (operators, lambdas, chained calls on values).
     * Keeps the source text and the names of the calls it contains so it can still be validated.
     */
    record RawExpr(String text, List<String> calls) implements FluentExpr {

        public RawExpr {
            calls = List.copyOf(calls);
        }

        @Override
        public String render() {
            return text;
        }

        @Override
        public List<String> callNames() {
            return calls;
        }
    }

    static String renderArgs(List<FluentExpr> args) {
        return args.stream().map(FluentExpr::render).collect(Collectors.joining(", "));
    }
}
