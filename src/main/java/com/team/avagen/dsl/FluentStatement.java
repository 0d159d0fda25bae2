package com.team.avagen.dsl;

import com.team.avagen.dsl.FluentExpr.ActionCall;
import com.team.avagen.dsl.FluentExpr.MatcherCall;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed {@code entry(...).modifier(...).perform(actions...).trailing(...);} statement.
 *
 * @param entry     the lookup call, e.g. {@code onView(withId(R.id.x))}
 * @param modifiers calls chained on the lookup before {@code perform}
 * @param actions   arguments of {@code perform}
 * @param trailing  calls chained after {@code perform}
 */
public record FluentStatement(MatcherCall entry,
                              List<MatcherCall> modifiers,
                              List<FluentExpr> actions,
                              List<ActionCall> trailing) {

    public FluentStatement {
        modifiers = List.copyOf(modifiers);
        actions = List.copyOf(actions);
        trailing = List.copyOf(trailing);
    }

    public FluentStatement withLookup(MatcherCall newEntry, List<MatcherCall> newModifiers) {
        return new FluentStatement(newEntry, newModifiers, actions, trailing);
    }

    /** Every call name in the lookup part, entry and modifiers included. */
    public List<String> matcherNames() {
        List<String> names = new ArrayList<>(entry.callNames());
        modifiers.forEach(m -> names.addAll(m.callNames()));
        return names;
    }

    /** Every call name in {@code perform(...)} and after it. */
    public List<String> actionNames() {
        List<String> names = new ArrayList<>();
        actions.forEach(a -> names.addAll(a.callNames()));
        trailing.forEach(t -> names.addAll(t.callNames()));
        return names;
    }

    /** The lookup part rendered in canonical form. */
    public String renderLookup() {
        StringBuilder sb = new StringBuilder(entry.render());
        modifiers.forEach(m -> sb.append('.').append(m.render()));
        return sb.toString();
    }

    public String renderActions() {
        return FluentExpr.renderArgs(actions);
    }

    public String render() {
        StringBuilder sb = new StringBuilder(renderLookup())
                .append(".perform(").append(renderActions()).append(')');
        trailing.forEach(t -> sb.append('.').append(t.render()));
        return sb.append(';').toString();
    }
}
