package com.team.avagen.service.converter;

import com.team.avagen.dsl.FluentCallParser;
import com.team.avagen.dsl.FluentExpr;
import com.team.avagen.dsl.FluentExpr.ActionCall;
import com.team.avagen.dsl.FluentStatement;
import com.team.avagen.exception.ConversionFormatException;
import com.team.avagen.model.ConversionResult;
import com.team.avagen.model.NormalizedCall;
import com.team.avagen.util.StatementText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;

/**
 * Validates normalized Espresso statements and rewrites them into the internal statement form.
 *
 * <pre>
 * onView(withId(R.id.button)).perform(click());   ->  performClick(findNode(withId("button")));
 * onView(isRoot()).perform(swipeLeft());          ->  performSwipeLeft();
 * onView(withId(R.id.name)).perform(typeText(x)); ->  performInput(findNode(withId("name")), x);
 * </pre>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StatementConverter {

    private static final Set<String> TEXT_INPUT_ACTIONS = Set.of("typeText", "replaceText");
    private static final String SCROLL_INTO_VIEW = "scrollTo";
    private static final String CLICK = "click";
    private static final String SWIPE_LEFT = "swipeLeft";
    private static final String SWIPE_RIGHT = "swipeRight";

    private final StatementValidator validator;
    private final FluentCallParser parser;
    private final LookupRewriter rewriter;

    /**
     * Validate only.
     *
     * @throws com.team.avagen.exception.StatementConversionException on any validation failure
     */
    public void validate(String statement) {
        validator.validate(statement);
    }

    /**
     * Validate, then rewrite. Validation failures propagate to the caller.
     */
    public ConversionResult convert(NormalizedCall call) {
        return convert(call.statement());
    }

    public ConversionResult convert(String statement) {
        FluentStatement parsed = validator.validate(statement);
        return ConversionResult.converted(render(parsed));
    }

    /**
     * Rewrite without validating. Never throws: an unparseable statement yields a
     * {@link ConversionResult.Status#FORMAT_ERROR} result.
     */
    public ConversionResult toInternalForm(String statement) {
        FluentStatement parsed;
        try {
            parsed = parser.parse(statement.strip());
        } catch (ConversionFormatException e) {
            log.debug("Cannot convert statement: {}", e.getMessage());
            return ConversionResult.formatError(statement);
        }
        return ConversionResult.converted(render(parsed));
    }

    private String render(FluentStatement statement) {
        boolean root = rewriter.targetsRoot(statement);
        FluentStatement rewritten = rewriter.rewrite(statement);
        String lookup = rewritten.renderLookup();

        if (!statement.trailing().isEmpty()) {
            return StatementText.tighten(rewritten.render());
        }

        Optional<ActionCall> textInput = statement.actions().stream()
                .filter(a -> a instanceof ActionCall)
                .map(a -> (ActionCall) a)
                .filter(a -> TEXT_INPUT_ACTIONS.contains(a.name()) && !a.args().isEmpty())
                .findFirst();
        if (textInput.isPresent()) {
            String text = textInput.get().args().get(0).render();
            return StatementText.tighten("performInput(" + lookup + ", " + text + ");");
        }

        String single = singleZeroArgAction(statement);
        if (SCROLL_INTO_VIEW.equals(single)) {
            log.debug("scrollTo() on {} becomes a plain scroll down", lookup);
            return "performScrollDown();";
        }

        if (root) {
            if (SWIPE_LEFT.equals(single)) return "performSwipeLeft();";
            if (SWIPE_RIGHT.equals(single)) return "performSwipeRight();";
            return StatementText.tighten("performOnRoot(" + statement.renderActions() + ");");
        }

        if (CLICK.equals(single)) {
            return StatementText.tighten("performClick(" + lookup + ");");
        }
        if (SWIPE_LEFT.equals(single)) {
            return StatementText.tighten("performSwipeLeftOnNode(" + lookup + ");");
        }
        if (SWIPE_RIGHT.equals(single)) {
            return StatementText.tighten("performSwipeRightOnNode(" + lookup + ");");
        }

        return StatementText.tighten(lookup + ".perform(" + statement.renderActions() + ");");
    }

    /** Name of the only action when it is a bare zero-argument call, otherwise {@code null}. */
    private String singleZeroArgAction(FluentStatement statement) {
        if (statement.actions().size() != 1) {
            return null;
        }
        FluentExpr action = statement.actions().get(0);
        if (action instanceof ActionCall call && call.qualifier() == null && call.hasNoArgs()) {
            return call.name();
        }
        return null;
    }
}
