package com.team.avagen.service.actionplan;

import com.team.avagen.model.SourceDialect;
import com.team.avagen.model.actionplan.ActionPlan;
import com.team.avagen.model.actionplan.ActionStep;
import com.team.avagen.model.actionplan.ActionType;
import com.team.avagen.util.ArgumentSplitter;
import com.team.avagen.util.BalancedBlockExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a synthesized method into an {@link ActionPlan}. Lines that match none of the
 * known statement shapes are skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ActionPlanParser {

    static final String UNKNOWN_METHOD = "UnknownMethod";

    private static final Map<String, ActionType> BARE_CALLS = Map.ofEntries(
            Map.entry("pressBack()", ActionType.PRESS_BACK),
            Map.entry("closeSoftKeyboard()", ActionType.CLOSE_SOFT_KEYBOARD),
            Map.entry("scrollDown()", ActionType.SCROLL_DOWN),
            Map.entry("performScrollDown()", ActionType.SCROLL_DOWN),
            Map.entry("scrollUp()", ActionType.SCROLL_UP),
            Map.entry("performScrollUp()", ActionType.SCROLL_UP),
            Map.entry("swipeLeft50Percent()", ActionType.SWIPE_LEFT_50_PERCENT),
            Map.entry("swipeRight50Percent()", ActionType.SWIPE_RIGHT_50_PERCENT),
            Map.entry("performSwipeLeft()", ActionType.SWIPE_LEFT),
            Map.entry("performSwipeRight()", ActionType.SWIPE_RIGHT));

    private static final Map<String, ActionType> NODE_CALLS = Map.of(
            "performClick", ActionType.CLICK,
            "performSwipeLeftOnNode", ActionType.SWIPE_LEFT_ON_NODE,
            "performSwipeRightOnNode", ActionType.SWIPE_RIGHT_ON_NODE);

    private static final Pattern SLEEP = Pattern.compile("^Thread\\.sleep\\((\\d+)\\)");
    private static final Pattern WRAPPING_CALL = Pattern.compile("^(\\w+)\\s*\\((.+)\\)$");
    private static final Pattern QUOTED_TEXT = Pattern.compile("^\"(.*)\"");
    private static final String INPUT_CALL = "performInput";

    private final NodeQueryParser nodeQueryParser;
    private final ArgumentSplitter splitter;

    public ActionPlan parse(String methodSource) {
        List<String> lines = List.of(methodSource.split("\\R", -1));
        String name = UNKNOWN_METHOD;
        int headerIndex = -1;

        outer:
        for (int i = 0; i < lines.size(); i++) {
            for (SourceDialect dialect : SourceDialect.values()) {
                Matcher m = dialect.getHeaderPattern().matcher(lines.get(i));
                if (m.find()) {
                    name = m.group(1);
                    headerIndex = i;
                    break outer;
                }
            }
        }

        List<ActionStep> steps = new ArrayList<>();
        if (headerIndex >= 0) {
            BalancedBlockExtractor.Block body = BalancedBlockExtractor.find(lines, headerIndex);
            List<String> bodyLines = body == null ? List.of() : body.inner(lines);
            for (String line : bodyLines) {
                if (line.isBlank()) continue;
                parseLine(line).ifPresentOrElse(steps::add,
                        () -> log.debug("Ignoring line in {}: {}", lines.get(0).strip(), line.strip()));
            }
        }
        return ActionPlan.builder().methodName(name).steps(steps).build();
    }

    /**
     * Parse one statement of a synthesized method.
     *
     * @return the step, or empty when the line has no recognized shape
     */
    public Optional<ActionStep> parseLine(String line) {
        String stmt = stripTerminators(line.strip());

        ActionType bare = BARE_CALLS.get(stmt);
        if (bare != null) {
            return Optional.of(ActionStep.of(bare));
        }

        Matcher sleep = SLEEP.matcher(stmt);
        if (sleep.find()) {
            return sleepStep(sleep.group(1));
        }

        Matcher call = WRAPPING_CALL.matcher(stmt);
        if (!call.matches()) {
            return Optional.empty();
        }
        String callName = call.group(1);
        String args = call.group(2).strip();

        ActionType nodeAction = NODE_CALLS.get(callName);
        if (nodeAction != null) {
            return Optional.of(targeted(nodeAction, args, null));
        }
        if (INPUT_CALL.equals(callName)) {
            List<String> parts = splitter.split(args);
            String target = parts.isEmpty() ? "" : parts.get(0);
            String text = parts.size() > 1 ? parts.get(1) : "";
            Matcher quoted = QUOTED_TEXT.matcher(text);
            if (quoted.find()) {
                text = quoted.group(1);
            }
            return Optional.of(targeted(ActionType.INPUT, target, text));
        }
        return Optional.empty();
    }

    private Optional<ActionStep> sleepStep(String digits) {
        try {
            return Optional.of(ActionStep.builder()
                    .action(ActionType.SLEEP)
                    .millis(Long.parseLong(digits))
                    .build());
        } catch (NumberFormatException e) {
            log.debug("Skipping sleep with out-of-range duration: {}", digits);
            return Optional.empty();
        }
    }

    private ActionStep targeted(ActionType action, String target, String text) {
        ActionStep.ActionStepBuilder step = ActionStep.builder().action(action).text(text);
        if (nodeQueryParser.isLookup(target)) {
            NodeQueryParser.NodeQuery query = nodeQueryParser.parse(target);
            step.matchers(new ArrayList<>(query.matchers())).nodeQuery(query.query());
        }
        return step.build();
    }

    private static String stripTerminators(String stmt) {
        int end = stmt.length();
        while (end > 0 && stmt.charAt(end - 1) == ';') {
            end--;
        }
        return stmt.substring(0, end).strip();
    }
}
