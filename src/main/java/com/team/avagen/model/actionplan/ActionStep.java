package com.team.avagen.model.actionplan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One replayable interaction of an action plan.
 * When {@code nodeQuery} contains a structural relation (parent, child, descendant),
 * {@code matchers} is empty and the query is the only description of the target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"action", "matchers", "text", "millis", "node_query"})
public class ActionStep {

    private ActionType action;

    @Builder.Default
    private List<StepMatcher> matchers = new ArrayList<>();

    private String text;            // input actions only
    private Long millis;            // sleep only

    @JsonProperty("node_query")
    private String nodeQuery;       // verbatim findNode(...) arguments

    public static ActionStep of(ActionType action) {
        return ActionStep.builder().action(action).build();
    }
}
