package com.team.avagen.model.actionplan;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A flat attribute matcher pulled out of a node lookup, e.g. {@code withText("Save")}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"type", "value", "mode"})
public class StepMatcher {

    private MatcherType type;
    private String value;
    private MatchMode mode;
}
