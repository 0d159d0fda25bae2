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
 * Ordered steps replaying one synthesized method.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"method_name", "steps"})
public class ActionPlan {

    @JsonProperty("method_name")
    private String methodName;

    @Builder.Default
    private List<ActionStep> steps = new ArrayList<>();
}
