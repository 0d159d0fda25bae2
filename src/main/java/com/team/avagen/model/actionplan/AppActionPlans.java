package com.team.avagen.model.actionplan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The per-app action plan document, keyed by method name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"app_id", "action_plans"})
public class AppActionPlans {

    @JsonProperty("app_id")
    private String appId;

    @JsonProperty("action_plans")
    @Builder.Default
    private Map<String, ActionPlan> actionPlans = new LinkedHashMap<>();
}
