package com.team.avagen.service.actionplan;

import com.team.avagen.config.ActionPlanConfig;
import com.team.avagen.exception.DuplicateActionPlanException;
import com.team.avagen.model.actionplan.ActionPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adds plans to an app's plan map. A plan whose method name is already present replaces
 * the earlier one, unless duplicates are configured to fail.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ActionPlanMerger {

    private final ActionPlanConfig config;

    /**
     * Result of one merge.
     *
     * @param plans    the updated map, a new instance
     * @param replaced the plan that was overwritten, or {@code null}
     */
    public record MergeOutcome(Map<String, ActionPlan> plans, ActionPlan replaced) {

        public boolean collided() {
            return replaced != null;
        }
    }

    public MergeOutcome merge(Map<String, ActionPlan> existing, ActionPlan plan) {
        ActionPlan previous = existing.get(plan.getMethodName());
        if (previous != null) {
            if (config.isFailOnDuplicate()) {
                throw new DuplicateActionPlanException(plan.getMethodName());
            }
            log.warn("Action plan '{}' defined more than once, replacing the earlier one ({} steps -> {} steps)",
                    plan.getMethodName(), previous.getSteps().size(), plan.getSteps().size());
        }
        Map<String, ActionPlan> updated = new LinkedHashMap<>(existing);
        updated.put(plan.getMethodName(), plan);
        return new MergeOutcome(Collections.unmodifiableMap(updated), previous);
    }
}
