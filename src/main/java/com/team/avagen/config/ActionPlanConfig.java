package com.team.avagen.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for action plan generation.
 */
@Configuration
@ConfigurationProperties(prefix = "avagen.action-plan")
@Getter
@Setter
public class ActionPlanConfig {

    /** Fail instead of overwriting when two methods of one app share a plan name */
    private boolean failOnDuplicate = false;
}
