package com.keystone.core.deploy;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Falls back to the in-memory target when no real environment adapter is defined.
 */
@Configuration
public class DeploymentConfig {

    @Bean
    @ConditionalOnMissingBean(DeploymentTarget.class)
    public DeploymentTarget inMemoryDeploymentTarget() {
        return new InMemoryDeploymentTarget();
    }
}
