package com.monumentlens.backend.global.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "app.identity.session", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
