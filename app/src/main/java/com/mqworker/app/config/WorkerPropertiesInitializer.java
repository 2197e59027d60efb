/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.app.config;

import com.mqworker.common.config.WorkerProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.AbstractEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertySource;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies Spring's {@link Environment} into the static {@link WorkerProperties}
 * singleton, so settings built outside Spring (worker retry delay, handler
 * code) see the same values as the application context.
 *
 * <p>Runs in {@code @PostConstruct}, before {@link AppConfig}'s beans that read
 * the singleton are created. Only enumerable property sources are captured.</p>
 */
@Component
public class WorkerPropertiesInitializer {

    private static final Logger log = LoggerFactory.getLogger(WorkerPropertiesInitializer.class);

    private final Environment environment;

    public WorkerPropertiesInitializer(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void init() {
        Map<String, String> props = new LinkedHashMap<>();

        for (PropertySource<?> source : ((AbstractEnvironment) environment).getPropertySources()) {
            if (source instanceof EnumerablePropertySource<?> enumerable) {
                for (String key : enumerable.getPropertyNames()) {
                    if (!props.containsKey(key)) {
                        resolve(key, props);
                    }
                }
            }
        }

        WorkerProperties.init(props);
        log.info("WorkerProperties initialized with {} properties", props.size());

        if (log.isDebugEnabled()) {
            props.entrySet().stream()
                    .filter(e -> e.getKey().startsWith("mqworker."))
                    .filter(e -> !e.getKey().endsWith("password"))
                    .forEach(e -> log.debug("  {} = {}", e.getKey(), e.getValue()));
        }
    }

    private void resolve(String key, Map<String, String> props) {
        try {
            String resolved = environment.getProperty(key);
            if (resolved != null) {
                props.put(key, resolved);
            }
        } catch (IllegalArgumentException e) {
            log.debug("Skipping unresolvable property {}: {}", key, e.getMessage());
        }
    }
}
