/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.mqworker.app")
public class MqWorkerApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(MqWorkerApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.setRegisterShutdownHook(true); // ContextClosedEvent on JVM shutdown stops the workers
        app.run(args);
    }
}
