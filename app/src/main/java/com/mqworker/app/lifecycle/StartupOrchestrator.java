/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.app.lifecycle;

import com.mqworker.common.exception.MqWorkerException;
import com.mqworker.common.model.ConsumerPoolConfig;
import com.mqworker.server.config.ConsumerPoolRegistry;
import com.mqworker.server.engine.ConsumerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the configured worker pools once the Spring context is ready.
 *
 * <pre>
 * Phase 1: Load consumer pool configurations
 * Phase 2: Start every enabled pool on the consumer engine
 * FINAL:   Ready announcement
 * </pre>
 *
 * A pool that fails to start (bad handler class, invalid settings) is logged
 * and skipped; the remaining pools still start.
 */
@Component
public class StartupOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StartupOrchestrator.class);

    private final ConsumerEngine consumerEngine;
    private final ConsumerPoolRegistry poolRegistry;

    @Value("${mqworker.app-name:MQWorker}")
    private String appName;

    @Value("${mqworker.version:1.0.0}")
    private String version;

    private final AtomicBoolean startupComplete = new AtomicBoolean(false);
    private final List<String> startedPools = new ArrayList<>();
    private final List<String> failedPools = new ArrayList<>();

    public StartupOrchestrator(ConsumerEngine consumerEngine, ConsumerPoolRegistry poolRegistry) {
        this.consumerEngine = consumerEngine;
        this.poolRegistry = poolRegistry;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        Instant startTime = Instant.now();
        logBanner("STARTUP INITIATED",
                appName + " v" + version,
                "Timestamp: " + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));

        logPhase(1, "Consumer Pool Configuration", "Reading pool definitions...");
        List<ConsumerPoolConfig> pools = poolRegistry.getEnabledPools();
        logPhaseComplete(1, pools.size() + " enabled pool(s) of " + poolRegistry.getPoolNames().size());

        logPhase(2, "Start Worker Pools", "Spawning queue workers...");
        for (ConsumerPoolConfig pool : pools) {
            try {
                consumerEngine.startPool(pool);
                startedPools.add(pool.getPoolName());
                log.info("  Pool '{}': {} worker(s) on queue '{}' (prefetch={})", pool.getPoolName(),
                        pool.getWorkerCount(), pool.getQueue(), pool.getPrefetchCount());
            } catch (MqWorkerException e) {
                failedPools.add(pool.getPoolName());
                log.error("  Pool '{}' not started [{}]: {}", pool.getPoolName(), e.getErrorCode(), e.getMessage());
            }
        }
        logPhaseComplete(2, startedPools.size() + " pool(s) started, " + failedPools.size() + " failed");

        startupComplete.set(true);
        logBanner("SYSTEM READY",
                appName + " v" + version + " is consuming",
                "Pools: " + (startedPools.isEmpty() ? "none" : String.join(", ", startedPools)),
                "Startup time: " + Duration.between(startTime, Instant.now()).toMillis() + " ms");
    }

    public boolean isStartupComplete() {
        return startupComplete.get();
    }

    public List<String> getStartedPools() {
        return List.copyOf(startedPools);
    }

    public List<String> getFailedPools() {
        return List.copyOf(failedPools);
    }

    // ─── Logging Helpers ──────────────────────────────────────────────────────

    private void logBanner(String title, String... lines) {
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  {}{}║", title, pad(title, 65));
        for (String line : lines) {
            log.info("║  {}{}║", line, pad(line, 65));
        }
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        log.info("");
    }

    private void logPhase(int number, String title, String description) {
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  Phase {}: {}{}║", number, title, pad("Phase " + number + ": " + title, 59));
        log.info("║  {}{}║", description, pad(description, 65));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
    }

    private void logPhaseComplete(int number, String detail) {
        log.info("✓ Phase {} complete: {}", number, detail);
    }

    private String pad(String text, int totalWidth) {
        int remaining = totalWidth - text.length();
        if (remaining <= 0) return " ";
        return " ".repeat(remaining);
    }
}
