/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.common.config;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Application-wide property accessor for non-Spring POJOs.
 *
 * <p>This singleton is initialized once by Spring at startup (via
 * {@code WorkerPropertiesInitializer}) and is then available to worker actors,
 * handlers and utility code that Spring does not manage.</p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 *   Duration retry = WorkerProperties.get().getDuration(
 *           "mqworker.consumer.retry-channel-after", Duration.ofMillis(2750));
 *   int threads = WorkerProperties.get().appInt("processing.threads", 0);
 * }</pre>
 *
 * <p>After initialization the property map is effectively immutable; reads are
 * safe from any thread.</p>
 */
public final class WorkerProperties {

    // ─── Singleton ──────────────────────────────────────────────────

    private static volatile WorkerProperties INSTANCE;

    private final Map<String, String> properties;

    private WorkerProperties(Map<String, String> properties) {
        this.properties = new ConcurrentHashMap<>(properties);
    }

    /**
     * Initialize the singleton. A second call merges the new values, which
     * lets tests override individual keys.
     *
     * @param props all resolved properties from the Spring Environment
     */
    public static synchronized void init(Map<String, String> props) {
        if (INSTANCE != null) {
            INSTANCE.properties.putAll(props);
            return;
        }
        INSTANCE = new WorkerProperties(props);
    }

    /**
     * @return the initialized instance
     * @throws IllegalStateException if Spring has not started yet
     */
    public static WorkerProperties get() {
        if (INSTANCE == null) {
            throw new IllegalStateException(
                "WorkerProperties not initialized; the Spring context has not started yet.");
        }
        return INSTANCE;
    }

    public static boolean isInitialized() {
        return INSTANCE != null;
    }

    // ─── Core Typed Getters ─────────────────────────────────────────

    public String getString(String key) {
        return properties.get(key);
    }

    public String getString(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        try { return Integer.parseInt(val.trim()); }
        catch (NumberFormatException e) { return defaultValue; }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim());
    }

    /**
     * Parse a duration string. Supports:
     * <ul>
     *   <li>Plain number → milliseconds</li>
     *   <li>{@code "2750ms"}, {@code "30s"}, {@code "5m"}, {@code "2h"}</li>
     *   <li>ISO-8601 ({@code "PT2.75S"}) via {@link Duration#parse}</li>
     * </ul>
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String val = properties.get(key);
        return parseDuration(val, defaultValue);
    }

    static Duration parseDuration(String val, Duration defaultValue) {
        if (val == null || val.isBlank()) return defaultValue;
        val = val.trim().toLowerCase();
        try {
            if (val.startsWith("pt")) return Duration.parse(val.toUpperCase());
            if (val.endsWith("ms")) return Duration.ofMillis(Long.parseLong(val.replace("ms", "").trim()));
            if (val.endsWith("s"))  return Duration.ofSeconds(Long.parseLong(val.replace("s", "").trim()));
            if (val.endsWith("m"))  return Duration.ofMinutes(Long.parseLong(val.replace("m", "").trim()));
            if (val.endsWith("h"))  return Duration.ofHours(Long.parseLong(val.replace("h", "").trim()));
            return Duration.ofMillis(Long.parseLong(val));
        } catch (Exception e) {
            return defaultValue;
        }
    }

    // ─── Namespace Helpers ──────────────────────────────────────────

    /**
     * All properties under a prefix, with the prefix stripped.
     * <p>Example: {@code getSubProperties("mqworker.rabbitmq.")} returns
     * {@code {"host" → "localhost", "port" → "5672", ...}}</p>
     */
    public Map<String, String> getSubProperties(String prefix) {
        return properties.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .collect(Collectors.toMap(
                        e -> e.getKey().substring(prefix.length()),
                        Map.Entry::getValue,
                        (a, b) -> b,
                        LinkedHashMap::new
                ));
    }

    /** Shortcut: reads {@code mqworker.<suffix>}. */
    public String app(String suffix, String defaultValue) {
        return getString("mqworker." + suffix, defaultValue);
    }

    /** Shortcut: reads {@code mqworker.<suffix>} as an int. */
    public int appInt(String suffix, int defaultValue) {
        return getInt("mqworker." + suffix, defaultValue);
    }

    public int size() {
        return properties.size();
    }
}
