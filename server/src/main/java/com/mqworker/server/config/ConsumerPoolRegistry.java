/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.server.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.mqworker.common.model.ConsumerPoolConfig;
import com.mqworker.common.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches consumer pool definitions from JSON files.
 * Every {@code *.json} file in the config directory maps pool names to
 * {@link ConsumerPoolConfig}s; files are read in name order and a later
 * definition of the same pool replaces an earlier one.
 */
public class ConsumerPoolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConsumerPoolRegistry.class);

    private final String configDir;
    private volatile Map<String, ConsumerPoolConfig> pools = new ConcurrentHashMap<>();

    public ConsumerPoolRegistry(String configDir) {
        this.configDir = configDir;
        reload();
    }

    public Optional<ConsumerPoolConfig> findPool(String poolName) {
        return Optional.ofNullable(pools.get(poolName));
    }

    /** Enabled pools in name order. */
    public List<ConsumerPoolConfig> getEnabledPools() {
        List<ConsumerPoolConfig> enabled = new ArrayList<>();
        for (ConsumerPoolConfig config : pools.values()) {
            if (config.isEnabled()) enabled.add(config);
        }
        enabled.sort(Comparator.comparing(ConsumerPoolConfig::getPoolName));
        return enabled;
    }

    public Set<String> getPoolNames() {
        return Collections.unmodifiableSet(new TreeSet<>(pools.keySet()));
    }

    public void reload() {
        log.info("Loading consumer pool configurations from: {}", configDir);
        File dir = new File(configDir);
        if (!dir.isDirectory()) {
            log.warn("Consumer config directory not found: {}", configDir);
            pools = new ConcurrentHashMap<>();
            return;
        }
        File[] files = dir.listFiles((d, name) -> name.endsWith(".json"));
        if (files == null) return;
        Arrays.sort(files, Comparator.comparing(File::getName));

        Map<String, ConsumerPoolConfig> loaded = new ConcurrentHashMap<>();
        for (File file : files) {
            try {
                Map<String, ConsumerPoolConfig> rawMap = JsonUtil.fromFile(file,
                        new TypeReference<Map<String, ConsumerPoolConfig>>() {});
                for (Map.Entry<String, ConsumerPoolConfig> entry : rawMap.entrySet()) {
                    ConsumerPoolConfig config = entry.getValue();
                    if (config.getPoolName() == null || config.getPoolName().isBlank()) {
                        config.setPoolName(entry.getKey());
                    }
                    if (loaded.put(config.getPoolName(), config) != null) {
                        log.warn("Pool '{}' redefined in {}", config.getPoolName(), file.getName());
                    }
                }
                log.info("Loaded {} consumer pool(s) from {}", rawMap.size(), file.getName());
            } catch (IOException e) {
                log.error("Failed to load consumer config: {}", file.getName(), e);
            }
        }
        pools = loaded;
    }
}
