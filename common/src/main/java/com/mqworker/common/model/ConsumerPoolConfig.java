/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Configuration for one pool of identical queue workers, loaded from
 * {@code config/consumers/*.json}. The map key in the file becomes the pool name
 * unless {@code pool_name} is given explicitly.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConsumerPoolConfig {

    public static final long DEFAULT_RETRY_CHANNEL_AFTER_MS = 2750;

    @JsonProperty("pool_name")
    private String poolName;

    @JsonProperty("queue")
    private String queue;

    @JsonProperty("prefetch_count")
    private Integer prefetchCount;

    @JsonProperty("handler_class")
    private String handlerClass;

    @JsonProperty("worker_count")
    private int workerCount = 1;

    @JsonProperty("retry_channel_after_ms")
    private Long retryChannelAfterMs;

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("handler_config")
    private Map<String, Object> handlerConfig;

    @JsonProperty("description")
    private String description;

    public ConsumerPoolConfig() {}

    public String getPoolName() { return poolName; }
    public void setPoolName(String poolName) { this.poolName = poolName; }
    public String getQueue() { return queue; }
    public void setQueue(String queue) { this.queue = queue; }
    public Integer getPrefetchCount() { return prefetchCount; }
    public void setPrefetchCount(Integer prefetchCount) { this.prefetchCount = prefetchCount; }
    public String getHandlerClass() { return handlerClass; }
    public void setHandlerClass(String handlerClass) { this.handlerClass = handlerClass; }
    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }
    /** Per-pool retry delay, or {@code null} to use the application-wide setting. */
    public Long getRetryChannelAfterMs() { return retryChannelAfterMs; }
    public void setRetryChannelAfterMs(Long retryChannelAfterMs) { this.retryChannelAfterMs = retryChannelAfterMs; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Map<String, Object> getHandlerConfig() { return handlerConfig; }
    public void setHandlerConfig(Map<String, Object> handlerConfig) { this.handlerConfig = handlerConfig; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    @Override
    public String toString() {
        return "ConsumerPoolConfig{pool=" + poolName + ", queue=" + queue
                + ", prefetch=" + prefetchCount + ", workers=" + workerCount
                + ", handler=" + handlerClass + "}";
    }
}
