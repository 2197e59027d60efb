/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.mqworker.common.util.JsonUtil;
import com.mqworker.messaging.core.DeliveryMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Built-in handler that logs every message and acknowledges it.
 * Useful for wiring checks against a real queue.
 *
 * <p>Config keys: {@code require_json} (default false) discards payloads that
 * are not well-formed JSON; {@code max_logged_chars} (default 256) truncates
 * the logged payload.</p>
 */
public class LoggingHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingHandler.class);

    private boolean requireJson;
    private int maxLoggedChars = 256;

    @Override
    public void construct(Map<String, Object> config) {
        this.requireJson = Boolean.parseBoolean(String.valueOf(config.getOrDefault("require_json", "false")));
        Object max = config.get("max_logged_chars");
        if (max instanceof Number n) this.maxLoggedChars = n.intValue();
    }

    @Override
    public Outcome process(byte[] payload, DeliveryMeta meta) {
        if (requireJson) {
            try {
                JsonNode node = JsonUtil.readTree(payload);
                if (node == null || node.isMissingNode()) {
                    return Outcome.other("empty payload");
                }
            } catch (IOException e) {
                log.warn("Discarding non-JSON payload (deliveryTag={}): {}", meta.deliveryTag(), e.getMessage());
                return Outcome.other("malformed JSON payload");
            }
        }
        String text = new String(payload, StandardCharsets.UTF_8);
        if (text.length() > maxLoggedChars) text = text.substring(0, maxLoggedChars) + "...";
        log.info("Received message deliveryTag={} redelivered={} routingKey='{}': {}",
                meta.deliveryTag(), meta.redelivered(), meta.routingKey(), text);
        return Outcome.success();
    }

    boolean isRequireJson() { return requireJson; }
}
