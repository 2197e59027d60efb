/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.common.exception;

public class ConfigurationException extends MqWorkerException {
    public ConfigurationException(String message) {
        super("MQW_CONFIG_INVALID", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("MQW_CONFIG_INVALID", message, cause);
    }
}
