/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.common.exception;

/**
 * Base exception for all MQ Worker errors.
 */
public class MqWorkerException extends RuntimeException {
    private final String errorCode;

    public MqWorkerException(String message) {
        super(message);
        this.errorCode = "MQW_GENERIC";
    }

    public MqWorkerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MqWorkerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
