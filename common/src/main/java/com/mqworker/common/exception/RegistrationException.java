/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.common.exception;

/**
 * Thrown when setting the prefetch or registering the consumer fails.
 * Fatal to the worker instance; recovery is left to the supervisor.
 */
public class RegistrationException extends MqWorkerException {
    public RegistrationException(String message, Throwable cause) {
        super("MQW_REGISTRATION_FAILED", message, cause);
    }
}
