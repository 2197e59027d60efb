/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.common.exception;

/**
 * Raised by a worker when the connection behind its channel terminates.
 */
public class ConnectionLostException extends MqWorkerException {
    private final String workerIdentity;

    public ConnectionLostException(String workerIdentity, Throwable reason) {
        super("MQW_CONNECTION_LOST",
                "Connection lost for worker '" + workerIdentity + "': "
                        + (reason != null ? reason.getMessage() : "no reason given"), reason);
        this.workerIdentity = workerIdentity;
    }

    public String getWorkerIdentity() { return workerIdentity; }
}
