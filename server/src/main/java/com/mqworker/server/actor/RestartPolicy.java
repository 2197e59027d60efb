/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.actor;

import java.time.Duration;

/**
 * Decides whether a terminated worker is replaced. A replacement always runs
 * with the same {@link com.mqworker.server.consumer.ConsumerSettings} and a
 * freshly generated worker identity.
 */
public interface RestartPolicy {

    /**
     * @param workerIdentity identity of the terminated worker
     * @param cause          failure that terminated it, or {@code null} for a normal stop
     */
    boolean shouldRestart(String workerIdentity, Throwable cause);

    /** Delay before the replacement is started. */
    default Duration restartDelay() { return Duration.ZERO; }

    /** Replace every terminated worker immediately, whatever the reason. */
    static RestartPolicy always() {
        return always(Duration.ZERO);
    }

    static RestartPolicy always(Duration delay) {
        return new RestartPolicy() {
            @Override
            public boolean shouldRestart(String workerIdentity, Throwable cause) { return true; }

            @Override
            public Duration restartDelay() { return delay; }

            @Override
            public String toString() { return "always(delay=" + delay.toMillis() + "ms)"; }
        };
    }
}
