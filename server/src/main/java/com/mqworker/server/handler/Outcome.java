/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.handler;

/**
 * Result of processing one message. Closed set of variants:
 * <ul>
 *   <li>{@link Success}: acknowledge</li>
 *   <li>{@link RetryOnce}: requeue on first delivery, discard on redelivery</li>
 *   <li>{@link Other}: discard</li>
 * </ul>
 */
public sealed interface Outcome permits Outcome.Success, Outcome.RetryOnce, Outcome.Other {

    record Success() implements Outcome {}

    record RetryOnce() implements Outcome {}

    record Other(String reason) implements Outcome {}

    Outcome SUCCESS = new Success();
    Outcome RETRY_ONCE = new RetryOnce();

    static Outcome success() { return SUCCESS; }

    static Outcome retryOnce() { return RETRY_ONCE; }

    static Outcome other(String reason) { return new Other(reason); }
}
