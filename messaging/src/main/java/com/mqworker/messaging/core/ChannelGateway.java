/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.messaging.core;

import java.util.concurrent.CompletionStage;

/**
 * Grants broker channels to workers. Owns the physical connections.
 *
 * <p>A failed stage (typically with
 * {@link com.mqworker.common.exception.ChannelUnavailableException}) is
 * treated as transient by the caller.</p>
 */
public interface ChannelGateway {

    CompletionStage<BrokerChannel> requestChannel(String workerIdentity);
}
