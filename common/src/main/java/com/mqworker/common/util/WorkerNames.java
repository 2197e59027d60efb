/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.common.util;

import java.util.Objects;
import java.util.UUID;

/**
 * Generates worker identities of the form {@code <pool>-<12 hex chars>}.
 * A new identity is produced on every call, so a restarted worker never
 * reuses the identity of the instance it replaces.
 */
public final class WorkerNames {

    private WorkerNames() {}

    public static String uniqueWorkerName(String poolName) {
        Objects.requireNonNull(poolName, "poolName");
        String prefix = poolName.trim().replaceAll("[^A-Za-z0-9_.\\-]", "_");
        if (prefix.isEmpty()) prefix = "worker";
        return prefix + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
