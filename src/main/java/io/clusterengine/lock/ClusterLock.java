package io.clusterengine.lock;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * A held, leased lock on one cluster. The owner is the id of the action holding it.
 */
@Data
@AllArgsConstructor
public class ClusterLock {
    private final String clusterId;
    private final String owner;
    // etcd lease backing the lock, 0 for in-process locks
    private final long leaseId;
    private volatile Instant expiresAt;
}
