package io.clusterengine.lock;

import java.util.Optional;

/**
 * Non-reentrant, leased mutex keyed by cluster id. Only the action dispatcher acquires,
 * renews and releases these locks.
 */
public interface ClusterLockManager {

    /**
     * Acquire the lock without blocking.
     *
     * @param clusterId the cluster to lock
     * @param owner id of the action that will hold the lock
     * @param ttlSeconds lease length; the lock frees itself when not renewed in time
     * @return the held lock, or empty when someone else holds it
     * @throws LockException if the lock backend fails
     */
    Optional<ClusterLock> tryAcquire(String clusterId, String owner, int ttlSeconds) throws LockException;

    /**
     * Extend the lease of a held lock.
     *
     * @return false when the lock was lost in the meantime
     */
    boolean renew(ClusterLock lock);

    /**
     * Release a held lock. Releasing a lock that was already lost is a no-op.
     */
    void release(ClusterLock lock);

    /**
     * Current holder of the lock on a cluster, if any.
     */
    Optional<String> getOwner(String clusterId) throws LockException;
}
