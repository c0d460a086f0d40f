package io.clusterengine.lock;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process cluster locks with lease expiry, for single-engine deployments and tests.
 */
@Slf4j
public class LocalClusterLockManager implements ClusterLockManager {

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    private static final class Lease {
        private final String owner;
        private final int ttlSeconds;
        private final Instant expiresAt;

        private Lease(String owner, int ttlSeconds, Instant expiresAt) {
            this.owner = owner;
            this.ttlSeconds = ttlSeconds;
            this.expiresAt = expiresAt;
        }
    }

    public LocalClusterLockManager() {
        this(Clock.systemUTC());
    }

    public LocalClusterLockManager(Clock clock) {
        this.clock = clock;
        log.info("LocalClusterLockManager initialized");
    }

    @Override
    public Optional<ClusterLock> tryAcquire(String clusterId, String owner, int ttlSeconds) {
        Instant now = clock.instant();
        AtomicBoolean acquired = new AtomicBoolean(false);
        Lease lease = leases.compute(clusterId, (id, current) -> {
            if (current == null || !current.expiresAt.isAfter(now)) {
                acquired.set(true);
                return new Lease(owner, ttlSeconds, now.plusSeconds(ttlSeconds));
            }
            return current;
        });
        if (!acquired.get()) {
            log.debug("Lock for cluster {} is held by {}", clusterId, lease.owner);
            return Optional.empty();
        }
        log.debug("Lock acquired for cluster: {} (owner: {})", clusterId, owner);
        return Optional.of(new ClusterLock(clusterId, owner, 0L, lease.expiresAt));
    }

    @Override
    public boolean renew(ClusterLock lock) {
        Instant now = clock.instant();
        Lease renewed = leases.computeIfPresent(lock.getClusterId(), (id, current) -> {
            if (current.owner.equals(lock.getOwner()) && current.expiresAt.isAfter(now)) {
                return new Lease(current.owner, current.ttlSeconds, now.plusSeconds(current.ttlSeconds));
            }
            return current;
        });
        if (renewed == null || !renewed.owner.equals(lock.getOwner()) || !renewed.expiresAt.isAfter(now)) {
            log.warn("Lock lost for cluster: {} (owner: {})", lock.getClusterId(), lock.getOwner());
            return false;
        }
        lock.setExpiresAt(renewed.expiresAt);
        return true;
    }

    @Override
    public void release(ClusterLock lock) {
        if (lock == null) {
            return;
        }
        boolean removed = leases.computeIfPresent(lock.getClusterId(),
                (id, current) -> current.owner.equals(lock.getOwner()) ? null : current) == null;
        if (removed) {
            log.debug("Lock released for cluster: {}", lock.getClusterId());
        }
    }

    @Override
    public Optional<String> getOwner(String clusterId) {
        Lease lease = leases.get(clusterId);
        if (lease == null || !lease.expiresAt.isAfter(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(lease.owner);
    }
}
