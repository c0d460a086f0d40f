package io.clusterengine.lock;

import io.clusterengine.store.EtcdPathResolver;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Cluster locks shared by every engine connected to the same etcd.
 *
 * A lock is a key under /cluster-engine/locks holding the owner id, attached to a lease.
 * Acquisition is a put-if-absent transaction, so a held lock never blocks the caller.
 * The lease is renewed explicitly by the dispatcher; when it lapses etcd deletes the key.
 */
@Slf4j
public class EtcdClusterLockManager implements ClusterLockManager {

    private static final int ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final KV kvClient;
    private final Lease leaseClient;
    private final EtcdPathResolver pathResolver;

    public EtcdClusterLockManager(Client etcdClient, EtcdPathResolver pathResolver) {
        this(etcdClient.getKVClient(), etcdClient.getLeaseClient(), pathResolver);
    }

    public EtcdClusterLockManager(KV kvClient, Lease leaseClient, EtcdPathResolver pathResolver) {
        this.kvClient = kvClient;
        this.leaseClient = leaseClient;
        this.pathResolver = pathResolver;

        log.info("EtcdClusterLockManager initialized");
    }

    @Override
    public Optional<ClusterLock> tryAcquire(String clusterId, String owner, int ttlSeconds) throws LockException {
        long leaseId = 0L;
        try {
            log.debug("Attempting to acquire lock for cluster: {}", clusterId);

            // Step 1: Create lease
            leaseId = leaseClient.grant(ttlSeconds)
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .getID();

            // Step 2: Put the lock key only if nobody holds it
            ByteSequence lockKey = ByteSequence.from(pathResolver.getClusterLockPath(clusterId), UTF_8);
            TxnResponse response = kvClient.txn()
                .If(new Cmp(lockKey, Cmp.Op.EQUAL, CmpTarget.createRevision(0)))
                .Then(Op.put(lockKey, ByteSequence.from(owner, UTF_8),
                    PutOption.newBuilder().withLeaseId(leaseId).build()))
                .Else(Op.get(lockKey, GetOption.DEFAULT))
                .commit()
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            if (!response.isSucceeded()) {
                log.debug("Lock for cluster {} is already held", clusterId);
                revokeQuietly(leaseId);
                return Optional.empty();
            }

            log.info("Lock acquired for cluster: {} (owner: {}, leaseId: {})", clusterId, owner, leaseId);
            return Optional.of(new ClusterLock(clusterId, owner, leaseId, Instant.now().plusSeconds(ttlSeconds)));

        } catch (TimeoutException e) {
            revokeQuietly(leaseId);
            throw new LockException("Timeout acquiring lock for cluster: " + clusterId, e);
        } catch (Exception e) {
            revokeQuietly(leaseId);
            throw new LockException("Failed to acquire lock for cluster: " + clusterId, e);
        }
    }

    @Override
    public boolean renew(ClusterLock lock) {
        try {
            LeaseKeepAliveResponse response = leaseClient.keepAliveOnce(lock.getLeaseId())
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (response.getTTL() <= 0) {
                log.warn("Lock lost for cluster: {} (lease {} expired)", lock.getClusterId(), lock.getLeaseId());
                return false;
            }
            lock.setExpiresAt(Instant.now().plusSeconds(response.getTTL()));
            return true;
        } catch (Exception e) {
            log.warn("Failed to renew lock for cluster: {}: {}", lock.getClusterId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void release(ClusterLock lock) {
        if (lock == null) {
            return;
        }

        try {
            log.debug("Releasing lock for cluster: {}", lock.getClusterId());

            // Step 1: Delete the key only while we still own it
            ByteSequence lockKey = ByteSequence.from(pathResolver.getClusterLockPath(lock.getClusterId()), UTF_8);
            kvClient.txn()
                .If(new Cmp(lockKey, Cmp.Op.EQUAL, CmpTarget.value(ByteSequence.from(lock.getOwner(), UTF_8))))
                .Then(Op.delete(lockKey, DeleteOption.DEFAULT))
                .commit()
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            // Step 2: Revoke lease
            revokeQuietly(lock.getLeaseId());

            log.info("Lock released for cluster: {}", lock.getClusterId());

        } catch (Exception e) {
            log.error("Error releasing lock for cluster: {}", lock.getClusterId(), e);
        }
    }

    @Override
    public Optional<String> getOwner(String clusterId) throws LockException {
        try {
            GetResponse response = kvClient.get(ByteSequence.from(pathResolver.getClusterLockPath(clusterId), UTF_8))
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (response.getCount() == 0) {
                return Optional.empty();
            }
            return Optional.of(response.getKvs().get(0).getValue().toString(UTF_8));
        } catch (Exception e) {
            throw new LockException("Failed to read lock owner for cluster: " + clusterId, e);
        }
    }

    private void revokeQuietly(long leaseId) {
        if (leaseId == 0L) {
            return;
        }
        try {
            leaseClient.revoke(leaseId).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            // the lease expires on its own
            log.debug("Failed to revoke lease {}: {}", leaseId, e.getMessage());
        }
    }
}
