package io.clusterengine.lock;

import io.clusterengine.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class LocalClusterLockManagerTest {

    private MutableClock clock;
    private LocalClusterLockManager lockManager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atT0();
        lockManager = new LocalClusterLockManager(clock);
    }

    @Test
    void testTryAcquire_SecondOwnerIsRejected() {
        // When
        Optional<ClusterLock> first = lockManager.tryAcquire("cluster-1", "action-1", 60);
        Optional<ClusterLock> second = lockManager.tryAcquire("cluster-1", "action-2", 60);

        // Then
        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(lockManager.getOwner("cluster-1")).contains("action-1");
    }

    @Test
    void testTryAcquire_NotReentrant() {
        assertThat(lockManager.tryAcquire("cluster-1", "action-1", 60)).isPresent();
        assertThat(lockManager.tryAcquire("cluster-1", "action-1", 60)).isEmpty();
    }

    @Test
    void testTryAcquire_DifferentClustersAreIndependent() {
        assertThat(lockManager.tryAcquire("cluster-1", "action-1", 60)).isPresent();
        assertThat(lockManager.tryAcquire("cluster-2", "action-2", 60)).isPresent();
    }

    @Test
    void testRelease_FreesLock() {
        // Given
        ClusterLock lock = lockManager.tryAcquire("cluster-1", "action-1", 60).orElseThrow();

        // When
        lockManager.release(lock);

        // Then
        assertThat(lockManager.getOwner("cluster-1")).isEmpty();
        assertThat(lockManager.tryAcquire("cluster-1", "action-2", 60)).isPresent();
    }

    @Test
    void testRelease_ByFormerOwnerDoesNotFreeNewHolder() {
        // Given
        ClusterLock stale = lockManager.tryAcquire("cluster-1", "action-1", 10).orElseThrow();
        clock.advance(Duration.ofSeconds(11));
        lockManager.tryAcquire("cluster-1", "action-2", 60).orElseThrow();

        // When
        lockManager.release(stale);

        // Then
        assertThat(lockManager.getOwner("cluster-1")).contains("action-2");
    }

    @Test
    void testLeaseExpiry_LetsAnotherOwnerIn() {
        // Given
        lockManager.tryAcquire("cluster-1", "action-1", 10).orElseThrow();

        // When
        clock.advance(Duration.ofSeconds(10));

        // Then
        assertThat(lockManager.getOwner("cluster-1")).isEmpty();
        assertThat(lockManager.tryAcquire("cluster-1", "action-2", 10)).isPresent();
    }

    @Test
    void testRenew_ExtendsLease() {
        // Given
        ClusterLock lock = lockManager.tryAcquire("cluster-1", "action-1", 10).orElseThrow();
        clock.advance(Duration.ofSeconds(8));

        // When
        boolean renewed = lockManager.renew(lock);
        clock.advance(Duration.ofSeconds(8));

        // Then
        assertThat(renewed).isTrue();
        assertThat(lockManager.getOwner("cluster-1")).contains("action-1");
    }

    @Test
    void testRenew_AfterExpiryFails() {
        ClusterLock lock = lockManager.tryAcquire("cluster-1", "action-1", 10).orElseThrow();
        clock.advance(Duration.ofSeconds(11));

        assertThat(lockManager.renew(lock)).isFalse();
    }

    @Test
    void testRelease_NullIsNoop() {
        assertThatCode(() -> lockManager.release(null)).doesNotThrowAnyException();
    }
}
