package io.clusterengine.capacity;

import io.clusterengine.config.EngineConfig;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Cluster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.clusterengine.models.Cluster.UNBOUNDED;
import static org.assertj.core.api.Assertions.*;

class CapacityResolverTest {

    private CapacityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new CapacityResolver(EngineConfig.defaults().toBuilder().maxNodesPerCluster(10).build());
    }

    private static Cluster cluster(int desired, int min, int max) {
        return Cluster.builder().id("c1").desiredCapacity(desired).minSize(min).maxSize(max).build();
    }

    private static CapacityRequest adjust(String type, double number) {
        return CapacityRequest.builder().adjustmentType(type).number(number).build();
    }

    @Test
    void testExactCapacity_WithinBounds() {
        // When
        CapacityDecision decision = resolver.resolve(cluster(3, 1, 5), adjust("EXACT_CAPACITY", 4));

        // Then
        assertThat(decision.getTargetCapacity()).isEqualTo(4);
        assertThat(decision.getMinSize()).isEqualTo(1);
        assertThat(decision.getMaxSize()).isEqualTo(5);
    }

    @Test
    void testExactCapacity_IsIdempotent() {
        // Given
        Cluster cluster = cluster(3, 1, 5);
        CapacityDecision first = resolver.resolve(cluster, adjust("EXACT_CAPACITY", 4));

        // When
        cluster.setDesiredCapacity(first.getTargetCapacity());
        CapacityDecision second = resolver.resolve(cluster, adjust("EXACT_CAPACITY", 4));

        // Then
        assertThat(second.getTargetCapacity()).isEqualTo(first.getTargetCapacity());
    }

    @Test
    void testExactCapacity_NegativeNumberRejected() {
        assertThatThrownBy(() -> resolver.resolve(cluster(3, 0, 5), adjust("EXACT_CAPACITY", -1)))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The 'number' must be positive integer for adjustment type 'EXACT_CAPACITY'.");
    }

    @Test
    void testChangeInCapacity_BelowMinStrict() {
        assertThatThrownBy(() -> resolver.resolve(cluster(3, 1, 5), adjust("CHANGE_IN_CAPACITY", -3)))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The target capacity (0) is less than the cluster's min_size (1).");
    }

    @Test
    void testChangeInCapacity_AboveMaxNonStrictClamps() {
        // Given
        CapacityRequest request = CapacityRequest.builder()
            .adjustmentType("CHANGE_IN_CAPACITY").number(5.0).strict(false).build();

        // When
        CapacityDecision decision = resolver.resolve(cluster(3, 1, 5), request);

        // Then
        assertThat(decision.getTargetCapacity()).isEqualTo(5);
    }

    @Test
    void testChangeInCapacity_FractionRejected() {
        assertThatThrownBy(() -> resolver.resolve(cluster(3, 0, 5), adjust("CHANGE_IN_CAPACITY", 1.5)))
            .isInstanceOf(BadRequestException.class)
            .hasMessageContaining("must be an integer");
    }

    @Test
    void testChangeInPercentage_TruncatesLargeDelta() {
        // 25% of 6 is 1.5 nodes
        CapacityDecision decision = resolver.resolve(cluster(6, 0, 10), adjust("CHANGE_IN_PERCENTAGE", 25));
        assertThat(decision.getTargetCapacity()).isEqualTo(7);
    }

    @Test
    void testPercentageDelta_Rounding() {
        assertThat(CapacityResolver.percentageDelta(2, 10, null)).isEqualTo(1);
        assertThat(CapacityResolver.percentageDelta(2, -10, null)).isEqualTo(-1);
        assertThat(CapacityResolver.percentageDelta(10, -25, null)).isEqualTo(-2);
        assertThat(CapacityResolver.percentageDelta(0, 50, null)).isEqualTo(0);
    }

    @Test
    void testPercentageDelta_MinStepLiftsMagnitude() {
        assertThat(CapacityResolver.percentageDelta(10, 10, 3)).isEqualTo(3);
        assertThat(CapacityResolver.percentageDelta(10, -10, 3)).isEqualTo(-3);
        assertThat(CapacityResolver.percentageDelta(10, 50, 3)).isEqualTo(5);
    }

    @Test
    void testNewMinGreaterThanNewMax() {
        CapacityRequest request = CapacityRequest.builder().minSize(5).maxSize(2).build();

        assertThatThrownBy(() -> resolver.resolve(cluster(3, 1, 5), request))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The specified min_size (5) is greater than the specified max_size (2).");
    }

    @Test
    void testNewMaxBelowCurrentMin() {
        CapacityRequest request = CapacityRequest.builder().maxSize(1).build();

        assertThatThrownBy(() -> resolver.resolve(cluster(3, 2, 5), request))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The specified max_size (1) is less than the current min_size (2) of the cluster.");
    }

    @Test
    void testNewMinAboveCurrentMax() {
        CapacityRequest request = CapacityRequest.builder().minSize(6).build();

        assertThatThrownBy(() -> resolver.resolve(cluster(3, 1, 5), request))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The specified min_size (6) is greater than the current max_size (5) of the cluster.");
    }

    @Test
    void testNewMaxBelowDesired_StrictRejected() {
        CapacityRequest request = CapacityRequest.builder().maxSize(3).build();

        assertThatThrownBy(() -> resolver.resolve(cluster(5, 1, 10), request))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The specified max_size (3) is less than the current desired_capacity (5) of the cluster.");
    }

    @Test
    void testNewMaxBelowDesired_NonStrictClamps() {
        // Given
        CapacityRequest request = CapacityRequest.builder().maxSize(3).strict(false).build();

        // When
        CapacityDecision decision = resolver.resolve(cluster(5, 1, 10), request);

        // Then
        assertThat(decision.getTargetCapacity()).isEqualTo(3);
        assertThat(decision.getMaxSize()).isEqualTo(3);
    }

    @Test
    void testBoundsOnlyChange_KeepsDesired() {
        CapacityRequest request = CapacityRequest.builder().minSize(0).maxSize(UNBOUNDED).build();

        CapacityDecision decision = resolver.resolve(cluster(4, 2, 6), request);

        assertThat(decision.getTargetCapacity()).isEqualTo(4);
        assertThat(decision.getMinSize()).isEqualTo(0);
        assertThat(decision.getMaxSize()).isEqualTo(UNBOUNDED);
    }

    @Test
    void testUnboundedClusterLimitedByNodeQuota() {
        assertThatThrownBy(() -> resolver.resolve(cluster(5, 0, UNBOUNDED), adjust("EXACT_CAPACITY", 11)))
            .isInstanceOf(BadRequestException.class)
            .hasMessageContaining("maximum number of nodes allowed per cluster (10)");
    }

    @Test
    void testChangeInCapacity_HugeGrowthNonStrictClampsToMax() {
        // Given
        CapacityRequest request = CapacityRequest.builder()
            .adjustmentType("CHANGE_IN_CAPACITY").number(3e9).strict(false).build();

        // When
        CapacityDecision decision = resolver.resolve(cluster(3, 2, 5), request);

        // Then
        assertThat(decision.getTargetCapacity()).isEqualTo(5);
    }

    @Test
    void testChangeInCapacity_HugeShrinkNonStrictClampsToMin() {
        // Given
        CapacityRequest request = CapacityRequest.builder()
            .adjustmentType("CHANGE_IN_CAPACITY").number(-3e9).strict(false).build();

        // When
        CapacityDecision decision = resolver.resolve(cluster(3, 2, 5), request);

        // Then
        assertThat(decision.getTargetCapacity()).isEqualTo(2);
    }

    @Test
    void testExactCapacity_HugeNumberStrictRejected() {
        assertThatThrownBy(() -> resolver.resolve(cluster(3, 0, UNBOUNDED), adjust("EXACT_CAPACITY", 1e12)))
            .isInstanceOf(BadRequestException.class)
            .hasMessageStartingWith("The target capacity (")
            .hasMessageEndingWith("is greater than the maximum number of nodes allowed per cluster (10).");
    }

    @Test
    void testChangeInPercentage_HugeGrowthNonStrictClampsToQuota() {
        // Given
        CapacityRequest request = CapacityRequest.builder()
            .adjustmentType("CHANGE_IN_PERCENTAGE").number(1e15).strict(false).build();

        // When
        CapacityDecision decision = resolver.resolve(cluster(4, 0, UNBOUNDED), request);

        // Then
        assertThat(decision.getTargetCapacity()).isEqualTo(10);
    }

    @Test
    void testNewMaxAboveNodeQuotaRejected() {
        CapacityRequest request = CapacityRequest.builder().maxSize(11).build();

        assertThatThrownBy(() -> resolver.resolve(cluster(3, 1, 5), request))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The specified max_size (11) is greater than the maximum number of nodes allowed per cluster (10).");
    }

    @Test
    void testNewMaxAboveNodeQuotaRejected_EvenWhenNotStrict() {
        CapacityRequest request = CapacityRequest.builder().maxSize(11).strict(false).build();

        assertThatThrownBy(() -> resolver.resolve(cluster(3, 1, 5), request))
            .isInstanceOf(BadRequestException.class)
            .hasMessageContaining("max_size (11)");
    }

    @Test
    void testTargetAboveNodeQuota_QuotaReportedBeforeClusterMax() {
        // the cluster's stored max predates a lower quota
        assertThatThrownBy(() -> resolver.resolve(cluster(5, 0, 20), adjust("EXACT_CAPACITY", 11)))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The target capacity (11) is greater than the maximum number of nodes allowed per cluster (10).");
    }

    @Test
    void testInvalidAdjustmentType() {
        assertThatThrownBy(() -> resolver.resolve(cluster(3, 0, 5), adjust("BOGUS", 1)))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid value 'BOGUS' specified for 'adjustment_type'");
    }

    @Test
    void testMissingNumber() {
        CapacityRequest request = CapacityRequest.builder().adjustmentType("EXACT_CAPACITY").build();

        assertThatThrownBy(() -> resolver.resolve(cluster(3, 0, 5), request))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Missing number value for size adjustment.");
    }

    @Test
    void testNegativeMinSizeRejected() {
        CapacityRequest request = CapacityRequest.builder().minSize(-1).build();

        assertThatThrownBy(() -> resolver.resolve(cluster(3, 0, 5), request))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid value '-1' specified for 'min_size'");
    }

    @Test
    void testCheckInitialSize() {
        assertThatCode(() -> resolver.checkInitialSize(2, 1, 3)).doesNotThrowAnyException();
        assertThatCode(() -> resolver.checkInitialSize(0, 0, UNBOUNDED)).doesNotThrowAnyException();

        assertThatThrownBy(() -> resolver.checkInitialSize(-1, 0, UNBOUNDED))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid value '-1' specified for 'desired_capacity'");
        assertThatThrownBy(() -> resolver.checkInitialSize(2, 3, 1))
            .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> resolver.checkInitialSize(4, 0, 3))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The target capacity (4) is greater than the cluster's max_size (3).");
    }

    @Test
    void testCheckInitialSize_NodeQuota() {
        assertThatThrownBy(() -> resolver.checkInitialSize(2, 0, 11))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The specified max_size (11) is greater than the maximum number of nodes allowed per cluster (10).");
        assertThatThrownBy(() -> resolver.checkInitialSize(11, 0, UNBOUNDED))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("The target capacity (11) is greater than the maximum number of nodes allowed per cluster (10).");
    }
}
