package io.clusterengine.store;

import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.exceptions.ConcurrentUpdateException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.util.JsonUtils;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Response;
import io.etcd.jetcd.Txn;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.options.GetOption;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for EtcdMetadataStore against a mocked etcd client.
 */
public class EtcdMetadataStoreTest {

    private static final String[] ENDPOINTS = new String[]{"http://localhost:2379"};

    private Client mockEtcdClient;
    private KV mockKv;
    private Txn mockTxn;
    private TxnResponse mockTxnResponse;
    private EtcdMetadataStore store;

    @BeforeEach
    public void setUp() {
        mockEtcdClient = mock(Client.class);
        mockKv = mock(KV.class);
        mockTxn = mock(Txn.class);
        mockTxnResponse = mock(TxnResponse.class);

        when(mockKv.txn()).thenReturn(mockTxn);
        when(mockTxn.If(any())).thenReturn(mockTxn);
        when(mockTxn.Then(any())).thenReturn(mockTxn);
        when(mockTxn.Else(any())).thenReturn(mockTxn);
        when(mockTxn.commit()).thenReturn(CompletableFuture.completedFuture(mockTxnResponse));

        store = EtcdMetadataStore.createTestInstance(ENDPOINTS, mockEtcdClient, mockKv);
    }

    @AfterEach
    public void tearDown() {
        EtcdMetadataStore.resetInstance();
    }

    // ------------------------- helpers -------------------------

    private static KeyValue keyValue(Object value, long modRevision) throws Exception {
        KeyValue kv = mock(KeyValue.class);
        when(kv.getValue()).thenReturn(ByteSequence.from(JsonUtils.mapper().writeValueAsString(value), UTF_8));
        when(kv.getModRevision()).thenReturn(modRevision);
        return kv;
    }

    private static GetResponse getResponse(KeyValue... kvs) {
        GetResponse response = mock(GetResponse.class);
        when(response.getKvs()).thenReturn(List.of(kvs));
        when(response.getCount()).thenReturn((long) kvs.length);
        return response;
    }

    private void commitSucceeds(long revision) {
        Response.Header header = mock(Response.Header.class);
        when(header.getRevision()).thenReturn(revision);
        when(mockTxnResponse.isSucceeded()).thenReturn(true);
        when(mockTxnResponse.getHeader()).thenReturn(header);
    }

    private static Cluster cluster(String id, String name) {
        return Cluster.builder().id(id).name(name).status(ClusterStatus.ACTIVE).build();
    }

    // ------------------------- reads -------------------------

    @Test
    public void testGetCluster_SetsRevisionFromKey() throws Exception {
        // Given
        KeyValue kv = keyValue(cluster("cluster-1", "web"), 7L);
        GetResponse response = getResponse(kv);
        when(mockKv.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(response));

        // When
        Optional<Cluster> result = store.getCluster("cluster-1");

        // Then
        assertThat(result).isPresent();
        assertThat(result.get().getName()).isEqualTo("web");
        assertThat(result.get().getRevision()).isEqualTo(7L);
        verify(mockKv).get(ByteSequence.from("/cluster-engine/clusters/cluster-1", UTF_8));
    }

    @Test
    public void testGetCluster_Missing() throws Exception {
        // Given
        GetResponse response = getResponse();
        when(mockKv.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(response));

        // When / Then
        assertThat(store.getCluster("cluster-1")).isEmpty();
    }

    @Test
    public void testGetAllClusters_UsesPrefixQuery() throws Exception {
        // Given
        GetResponse response = getResponse(keyValue(cluster("c1", "web"), 3L), keyValue(cluster("c2", "db"), 4L));
        when(mockKv.get(any(ByteSequence.class), any(GetOption.class)))
            .thenReturn(CompletableFuture.completedFuture(response));

        // When
        List<Cluster> clusters = store.getAllClusters();

        // Then
        assertThat(clusters).extracting(Cluster::getName).containsExactly("web", "db");
        verify(mockKv).get(eq(ByteSequence.from("/cluster-engine/clusters/", UTF_8)), any(GetOption.class));
    }

    @Test
    public void testGetActionsByStatus_Filters() throws Exception {
        // Given
        Action running = Action.builder().id("a1").name(ActionName.CLUSTER_RESIZE).status(ActionStatus.RUNNING).build();
        Action waiting = Action.builder().id("a2").name(ActionName.CLUSTER_RESIZE).status(ActionStatus.WAITING).build();
        GetResponse response = getResponse(keyValue(running, 1L), keyValue(waiting, 2L));
        when(mockKv.get(any(ByteSequence.class), any(GetOption.class)))
            .thenReturn(CompletableFuture.completedFuture(response));

        // When
        List<Action> result = store.getActionsByStatus(ActionStatus.WAITING);

        // Then
        assertThat(result).extracting(Action::getId).containsExactly("a2");
    }

    // ------------------------- writes -------------------------

    @Test
    public void testCreateCluster_SetsCommittedRevision() throws Exception {
        // Given
        commitSucceeds(42L);
        Cluster cluster = cluster("cluster-1", "web");

        // When
        store.createCluster(cluster);

        // Then
        assertThat(cluster.getRevision()).isEqualTo(42L);
        verify(mockTxn).commit();
    }

    @Test
    public void testUpdateCluster_StaleRevisionFails() throws Exception {
        // Given
        when(mockTxnResponse.isSucceeded()).thenReturn(false);
        Cluster cluster = cluster("cluster-1", "web");
        cluster.setRevision(3L);

        // When / Then
        assertThatThrownBy(() -> store.updateCluster(cluster))
            .isInstanceOf(ConcurrentUpdateException.class)
            .hasMessageContaining("/cluster-engine/clusters/cluster-1");
        assertThat(cluster.getRevision()).isEqualTo(3L);
    }

    @Test
    public void testUpdateAction_LostRaceReturnsFalse() throws Exception {
        // Given
        when(mockTxnResponse.isSucceeded()).thenReturn(false);
        Action action = Action.builder().id("a1").name(ActionName.CLUSTER_RESIZE).status(ActionStatus.RUNNING).build();

        // When / Then
        assertThat(store.updateAction(action)).isFalse();
    }

    @Test
    public void testClose_ClosesClient() throws Exception {
        // When
        store.close();

        // Then
        verify(mockEtcdClient).close();
    }

    @Test
    public void testGetInstance_ReturnsSingleton() {
        assertThat(EtcdMetadataStore.createTestInstance(ENDPOINTS, mockEtcdClient, mockKv))
            .isSameAs(EtcdMetadataStore.getInstance(ENDPOINTS));
    }
}
