package io.clusterengine.driver;

import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.Profile;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Driver that only records the resources it pretends to manage.
 *
 * A profile whose spec sets {@code "fail": true} makes node creation and update fail,
 * which lets callers exercise failure handling without a real backend.
 */
@Slf4j
public class SimulatedResourceDriver implements ResourceDriver {

    public static final String SPEC_FAIL = "fail";

    private final long delayMillis;
    private final Set<String> resources = ConcurrentHashMap.newKeySet();

    public SimulatedResourceDriver() {
        this(0L);
    }

    public SimulatedResourceDriver(long delayMillis) {
        this.delayMillis = delayMillis;
    }

    @Override
    public String createNode(Node node, Profile profile) throws Exception {
        pause();
        failIfRequested(profile, "create", node);
        String physicalId = UUID.randomUUID().toString();
        resources.add(physicalId);
        log.info("Simulated creation of node {} as {}", node.getId(), physicalId);
        return physicalId;
    }

    @Override
    public void updateNode(Node node, Profile profile) throws Exception {
        pause();
        failIfRequested(profile, "update", node);
        log.info("Simulated update of node {} to profile {}", node.getId(), profile.getId());
    }

    @Override
    public void deleteNode(Node node) throws Exception {
        pause();
        if (node.getPhysicalId() != null) {
            resources.remove(node.getPhysicalId());
        }
        log.info("Simulated deletion of node {}", node.getId());
    }

    @Override
    public void createCluster(Cluster cluster) {
        log.debug("[Cluster: {}] Nothing to provision at cluster level", cluster.getId());
    }

    @Override
    public void deleteCluster(Cluster cluster) {
        log.debug("[Cluster: {}] Nothing to release at cluster level", cluster.getId());
    }

    public int getResourceCount() {
        return resources.size();
    }

    private void pause() throws InterruptedException {
        if (delayMillis > 0) {
            Thread.sleep(delayMillis);
        }
    }

    private static void failIfRequested(Profile profile, String operation, Node node) {
        Map<String, Object> spec = profile.getSpec();
        if (spec != null && Boolean.TRUE.equals(spec.get(SPEC_FAIL))) {
            throw new IllegalStateException(String.format(
                    "Simulated %s failure for node %s", operation, node.getId()));
        }
    }
}
