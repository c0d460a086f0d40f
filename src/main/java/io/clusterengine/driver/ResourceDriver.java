package io.clusterengine.driver;

import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.Profile;

/**
 * Provisions the physical resources behind clusters and nodes.
 *
 * Implementations may block; they are only called from action workers, never while
 * a store transaction is open.
 */
public interface ResourceDriver {

    /**
     * Create the physical resource of a node.
     *
     * @return the physical id of the new resource
     */
    String createNode(Node node, Profile profile) throws Exception;

    /**
     * Rebuild or reconfigure a node's resource for a new profile.
     */
    void updateNode(Node node, Profile profile) throws Exception;

    /**
     * Delete a node's resource. Deleting a node without a physical resource is a no-op.
     */
    void deleteNode(Node node) throws Exception;

    /**
     * Hook run before the nodes of a new cluster are created.
     */
    void createCluster(Cluster cluster) throws Exception;

    /**
     * Hook run after every node of a cluster was deleted.
     */
    void deleteCluster(Cluster cluster) throws Exception;
}
