package io.clusterengine.actions;

import io.clusterengine.actions.executors.ClusterAddNodesExecutor;
import io.clusterengine.actions.executors.ClusterCreateExecutor;
import io.clusterengine.actions.executors.ClusterDelNodesExecutor;
import io.clusterengine.actions.executors.ClusterDeleteExecutor;
import io.clusterengine.actions.executors.ClusterPolicyExecutor;
import io.clusterengine.actions.executors.ClusterReplaceNodesExecutor;
import io.clusterengine.actions.executors.ClusterResizeExecutor;
import io.clusterengine.actions.executors.ClusterScaleInExecutor;
import io.clusterengine.actions.executors.ClusterScaleOutExecutor;
import io.clusterengine.actions.executors.ClusterUpdateExecutor;
import io.clusterengine.actions.executors.NodeCreateExecutor;
import io.clusterengine.actions.executors.NodeDeleteExecutor;
import io.clusterengine.actions.executors.NodeUpdateExecutor;
import io.clusterengine.enums.ActionName;

/**
 * Factory for creating ActionExecutor implementations from action names.
 */
public class ActionExecutorFactory {

    /**
     * Create the executor of an action name.
     */
    public static ActionExecutor createExecutor(ActionName name) {
        return switch (name) {
            case CLUSTER_CREATE -> new ClusterCreateExecutor();
            case CLUSTER_UPDATE -> new ClusterUpdateExecutor();
            case CLUSTER_DELETE -> new ClusterDeleteExecutor();
            case CLUSTER_RESIZE -> new ClusterResizeExecutor();
            case CLUSTER_SCALE_OUT -> new ClusterScaleOutExecutor();
            case CLUSTER_SCALE_IN -> new ClusterScaleInExecutor();
            case CLUSTER_ADD_NODES -> new ClusterAddNodesExecutor();
            case CLUSTER_DEL_NODES -> new ClusterDelNodesExecutor();
            case CLUSTER_REPLACE_NODES -> new ClusterReplaceNodesExecutor();
            case CLUSTER_ATTACH_POLICY, CLUSTER_DETACH_POLICY, CLUSTER_UPDATE_POLICY -> new ClusterPolicyExecutor(name);
            case NODE_CREATE -> new NodeCreateExecutor();
            case NODE_UPDATE -> new NodeUpdateExecutor();
            case NODE_DELETE -> new NodeDeleteExecutor();
        };
    }
}
