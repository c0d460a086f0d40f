package io.clusterengine.membership;

import io.clusterengine.enums.DeletionCriteria;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.models.Node;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Picks the members to remove when a cluster shrinks.
 *
 * Nodes that are not ACTIVE always go first. The remaining victims are picked by the
 * deletion criteria; OLDEST_PROFILE_FIRST prefers nodes still running a profile other
 * than the cluster's current one, oldest first.
 */
public class VictimSelector {

    private static final Comparator<Node> BY_AGE = Comparator.comparing(
            Node::getCreatedAt, Comparator.nullsFirst(Comparator.<OffsetDateTime>naturalOrder()));

    private final Random random;

    public VictimSelector() {
        this(new Random());
    }

    public VictimSelector(Random random) {
        this.random = random;
    }

    public List<String> select(List<Node> members, int count, DeletionCriteria criteria, String clusterProfileId) {
        if (count <= 0) {
            return new ArrayList<>();
        }
        if (count >= members.size()) {
            return members.stream().map(Node::getId).collect(Collectors.toList());
        }

        List<Node> victims = new ArrayList<>();
        List<Node> healthy = new ArrayList<>();
        for (Node node : members) {
            if (node.getStatus() != NodeStatus.ACTIVE) {
                victims.add(node);
            } else {
                healthy.add(node);
            }
        }
        if (victims.size() >= count) {
            return ids(victims.subList(0, count));
        }

        List<Node> ordered = order(healthy, criteria == null ? DeletionCriteria.RANDOM : criteria, clusterProfileId);
        victims.addAll(ordered.subList(0, count - victims.size()));
        return ids(victims);
    }

    private List<Node> order(List<Node> nodes, DeletionCriteria criteria, String clusterProfileId) {
        List<Node> ordered = new ArrayList<>(nodes);
        switch (criteria) {
            case OLDEST_FIRST:
                ordered.sort(BY_AGE);
                break;
            case YOUNGEST_FIRST:
                ordered.sort(BY_AGE.reversed());
                break;
            case OLDEST_PROFILE_FIRST:
                ordered.sort(Comparator.comparing((Node node) -> clusterProfileId != null
                                && clusterProfileId.equals(node.getProfileId()))
                        .thenComparing(BY_AGE));
                break;
            case RANDOM:
            default:
                Collections.shuffle(ordered, random);
                break;
        }
        return ordered;
    }

    private static List<String> ids(List<Node> nodes) {
        return nodes.stream().map(Node::getId).collect(Collectors.toList());
    }
}
