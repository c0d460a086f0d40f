package io.clusterengine.identity;

import io.clusterengine.enums.EntityKind;
import io.clusterengine.exceptions.AmbiguousReferenceException;
import io.clusterengine.exceptions.InternalErrorException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.Policy;
import io.clusterengine.models.Profile;
import io.clusterengine.models.Receiver;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves a UUID-or-name reference to exactly one entity of a given kind.
 * Soft-deleted clusters are invisible to resolution.
 */
@Slf4j
public class IdentityResolver {

    private final MetadataStore metadataStore;

    public IdentityResolver(MetadataStore metadataStore) {
        this.metadataStore = metadataStore;
    }

    public Cluster resolveCluster(Reference reference) {
        return resolve(EntityKind.CLUSTER, reference,
                () -> metadataStore.getCluster(reference.getValue()).filter(cluster -> !cluster.isDeleted()),
                () -> metadataStore.getAllClusters().stream()
                        .filter(cluster -> !cluster.isDeleted())
                        .collect(Collectors.toList()),
                Cluster::getName,
                Cluster::getId);
    }

    public Node resolveNode(Reference reference) {
        return resolve(EntityKind.NODE, reference,
                () -> metadataStore.getNode(reference.getValue()),
                metadataStore::getAllNodes,
                Node::getName,
                Node::getId);
    }

    public Profile resolveProfile(Reference reference) {
        return resolve(EntityKind.PROFILE, reference,
                () -> metadataStore.getProfile(reference.getValue()),
                metadataStore::getAllProfiles,
                Profile::getName,
                Profile::getId);
    }

    public Policy resolvePolicy(Reference reference) {
        return resolve(EntityKind.POLICY, reference,
                () -> metadataStore.getPolicy(reference.getValue()),
                metadataStore::getAllPolicies,
                Policy::getName,
                Policy::getId);
    }

    public Receiver resolveReceiver(Reference reference) {
        return resolve(EntityKind.RECEIVER, reference,
                () -> metadataStore.getReceiver(reference.getValue()),
                metadataStore::getAllReceivers,
                Receiver::getName,
                Receiver::getId);
    }

    /**
     * Like {@link #resolveNode(Reference)} but reports a missing node as empty instead of
     * failing, so batch validation can aggregate every missing reference.
     */
    public Optional<Node> findNode(Reference reference) {
        try {
            return Optional.of(resolveNode(reference));
        } catch (ResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    public static String notFoundMessage(EntityKind kind, String token) {
        return String.format("The %s '%s' could not be found.", kind.getValue(), token);
    }

    /**
     * Names the token and quotes every matching id.
     */
    public static String ambiguousMessage(String token, List<String> matchingIds) {
        return String.format("Multiple results found matching the query criteria '%s'. Please be more specific. "
                + "Candidates: %s.", token, matchingIds.stream()
                .map(id -> "'" + id + "'")
                .collect(Collectors.joining(", ", "[", "]")));
    }

    private <T> T resolve(EntityKind kind,
                          Reference reference,
                          StoreQuery<Optional<T>> byId,
                          StoreQuery<List<T>> all,
                          Function<T, String> nameOf,
                          Function<T, String> idOf) {
        String token = reference.getValue();
        try {
            if (reference.isById()) {
                return byId.run().orElseThrow(() -> new ResourceNotFoundException(notFoundMessage(kind, token)));
            }

            List<T> matches = all.run().stream()
                    .filter(entity -> token.equals(nameOf.apply(entity)))
                    .collect(Collectors.toList());
            if (matches.isEmpty()) {
                throw new ResourceNotFoundException(notFoundMessage(kind, token));
            }
            if (matches.size() > 1) {
                log.debug("Name '{}' matches {} {} entities", token, matches.size(), kind.getValue());
                throw new AmbiguousReferenceException(ambiguousMessage(token,
                        matches.stream().map(idOf).collect(Collectors.toList())));
            }
            return matches.get(0);
        } catch (ResourceNotFoundException | AmbiguousReferenceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to resolve {} '{}': {}", kind.getValue(), token, e.getMessage(), e);
            throw new InternalErrorException("Failed to resolve " + kind.getValue() + " '" + token + "'", e);
        }
    }

    @FunctionalInterface
    private interface StoreQuery<T> {
        T run() throws Exception;
    }
}
