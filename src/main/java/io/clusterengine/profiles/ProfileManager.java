package io.clusterengine.profiles;

import io.clusterengine.api.models.requests.ProfileCreateRequest;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.exceptions.ConflictException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Profile;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

/**
 * Creates, lists and deletes node profiles. Profiles are immutable once created.
 */
@Slf4j
public class ProfileManager {

    private final MetadataStore metadataStore;
    private final IdentityResolver identityResolver;
    private final Clock clock;

    public ProfileManager(MetadataStore metadataStore, IdentityResolver identityResolver, Clock clock) {
        this.metadataStore = metadataStore;
        this.identityResolver = identityResolver;
        this.clock = clock;
    }

    public Profile createProfile(ProfileCreateRequest request) throws Exception {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new BadRequestException("The 'name' field is required.");
        }
        if (request.getType() == null || request.getType().isBlank()) {
            throw new BadRequestException("The 'type' field is required.");
        }

        Profile profile = Profile.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName())
                .type(request.getType())
                .spec(request.getSpec() != null ? request.getSpec() : new HashMap<>())
                .metadata(request.getMetadata() != null ? request.getMetadata() : new HashMap<>())
                .createdAt(OffsetDateTime.now(clock))
                .build();
        metadataStore.createProfile(profile);

        log.info("Created profile '{}' ({}) of type {}", profile.getName(), profile.getId(), profile.getType());
        return profile;
    }

    public List<Profile> listProfiles() throws Exception {
        return metadataStore.getAllProfiles();
    }

    public Profile getProfile(Reference reference) {
        return identityResolver.resolveProfile(reference);
    }

    public void deleteProfile(Reference reference) throws Exception {
        Profile profile = identityResolver.resolveProfile(reference);

        boolean inUse = metadataStore.getAllClusters().stream()
                .anyMatch(cluster -> !cluster.isDeleted() && profile.getId().equals(cluster.getProfileId()))
                || metadataStore.getAllNodes().stream()
                .anyMatch(node -> profile.getId().equals(node.getProfileId()));
        if (inUse) {
            throw new ConflictException(String.format(
                    "The profile '%s' cannot be deleted: still referenced by some clusters and/or nodes.",
                    reference.getValue()));
        }

        metadataStore.deleteProfile(profile.getId());
        log.info("Deleted profile {}", profile.getId());
    }
}
