package io.clusterengine.api.handlers;

import io.clusterengine.api.models.requests.ProfileCreateRequest;
import io.clusterengine.api.models.responses.ItemsResponse;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Profile;
import io.clusterengine.profiles.ProfileManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for profiles. All operations are synchronous.
 */
@Slf4j
@RestController
@RequestMapping(ProfileHandler.BASE_PATH)
public class ProfileHandler {

    static final String BASE_PATH = "/v1/profiles";

    private final ProfileManager profileManager;
    private final HandlerSupport support;

    public ProfileHandler(ProfileManager profileManager, HandlerSupport support) {
        this.profileManager = profileManager;
        this.support = support;
    }

    @PostMapping
    public ResponseEntity<Object> createProfile(@RequestBody ProfileCreateRequest request) {
        try {
            log.info("Creating profile '{}'", request.getName());
            Profile profile = profileManager.createProfile(request);
            return support.created(BASE_PATH, profile.getId());
        } catch (Exception e) {
            return support.error(e, "creating profile");
        }
    }

    @GetMapping
    public ResponseEntity<Object> listProfiles() {
        try {
            return ResponseEntity.ok(ItemsResponse.of(profileManager.listProfiles()));
        } catch (Exception e) {
            return support.error(e, "listing profiles");
        }
    }

    @GetMapping("/{profile}")
    public ResponseEntity<Object> getProfile(@PathVariable String profile) {
        try {
            return ResponseEntity.ok(profileManager.getProfile(Reference.parse(profile)));
        } catch (Exception e) {
            return support.error(e, "getting profile " + profile);
        }
    }

    @DeleteMapping("/{profile}")
    public ResponseEntity<Object> deleteProfile(@PathVariable String profile) {
        try {
            log.info("Deleting profile '{}'", profile);
            profileManager.deleteProfile(Reference.parse(profile));
            return ResponseEntity.noContent().build();
        } catch (Exception e) {
            return support.error(e, "deleting profile " + profile);
        }
    }
}
