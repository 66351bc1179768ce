package com.storynest.reading.api;

import com.storynest.reading.profile.ChildProfileService;
import com.storynest.reading.profile.ProfileModels;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/profiles")
public class ChildProfileController {
    static final String USER_HEADER = "X-User-Id";

    private final ChildProfileService profileService;

    public ChildProfileController(ChildProfileService profileService) {
        this.profileService = profileService;
    }

    @PostMapping
    public ResponseEntity<ProfileModels.ProfileCreatedResponse> create(@RequestHeader(USER_HEADER) long userId,
                                                                       @RequestBody ProfileModels.CreateProfileRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(profileService.createProfile(userId, request));
    }

    @GetMapping
    public ResponseEntity<ProfileModels.ProfilesResponse> list(@RequestHeader(USER_HEADER) long userId) {
        return ResponseEntity.ok(new ProfileModels.ProfilesResponse(
                profileService.listProfiles(userId).stream().map(ProfileModels.ProfileView::of).toList()));
    }

    @GetMapping("/{profileId}")
    public ResponseEntity<ProfileModels.ProfileView> get(@RequestHeader(USER_HEADER) long userId, @PathVariable long profileId) {
        return ResponseEntity.ok(ProfileModels.ProfileView.of(profileService.getProfile(userId, profileId)));
    }
}
