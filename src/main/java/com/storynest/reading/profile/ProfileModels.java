package com.storynest.reading.profile;

import com.storynest.reading.domain.DomainModels.ChildProfile;
import com.storynest.reading.path.LearningPathModels.LearningPathView;

import java.time.Instant;
import java.util.List;

public class ProfileModels {
    public record CreateProfileRequest(String name, Integer age, String readingLevel, String avatarUrl) {}

    // client view of a profile, the owning user id stays server side
    public record ProfileView(long id, String name, int age, String readingLevel, String avatarUrl, Instant createdAt) {
        public static ProfileView of(ChildProfile p) {
            return new ProfileView(p.id(), p.name(), p.age(), p.readingLevel(), p.avatarUrl(), p.createdAt());
        }
    }

    public record ProfileCreatedResponse(ProfileView profile, LearningPathView learningPath) {}

    public record ProfilesResponse(List<ProfileView> profiles) {}
}
