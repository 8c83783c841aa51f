package com.photohunt.service;

import com.photohunt.dto.UserProfileResponse;
import com.photohunt.model.UserProfile;
import com.photohunt.repository.UserProfileRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class UserProfileService {

    private final UserProfileRepository userProfileRepository;

    public UserProfileService(UserProfileRepository userProfileRepository) {
        this.userProfileRepository = userProfileRepository;
    }

    /**
     * Profiles are only created by the ledger, so an unknown user reads as zero completions.
     */
    @Transactional(readOnly = true)
    public UserProfileResponse getProfile(UUID userId) {
        return userProfileRepository.findById(userId)
                .map(UserProfileService::toResponse)
                .orElseGet(() -> UserProfileResponse.empty(userId));
    }

    private static UserProfileResponse toResponse(UserProfile profile) {
        return new UserProfileResponse(
                profile.getUserId(),
                profile.getTotalCompletions() == null ? 0 : profile.getTotalCompletions(),
                profile.getCreatedAt(),
                profile.getUpdatedAt()
        );
    }
}
