package com.photohunt.controller;

import com.photohunt.dto.UserProfileResponse;
import com.photohunt.service.UserProfileService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
public class UserProfileController {

    private final UserProfileService userProfileService;

    public UserProfileController(UserProfileService userProfileService) {
        this.userProfileService = userProfileService;
    }

    @GetMapping("/profile")
    public UserProfileResponse getProfile(@RequestHeader(PhotoSubmissionController.USER_ID_HEADER) UUID userId) {
        return userProfileService.getProfile(userId);
    }
}
