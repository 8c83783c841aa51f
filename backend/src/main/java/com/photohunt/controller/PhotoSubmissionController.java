package com.photohunt.controller;

import com.photohunt.dto.PhotoSubmissionResponses;
import com.photohunt.service.PhotoSubmissionService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@RestController
@RequestMapping("/photos")
public class PhotoSubmissionController {

    public static final String USER_ID_HEADER = "X-Photohunt-User-Id";

    private final PhotoSubmissionService photoSubmissionService;

    public PhotoSubmissionController(PhotoSubmissionService photoSubmissionService) {
        this.photoSubmissionService = photoSubmissionService;
    }

    /**
     * 201 with the completion when the photo is approved, 200 with the verdict alone when it is not.
     */
    @PostMapping(path = "/submit", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PhotoSubmissionResponses.SubmissionResult> submit(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam("challenge_id") UUID challengeId,
            @RequestPart("photo") MultipartFile photo
    ) {
        PhotoSubmissionResponses.SubmissionResult result = photoSubmissionService.submit(userId, challengeId, photo);
        return ResponseEntity.status(result.outcome().httpStatus()).body(result);
    }
}
