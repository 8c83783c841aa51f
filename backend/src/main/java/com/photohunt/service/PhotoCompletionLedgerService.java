package com.photohunt.service;

import com.photohunt.dto.PhotoVerdict;
import com.photohunt.model.PhotoHuntCompletion;
import com.photohunt.model.PhotoValidation;
import com.photohunt.repository.PhotoHuntCompletionRepository;
import com.photohunt.repository.PhotoHuntRepository;
import com.photohunt.repository.PhotoValidationRepository;
import com.photohunt.repository.UserProfileRepository;
import com.photohunt.web.PhotoSubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Records accepted submissions: one completion and one validation record per
 * (user, photo hunt), updated in place under a row lock.
 */
@Service
public class PhotoCompletionLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PhotoCompletionLedgerService.class);

    private final PhotoHuntRepository photoHuntRepository;
    private final PhotoHuntCompletionRepository photoHuntCompletionRepository;
    private final PhotoValidationRepository photoValidationRepository;
    private final UserProfileRepository userProfileRepository;

    public PhotoCompletionLedgerService(
            PhotoHuntRepository photoHuntRepository,
            PhotoHuntCompletionRepository photoHuntCompletionRepository,
            PhotoValidationRepository photoValidationRepository,
            UserProfileRepository userProfileRepository
    ) {
        this.photoHuntRepository = photoHuntRepository;
        this.photoHuntCompletionRepository = photoHuntCompletionRepository;
        this.photoValidationRepository = photoValidationRepository;
        this.userProfileRepository = userProfileRepository;
    }

    /**
     * A duplicate concurrent create surfaces as a
     * {@link org.springframework.dao.DataIntegrityViolationException} from the unique
     * (user, photo hunt) constraint.
     */
    @Transactional
    public LedgerCommit recordAcceptedSubmission(AcceptedSubmission submission) {
        Objects.requireNonNull(submission, "submission is required");
        OffsetDateTime now = OffsetDateTime.now();

        Optional<PhotoHuntCompletion> existing = photoHuntCompletionRepository.findByUserIdAndPhotoHuntIdForUpdate(
                submission.userId(),
                submission.photoHuntId()
        );

        PhotoHuntCompletion completion;
        String previousSubmittedImage;
        boolean previouslyValid;
        if (existing.isPresent()) {
            completion = existing.get();
            previousSubmittedImage = completion.getSubmittedImage();
            previouslyValid = Boolean.TRUE.equals(completion.getValid());
        } else {
            if (!photoHuntRepository.existsByPhotoHuntIdAndActiveTrue(submission.photoHuntId())) {
                throw PhotoSubmissionException.photoHuntNotFound(
                        "PhotoHunt not found or inactive: " + submission.photoHuntId()
                );
            }
            completion = new PhotoHuntCompletion();
            completion.setCompletionId(UUID.randomUUID());
            completion.setUserId(submission.userId());
            completion.setPhotoHuntId(submission.photoHuntId());
            completion.setCreatedAt(now);
            previousSubmittedImage = null;
            previouslyValid = false;
        }

        PhotoVerdict verdict = submission.verdict();
        completion.setSubmittedImage(submission.submittedImage());
        completion.setValid(true);
        completion.setValidationScore(verdict.similarityScore());
        completion.setValidationNotes(verdict.notes());
        completion.setUpdatedAt(now);
        PhotoHuntCompletion savedCompletion = photoHuntCompletionRepository.saveAndFlush(completion);

        PhotoValidation validation = photoValidationRepository.findByCompletionId(savedCompletion.getCompletionId())
                .orElseGet(() -> newValidation(savedCompletion.getCompletionId(), now));
        validation.setReferenceImageUrl(submission.referenceImage());
        validation.setSubmittedImageUrl(submission.submittedImage());
        validation.setSimilarityScore(verdict.similarityScore());
        validation.setConfidenceScore(verdict.confidenceScore());
        validation.setValidationPrompt(submission.prompt());
        validation.setAiResponse(submission.rawResponse());
        validation.setApproved(verdict.valid());
        validation.setUpdatedAt(now);
        photoValidationRepository.saveAndFlush(validation);

        boolean newlyCompleted = !previouslyValid;
        if (newlyCompleted) {
            userProfileRepository.insertIfAbsent(submission.userId(), now);
            userProfileRepository.incrementTotalCompletions(submission.userId(), now);
        }

        log.info(
                "Recorded completion {} for user {} on photo hunt {} (newlyCompleted={})",
                savedCompletion.getCompletionId(),
                submission.userId(),
                submission.photoHuntId(),
                newlyCompleted
        );
        return new LedgerCommit(savedCompletion, previousSubmittedImage, newlyCompleted);
    }

    private static PhotoValidation newValidation(UUID completionId, OffsetDateTime now) {
        PhotoValidation validation = new PhotoValidation();
        validation.setValidationId(UUID.randomUUID());
        validation.setCompletionId(completionId);
        validation.setCreatedAt(now);
        return validation;
    }

    public record AcceptedSubmission(
            UUID userId,
            UUID photoHuntId,
            String referenceImage,
            String submittedImage,
            PhotoVerdict verdict,
            String prompt,
            String rawResponse
    ) {
        public AcceptedSubmission {
            Objects.requireNonNull(userId, "userId is required");
            Objects.requireNonNull(photoHuntId, "photoHuntId is required");
            Objects.requireNonNull(referenceImage, "referenceImage is required");
            Objects.requireNonNull(submittedImage, "submittedImage is required");
            Objects.requireNonNull(verdict, "verdict is required");
            prompt = prompt == null ? "" : prompt;
            rawResponse = rawResponse == null ? "" : rawResponse;
        }
    }

    public record LedgerCommit(
            PhotoHuntCompletion completion,
            String previousSubmittedImage,
            boolean newlyCompleted
    ) {
    }
}
