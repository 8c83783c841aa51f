package com.photohunt.service;

import com.photohunt.comparator.PhotoComparatorException;
import com.photohunt.comparator.PhotoComparatorGateway;
import com.photohunt.comparator.PhotoComparisonPrompt;
import com.photohunt.dto.PhotoSubmissionResponses;
import com.photohunt.dto.PhotoVerdict;
import com.photohunt.mapper.PhotoSubmissionResponseMapper;
import com.photohunt.model.PhotoHunt;
import com.photohunt.repository.PhotoHuntRepository;
import com.photohunt.storage.BlobStoreGateway;
import com.photohunt.storage.LocalMediaStorage;
import com.photohunt.storage.StorageUploadResult;
import com.photohunt.validation.PhotoVerdictInterpreter;
import com.photohunt.web.InvalidPhotoRequestException;
import com.photohunt.web.PhotoSubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one photo submission: store the image, ask the comparator, and record the
 * completion when the verdict approves it.
 */
@Service
public class PhotoSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(PhotoSubmissionService.class);

    static final String SUBMISSIONS_FOLDER = "submissions";
    static final Set<String> ALLOWED_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp");

    private final PhotoHuntRepository photoHuntRepository;
    private final BlobStoreGateway blobStoreGateway;
    private final LocalMediaStorage localMediaStorage;
    private final ImageAccessUrlResolver imageAccessUrlResolver;
    private final PhotoComparatorGateway photoComparatorGateway;
    private final PhotoCompletionLedgerService photoCompletionLedgerService;
    private final PhotoSubmissionResponseMapper photoSubmissionResponseMapper;

    public PhotoSubmissionService(
            PhotoHuntRepository photoHuntRepository,
            BlobStoreGateway blobStoreGateway,
            LocalMediaStorage localMediaStorage,
            ImageAccessUrlResolver imageAccessUrlResolver,
            PhotoComparatorGateway photoComparatorGateway,
            PhotoCompletionLedgerService photoCompletionLedgerService,
            PhotoSubmissionResponseMapper photoSubmissionResponseMapper
    ) {
        this.photoHuntRepository = photoHuntRepository;
        this.blobStoreGateway = blobStoreGateway;
        this.localMediaStorage = localMediaStorage;
        this.imageAccessUrlResolver = imageAccessUrlResolver;
        this.photoComparatorGateway = photoComparatorGateway;
        this.photoCompletionLedgerService = photoCompletionLedgerService;
        this.photoSubmissionResponseMapper = photoSubmissionResponseMapper;
    }

    public PhotoSubmissionResponses.SubmissionResult submit(UUID userId, UUID photoHuntId, MultipartFile photo) {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(photoHuntId, "photoHuntId is required");

        PhotoHunt photoHunt = photoHuntRepository.findByPhotoHuntIdAndActiveTrue(photoHuntId)
                .orElseThrow(() -> PhotoSubmissionException.photoHuntNotFound(
                        "PhotoHunt not found or inactive: " + photoHuntId
                ));

        if (photo == null) {
            throw new InvalidPhotoRequestException("photo", "This field is required.");
        }
        String extension = requireAllowedExtension(photo.getOriginalFilename());
        if (photo.isEmpty()) {
            throw new InvalidPhotoRequestException("photo", "The submitted file is empty.");
        }

        byte[] payload;
        try {
            payload = photo.getBytes();
        } catch (IOException ex) {
            throw PhotoSubmissionException.unreadablePhoto("The submitted photo could not be read.", ex);
        }

        String submittedImage = store(payload, extension);

        String rawResponse = compare(photoHunt, submittedImage, payload, extension);
        PhotoVerdict verdict = photoSubmissionResponseMapper.toValidationView(
                PhotoVerdictInterpreter.interpret(rawResponse)
        );

        if (!verdict.valid()) {
            log.info(
                    "Submission by user {} for photo hunt {} rejected (similarity={})",
                    userId,
                    photoHuntId,
                    verdict.similarityScore()
            );
            discardStoredImage(submittedImage);
            return PhotoSubmissionResponses.SubmissionResult.rejected(verdict);
        }

        PhotoCompletionLedgerService.LedgerCommit commit;
        try {
            commit = photoCompletionLedgerService.recordAcceptedSubmission(
                    new PhotoCompletionLedgerService.AcceptedSubmission(
                            userId,
                            photoHuntId,
                            photoHunt.getReferenceImage(),
                            submittedImage,
                            verdict,
                            PhotoComparisonPrompt.auditText(
                                    photoHunt.getReferenceImage(),
                                    submittedImage,
                                    photoHunt.getDescription()
                            ),
                            photoSubmissionResponseMapper.withoutSignedLinks(rawResponse)
                    )
            );
        } catch (DataIntegrityViolationException ex) {
            discardStoredImage(submittedImage);
            throw PhotoSubmissionException.validationConflict(
                    "A concurrent submission for this photo hunt was recorded first; retry the submission.",
                    ex
            );
        } catch (RuntimeException ex) {
            discardStoredImage(submittedImage);
            throw ex;
        }

        String previousImage = commit.previousSubmittedImage();
        if (previousImage != null && !previousImage.equals(submittedImage)) {
            discardStoredImage(previousImage);
        }

        return PhotoSubmissionResponses.SubmissionResult.accepted(
                photoSubmissionResponseMapper.toCompletionSummary(commit.completion()),
                verdict
        );
    }

    private String store(byte[] payload, String extension) {
        StorageUploadResult uploadResult = blobStoreGateway.upload(payload, SUBMISSIONS_FOLDER, extension);
        if (uploadResult.isUploaded()) {
            return uploadResult.url();
        }

        log.warn("Object store upload failed; writing submission to local media", uploadResult.failure());
        try {
            return localMediaStorage.store(payload, SUBMISSIONS_FOLDER, extension);
        } catch (IOException ex) {
            throw PhotoSubmissionException.storageFailure("The submitted photo could not be stored.", ex);
        }
    }

    /**
     * @return raw comparator text, or {@code null} when no comparison could be made
     */
    private String compare(PhotoHunt photoHunt, String submittedImage, byte[] payload, String extension) {
        String referenceUrl = imageAccessUrlResolver.resolve(photoHunt.getReferenceImage());
        if (referenceUrl == null) {
            log.warn("Photo hunt {} has no fetchable reference image; skipping comparison", photoHunt.getPhotoHuntId());
            return null;
        }

        String description = photoHunt.getDescription() == null ? "" : photoHunt.getDescription();
        String submittedUrl = imageAccessUrlResolver.resolve(submittedImage);
        try {
            if (submittedUrl == null) {
                return photoComparatorGateway.compare(referenceUrl, payload, mediaType(extension), description);
            }
            return photoComparatorGateway.compare(referenceUrl, submittedUrl, description);
        } catch (PhotoComparatorException ex) {
            log.error("Comparator call for photo hunt {} failed", photoHunt.getPhotoHuntId(), ex);
            return null;
        }
    }

    private static String requireAllowedExtension(String filename) {
        String extension = StringUtils.getFilenameExtension(filename);
        if (extension == null || !ALLOWED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT))) {
            throw new InvalidPhotoRequestException(
                    "photo",
                    "Unsupported file format. Allowed: " + String.join(", ", ALLOWED_EXTENSIONS.stream().sorted().toList())
            );
        }
        return extension.toLowerCase(Locale.ROOT);
    }

    private static String mediaType(String extension) {
        return "image/" + ("jpg".equals(extension) ? "jpeg" : extension);
    }

    private void discardStoredImage(String storedImage) {
        if (!StringUtils.hasText(storedImage)) {
            return;
        }
        if (localMediaStorage.isLocal(storedImage)) {
            if (!localMediaStorage.delete(storedImage)) {
                log.warn("Local media {} was not removed", storedImage);
            }
            return;
        }
        String key = blobStoreGateway.extractKey(storedImage);
        if (key == null) {
            log.warn("Stored image {} is not in the object store; leaving it in place", storedImage);
            return;
        }
        if (!blobStoreGateway.delete(key)) {
            log.warn("Object {} was not removed", key);
        }
    }
}
