package com.photohunt.storage;

import com.photohunt.config.AwsS3Config;
import com.photohunt.config.PhotoHuntProperties;
import com.photohunt.config.PhotoHuntTestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3BlobStoreGatewayTest {

    private static final byte[] PAYLOAD = "jpeg-bytes".getBytes(StandardCharsets.UTF_8);

    @Mock
    private S3Client s3Client;

    private S3Presigner s3Presigner;

    @BeforeEach
    void setUp() {
        s3Presigner = AwsS3Config.buildPresigner(PhotoHuntTestProperties.storage());
    }

    @AfterEach
    void tearDown() {
        s3Presigner.close();
    }

    @Test
    void uploadStoresUnderFolderWithConfiguredAclAndReturnsPublicUrl() throws IOException {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());

        StorageUploadResult result = gateway(PhotoHuntTestProperties.storage()).upload(PAYLOAD, "submissions", "JPG");

        assertTrue(result.isUploaded());
        assertTrue(result.url().startsWith("https://photos-bucket.s3.us-east-1.amazonaws.com/submissions/"));
        assertTrue(result.url().endsWith(".jpg"));

        ArgumentCaptor<PutObjectRequest> requestCaptor = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> bodyCaptor = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client).putObject(requestCaptor.capture(), bodyCaptor.capture());
        PutObjectRequest request = requestCaptor.getValue();
        assertEquals("photos-bucket", request.bucket());
        assertTrue(request.key().startsWith("submissions/"));
        assertEquals("image/jpeg", request.contentType());
        assertEquals(ObjectCannedACL.PUBLIC_READ, request.acl());
        assertArrayEquals(PAYLOAD, readAll(bodyCaptor.getValue()));
    }

    @Test
    void aclRejectionIsRetriedOnceWithoutAclUsingIdenticalBytes() throws IOException {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(s3Exception("AccessControlListNotSupported"))
                .thenReturn(PutObjectResponse.builder().build());

        StorageUploadResult result = gateway(PhotoHuntTestProperties.storage()).upload(PAYLOAD, "submissions", "png");

        assertTrue(result.isUploaded());
        ArgumentCaptor<PutObjectRequest> requestCaptor = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> bodyCaptor = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3Client, times(2)).putObject(requestCaptor.capture(), bodyCaptor.capture());

        List<PutObjectRequest> requests = requestCaptor.getAllValues();
        assertEquals(ObjectCannedACL.PUBLIC_READ, requests.get(0).acl());
        assertNull(requests.get(1).acl());
        assertEquals(requests.get(0).key(), requests.get(1).key());
        assertEquals("image/png", requests.get(1).contentType());

        List<RequestBody> bodies = bodyCaptor.getAllValues();
        assertArrayEquals(PAYLOAD, readAll(bodies.get(0)));
        assertArrayEquals(PAYLOAD, readAll(bodies.get(1)));
    }

    @Test
    void failedRetryWithoutAclReportsFailure() {
        S3Exception retryFailure = s3Exception("InternalError");
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(s3Exception("AccessDenied"))
                .thenThrow(retryFailure);

        StorageUploadResult result = gateway(PhotoHuntTestProperties.storage()).upload(PAYLOAD, "submissions", "jpg");

        assertFalse(result.isUploaded());
        assertSame(retryFailure, result.failure());
        verify(s3Client, times(2)).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void nonAclFailureIsNotRetried() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(s3Exception("SlowDown"));

        StorageUploadResult result = gateway(PhotoHuntTestProperties.storage()).upload(PAYLOAD, "submissions", "jpg");

        assertFalse(result.isUploaded());
        assertInstanceOf(S3Exception.class, result.failure());
        verify(s3Client, times(1)).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void clientFailureIsReportedAsFailedResult() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("connection refused"));

        StorageUploadResult result = gateway(PhotoHuntTestProperties.storage()).upload(PAYLOAD, "submissions", "jpg");

        assertFalse(result.isUploaded());
        assertInstanceOf(SdkClientException.class, result.failure());
    }

    @Test
    void blankAclUploadsWithoutAcl() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());
        PhotoHuntProperties.Storage storage = PhotoHuntTestProperties.storage(
                PhotoHuntTestProperties.BUCKET, "", null, null, false
        );

        StorageUploadResult result = gateway(storage).upload(PAYLOAD, "submissions", "webp");

        assertTrue(result.isUploaded());
        ArgumentCaptor<PutObjectRequest> requestCaptor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(requestCaptor.capture(), any(RequestBody.class));
        assertNull(requestCaptor.getValue().acl());
    }

    @Test
    void missingBucketFailsWithoutCallingStore() {
        PhotoHuntProperties.Storage storage = PhotoHuntTestProperties.storage("", "public-read", null, null, false);

        StorageUploadResult result = gateway(storage).upload(PAYLOAD, "submissions", "jpg");

        assertFalse(result.isUploaded());
        assertInstanceOf(IllegalStateException.class, result.failure());
        verifyNoInteractions(s3Client);
    }

    @Test
    void extractKeyRecoversKeyFromPresignedUrl() {
        S3BlobStoreGateway gateway = gateway(PhotoHuntTestProperties.storage());
        String key = "submissions/5b0c9a2e-4a43-4d0e-9a57-6d1b8d3a3f10.jpg";

        String presigned = gateway.presign(key, 900);

        assertTrue(presigned.contains("X-Amz-Signature="));
        assertTrue(presigned.contains("X-Amz-Expires=900"));
        assertEquals(key, gateway.extractKey(presigned));
    }

    @Test
    void extractKeyRecoversKeyFromPublicUrlOfUpload() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());
        S3BlobStoreGateway gateway = gateway(PhotoHuntTestProperties.storage());

        StorageUploadResult result = gateway.upload(PAYLOAD, "submissions", "jpg");

        ArgumentCaptor<PutObjectRequest> requestCaptor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(requestCaptor.capture(), any(RequestBody.class));
        String key = requestCaptor.getValue().key();
        assertEquals(key, gateway.extractKey(result.url()));
        assertEquals(key, gateway.extractKey(gateway.presign(key, 60)));
    }

    @Test
    void extractKeyHandlesCustomDomainAndPathStyleEndpoints() {
        S3BlobStoreGateway customDomain = gateway(PhotoHuntTestProperties.storage(
                PhotoHuntTestProperties.BUCKET, "public-read", "cdn.photohunt.test", null, false
        ));
        assertEquals("photohunts/ref.jpg", customDomain.extractKey("https://cdn.photohunt.test/photohunts/ref.jpg"));

        PhotoHuntProperties.Storage pathStyle = PhotoHuntTestProperties.storage(
                PhotoHuntTestProperties.BUCKET, "public-read", null, "http://localhost:9000", true
        );
        try (S3Presigner pathStylePresigner = AwsS3Config.buildPresigner(pathStyle)) {
            S3BlobStoreGateway gateway = new S3BlobStoreGateway(
                    s3Client,
                    pathStylePresigner,
                    PhotoHuntTestProperties.properties(
                            pathStyle,
                            PhotoHuntTestProperties.mockComparator(),
                            PhotoHuntTestProperties.media("media", "")
                    )
            );
            String presigned = gateway.presign("submissions/a.jpg", 900);
            assertTrue(presigned.startsWith("http://localhost:9000/photos-bucket/"));
            assertEquals("submissions/a.jpg", gateway.extractKey(presigned));
        }
    }

    @Test
    void extractKeyIgnoresForeignAndLocalUrls() {
        S3BlobStoreGateway gateway = gateway(PhotoHuntTestProperties.storage());

        assertNull(gateway.extractKey("https://images.example.org/photohunts/ref.jpg"));
        assertNull(gateway.extractKey("https://other-bucket.s3.amazonaws.com/photohunts/ref.jpg"));
        assertNull(gateway.extractKey("/media/submissions/a.jpg"));
        assertNull(gateway.extractKey(null));
        assertNull(gateway.extractKey("https://photos-bucket.s3.amazonaws.com/"));
    }

    @Test
    void deleteReturnsTrueWhenStoreAccepts() {
        when(s3Client.deleteObject(any(DeleteObjectRequest.class))).thenReturn(DeleteObjectResponse.builder().build());

        assertTrue(gateway(PhotoHuntTestProperties.storage()).delete("submissions/a.jpg"));

        ArgumentCaptor<DeleteObjectRequest> captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client).deleteObject(captor.capture());
        assertEquals("photos-bucket", captor.getValue().bucket());
        assertEquals("submissions/a.jpg", captor.getValue().key());
    }

    @Test
    void deleteNeverThrows() {
        when(s3Client.deleteObject(any(DeleteObjectRequest.class))).thenThrow(s3Exception("AccessDenied"));

        assertFalse(gateway(PhotoHuntTestProperties.storage()).delete("submissions/a.jpg"));
        assertFalse(gateway(PhotoHuntTestProperties.storage()).delete(" "));
    }

    private S3BlobStoreGateway gateway(PhotoHuntProperties.Storage storage) {
        return new S3BlobStoreGateway(
                s3Client,
                s3Presigner,
                PhotoHuntTestProperties.properties(
                        storage,
                        PhotoHuntTestProperties.mockComparator(),
                        PhotoHuntTestProperties.media("media", "http://localhost:8080")
                )
        );
    }

    private static S3Exception s3Exception(String errorCode) {
        return (S3Exception) S3Exception.builder()
                .statusCode(403)
                .message(errorCode)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(errorCode).errorMessage(errorCode).build())
                .build();
    }

    private static byte[] readAll(RequestBody body) throws IOException {
        try (InputStream stream = body.contentStreamProvider().newStream()) {
            return stream.readAllBytes();
        }
    }
}
