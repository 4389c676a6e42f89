package org.iceforge.bucketvault.aws.s3;

import org.iceforge.bucketvault.aws.BucketVaultAwsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AwsSdkObjectStoreManagerTest {

    @Mock
    private S3Client s3Client;

    private AwsSdkObjectStoreManager manager;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        manager = new AwsSdkObjectStoreManager(s3Client, new BucketVaultAwsProperties("us-east-1", null));
    }

    /* ---------- createBucket ---------- */

    @Test
    void createBucketInDefaultRegionSendsNoLocationConstraint() {
        when(s3Client.createBucket(any(CreateBucketRequest.class))).thenReturn(CreateBucketResponse.builder().build());

        assertTrue(manager.createBucket("my-bucket"));

        ArgumentCaptor<CreateBucketRequest> captor = ArgumentCaptor.forClass(CreateBucketRequest.class);
        verify(s3Client).createBucket(captor.capture());
        assertEquals("my-bucket", captor.getValue().bucket());
        assertNull(captor.getValue().createBucketConfiguration());
    }

    @Test
    void createBucketInOtherRegionSendsMatchingLocationConstraint() {
        AwsSdkObjectStoreManager euManager =
                new AwsSdkObjectStoreManager(s3Client, new BucketVaultAwsProperties("eu-west-1", null));
        when(s3Client.createBucket(any(CreateBucketRequest.class))).thenReturn(CreateBucketResponse.builder().build());

        assertTrue(euManager.createBucket("my-bucket"));

        ArgumentCaptor<CreateBucketRequest> captor = ArgumentCaptor.forClass(CreateBucketRequest.class);
        verify(s3Client).createBucket(captor.capture());
        assertNotNull(captor.getValue().createBucketConfiguration());
        assertEquals("eu-west-1", captor.getValue().createBucketConfiguration().locationConstraintAsString());
    }

    @Test
    void repeatedCreateOfOwnedBucketSucceedsBothTimes() {
        when(s3Client.createBucket(any(CreateBucketRequest.class)))
                .thenReturn(CreateBucketResponse.builder().build())
                .thenThrow(s3Error("BucketAlreadyOwnedByYou", 409));

        assertTrue(manager.createBucket("my-bucket"));
        assertTrue(manager.createBucket("my-bucket"));
        verify(s3Client, times(2)).createBucket(any(CreateBucketRequest.class));
    }

    @Test
    void createBucketReturnsFalseForProviderRejections() {
        for (String code : List.of("BucketAlreadyExists", "AccessDenied", "InvalidAccessKeyId",
                "SignatureDoesNotMatch", "InvalidBucketName")) {
            reset(s3Client);
            when(s3Client.createBucket(any(CreateBucketRequest.class))).thenThrow(s3Error(code, 400));

            assertFalse(manager.createBucket("taken-bucket"), code);
        }
    }

    @Test
    void createBucketReturnsFalseOnClientFailure() {
        when(s3Client.createBucket(any(CreateBucketRequest.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        assertFalse(manager.createBucket("my-bucket"));
    }

    /* ---------- listBuckets ---------- */

    @Test
    void listBucketsMapsNamesAndIsoCreationDates() {
        when(s3Client.listBuckets()).thenReturn(ListBucketsResponse.builder()
                .buckets(
                        Bucket.builder().name("alpha").creationDate(Instant.parse("2024-01-02T03:04:05Z")).build(),
                        Bucket.builder().name("beta").build())
                .build());

        List<S3Models.BucketDescriptor> buckets = manager.listBuckets();

        assertEquals(2, buckets.size());
        assertEquals(new S3Models.BucketDescriptor("alpha", "2024-01-02T03:04:05Z"), buckets.get(0));
        assertEquals(new S3Models.BucketDescriptor("beta", null), buckets.get(1));
    }

    @Test
    void listBucketsPropagatesProviderErrors() {
        S3Exception error = s3Error("AccessDenied", 403);
        when(s3Client.listBuckets()).thenThrow(error);

        assertSame(error, assertThrows(S3Exception.class, () -> manager.listBuckets()));
    }

    /* ---------- emptyBucket / deleteBucket ---------- */

    @Test
    void deleteBucketIssuesOneBatchPerKindSizedToContentsBeforeDeleting() {
        stubContents("b",
                List.of("k1", "k2"),
                List.of(version("k1", "v1"), version("k1", "v2"), version("k3", "v3")),
                List.of(marker("k4", "m1")));

        manager.deleteBucket("b");

        ArgumentCaptor<DeleteObjectsRequest> batches = ArgumentCaptor.forClass(DeleteObjectsRequest.class);
        InOrder order = inOrder(s3Client);
        order.verify(s3Client).listObjectsV2(any(ListObjectsV2Request.class));
        order.verify(s3Client).deleteObjects(any(DeleteObjectsRequest.class));
        order.verify(s3Client).listObjectVersions(any(ListObjectVersionsRequest.class));
        order.verify(s3Client, times(2)).deleteObjects(any(DeleteObjectsRequest.class));
        order.verify(s3Client).deleteBucket(any(DeleteBucketRequest.class));

        verify(s3Client, times(3)).deleteObjects(batches.capture());
        List<DeleteObjectsRequest> sent = batches.getAllValues();
        assertEquals(2, sent.get(0).delete().objects().size());
        assertEquals(3, sent.get(1).delete().objects().size());
        assertEquals(1, sent.get(2).delete().objects().size());

        assertNull(sent.get(0).delete().objects().get(0).versionId());
        assertEquals("v2", sent.get(1).delete().objects().get(1).versionId());
        assertEquals("m1", sent.get(2).delete().objects().get(0).versionId());
    }

    @Test
    void emptyBucketSkipsBatchesForEmptyKinds() {
        stubContents("b", List.of("only"), List.of(), List.of());

        S3Models.EmptyResult result = manager.emptyBucket("b");

        assertEquals(new S3Models.EmptyResult(1, 0, 0), result);
        verify(s3Client, times(1)).deleteObjects(any(DeleteObjectsRequest.class));
    }

    @Test
    void deleteOfEmptyBucketGoesStraightToDeleteCall() {
        stubContents("b", List.of(), List.of(), List.of());

        manager.deleteBucket("b");

        verify(s3Client, never()).deleteObjects(any(DeleteObjectsRequest.class));
        verify(s3Client).deleteBucket(any(DeleteBucketRequest.class));
    }

    @Test
    void emptyBucketPropagatesProviderErrorUnchanged() {
        S3Exception error = s3Error("AccessDenied", 403);
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenThrow(error);

        assertSame(error, assertThrows(S3Exception.class, () -> manager.emptyBucket("b")));
    }

    @Test
    void deleteMissingBucketYieldsNotFoundWithoutDeleteCall() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenThrow(s3Error("NoSuchBucket", 404));

        BucketDeletionException ex = assertThrows(BucketDeletionException.class, () -> manager.deleteBucket("gone"));

        assertEquals(BucketDeletionException.Kind.NOT_FOUND, ex.kind());
        assertEquals(BucketDeletionException.Phase.EMPTYING, ex.failedIn());
        verify(s3Client, never()).deleteBucket(any(DeleteBucketRequest.class));
    }

    @Test
    void deleteWithoutPermissionYieldsForbidden() {
        stubContents("b", List.of(), List.of(), List.of());
        when(s3Client.deleteBucket(any(DeleteBucketRequest.class))).thenThrow(s3Error("AccessDenied", 403));

        BucketDeletionException ex = assertThrows(BucketDeletionException.class, () -> manager.deleteBucket("b"));

        assertEquals(BucketDeletionException.Kind.FORBIDDEN, ex.kind());
        assertEquals(BucketDeletionException.Phase.DELETING, ex.failedIn());
    }

    @Test
    void residualContentAfterEmptyingYieldsConflict() {
        stubContents("b", List.of("k1"), List.of(), List.of());
        when(s3Client.deleteBucket(any(DeleteBucketRequest.class))).thenThrow(s3Error("BucketNotEmpty", 409));

        BucketDeletionException ex = assertThrows(BucketDeletionException.class, () -> manager.deleteBucket("b"));

        assertEquals(BucketDeletionException.Kind.CONFLICT, ex.kind());
        assertEquals("BucketNotEmpty", ex.providerCode());
        verify(s3Client, times(1)).deleteBucket(any(DeleteBucketRequest.class));
    }

    @Test
    void perKeyDeleteErrorsAreLoggedAndDeleteReportsResidue() {
        stubContents("b", List.of("locked", "free"), List.of(), List.of());
        when(s3Client.deleteObjects(any(DeleteObjectsRequest.class))).thenReturn(DeleteObjectsResponse.builder()
                .deleted(DeletedObject.builder().key("free").build())
                .errors(S3Error.builder().key("locked").code("AccessDenied").message("Access Denied").build())
                .build());
        when(s3Client.deleteBucket(any(DeleteBucketRequest.class))).thenThrow(s3Error("BucketNotEmpty", 409));

        assertDoesNotThrow(() -> manager.emptyBucket("b"));

        BucketDeletionException ex = assertThrows(BucketDeletionException.class, () -> manager.deleteBucket("b"));

        assertEquals(BucketDeletionException.Kind.CONFLICT, ex.kind());
        assertEquals(BucketDeletionException.Phase.DELETING, ex.failedIn());
        assertEquals("BucketNotEmpty", ex.providerCode());
        verify(s3Client, times(1)).deleteBucket(any(DeleteBucketRequest.class));
    }

    @Test
    void unknownProviderCodeYieldsInternalWithCodeAndMessage() {
        stubContents("b", List.of(), List.of(), List.of());
        when(s3Client.deleteBucket(any(DeleteBucketRequest.class))).thenThrow(s3Error("OperationAborted", 409));

        BucketDeletionException ex = assertThrows(BucketDeletionException.class, () -> manager.deleteBucket("b"));

        assertEquals(BucketDeletionException.Kind.INTERNAL, ex.kind());
        assertTrue(ex.getMessage().contains("Code=OperationAborted"));
        assertTrue(ex.getMessage().contains("OperationAborted message"));
    }

    @Test
    void nonProviderFailureYieldsInternal() {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenThrow(SdkClientException.create("connection reset"));

        BucketDeletionException ex = assertThrows(BucketDeletionException.class, () -> manager.deleteBucket("b"));

        assertEquals(BucketDeletionException.Kind.INTERNAL, ex.kind());
        assertNull(ex.providerCode());
        assertTrue(ex.getMessage().contains("connection reset"));
    }

    private void stubContents(String bucket, List<String> keys, List<ObjectVersion> versions, List<DeleteMarkerEntry> markers) {
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                .name(bucket)
                .contents(keys.stream().map(k -> S3Object.builder().key(k).build()).toList())
                .build());
        when(s3Client.listObjectVersions(any(ListObjectVersionsRequest.class))).thenReturn(ListObjectVersionsResponse.builder()
                .name(bucket)
                .versions(versions)
                .deleteMarkers(markers)
                .build());
        when(s3Client.deleteObjects(any(DeleteObjectsRequest.class))).thenReturn(DeleteObjectsResponse.builder().build());
    }

    private static ObjectVersion version(String key, String versionId) {
        return ObjectVersion.builder().key(key).versionId(versionId).build();
    }

    private static DeleteMarkerEntry marker(String key, String versionId) {
        return DeleteMarkerEntry.builder().key(key).versionId(versionId).build();
    }

    private static S3Exception s3Error(String code, int status) {
        return (S3Exception) S3Exception.builder()
                .statusCode(status)
                .awsErrorDetails(AwsErrorDetails.builder()
                        .errorCode(code)
                        .errorMessage(code + " message")
                        .build())
                .message(code + " message")
                .build();
    }
}
