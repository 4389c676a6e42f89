package org.iceforge.bucketvault.aws.s3;

import org.iceforge.bucketvault.aws.BucketVaultAwsProperties;
import org.iceforge.bucketvault.aws.s3.BucketDeletionException.Kind;
import org.iceforge.bucketvault.aws.s3.BucketDeletionException.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
public class AwsSdkObjectStoreManager implements ObjectStoreManager {
    private static final Logger logger = LoggerFactory.getLogger(AwsSdkObjectStoreManager.class);

    private final S3Client s3;
    private final String region;

    public AwsSdkObjectStoreManager(S3Client s3, BucketVaultAwsProperties props) {
        this.s3 = Objects.requireNonNull(s3);
        this.region = props.region();
    }

    public String region() {
        return region;
    }

    @Override
    public boolean createBucket(String bucketName) {
        logger.info("Attempting to create S3 bucket '{}' in region '{}'", bucketName, region);

        CreateBucketRequest.Builder req = CreateBucketRequest.builder().bucket(bucketName);
        // us-east-1 rejects an explicit LocationConstraint; every other region requires one
        if (!BucketVaultAwsProperties.DEFAULT_REGION.equals(region)) {
            req = req.createBucketConfiguration(CreateBucketConfiguration.builder()
                    .locationConstraint(region)
                    .build());
        }

        try {
            s3.createBucket(req.build());
            logger.info("S3 bucket '{}' created successfully", bucketName);
            return true;
        } catch (S3Exception e) {
            String code = errorCode(e);
            logger.error("Failed to create S3 bucket '{}'. S3 error: Code={}, Message={}",
                    bucketName, code, errorMessage(e), e);
            switch (code) {
                case "BucketAlreadyOwnedByYou":
                    logger.warn("Bucket '{}' already exists and is owned by you. Considering it successful.", bucketName);
                    return true;
                case "BucketAlreadyExists":
                    logger.error("Bucket '{}' already exists and is owned by another account. Cannot create.", bucketName);
                    return false;
                case "AccessDenied":
                    logger.error("Access denied: the AWS credentials may not create buckets in '{}'", region);
                    return false;
                case "InvalidAccessKeyId":
                case "SignatureDoesNotMatch":
                    logger.error("Invalid AWS credentials. Check the credentials stored in Vault.");
                    return false;
                default:
                    return false;
            }
        } catch (Exception e) {
            logger.error("Unexpected error while creating S3 bucket '{}'", bucketName, e);
            return false;
        }
    }

    @Override
    public List<S3Models.BucketDescriptor> listBuckets() {
        logger.info("Attempting to list S3 buckets");
        ListBucketsResponse r = s3.listBuckets();

        List<S3Models.BucketDescriptor> out = new ArrayList<>();
        for (Bucket b : r.buckets()) {
            out.add(new S3Models.BucketDescriptor(
                    b.name(),
                    b.creationDate() == null ? null : b.creationDate().toString()
            ));
        }
        logger.info("Successfully listed {} S3 buckets", out.size());
        return out;
    }

    @Override
    public S3Models.EmptyResult emptyBucket(String bucketName) {
        logger.info("Attempting to empty S3 bucket '{}'", bucketName);
        try {
            ListObjectsV2Response objects = s3.listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(bucketName)
                    .build());
            List<S3Models.ObjectKey> keys = objects.contents().stream()
                    .map(o -> new S3Models.ObjectKey(o.key()))
                    .toList();
            if (!keys.isEmpty()) {
                deleteBatch(bucketName, keys.stream()
                        .map(k -> ObjectIdentifier.builder().key(k.key()).build())
                        .toList());
                logger.info("Deleted {} objects from '{}'", keys.size(), bucketName);
            }

            ListObjectVersionsResponse history = s3.listObjectVersions(ListObjectVersionsRequest.builder()
                    .bucket(bucketName)
                    .build());

            List<S3Models.ObjectVersionKey> versions = history.versions().stream()
                    .map(v -> new S3Models.ObjectVersionKey(v.key(), v.versionId()))
                    .toList();
            if (!versions.isEmpty()) {
                deleteBatch(bucketName, toIdentifiers(versions));
                logger.info("Deleted {} versions from '{}'", versions.size(), bucketName);
            }

            List<S3Models.ObjectVersionKey> markers = history.deleteMarkers().stream()
                    .map(m -> new S3Models.ObjectVersionKey(m.key(), m.versionId()))
                    .toList();
            if (!markers.isEmpty()) {
                deleteBatch(bucketName, toIdentifiers(markers));
                logger.info("Deleted {} delete markers from '{}'", markers.size(), bucketName);
            }

            logger.info("S3 bucket '{}' successfully emptied", bucketName);
            return new S3Models.EmptyResult(keys.size(), versions.size(), markers.size());
        } catch (S3Exception e) {
            logger.error("S3 error while emptying bucket '{}': Code={}, Message={}",
                    bucketName, errorCode(e), errorMessage(e));
            throw e;
        }
    }

    @Override
    public void deleteBucket(String bucketName) {
        logger.info("Attempting to delete S3 bucket '{}'", bucketName);

        Phase phase = Phase.REQUESTED;
        try {
            phase = Phase.EMPTYING;
            S3Models.EmptyResult emptied = emptyBucket(bucketName);
            phase = Phase.EMPTIED;
            logger.debug("Bucket '{}' emptied: {}", bucketName, emptied);

            phase = Phase.DELETING;
            s3.deleteBucket(DeleteBucketRequest.builder().bucket(bucketName).build());
            phase = Phase.DELETED;
            logger.info("S3 bucket '{}' successfully deleted", bucketName);
        } catch (S3Exception e) {
            String code = errorCode(e);
            String message = errorMessage(e);
            logger.error("S3 error during deletion of bucket '{}' in phase {}: Code={}, Message={}",
                    bucketName, phase, code, message);
            throw switch (code) {
                case "NoSuchBucket" -> new BucketDeletionException(Kind.NOT_FOUND, phase, code,
                        "Bucket '" + bucketName + "' not found.", e);
                case "AccessDenied" -> new BucketDeletionException(Kind.FORBIDDEN, phase, code,
                        "Access denied to delete bucket '" + bucketName + "'. Check AWS permissions.", e);
                case "BucketNotEmpty" -> new BucketDeletionException(Kind.CONFLICT, phase, code,
                        "Bucket '" + bucketName + "' is not empty after emptying attempt. Manual verification needed.", e);
                default -> new BucketDeletionException(Kind.INTERNAL, phase, code,
                        "S3 error during deletion: Code=" + code + ", Message=" + message, e);
            };
        } catch (Exception e) {
            logger.error("Unexpected error during deletion of bucket '{}' in phase {}", bucketName, phase, e);
            throw new BucketDeletionException(Kind.INTERNAL, phase, null,
                    "An unexpected error occurred: " + e.getMessage(), e);
        }
    }

    private void deleteBatch(String bucketName, List<ObjectIdentifier> ids) {
        DeleteObjectsResponse resp = s3.deleteObjects(DeleteObjectsRequest.builder()
                .bucket(bucketName)
                .delete(Delete.builder().objects(ids).build())
                .build());
        if (resp != null && resp.hasErrors() && !resp.errors().isEmpty()) {
            for (S3Error err : resp.errors()) {
                logger.warn("Could not delete s3://{}/{} (version {}): Code={}, Message={}",
                        bucketName, err.key(), err.versionId(), err.code(), err.message());
            }
        }
    }

    private static List<ObjectIdentifier> toIdentifiers(List<S3Models.ObjectVersionKey> keys) {
        return keys.stream()
                .map(k -> ObjectIdentifier.builder().key(k.key()).versionId(k.versionId()).build())
                .toList();
    }

    static String errorCode(S3Exception e) {
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorCode() != null) {
            return e.awsErrorDetails().errorCode();
        }
        if (e instanceof NoSuchBucketException) return "NoSuchBucket";
        return "";
    }

    private static String errorMessage(S3Exception e) {
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null) {
            return e.awsErrorDetails().errorMessage();
        }
        return e.getMessage();
    }
}
