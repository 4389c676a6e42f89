package org.iceforge.bucketvault.api;

import org.iceforge.bucketvault.aws.BucketVaultAwsProperties;
import org.iceforge.bucketvault.aws.s3.ObjectStoreManager;
import org.iceforge.bucketvault.lock.BucketLockService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

@RestController
public class BucketController {
    private static final Logger logger = LoggerFactory.getLogger(BucketController.class);

    private final ObjectStoreManager objectStore;
    private final BucketNameGenerator nameGenerator;
    private final BucketLockService locks;
    private final String region;

    public BucketController(ObjectStoreManager objectStore,
                            BucketNameGenerator nameGenerator,
                            BucketLockService locks,
                            BucketVaultAwsProperties awsProps) {
        this.objectStore = Objects.requireNonNull(objectStore);
        this.nameGenerator = Objects.requireNonNull(nameGenerator);
        this.locks = Objects.requireNonNull(locks);
        this.region = awsProps.region();
    }

    @GetMapping("/")
    public BucketApiModels.MessageResponse root() {
        logger.info("Accessed root endpoint");
        return new BucketApiModels.MessageResponse(
                "Welcome to Bucket Vault. Manage S3 buckets with credentials read from Vault.");
    }

    @GetMapping("/generate-unique-bucket-name")
    public BucketApiModels.BucketNameSuggestion generateUniqueBucketName() {
        String suggested = nameGenerator.suggest();
        logger.info("Generated unique bucket name suggestion: {}", suggested);
        return new BucketApiModels.BucketNameSuggestion(suggested);
    }

    @PostMapping("/create-s3-bucket")
    public BucketApiModels.MessageResponse createBucket(@RequestBody BucketApiModels.CreateBucketRequest req) {
        String bucketName = req == null ? null : req.bucketName();
        if (bucketName == null || bucketName.isBlank()) throw BucketApiException.invalidBucketName();

        logger.info("Received request to create S3 bucket '{}'", bucketName);
        return withBucketLock(bucketName, () -> {
            if (!objectStore.createBucket(bucketName)) {
                throw BucketApiException.creationFailed(bucketName);
            }
            return new BucketApiModels.MessageResponse(
                    "Bucket '" + bucketName + "' creation initiated successfully in region '" + region + "'.");
        });
    }

    @GetMapping("/list-s3-buckets")
    public BucketApiModels.BucketListResponse listBuckets() {
        logger.info("Attempting to list S3 buckets");
        return new BucketApiModels.BucketListResponse(objectStore.listBuckets());
    }

    @DeleteMapping("/delete-s3-bucket/{bucket_name}")
    public BucketApiModels.MessageResponse deleteBucket(@PathVariable("bucket_name") String bucketName) {
        logger.info("Received request to delete S3 bucket '{}'", bucketName);
        return withBucketLock(bucketName, () -> {
            objectStore.deleteBucket(bucketName);
            return new BucketApiModels.MessageResponse("S3 bucket '" + bucketName + "' deleted successfully.");
        });
    }

    private <T> T withBucketLock(String bucketName, Supplier<T> action) {
        String owner = UUID.randomUUID().toString();
        if (!locks.tryAcquire(bucketName, owner)) {
            logger.warn("Rejected request for bucket '{}': another operation is in progress", bucketName);
            throw BucketApiException.busy(bucketName);
        }
        try {
            return action.get();
        } finally {
            locks.release(bucketName, owner);
        }
    }
}
