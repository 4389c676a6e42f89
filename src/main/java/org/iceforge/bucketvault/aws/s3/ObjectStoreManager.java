package org.iceforge.bucketvault.aws.s3;

import java.util.List;

public interface ObjectStoreManager {

    /**
     * Create a bucket in the configured region.
     * A bucket we already own counts as created.
     *
     * @return false on any provider failure (the cause is logged, not returned)
     */
    boolean createBucket(String bucketName);

    // Single unpaginated call
    List<S3Models.BucketDescriptor> listBuckets();

    /**
     * Delete live objects, then versions, then delete markers. Provider errors propagate as-is.
     */
    S3Models.EmptyResult emptyBucket(String bucketName);

    /**
     * Empty the bucket, then delete it.
     *
     * @throws BucketDeletionException on any failure in either phase
     */
    void deleteBucket(String bucketName);
}
