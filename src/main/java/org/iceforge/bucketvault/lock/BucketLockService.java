package org.iceforge.bucketvault.lock;

/**
 * Serializes create/delete requests that target the same bucket name.
 */
public interface BucketLockService {

    /** Non-blocking. Returns false if another owner holds an unexpired lock on the name. */
    boolean tryAcquire(String bucketName, String owner);

    /** Releases the lock only if {@code owner} still holds it. */
    void release(String bucketName, String owner);
}
