package org.iceforge.bucketvault.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process lock keyed by bucket name.
 *
 * <p>Single-JVM semantics only. Locks expire after a TTL so a request that dies
 * while holding one cannot block its bucket name forever.
 */
@Service
public class LocalBucketLockService implements BucketLockService {

    private static final Logger log = LoggerFactory.getLogger(LocalBucketLockService.class);

    private record Lock(String owner, Instant expiresAt) {}

    private final ConcurrentHashMap<String, Lock> locks = new ConcurrentHashMap<>();
    private final long ttlSeconds;
    private final Clock clock;

    @Autowired
    public LocalBucketLockService(@Value("${bucketvault.bucket-locks.ttl-seconds:300}") long ttlSeconds) {
        this(ttlSeconds, Clock.systemUTC());
    }

    LocalBucketLockService(long ttlSeconds, Clock clock) {
        this.ttlSeconds = Math.max(1, ttlSeconds);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public boolean tryAcquire(String bucketName, String owner) {
        Objects.requireNonNull(bucketName);
        Objects.requireNonNull(owner);
        Instant now = clock.instant();
        Instant exp = now.plusSeconds(ttlSeconds);

        for (int i = 0; i < 3; i++) {
            Lock existing = locks.get(bucketName);
            if (existing == null) {
                if (locks.putIfAbsent(bucketName, new Lock(owner, exp)) == null) return true;
                continue;
            }
            if (existing.expiresAt().isBefore(now)) {
                if (locks.replace(bucketName, existing, new Lock(owner, exp))) return true;
                continue;
            }
            break;
        }

        log.debug("Bucket lock contention for '{}'", bucketName);
        return false;
    }

    @Override
    public void release(String bucketName, String owner) {
        Lock existing = locks.get(bucketName);
        if (existing != null && existing.owner().equals(owner)) {
            locks.remove(bucketName, existing);
        }
    }
}
