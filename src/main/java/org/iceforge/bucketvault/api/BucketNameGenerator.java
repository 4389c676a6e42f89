package org.iceforge.bucketvault.api;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Suggests bucket names of the form {@code my-app-s3-kv2-<yyyyMMddHHmmss>-<6 chars>}.
 * Output is lowercase with no underscores, as S3 naming rules require.
 */
@Component
public class BucketNameGenerator {

    static final String PREFIX = "my-app-s3-kv2-";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 6;

    private final Clock clock;
    private final Random random;

    public BucketNameGenerator() {
        this(Clock.systemDefaultZone(), new SecureRandom());
    }

    BucketNameGenerator(Clock clock, Random random) {
        this.clock = Objects.requireNonNull(clock);
        this.random = Objects.requireNonNull(random);
    }

    public String suggest() {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return (PREFIX + timestamp + "-" + suffix).toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
