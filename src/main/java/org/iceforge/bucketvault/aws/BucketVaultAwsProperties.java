package org.iceforge.bucketvault.aws;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bucketvault.aws")
public record BucketVaultAwsProperties(
        String region,
        S3Properties s3
) {
    public static final String DEFAULT_REGION = "us-east-1";

    public BucketVaultAwsProperties {
        if (region == null || region.isBlank()) region = DEFAULT_REGION;
        if (s3 == null) s3 = new S3Properties(null, false);
    }

    public record S3Properties(
            String endpoint,
            boolean pathStyleAccess
    ) {}
}
