package org.iceforge.bucketvault.aws.s3;

import org.iceforge.bucketvault.aws.BucketVaultAwsProperties;
import org.iceforge.bucketvault.vault.AwsCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * Builds the single S3 client from the credentials read out of Vault at startup.
 */
@Configuration
public class S3ClientConfig {
    private static final Logger logger = LoggerFactory.getLogger(S3ClientConfig.class);

    @Bean(destroyMethod = "close")
    public S3Client s3Client(BucketVaultAwsProperties props, AwsCredentials credentials) {
        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(credentialsProvider(credentials))
                .region(Region.of(props.region()))
                .serviceConfiguration(
                        S3Configuration.builder()
                                .pathStyleAccessEnabled(props.s3().pathStyleAccess())
                                .build()
                );

        if (props.s3().endpoint() != null && !props.s3().endpoint().isBlank()) {
            b = b.endpointOverride(URI.create(props.s3().endpoint()));
        }

        return b.build();
    }

    static AwsCredentialsProvider credentialsProvider(AwsCredentials credentials) {
        if (credentials.sessionToken() != null) {
            logger.info("Initializing S3 client with temporary STS credentials");
            return StaticCredentialsProvider.create(AwsSessionCredentials.create(
                    credentials.accessKey(), credentials.secretAccessKey(), credentials.sessionToken()));
        }
        logger.info("Initializing S3 client with static AWS credentials");
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(
                credentials.accessKey(), credentials.secretAccessKey()));
    }
}
