package org.iceforge.bucketvault;

import org.iceforge.bucketvault.aws.BucketVaultAwsProperties;
import org.iceforge.bucketvault.vault.VaultProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({BucketVaultAwsProperties.class, VaultProperties.class})
public class BucketVaultApplication {

	public static void main(String[] args) {
		SpringApplication.run(BucketVaultApplication.class, args);
	}
}
