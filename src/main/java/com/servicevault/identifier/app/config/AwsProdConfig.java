/**
 * AWS configuration package for the master identifier service.
 *
 * <p>Contains Spring configuration classes that provide AWS client beans for DynamoDB and S3.
 */
package com.servicevault.identifier.app.config;

import com.servicevault.identifier.app.repository.MasterIdentifierRepository;
import com.servicevault.identifier.app.repository.dynamodb.DynamoDbMasterIdentifierRepository;
import com.servicevault.identifier.app.service.DocumentLinkSigner;
import com.servicevault.identifier.app.service.S3DocumentLinkSigner;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * AWS configuration for the production profile. Credentials come from the default provider chain
 * (instance profile, task role or environment).
 *
 * <p>This configuration is active only when the {@code production} Spring profile is enabled.
 */
@Configuration
@Profile("production")
public class AwsProdConfig {

  /**
   * AWS region in which the clients will operate. Injected from the application configuration
   * property {@code aws.region}.
   */
  @Value("${aws.region}")
  private String region;

  @Value("${dynamodb.identifier-table}")
  private String identifierTable;

  @Value("${dynamodb.token-table}")
  private String tokenTable;

  @Value("${aws.s3.bucket}")
  private String bucket;

  @Value("${aws.s3.document-link-ttl-minutes:15}")
  private long linkTtlMinutes;

  /**
   * Creates an Amazon DynamoDB client using the default credentials provider.
   *
   * @return a configured {@link DynamoDbClient} for the specified AWS region.
   */
  @Bean
  public DynamoDbClient dynamoDbClient() {
    return DynamoDbClient.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean
  S3Presigner s3Presigner() {
    return S3Presigner.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean
  public MasterIdentifierRepository masterIdentifierRepository(DynamoDbClient ddb) {
    return new DynamoDbMasterIdentifierRepository(ddb, identifierTable, tokenTable);
  }

  @Bean
  public DocumentLinkSigner documentLinkSigner(S3Presigner presigner) {
    return new S3DocumentLinkSigner(presigner, bucket, Duration.ofMinutes(linkTtlMinutes));
  }
}
