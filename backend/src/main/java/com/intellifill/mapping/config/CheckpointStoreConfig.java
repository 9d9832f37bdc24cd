package com.intellifill.mapping.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/** S3 client for the {@code s3} checkpoint store, using the default AWS credential chain. */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "mapping.checkpoint", name = "store", havingValue = "s3")
public class CheckpointStoreConfig {

  @Bean(destroyMethod = "close")
  public S3Client checkpointS3Client(MappingProperties mappingProperties) {
    String region = mappingProperties.getCheckpoint().getRegion();
    log.info("Building S3 client for checkpoints in region {}", region);
    return S3Client.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }
}
