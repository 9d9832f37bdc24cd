package com.intellifill.mapping.service.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intellifill.mapping.config.MappingProperties;
import com.intellifill.mapping.exception.CheckpointStoreException;
import com.intellifill.mapping.service.pipeline.ProcessingState;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/** Checkpoint store on Amazon S3, one JSON object per job under the configured prefix. */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "mapping.checkpoint", name = "store", havingValue = "s3")
public class S3JobCheckpointRepository implements IJobCheckpointRepository {

  private final S3Client s3Client;
  private final ObjectMapper objectMapper;
  private final String bucketName;
  private final String prefix;

  public S3JobCheckpointRepository(
      S3Client s3Client, ObjectMapper objectMapper, MappingProperties mappingProperties) {
    this.s3Client = s3Client;
    this.objectMapper = objectMapper;
    this.bucketName = mappingProperties.getCheckpoint().getBucket();
    this.prefix = mappingProperties.getCheckpoint().getPrefix();
    if (bucketName == null || bucketName.isBlank()) {
      throw new IllegalStateException("mapping.checkpoint.bucket must be set for the s3 store");
    }
    log.info("Storing job checkpoints in s3://{}/{}", bucketName, prefix);
  }

  @Override
  public void save(ProcessingState state) {
    String key = keyFor(state.getJobId());
    try {
      String json = objectMapper.writeValueAsString(state);
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(bucketName)
              .key(key)
              .contentType("application/json")
              .build(),
          RequestBody.fromString(json, StandardCharsets.UTF_8));
      log.debug("Checkpointed job {} to S3 key '{}'", state.getJobId(), key);
    } catch (IOException | SdkException e) {
      throw new CheckpointStoreException(
          "Failed to write checkpoint for job " + state.getJobId(), e);
    }
  }

  @Override
  public Optional<ProcessingState> findById(String jobId) {
    if (jobId == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(read(keyFor(jobId)));
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    }
  }

  @Override
  public List<ProcessingState> findAll() {
    List<ProcessingState> all = new ArrayList<>();
    String continuationToken = null;
    try {
      do {
        ListObjectsV2Response response =
            s3Client.listObjectsV2(
                ListObjectsV2Request.builder()
                    .bucket(bucketName)
                    .prefix(prefix)
                    .continuationToken(continuationToken)
                    .build());
        for (S3Object object : response.contents()) {
          if (object.key().endsWith(".json")) {
            all.add(read(object.key()));
          }
        }
        continuationToken =
            Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
      } while (continuationToken != null);
    } catch (SdkException e) {
      throw new CheckpointStoreException("Failed to list checkpoints in bucket " + bucketName, e);
    }
    all.sort(Comparator.comparing(ProcessingState::getJobId));
    return all;
  }

  @Override
  public boolean deleteById(String jobId) {
    if (jobId == null || findById(jobId).isEmpty()) {
      return false;
    }
    try {
      s3Client.deleteObject(
          DeleteObjectRequest.builder().bucket(bucketName).key(keyFor(jobId)).build());
      clearCancellation(jobId);
      return true;
    } catch (SdkException e) {
      throw new CheckpointStoreException("Failed to delete checkpoint for job " + jobId, e);
    }
  }

  @Override
  public void requestCancellation(String jobId) {
    try {
      s3Client.putObject(
          PutObjectRequest.builder().bucket(bucketName).key(cancelKeyFor(jobId)).build(),
          RequestBody.empty());
    } catch (SdkException e) {
      throw new CheckpointStoreException("Failed to record cancellation of job " + jobId, e);
    }
  }

  @Override
  public boolean isCancellationRequested(String jobId) {
    if (jobId == null) {
      return false;
    }
    try {
      s3Client.headObject(
          HeadObjectRequest.builder().bucket(bucketName).key(cancelKeyFor(jobId)).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      throw new CheckpointStoreException("Failed to check cancellation of job " + jobId, e);
    } catch (SdkException e) {
      throw new CheckpointStoreException("Failed to check cancellation of job " + jobId, e);
    }
  }

  @Override
  public void clearCancellation(String jobId) {
    if (jobId == null) {
      return;
    }
    try {
      s3Client.deleteObject(
          DeleteObjectRequest.builder().bucket(bucketName).key(cancelKeyFor(jobId)).build());
    } catch (SdkException e) {
      throw new CheckpointStoreException("Failed to clear cancellation of job " + jobId, e);
    }
  }

  private ProcessingState read(String key) {
    try {
      byte[] data =
          s3Client
              .getObjectAsBytes(GetObjectRequest.builder().bucket(bucketName).key(key).build())
              .asByteArray();
      return objectMapper.readValue(data, ProcessingState.class);
    } catch (NoSuchKeyException e) {
      throw e;
    } catch (IOException | SdkException e) {
      throw new CheckpointStoreException("Failed to read checkpoint '" + key + "'", e);
    }
  }

  private String keyFor(String jobId) {
    return prefix + jobId + ".json";
  }

  private String cancelKeyFor(String jobId) {
    return prefix + jobId + ".cancel";
  }
}
