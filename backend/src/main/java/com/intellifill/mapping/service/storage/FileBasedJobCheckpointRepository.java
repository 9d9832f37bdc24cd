package com.intellifill.mapping.service.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intellifill.mapping.config.MappingProperties;
import com.intellifill.mapping.exception.CheckpointStoreException;
import com.intellifill.mapping.service.pipeline.ProcessingState;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Checkpoint store on the local file system, one JSON file per job. Each write goes to a temporary
 * file first and is then moved over the previous checkpoint, so a crash never leaves a torn file.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "mapping.checkpoint", name = "store", havingValue = "file")
public class FileBasedJobCheckpointRepository implements IJobCheckpointRepository {

  private static final String SUFFIX = ".json";
  private static final String CANCEL_SUFFIX = ".cancel";

  private final ObjectMapper objectMapper;
  private final Path directory;

  @Autowired
  public FileBasedJobCheckpointRepository(
      ObjectMapper objectMapper, MappingProperties mappingProperties) {
    this(objectMapper, Paths.get(mappingProperties.getCheckpoint().getDirectory()));
  }

  public FileBasedJobCheckpointRepository(ObjectMapper objectMapper, Path directory) {
    this.objectMapper = objectMapper;
    this.directory = directory;
  }

  @PostConstruct
  public void init() {
    try {
      Files.createDirectories(directory);
      log.info("Storing job checkpoints under {}", directory.toAbsolutePath());
    } catch (IOException e) {
      throw new CheckpointStoreException("Cannot create checkpoint directory " + directory, e);
    }
  }

  @Override
  public void save(ProcessingState state) {
    Path target = fileFor(state.getJobId());
    Path temp = directory.resolve(state.getJobId() + SUFFIX + ".tmp");
    try {
      Files.createDirectories(directory);
      Files.write(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state));
      try {
        Files.move(
            temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Checkpointed job {} to {}", state.getJobId(), target);
    } catch (IOException e) {
      throw new CheckpointStoreException(
          "Failed to write checkpoint for job " + state.getJobId(), e);
    }
  }

  @Override
  public Optional<ProcessingState> findById(String jobId) {
    if (jobId == null) {
      return Optional.empty();
    }
    Path file = fileFor(jobId);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    return Optional.of(read(file));
  }

  @Override
  public List<ProcessingState> findAll() {
    List<ProcessingState> all = new ArrayList<>();
    if (!Files.isDirectory(directory)) {
      return all;
    }
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
      for (Path file : files) {
        all.add(read(file));
      }
    } catch (IOException e) {
      throw new CheckpointStoreException("Failed to list checkpoints in " + directory, e);
    }
    all.sort(Comparator.comparing(ProcessingState::getJobId));
    return all;
  }

  @Override
  public boolean deleteById(String jobId) {
    if (jobId == null) {
      return false;
    }
    try {
      Files.deleteIfExists(directory.resolve(jobId + CANCEL_SUFFIX));
      return Files.deleteIfExists(fileFor(jobId));
    } catch (IOException e) {
      throw new CheckpointStoreException("Failed to delete checkpoint for job " + jobId, e);
    }
  }

  @Override
  public void requestCancellation(String jobId) {
    Path marker = directory.resolve(jobId + CANCEL_SUFFIX);
    try {
      Files.createDirectories(directory);
      if (!Files.exists(marker)) {
        Files.createFile(marker);
      }
    } catch (FileAlreadyExistsException e) {
      log.debug("Cancellation of job {} already recorded", jobId);
    } catch (IOException e) {
      throw new CheckpointStoreException("Failed to record cancellation of job " + jobId, e);
    }
  }

  @Override
  public boolean isCancellationRequested(String jobId) {
    return jobId != null && Files.exists(directory.resolve(jobId + CANCEL_SUFFIX));
  }

  @Override
  public void clearCancellation(String jobId) {
    if (jobId == null) {
      return;
    }
    try {
      Files.deleteIfExists(directory.resolve(jobId + CANCEL_SUFFIX));
    } catch (IOException e) {
      throw new CheckpointStoreException("Failed to clear cancellation of job " + jobId, e);
    }
  }

  private ProcessingState read(Path file) {
    try {
      return objectMapper.readValue(file.toFile(), ProcessingState.class);
    } catch (IOException e) {
      throw new CheckpointStoreException("Failed to read checkpoint " + file, e);
    }
  }

  private Path fileFor(String jobId) {
    return directory.resolve(jobId + SUFFIX);
  }
}
