package com.intellifill.mapping.config;

import java.time.Clock;
import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intellifill.mapping.exception.CheckpointStoreException;

@Configuration
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Executor mappingJobExecutor(MappingProperties mappingProperties) {
    MappingProperties.Pipeline pipeline = mappingProperties.getPipeline();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pipeline.getCorePoolSize());
    executor.setMaxPoolSize(pipeline.getMaxPoolSize());
    executor.setQueueCapacity(pipeline.getQueueCapacity());
    executor.setThreadNamePrefix("mapping-job-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  /** Retries whole job runs when the checkpoint store fails; stage logic never sees these. */
  @Bean
  public RetryTemplate checkpointRetryTemplate(
      MappingProperties mappingProperties, RetryListener checkpointRetryListener) {
    MappingProperties.Retry retry = mappingProperties.getRetry();
    return RetryTemplate.builder()
        .maxAttempts(retry.getMaxAttempts())
        .exponentialBackoff(
            retry.getInitialIntervalMs(), retry.getMultiplier(), retry.getMaxIntervalMs())
        .retryOn(CheckpointStoreException.class)
        .withListener(checkpointRetryListener)
        .build();
  }
}
