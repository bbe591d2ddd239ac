package com.flamingo.ai.mano.service.task;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Runs mining jobs off the request path. A job that fails or is rejected by the bounded pool is
 * logged and counted; the caller never sees the failure.
 */
@Component
@Slf4j
public class BackgroundTaskDispatcher {

  private final TaskExecutor backgroundExecutor;
  private final MeterRegistry meterRegistry;

  public BackgroundTaskDispatcher(
      @Qualifier("backgroundExecutor") TaskExecutor backgroundExecutor,
      MeterRegistry meterRegistry) {
    this.backgroundExecutor = backgroundExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Submits a job.
   *
   * @param taskName name used in logs and metrics
   * @param task the job
   * @return false when the pool rejected the job
   */
  public boolean submit(String taskName, Runnable task) {
    try {
      backgroundExecutor.execute(() -> run(taskName, task));
      return true;
    } catch (TaskRejectedException e) {
      log.warn("Background task '{}' rejected: {}", taskName, e.getMessage());
      record(taskName, "rejected");
      return false;
    }
  }

  private void run(String taskName, Runnable task) {
    try {
      task.run();
      record(taskName, "success");
    } catch (RuntimeException e) {
      log.error("Background task '{}' failed", taskName, e);
      record(taskName, "failure");
    }
  }

  private void record(String taskName, String outcome) {
    meterRegistry.counter("background.tasks", "task", taskName, "outcome", outcome).increment();
  }
}
