package com.flamingo.ai.mano.service.task;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

class BackgroundTaskDispatcherTest {

  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
  }

  private double count(String task, String outcome) {
    return meterRegistry.counter("background.tasks", "task", task, "outcome", outcome).count();
  }

  @Test
  @DisplayName("should run the job and count a success")
  void shouldRunJob() {
    BackgroundTaskDispatcher dispatcher =
        new BackgroundTaskDispatcher(new SyncTaskExecutor(), meterRegistry);
    AtomicBoolean ran = new AtomicBoolean();

    boolean accepted = dispatcher.submit("pattern-learning", () -> ran.set(true));

    assertThat(accepted).isTrue();
    assertThat(ran).isTrue();
    assertThat(count("pattern-learning", "success")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should contain a failing job and count it")
  void shouldContainFailure() {
    BackgroundTaskDispatcher dispatcher =
        new BackgroundTaskDispatcher(new SyncTaskExecutor(), meterRegistry);

    boolean accepted =
        dispatcher.submit(
            "embedding-backfill",
            () -> {
              throw new IllegalStateException("index down");
            });

    assertThat(accepted).isTrue();
    assertThat(count("embedding-backfill", "failure")).isEqualTo(1.0);
    assertThat(count("embedding-backfill", "success")).isZero();
  }

  @Test
  @DisplayName("should report false when the pool rejects the job")
  void shouldReportRejection() {
    BackgroundTaskDispatcher dispatcher =
        new BackgroundTaskDispatcher(
            task -> {
              throw new TaskRejectedException("queue full");
            },
            meterRegistry);
    AtomicBoolean ran = new AtomicBoolean();

    boolean accepted = dispatcher.submit("pattern-learning", () -> ran.set(true));

    assertThat(accepted).isFalse();
    assertThat(ran).isFalse();
    assertThat(count("pattern-learning", "rejected")).isEqualTo(1.0);
  }
}
