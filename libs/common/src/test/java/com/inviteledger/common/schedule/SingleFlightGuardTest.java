package com.inviteledger.common.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SingleFlightGuardTest {

  private final SingleFlightGuard guard = new SingleFlightGuard();

  @Test
  void returnsTaskResultWhenIdle() {
    assertThat(guard.tryRun("sync", () -> 42)).contains(42);
    assertThat(guard.isRunning("sync")).isFalse();
  }

  @Test
  void skipsOverlappingRunOfSameTask() throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<Optional<String>> first =
          executor.submit(
              () ->
                  guard.tryRun(
                      "expiry",
                      () -> {
                        started.countDown();
                        await(release);
                        return "first";
                      }));
      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

      assertThat(guard.isRunning("expiry")).isTrue();
      assertThat(guard.tryRun("expiry", () -> "second")).isEmpty();
      // other task names are independent
      assertThat(guard.tryRun("sync", () -> "other")).contains("other");

      release.countDown();
      assertThat(first.get(5, TimeUnit.SECONDS)).contains("first");
    } finally {
      executor.shutdownNow();
    }
    assertThat(guard.tryRun("expiry", () -> "third")).contains("third");
  }

  @Test
  void releasesFlagWhenTaskThrows() {
    assertThatThrownBy(
            () ->
                guard.tryRun(
                    "sync",
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(guard.isRunning("sync")).isFalse();
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(ex);
    }
  }
}
