package com.inviteledger.reconciler.remote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.inviteledger.reconciler.config.RemoteCallProperties;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RemoteCallExecutorTest {

  private ExecutorService executorService;
  private RemoteCallExecutor executor;

  @BeforeEach
  void setUp() {
    executorService = Executors.newFixedThreadPool(2);
    executor = new RemoteCallExecutor(executorService, new RemoteCallProperties(Duration.ofMillis(200), 2));
  }

  @AfterEach
  void tearDown() {
    executorService.shutdownNow();
  }

  @Test
  void returnsResultOfCompletedCall() {
    assertThat(executor.call("listRemoteUsers", () -> "ok")).isEqualTo("ok");
  }

  @Test
  void slowCallIsCancelledAndReportedAsTimeout() throws InterruptedException {
    final CountDownLatch interrupted = new CountDownLatch(1);

    assertThatThrownBy(
            () ->
                executor.call(
                    "deleteAccount",
                    () -> {
                      try {
                        Thread.sleep(5_000);
                      } catch (InterruptedException ex) {
                        interrupted.countDown();
                        Thread.currentThread().interrupt();
                      }
                      return "late";
                    }))
        .isInstanceOf(ProvisioningTransportException.class)
        .extracting(ex -> ((ProvisioningTransportException) ex).reason())
        .isEqualTo(ProvisioningTransportException.Reason.TIMEOUT);
    assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void transportFailureFromTheCallIsRethrownAsIs() {
    final ProvisioningTransportException failure =
        new ProvisioningTransportException(
            ProvisioningTransportException.Reason.BAD_RESPONSE, "bad body");

    assertThatThrownBy(
            () ->
                executor.call(
                    "listRemoteUsers",
                    () -> {
                      throw failure;
                    }))
        .isSameAs(failure);
  }

  @Test
  void rejectedSubmissionIsReportedAsConnectionFailure() {
    executorService.shutdown();

    assertThatThrownBy(() -> executor.call("createInvite", () -> "never"))
        .isInstanceOf(ProvisioningTransportException.class)
        .extracting(ex -> ((ProvisioningTransportException) ex).reason())
        .isEqualTo(ProvisioningTransportException.Reason.CONNECTION);
  }
}
