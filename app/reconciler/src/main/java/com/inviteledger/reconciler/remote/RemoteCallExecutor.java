/*
 * Where: reconciler remote capability boundary
 * What: runs a provisioning call on the bounded pool and waits at most the configured timeout
 * Why: a hung provisioning service must surface as a timeout instead of stalling a pass
 */
package com.inviteledger.reconciler.remote;

import com.inviteledger.reconciler.config.RemoteCallProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RemoteCallExecutor {

  private static final Logger logger = LoggerFactory.getLogger(RemoteCallExecutor.class);

  private final ExecutorService remoteCallExecutorService;
  private final Duration timeout;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ExecutorService is a shared Spring-managed pool and cannot be copied")
  public RemoteCallExecutor(
      ExecutorService remoteCallExecutorService, RemoteCallProperties properties) {
    this.remoteCallExecutorService = remoteCallExecutorService;
    this.timeout = properties.timeout();
  }

  public <T> T call(String operation, Supplier<T> call) {
    final Future<T> future;
    try {
      future = remoteCallExecutorService.submit(call::get);
    } catch (RejectedExecutionException ex) {
      throw new ProvisioningTransportException(
          ProvisioningTransportException.Reason.CONNECTION,
          "remote call rejected operation=" + operation,
          ex);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      logger.warn("remote call timed out operation={} timeout={}", operation, timeout);
      throw new ProvisioningTransportException(
          ProvisioningTransportException.Reason.TIMEOUT,
          "remote call timed out operation=" + operation,
          ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ProvisioningTransportException(
          ProvisioningTransportException.Reason.CONNECTION,
          "remote call interrupted operation=" + operation,
          ex);
    } catch (ExecutionException ex) {
      throw unwrap(operation, ex);
    }
  }

  private RuntimeException unwrap(String operation, ExecutionException ex) {
    final Throwable cause = ex.getCause();
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new ProvisioningTransportException(
        ProvisioningTransportException.Reason.CONNECTION,
        "remote call failed operation=" + operation,
        cause);
  }
}
