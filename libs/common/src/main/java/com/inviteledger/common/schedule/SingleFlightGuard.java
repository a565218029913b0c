/*
 * Where: shared scheduling helpers
 * What: lets at most one run of a named task execute at a time
 * Why: a scheduled pass and a manual trigger of the same task must not overlap
 */
package com.inviteledger.common.schedule;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

public class SingleFlightGuard {

  private final ConcurrentMap<String, AtomicBoolean> running = new ConcurrentHashMap<>();

  /**
   * Runs {@code task} unless another run under the same name is still in progress.
   *
   * @return the task result, or empty when the run was skipped
   */
  public <T> Optional<T> tryRun(String taskName, Supplier<T> task) {
    final AtomicBoolean flag = running.computeIfAbsent(taskName, ignored -> new AtomicBoolean());
    if (!flag.compareAndSet(false, true)) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(task.get());
    } finally {
      flag.set(false);
    }
  }

  boolean isRunning(String taskName) {
    final AtomicBoolean flag = running.get(taskName);
    return flag != null && flag.get();
  }
}
