package com.inviteledger.reconciler.service;

import com.inviteledger.common.TraceIds;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "reconciler.directory-sync.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DirectorySyncWorker {

  private final DirectorySyncService directorySyncService;

  @Scheduled(fixedDelayString = "${reconciler.directory-sync.interval}")
  public void run() {
    MDC.put("task", DirectorySyncService.TASK_NAME);
    MDC.put("trace_id", TraceIds.newTraceId());
    try {
      directorySyncService.syncOnce();
    } finally {
      MDC.remove("task");
      MDC.remove("trace_id");
    }
  }
}
