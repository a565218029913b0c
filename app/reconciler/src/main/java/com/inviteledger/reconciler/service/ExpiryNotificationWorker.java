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
    name = "reconciler.expiry.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ExpiryNotificationWorker {

  private final ExpiryNotificationService expiryNotificationService;

  @Scheduled(
      initialDelayString = "${reconciler.expiry.initial-delay:PT1M}",
      fixedDelayString = "${reconciler.expiry.poll-interval}")
  public void run() {
    MDC.put("task", ExpiryNotificationService.TASK_NAME);
    MDC.put("trace_id", TraceIds.newTraceId());
    try {
      expiryNotificationService.runPass();
    } finally {
      MDC.remove("task");
      MDC.remove("trace_id");
    }
  }
}
