/*
 * Where: reconciler service layer
 * What: one pass of expiry reminders over records expiring inside the lookahead window
 * Why: reminders fire on configured day marks and at most once per dedup interval
 */
package com.inviteledger.reconciler.service;

import com.google.common.annotations.VisibleForTesting;
import com.inviteledger.common.schedule.SingleFlightGuard;
import com.inviteledger.reconciler.config.ExpiryNotificationProperties;
import com.inviteledger.reconciler.model.InviteRecord;
import com.inviteledger.reconciler.repository.InviteRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExpiryNotificationService {

  public static final String TASK_NAME = "expiry-notification";

  private static final Logger logger = LoggerFactory.getLogger(ExpiryNotificationService.class);
  private static final long SECONDS_PER_DAY = 86_400L;

  private final InviteRepository inviteRepository;
  private final ExpiryNotifier notifier;
  private final ExpiryMessageFormatter messageFormatter;
  private final ExpiryNotificationProperties properties;
  private final SingleFlightGuard singleFlightGuard;
  private final ReconcilerMetrics metrics;
  private final Clock clock;

  /** Runs a pass unless one is already in progress; empty when skipped. */
  public Optional<ExpiryPassSummary> runPass() {
    final Optional<ExpiryPassSummary> summary =
        singleFlightGuard.tryRun(TASK_NAME, () -> runPassAt(Instant.now(clock)));
    if (summary.isEmpty()) {
      logger.info("expiry pass skipped because a previous pass is still running");
    }
    return summary;
  }

  @VisibleForTesting
  ExpiryPassSummary runPassAt(Instant passTime) {
    final long startedNanos = System.nanoTime();
    final Instant now = passTime.truncatedTo(ChronoUnit.SECONDS);
    final List<InviteRecord> expiring = inviteRepository.listExpiringBefore(now.plus(properties.lookahead()));
    final List<ExpiryNoticeLine> lines = new ArrayList<>(expiring.size());
    for (InviteRecord record : expiring) {
      lines.add(process(record, now));
    }
    final ExpiryPassSummary summary = new ExpiryPassSummary(now, lines);
    logger.info(
        "expiry pass finished scanned={} notified={} failed={} notDue={} deduplicated={}",
        summary.scanned(),
        summary.notified(),
        summary.failed(),
        summary.notDue(),
        summary.deduplicated());
    try {
      notifier.publishSummary(summary);
    } catch (RuntimeException ex) {
      logger.warn("expiry pass summary publish failed", ex);
    }
    metrics.recordTaskDuration(TASK_NAME, Duration.ofNanos(System.nanoTime() - startedNanos));
    return summary;
  }

  private ExpiryNoticeLine process(InviteRecord record, Instant now) {
    final long days = daysRemaining(record.accountExpiresAt(), now);
    if (!properties.notifyDays().contains((int) days)) {
      return line(record, days, ExpiryNoticeLine.Result.NOT_DUE);
    }
    if (recentlyNotified(record.lastNotifiedAt(), now)) {
      return line(record, days, ExpiryNoticeLine.Result.DEDUPLICATED);
    }
    final DeliveryResult result;
    try {
      result = notifier.send(record.chatId(), messageFormatter.format(record, days));
    } catch (RuntimeException ex) {
      logger.warn("expiry notification failed chatId={} days={}", record.chatId(), days, ex);
      metrics.recordNotification("failed");
      return line(record, days, ExpiryNoticeLine.Result.FAILED);
    }
    if (result != DeliveryResult.DELIVERED) {
      logger.warn("expiry notification unreachable chatId={} days={}", record.chatId(), days);
      metrics.recordNotification("unreachable");
      return line(record, days, ExpiryNoticeLine.Result.FAILED);
    }
    try {
      inviteRepository.setLastNotified(record.chatId(), now);
    } catch (DataAccessException ex) {
      // Delivered but unmarked: the next pass may send a duplicate.
      logger.warn("expiry notification sent but marker update failed chatId={}", record.chatId(), ex);
    }
    metrics.recordNotification("delivered");
    return line(record, days, ExpiryNoticeLine.Result.NOTIFIED);
  }

  @VisibleForTesting
  static long daysRemaining(Instant expiresAt, Instant now) {
    return Math.floorDiv(expiresAt.getEpochSecond() - now.getEpochSecond(), SECONDS_PER_DAY);
  }

  private boolean recentlyNotified(Instant lastNotifiedAt, Instant now) {
    return lastNotifiedAt != null
        && Duration.between(lastNotifiedAt, now).compareTo(properties.dedupInterval()) < 0;
  }

  private static ExpiryNoticeLine line(
      InviteRecord record, long days, ExpiryNoticeLine.Result result) {
    return new ExpiryNoticeLine(record.chatId(), record.chatUsername(), days, result);
  }
}
