/*
 * Where: reconciler configuration
 * What: expiry pass schedule, lookahead window, notify days and dedup interval
 * Why: operators tune reminder cadence without a redeploy
 */
package com.inviteledger.reconciler.config;

import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reconciler.expiry")
public record ExpiryNotificationProperties(
    boolean enabled,
    Duration pollInterval,
    Duration lookahead,
    Set<Integer> notifyDays,
    Duration dedupInterval) {

  public ExpiryNotificationProperties {
    pollInterval = pollInterval == null ? Duration.ofHours(6) : pollInterval;
    lookahead = lookahead == null ? Duration.ofDays(4) : lookahead;
    notifyDays = notifyDays == null || notifyDays.isEmpty() ? Set.of(3, 0) : Set.copyOf(notifyDays);
    dedupInterval = dedupInterval == null ? Duration.ofDays(2) : dedupInterval;
  }
}
