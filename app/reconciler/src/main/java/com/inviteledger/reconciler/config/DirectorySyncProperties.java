package com.inviteledger.reconciler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reconciler.directory-sync")
public record DirectorySyncProperties(boolean enabled, Duration interval) {

  public DirectorySyncProperties {
    interval = interval == null ? Duration.ofHours(12) : interval;
  }

  /** Cache entries synced longer ago than this are treated as unconfirmed. */
  public Duration staleAfter() {
    return interval.multipliedBy(2);
  }
}
