package com.inviteledger.reconciler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reconciler.remote-call")
public record RemoteCallProperties(Duration timeout, int poolSize) {

  public RemoteCallProperties {
    timeout = timeout == null ? Duration.ofSeconds(15) : timeout;
    poolSize = poolSize <= 0 ? 4 : poolSize;
  }
}
