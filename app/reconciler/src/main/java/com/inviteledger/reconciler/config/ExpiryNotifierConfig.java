package com.inviteledger.reconciler.config;

import com.inviteledger.reconciler.service.ExpiryNotifier;
import com.inviteledger.reconciler.service.LocalExpiryNotifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Falls back to the log-only notifier until a chat layer contributes its own component. */
@Configuration
public class ExpiryNotifierConfig {

  @Bean
  @ConditionalOnMissingBean(ExpiryNotifier.class)
  ExpiryNotifier localExpiryNotifier() {
    return new LocalExpiryNotifier();
  }
}
