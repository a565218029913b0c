package com.inviteledger.reconciler.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.inviteledger.reconciler.service.DeliveryResult;
import com.inviteledger.reconciler.service.ExpiryNotifier;
import com.inviteledger.reconciler.service.ExpiryPassSummary;
import com.inviteledger.reconciler.service.LocalExpiryNotifier;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class ExpiryNotifierConfigTest {

  private final ApplicationContextRunner contextRunner = new ApplicationContextRunner();

  @Test
  void localNotifierIsUsedWhenNoOtherNotifierExists() {
    contextRunner
        .withUserConfiguration(ExpiryNotifierConfig.class)
        .run(
            context -> {
              assertThat(context).hasSingleBean(ExpiryNotifier.class);
              assertThat(context.getBean(ExpiryNotifier.class))
                  .isInstanceOf(LocalExpiryNotifier.class);
            });
  }

  @Test
  void chatNotifierReplacesLocalNotifier() {
    contextRunner
        .withUserConfiguration(ChatNotifier.class, ExpiryNotifierConfig.class)
        .run(
            context -> {
              assertThat(context).hasSingleBean(ExpiryNotifier.class);
              assertThat(context.getBean(ExpiryNotifier.class)).isInstanceOf(ChatNotifier.class);
            });
  }

  static class ChatNotifier implements ExpiryNotifier {

    @Override
    public DeliveryResult send(String chatId, String message) {
      return DeliveryResult.DELIVERED;
    }

    @Override
    public void publishSummary(ExpiryPassSummary summary) {}
  }
}
