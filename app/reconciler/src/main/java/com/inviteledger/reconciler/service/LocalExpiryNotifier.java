/*
 * Where: reconciler service layer
 * What: expiry notifier that only writes the message to the log
 * Why: lets the engine run without a chat platform connection; registered by ExpiryNotifierConfig
 */
package com.inviteledger.reconciler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalExpiryNotifier implements ExpiryNotifier {

  private static final Logger logger = LoggerFactory.getLogger(LocalExpiryNotifier.class);

  @Override
  public DeliveryResult send(String chatId, String message) {
    logger.info("expiry notification simulated send chatId={} message={}", chatId, message);
    return DeliveryResult.DELIVERED;
  }

  @Override
  public void publishSummary(ExpiryPassSummary summary) {
    logger.info(
        "expiry pass summary scanned={} notified={} failed={} notDue={} deduplicated={}",
        summary.scanned(),
        summary.notified(),
        summary.failed(),
        summary.notDue(),
        summary.deduplicated());
  }
}
