package com.inviteledger.reconciler.config;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Defaults applied when an invite is issued without explicit durations. */
@ConfigurationProperties(prefix = "reconciler.invites")
public record InviteIssueProperties(
    String trialProfile,
    Duration trialAccountDuration,
    Duration linkValidity,
    ZoneId labelDateZone) {

  public InviteIssueProperties {
    trialProfile = trialProfile == null || trialProfile.isBlank() ? "trial" : trialProfile;
    trialAccountDuration =
        trialAccountDuration == null ? Duration.ofDays(7) : trialAccountDuration;
    linkValidity = linkValidity == null ? Duration.ofDays(1) : linkValidity;
    labelDateZone = labelDateZone == null ? ZoneId.of("UTC") : labelDateZone;
  }
}
