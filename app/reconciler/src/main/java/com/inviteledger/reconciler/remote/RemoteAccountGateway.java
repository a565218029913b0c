package com.inviteledger.reconciler.remote;

import java.time.Duration;
import java.util.List;

/**
 * Mutations against the provisioning service. Every method throws {@link
 * ProvisioningTransportException} when the service cannot be reached or answers garbage.
 */
public interface RemoteAccountGateway {

  /**
   * @return the redeemable invite code
   * @throws ProvisioningTransportException also when the service rejects the invite
   */
  String createInvite(InviteSpec spec);

  RemoteOutcome extendAccount(String remoteUsername, Duration duration);

  RemoteOutcome deleteAccount(String remoteUsername);

  RemoteOutcome deleteInvite(String inviteCode);

  /** Names of the user profiles a paid invite may be created from. */
  List<String> listProfiles();
}
