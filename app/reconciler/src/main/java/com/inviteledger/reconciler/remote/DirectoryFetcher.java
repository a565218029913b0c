package com.inviteledger.reconciler.remote;

import java.util.List;

public interface DirectoryFetcher {

  /**
   * Lists every user known to the provisioning service.
   *
   * @throws ProvisioningTransportException on transport or authentication failure
   */
  List<RemoteUser> listRemoteUsers();
}
