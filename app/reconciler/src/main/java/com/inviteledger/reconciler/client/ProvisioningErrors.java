package com.inviteledger.reconciler.client;

import com.inviteledger.reconciler.remote.ProvisioningTransportException;
import java.net.SocketTimeoutException;
import org.springframework.web.client.ResourceAccessException;

final class ProvisioningErrors {

  private ProvisioningErrors() {}

  static ProvisioningTransportException fromResourceAccess(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new ProvisioningTransportException(
          ProvisioningTransportException.Reason.TIMEOUT,
          "provisioning " + operation + " timed out",
          ex);
    }
    return new ProvisioningTransportException(
        ProvisioningTransportException.Reason.CONNECTION,
        "provisioning " + operation + " connection failed",
        ex);
  }

  static ProvisioningTransportException badResponse(String operation, Throwable cause) {
    return new ProvisioningTransportException(
        ProvisioningTransportException.Reason.BAD_RESPONSE,
        "provisioning " + operation + " returned an unusable response",
        cause);
  }

  private static boolean isTimeout(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
