/*
 * Where: reconciler remote capability boundary
 * What: a provisioning call that did not produce a usable answer
 * Why: callers treat every transport failure as retryable and never fatal to the engine
 */
package com.inviteledger.reconciler.remote;

public class ProvisioningTransportException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    CONNECTION,
    BAD_RESPONSE
  }

  private final Reason reason;

  public ProvisioningTransportException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ProvisioningTransportException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
