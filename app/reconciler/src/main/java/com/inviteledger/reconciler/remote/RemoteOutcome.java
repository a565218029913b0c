package com.inviteledger.reconciler.remote;

public enum RemoteOutcome {
  SUCCESS,
  NOT_FOUND,
  FAILED
}
