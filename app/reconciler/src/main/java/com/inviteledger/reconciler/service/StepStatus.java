package com.inviteledger.reconciler.service;

public enum StepStatus {
  SUCCEEDED,
  /** Attempted and did not take effect. */
  FAILED,
  NOT_ATTEMPTED
}
