package com.inviteledger.reconciler.model;

public enum AdminActionKind {
  ISSUE_INVITE,
  EXTEND_ACCOUNT,
  REMOVE_ACCOUNT
}
