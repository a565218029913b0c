package com.inviteledger.reconciler.service;

/** What the local store held for a chat identity when a new invite was issued. */
public enum PriorInviteState {
  NONE,
  /** An unclaimed invite with a still-live link was replaced. */
  UNCLAIMED_SUPERSEDED,
  CLAIMED,
  LINK_EXPIRED,
  DISABLED
}
