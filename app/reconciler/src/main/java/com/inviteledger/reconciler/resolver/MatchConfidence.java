package com.inviteledger.reconciler.resolver;

/** Declared from most to least trustworthy; ordinal order is ranking order. */
public enum MatchConfidence {
  CONFIRMED_DIRECT,
  NAME_MATCH,
  LOCAL_REVERSE,
  FORCED
}
