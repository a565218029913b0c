package com.inviteledger.reconciler.model;

import java.util.Locale;

public enum InviteStatus {
  TRIAL("trial"),
  PAID("paid"),
  DISABLED("disabled");

  public static final String TRIAL_PLAN = "trial";

  private final String value;

  InviteStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static InviteStatus fromValue(String value) {
    for (InviteStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown invite status: " + value);
  }

  /** Status an active record carries for the given plan label. */
  public static InviteStatus forPlan(String plan) {
    if (plan != null && TRIAL_PLAN.equals(plan.trim().toLowerCase(Locale.ROOT))) {
      return TRIAL;
    }
    return PAID;
  }
}
