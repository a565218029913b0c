package com.inviteledger.reconciler.service;

import com.inviteledger.reconciler.model.InviteStatus;
import java.time.Instant;
import java.util.List;

public record IssueResult(
    String chatId,
    String inviteCode,
    InviteStatus status,
    Instant accountExpiresAt,
    Instant inviteExpiresAt,
    PriorInviteState previousState,
    String supersededInviteCode,
    List<StepOutcome> steps,
    boolean auditRecorded) {

  public IssueResult {
    steps = List.copyOf(steps);
  }

  /** The invite exists remotely and is tracked locally. */
  public boolean issued() {
    return steps.stream()
        .filter(step -> !LifecycleCoordinator.STEP_REVOKE_SUPERSEDED.equals(step.step()))
        .allMatch(StepOutcome::succeeded);
  }
}
