package com.inviteledger.reconciler.service;

import com.inviteledger.reconciler.resolver.IdentityResolution;
import java.util.List;

/** Per-step outcome of a removal, in the order the steps ran. */
public record RemovalReport(
    IdentityResolution resolution,
    StepOutcome remoteAccountDelete,
    StepOutcome inviteDelete,
    StepOutcome localDisable,
    boolean auditRecorded) {

  public List<StepOutcome> steps() {
    return List.of(remoteAccountDelete, inviteDelete, localDisable);
  }

  public boolean fullySucceeded() {
    return steps().stream().allMatch(StepOutcome::succeeded);
  }
}
