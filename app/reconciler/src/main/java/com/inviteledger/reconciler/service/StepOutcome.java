package com.inviteledger.reconciler.service;

/**
 * Result of one sub-action of a lifecycle operation.
 *
 * @param step stable step name, e.g. {@code remote-account-delete}
 * @param target what the step acted on, if anything
 * @param cause set only when {@code status} is {@link StepStatus#FAILED}
 */
public record StepOutcome(
    String step, StepStatus status, String target, FailureCause cause, String detail) {

  public static StepOutcome succeeded(String step, String target) {
    return new StepOutcome(step, StepStatus.SUCCEEDED, target, null, null);
  }

  public static StepOutcome failed(String step, String target, FailureCause cause, String detail) {
    return new StepOutcome(step, StepStatus.FAILED, target, cause, detail);
  }

  public static StepOutcome notAttempted(String step, String detail) {
    return new StepOutcome(step, StepStatus.NOT_ATTEMPTED, null, null, detail);
  }

  public boolean succeeded() {
    return status == StepStatus.SUCCEEDED;
  }
}
