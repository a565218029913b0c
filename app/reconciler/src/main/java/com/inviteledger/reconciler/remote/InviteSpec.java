package com.inviteledger.reconciler.remote;

import java.time.Duration;

/**
 * Parameters of an invite to create remotely.
 *
 * @param label unique label used to read the generated code back
 * @param profile account profile applied on redemption
 * @param linkValidity how long the link can be redeemed
 * @param accountDuration lifetime of the created account, or null for a non-expiring account
 */
public record InviteSpec(
    String label, String profile, Duration linkValidity, Duration accountDuration) {}
