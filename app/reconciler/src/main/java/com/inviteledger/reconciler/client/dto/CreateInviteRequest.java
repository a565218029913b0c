package com.inviteledger.reconciler.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code POST /invites}; the provisioning API uses kebab-case keys. */
public record CreateInviteRequest(
    @JsonProperty("days") long days,
    @JsonProperty("hours") long hours,
    @JsonProperty("label") String label,
    @JsonProperty("multiple-uses") boolean multipleUses,
    @JsonProperty("no-limit") boolean noLimit,
    @JsonProperty("profile") String profile,
    @JsonProperty("remaining-uses") int remainingUses,
    @JsonProperty("send-to") String sendTo,
    @JsonProperty("user-days") long userDays,
    @JsonProperty("user-hours") long userHours,
    @JsonProperty("user-expiry") boolean userExpiry) {}
