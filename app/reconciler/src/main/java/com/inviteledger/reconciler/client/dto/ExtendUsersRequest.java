package com.inviteledger.reconciler.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ExtendUsersRequest(
    List<String> users,
    long months,
    long days,
    long hours,
    long minutes,
    @JsonProperty("notify") boolean notifyUsers,
    String reason) {}
