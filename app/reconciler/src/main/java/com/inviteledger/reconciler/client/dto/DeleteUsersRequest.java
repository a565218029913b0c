package com.inviteledger.reconciler.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record DeleteUsersRequest(
    List<String> users, @JsonProperty("notify") boolean notifyUsers, String reason) {}
