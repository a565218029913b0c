package com.inviteledger.reconciler.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InviteListResponse(List<InvitePayload> invites) {}
