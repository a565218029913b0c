package com.inviteledger.reconciler.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** One entry of {@code GET /users}; {@code expiry} is epoch seconds, 0 when unset. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RemoteUserPayload(
    String id,
    String name,
    String email,
    Long expiry,
    Boolean disabled,
    Boolean admin,
    String discordId) {}
