package com.inviteledger.reconciler.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/** Body of {@code GET /profiles}; only the profile names (the map keys) are used. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProfilesResponse(Map<String, JsonNode> profiles) {}
