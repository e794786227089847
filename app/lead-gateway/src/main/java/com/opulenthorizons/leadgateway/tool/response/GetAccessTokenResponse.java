package com.opulenthorizons.leadgateway.tool.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GetAccessTokenResponse(
    String accessToken, String tokenType, String tokenState, Instant expiresAt) {}
