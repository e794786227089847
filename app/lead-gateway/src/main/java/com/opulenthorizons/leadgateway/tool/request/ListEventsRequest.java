package com.opulenthorizons.leadgateway.tool.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ListEventsRequest(
    @NotNull(message = "ohid is required") UUID ohid,
    @Positive(message = "limit must be positive") Integer limit) {}
