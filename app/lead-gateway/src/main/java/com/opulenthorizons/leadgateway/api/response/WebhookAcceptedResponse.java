package com.opulenthorizons.leadgateway.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WebhookAcceptedResponse(
    String source, UUID eventId, String eventType, UUID ohid, boolean accepted) {}
