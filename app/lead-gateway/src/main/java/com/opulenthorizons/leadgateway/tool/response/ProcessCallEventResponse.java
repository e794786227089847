package com.opulenthorizons.leadgateway.tool.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

/** accepted は初回受信なら true、同じイベントの再送なら false。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessCallEventResponse(
    UUID eventId, String eventType, UUID ohid, boolean accepted) {}
