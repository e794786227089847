/*
 * どこで: Lead Gateway ツール API
 * 何を: workflow_event 1 件の応答表現
 * なぜ: payload を文字列ではなく JSON としてそのまま返すため
 */
package com.opulenthorizons.leadgateway.tool.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkflowEventView(
    UUID eventId,
    long seq,
    UUID ohid,
    String eventType,
    Instant occurredAt,
    String sourceSystem,
    JsonNode payload) {}
