/*
 * どこで: Lead Gateway ツール API
 * 何を: record_event の入力を保持する
 * なぜ: 任意の業務イベントを OHID に紐づけて追記できるようにするため
 */
package com.opulenthorizons.leadgateway.tool.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecordEventRequest(
    UUID ohid,
    @NotBlank(message = "event_type is required") String eventType,
    Map<String, Object> payload,
    @NotBlank(message = "source_system is required") String sourceSystem) {

  public RecordEventRequest {
    payload = payload == null ? Map.of() : payload;
  }
}
