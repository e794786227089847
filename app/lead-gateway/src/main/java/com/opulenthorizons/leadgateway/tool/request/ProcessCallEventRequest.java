/*
 * どこで: Lead Gateway ツール API
 * 何を: process_call_event の入力 (電話システムのイベント) を保持する
 * なぜ: Webhook と同じ処理をツール経由でも呼べるようにするため
 */
package com.opulenthorizons.leadgateway.tool.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessCallEventRequest(
    @NotBlank(message = "event_type is required") String eventType,
    @NotBlank(message = "call_id is required") String callId,
    @NotBlank(message = "direction is required") String direction,
    String fromNumber,
    String toNumber,
    String recordingUrl,
    Map<String, Object> raw) {

  public ProcessCallEventRequest {
    raw = raw == null ? Map.of() : raw;
  }
}
