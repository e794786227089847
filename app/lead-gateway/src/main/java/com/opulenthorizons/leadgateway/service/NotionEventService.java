/*
 * どこで: Lead Gateway サービス層
 * 何を: Notion の Webhook イベントを NotionEvent として記録する
 * なぜ: ワークフロー側が Notion 上の変更を監査ログから追えるようにするため
 */
package com.opulenthorizons.leadgateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.opulenthorizons.common.event.WorkflowEventTypes;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotionEventService {

  private static final Logger logger = LoggerFactory.getLogger(NotionEventService.class);
  static final String DEFAULT_SUBTYPE = "notion.event";

  private final EventStore eventStore;

  public record Recorded(UUID eventId, String subtype, boolean accepted) {}

  public Recorded record(JsonNode body) {
    if (body == null || !body.isObject()) {
      throw new IllegalArgumentException("notion payload must be a JSON object");
    }
    final String subtype = textOrNull(body.get("type"));
    final String notionId = textOrNull(body.get("id"));
    final UUID eventId =
        notionId == null
            ? UUID.randomUUID()
            : UUID.nameUUIDFromBytes(("notion:" + notionId).getBytes(StandardCharsets.UTF_8));

    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("event_subtype", subtype == null ? DEFAULT_SUBTYPE : subtype);
    payload.put("notion_event_id", notionId);
    payload.put("payload", body);
    final boolean accepted =
        eventStore
            .appendOnce(
                eventId, null, WorkflowEventTypes.NOTION_EVENT, payload, SourceSystem.NOTION.name())
            .isPresent();
    logger.info(
        "notion event received eventId={} subtype={} accepted={}", eventId, subtype, accepted);
    return new Recorded(eventId, subtype == null ? DEFAULT_SUBTYPE : subtype, accepted);
  }

  private String textOrNull(JsonNode node) {
    if (node == null || !node.isTextual() || node.asText().isBlank()) {
      return null;
    }
    return node.asText();
  }
}
