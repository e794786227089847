/*
 * どこで: Lead Gateway Webhook 受信
 * 何を: 署名を検証し、送信元ごとのイベント処理へ振り分ける
 * なぜ: 検証に通らない呼び出しを一切処理しないことを 1 か所で保証するため
 */
package com.opulenthorizons.leadgateway.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opulenthorizons.common.event.WorkflowEventTypes;
import com.opulenthorizons.leadgateway.service.CallEventService;
import com.opulenthorizons.leadgateway.service.NotionEventService;
import com.opulenthorizons.leadgateway.tool.request.ProcessCallEventRequest;
import com.opulenthorizons.leadgateway.tool.response.ProcessCallEventResponse;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WebhookDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(WebhookDispatcher.class);
  static final String CLOUDTALK = "cloudtalk";
  static final String NOTION = "notion";

  private final SignatureVerifier signatureVerifier;
  private final CallEventService callEventService;
  private final NotionEventService notionEventService;
  private final ObjectMapper objectMapper;

  public WebhookReceipt dispatch(String source, HttpHeaders headers, byte[] body) {
    final String normalized = source == null ? "" : source.toLowerCase(Locale.ROOT);
    final VerificationResult verification = signatureVerifier.verify(normalized, headers, body);
    if (!verification.isAuthentic()) {
      logger.warn(
          "webhook rejected source={} reason={}", normalized, verification.reason());
      throw new WebhookAuthenticationException(normalized, verification.reason());
    }
    if (verification.isChallenge()) {
      logger.info("webhook challenge answered source={}", normalized);
      return WebhookReceipt.challenge(normalized, verification.challenge());
    }
    final JsonNode payload = parse(body);
    return switch (normalized) {
      case CLOUDTALK -> handleCall(payload);
      case NOTION -> handleNotion(payload);
      default -> throw new IllegalArgumentException("no handler for webhook source: " + normalized);
    };
  }

  private WebhookReceipt handleCall(JsonNode payload) {
    final ProcessCallEventRequest request =
        new ProcessCallEventRequest(
            firstText(payload, "event_type", "event"),
            firstText(payload, "call_id", "id"),
            firstText(payload, "direction"),
            firstText(payload, "from_number", "from"),
            firstText(payload, "to_number", "to"),
            firstText(payload, "recording_url"),
            toMap(payload));
    if (request.eventType() == null || request.callId() == null) {
      throw new IllegalArgumentException("call event requires event_type and call_id");
    }
    final ProcessCallEventResponse response = callEventService.process(request);
    return new WebhookReceipt(
        CLOUDTALK,
        null,
        response.eventId(),
        response.eventType(),
        response.ohid(),
        response.accepted());
  }

  private WebhookReceipt handleNotion(JsonNode payload) {
    final NotionEventService.Recorded recorded = notionEventService.record(payload);
    return new WebhookReceipt(
        NOTION,
        null,
        recorded.eventId(),
        WorkflowEventTypes.NOTION_EVENT,
        null,
        recorded.accepted());
  }

  private JsonNode parse(byte[] body) {
    if (body == null || body.length == 0) {
      throw new IllegalArgumentException("request body is required");
    }
    try {
      final JsonNode node = objectMapper.readTree(body);
      if (node == null || !node.isObject()) {
        throw new IllegalArgumentException("request body must be a JSON object");
      }
      return node;
    } catch (IOException ex) {
      throw new IllegalArgumentException("request body is invalid", ex);
    }
  }

  private String firstText(JsonNode payload, String... fields) {
    for (String field : fields) {
      final JsonNode value = payload.get(field);
      if (value != null && !value.isNull() && !value.isContainerNode()) {
        final String text = value.asText();
        if (!text.isBlank()) {
          return text;
        }
      }
    }
    return null;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> toMap(JsonNode payload) {
    return objectMapper.convertValue(payload, Map.class);
  }
}
