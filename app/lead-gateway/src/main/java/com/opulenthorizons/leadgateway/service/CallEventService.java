/*
 * どこで: Lead Gateway サービス層
 * 何を: 電話システムの通話イベントを CallReceived / CallCompleted として記録する
 * なぜ: 相手側の番号から OHID を決め、通話履歴をリードの監査ログに残すため
 */
package com.opulenthorizons.leadgateway.service;

import com.opulenthorizons.common.event.WorkflowEventTypes;
import com.opulenthorizons.leadgateway.model.ContactInfo;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import com.opulenthorizons.leadgateway.model.WorkflowEventRecord;
import com.opulenthorizons.leadgateway.tool.request.ProcessCallEventRequest;
import com.opulenthorizons.leadgateway.tool.response.ProcessCallEventResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CallEventService {

  private static final Logger logger = LoggerFactory.getLogger(CallEventService.class);
  private static final Set<String> RECEIVED_EVENT_TYPES = Set.of("call.started", "call.ringing");
  private static final Set<String> INBOUND_DIRECTIONS = Set.of("INBOUND", "INCOMING");
  private static final Set<String> OUTBOUND_DIRECTIONS = Set.of("OUTBOUND", "OUTGOING");

  private final IdentityResolver identityResolver;
  private final EventStore eventStore;

  public ProcessCallEventResponse process(ProcessCallEventRequest request) {
    final String direction = normalizeDirection(request.direction());
    final String eventType = internalEventType(request.eventType());
    final String counterpart =
        "INBOUND".equals(direction) ? request.fromNumber() : request.toNumber();
    final UUID ohid = resolveCounterpart(counterpart);

    final Map<String, Object> call = new LinkedHashMap<>();
    call.put("call_id", request.callId());
    call.put("direction", direction);
    call.put("from", request.fromNumber());
    call.put("to", request.toNumber());
    call.put("recording_url", request.recordingUrl());
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("provider_event_type", request.eventType());
    payload.put("call", call);
    payload.put("raw", request.raw());

    final UUID eventId = eventIdFor(request.callId(), request.eventType());
    final Optional<WorkflowEventRecord> appended =
        eventStore.appendOnce(eventId, ohid, eventType, payload, SourceSystem.CLOUDTALK.name());
    if (appended.isPresent()) {
      logger.info(
          "call event recorded eventId={} eventType={} callId={} ohid={}",
          eventId,
          eventType,
          request.callId(),
          ohid);
    }
    return new ProcessCallEventResponse(eventId, eventType, ohid, appended.isPresent());
  }

  static String internalEventType(String providerEventType) {
    if (providerEventType != null
        && RECEIVED_EVENT_TYPES.contains(providerEventType.trim().toLowerCase(Locale.ROOT))) {
      return WorkflowEventTypes.CALL_RECEIVED;
    }
    return WorkflowEventTypes.CALL_COMPLETED;
  }

  /** 同じ通話の同じ種別のイベントは再送されても同じ id になる。 */
  static UUID eventIdFor(String callId, String providerEventType) {
    final String key = "cloudtalk:" + callId + ":" + providerEventType;
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
  }

  private UUID resolveCounterpart(String number) {
    final ContactInfo contact = ContactInfo.of(null, null, number);
    if (contact.isKeyless()) {
      // 番号のない通知は OHID なしで記録する
      return null;
    }
    return identityResolver.resolve(contact, SourceSystem.CLOUDTALK).ohid();
  }

  private String normalizeDirection(String direction) {
    final String upper = direction == null ? "" : direction.trim().toUpperCase(Locale.ROOT);
    if (INBOUND_DIRECTIONS.contains(upper)) {
      return "INBOUND";
    }
    if (OUTBOUND_DIRECTIONS.contains(upper)) {
      return "OUTBOUND";
    }
    throw new IllegalArgumentException("unknown call direction: " + direction);
  }
}
