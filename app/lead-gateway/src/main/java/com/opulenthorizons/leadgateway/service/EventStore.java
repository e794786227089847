/*
 * どこで: Lead Gateway サービス層
 * 何を: lead_context / workflow_event への追記と OHID 単位の読み出しを担う
 * なぜ: 同一 OHID のイベント時刻を単調に保ち、同期処理の変更フィードとして使えるようにするため
 */
package com.opulenthorizons.leadgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opulenthorizons.common.event.WorkflowEventTypes;
import com.opulenthorizons.leadgateway.model.ContactField;
import com.opulenthorizons.leadgateway.model.LeadContextRecord;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import com.opulenthorizons.leadgateway.model.WorkflowEventRecord;
import com.opulenthorizons.leadgateway.repository.LeadContextRepository;
import com.opulenthorizons.leadgateway.repository.WorkflowEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EventStore {

  private static final Logger logger = LoggerFactory.getLogger(EventStore.class);

  private final WorkflowEventRepository workflowEventRepository;
  private final LeadContextRepository leadContextRepository;
  private final OhidLockKeyGenerator lockKeyGenerator;
  private final StorageTransactions storageTransactions;
  private final WorkflowEventPublisher workflowEventPublisher;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * イベントを追記する。呼び出し元のトランザクションがあればそれに参加する。
   *
   * <p>ohid がある場合、同一 ohid の追記は advisory lock で直列化され、occurred_at は直前のイベント以上になる。
   */
  public WorkflowEventRecord append(
      UUID ohid, String eventType, Map<String, ?> payload, String sourceSystem) {
    final UUID eventId = UUID.randomUUID();
    return appendOnce(eventId, ohid, eventType, payload, sourceSystem)
        .orElseThrow(() -> new IllegalStateException("event id collided: " + eventId));
  }

  /**
   * 呼び出し元が決めた eventId で追記する。同じ eventId が既にあれば追記も配信もせず empty を返す。
   *
   * <p>再送された Webhook を二重に記録しないために使う。
   */
  public Optional<WorkflowEventRecord> appendOnce(
      UUID eventId, UUID ohid, String eventType, Map<String, ?> payload, String sourceSystem) {
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("event_type is required");
    }
    if (sourceSystem == null || sourceSystem.isBlank()) {
      throw new IllegalArgumentException("source_system is required");
    }
    final String payloadJson = toJson(payload == null ? Map.of() : payload);
    return storageTransactions.execute(
        "append_event",
        () -> appendInTransaction(eventId, ohid, eventType, payloadJson, sourceSystem));
  }

  public Optional<WorkflowEventRecord> findEvent(UUID eventId) {
    return workflowEventRepository.findById(eventId);
  }

  /** 同一 source / source_lead_id の取り込みが既にあれば登録せず false を返す。 */
  public boolean recordLeadContext(LeadContextRecord record) {
    return storageTransactions.execute(
        "record_lead_context", () -> leadContextRepository.insert(record) == 1);
  }

  public Optional<LeadContextRecord> findLeadContext(
      SourceSystem sourceSystem, String sourceLeadId) {
    return leadContextRepository.findBySourceLeadId(sourceSystem, sourceLeadId);
  }

  public List<WorkflowEventRecord> listEvents(UUID ohid, int limit) {
    return workflowEventRepository.findByOhid(ohid, limit);
  }

  public List<LeadContextRecord> listLeadContexts(UUID ohid) {
    return leadContextRepository.findByOhid(ohid);
  }

  /** 項目ごとに、ローカル起点で最後に値が変わった時刻を返す。 */
  public Map<ContactField, Instant> lastLocalChanges(UUID ohid) {
    final Map<ContactField, Instant> changes = new EnumMap<>(ContactField.class);
    for (WorkflowEventRecord event :
        workflowEventRepository.findByOhidAndTypes(ohid, WorkflowEventTypes.LOCAL_CHANGE_TYPES)) {
      for (ContactField field : changedFields(event)) {
        // 時系列順に読むので後勝ちで最新時刻になる
        changes.put(field, event.occurredAt());
      }
    }
    return changes;
  }

  private Optional<WorkflowEventRecord> appendInTransaction(
      UUID eventId, UUID ohid, String eventType, String payloadJson, String sourceSystem) {
    Instant occurredAt = Instant.now(clock);
    if (ohid != null) {
      workflowEventRepository.lockAppendsFor(lockKeyGenerator.generate(ohid));
      final Optional<Instant> latest = workflowEventRepository.findLatestOccurredAt(ohid);
      if (latest.isPresent() && latest.get().isAfter(occurredAt)) {
        // 時計の巻き戻りがあっても同一 OHID 内の順序は崩さない
        occurredAt = latest.get();
      }
    }
    final Optional<WorkflowEventRecord> record =
        workflowEventRepository.insertIfAbsent(
            eventId, ohid, eventType, payloadJson, occurredAt, sourceSystem);
    if (record.isEmpty()) {
      logger.info("duplicate workflow event ignored eventId={} eventType={}", eventId, eventType);
    }
    record.ifPresent(this::publishAfterCommit);
    return record;
  }

  private void publishAfterCommit(WorkflowEventRecord record) {
    // 外部への POST 中に DB 接続を握らない
    storageTransactions.runAfterRelease(() -> workflowEventPublisher.publish(record));
  }

  private List<ContactField> changedFields(WorkflowEventRecord event) {
    try {
      final JsonNode fields = objectMapper.readTree(event.payloadJson()).path("changed_fields");
      if (!fields.isArray()) {
        return List.of();
      }
      final List<ContactField> result = new ArrayList<>();
      for (JsonNode field : fields) {
        result.add(ContactField.fromColumn(field.asText()));
      }
      return result;
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      logger.warn("ignoring malformed change event eventId={}", event.id(), ex);
      return List.of();
    }
  }

  private String toJson(Map<String, ?> payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("payload is not serializable", ex);
    }
  }
}
