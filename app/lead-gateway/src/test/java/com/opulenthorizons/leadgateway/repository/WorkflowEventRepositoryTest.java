/*
 * どこで: WorkflowEventRepository の統合テスト
 * 何を: id 単位の重複排除と OHID ごとの時系列読み出しを検証する
 * なぜ: 再送された Webhook を 1 件に保ち、変更フィードの順序を崩さないため
 */
package com.opulenthorizons.leadgateway.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.opulenthorizons.leadgateway.AbstractPostgresContainerTest;
import com.opulenthorizons.leadgateway.model.WorkflowEventRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class WorkflowEventRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private WorkflowEventRepository workflowEventRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM workflow_event", new MapSqlParameterSource());
  }

  @Test
  void insertIfAbsentIgnoresDuplicateId() {
    final UUID id = UUID.randomUUID();
    final UUID ohid = UUID.randomUUID();

    final Optional<WorkflowEventRecord> first =
        workflowEventRepository.insertIfAbsent(
            id, ohid, "CallCompleted", "{\"n\":1}", BASE_TIME, "CLOUDTALK");
    final Optional<WorkflowEventRecord> second =
        workflowEventRepository.insertIfAbsent(
            id, ohid, "CallCompleted", "{\"n\":2}", BASE_TIME.plusSeconds(1), "CLOUDTALK");

    assertThat(first).isPresent();
    assertThat(first.get().seq()).isPositive();
    assertThat(second).isEmpty();
    assertThat(workflowEventRepository.findById(id))
        .get()
        .extracting(WorkflowEventRecord::payloadJson)
        .asString()
        .contains("\"n\": 1");
  }

  @Test
  void findByOhidOrdersByOccurredAtThenSeq() {
    final UUID ohid = UUID.randomUUID();
    final UUID later = insert(ohid, "IdentityEnriched", BASE_TIME.plusSeconds(10));
    final UUID earlier = insert(ohid, "IdentityCreated", BASE_TIME);
    final UUID sameTime = insert(ohid, "LeadIngested", BASE_TIME.plusSeconds(10));
    insert(UUID.randomUUID(), "IdentityCreated", BASE_TIME);

    final List<WorkflowEventRecord> events = workflowEventRepository.findByOhid(ohid, 10);

    assertThat(events)
        .extracting(WorkflowEventRecord::id)
        .containsExactly(earlier, later, sameTime);
    assertThat(workflowEventRepository.findByOhid(ohid, 2)).hasSize(2);
  }

  @Test
  void findByOhidAndTypesFiltersEventTypes() {
    final UUID ohid = UUID.randomUUID();
    final UUID created = insert(ohid, "IdentityCreated", BASE_TIME);
    insert(ohid, "LeadIngested", BASE_TIME.plusSeconds(1));
    final UUID enriched = insert(ohid, "IdentityEnriched", BASE_TIME.plusSeconds(2));

    final List<WorkflowEventRecord> events =
        workflowEventRepository.findByOhidAndTypes(
            ohid, List.of("IdentityCreated", "IdentityEnriched"));

    assertThat(events).extracting(WorkflowEventRecord::id).containsExactly(created, enriched);
  }

  @Test
  void findLatestOccurredAtReturnsMaximum() {
    final UUID ohid = UUID.randomUUID();
    assertThat(workflowEventRepository.findLatestOccurredAt(ohid)).isEmpty();

    insert(ohid, "IdentityCreated", BASE_TIME.plusSeconds(30));
    insert(ohid, "LeadIngested", BASE_TIME);

    assertThat(workflowEventRepository.findLatestOccurredAt(ohid))
        .contains(BASE_TIME.plusSeconds(30));
  }

  private UUID insert(UUID ohid, String eventType, Instant occurredAt) {
    final UUID id = UUID.randomUUID();
    workflowEventRepository.insertIfAbsent(id, ohid, eventType, "{}", occurredAt, "WEB");
    return id;
  }
}
