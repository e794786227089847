/*
 * どこで: Lead Gateway データアクセス
 * 何を: workflow_event の append と OHID 単位の時系列読み出しを担う
 * なぜ: 監査ログと双方向同期の変更フィードを同じテーブルから引くため
 */
package com.opulenthorizons.leadgateway.repository;

import static com.opulenthorizons.common.JdbcTimestampUtils.toTimestamp;

import com.opulenthorizons.leadgateway.model.WorkflowEventRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class WorkflowEventRepository {

  private static final String SELECT_COLUMNS =
      "id, seq, ohid, event_type, payload::text AS payload_text, occurred_at, source_system";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public WorkflowEventRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public void lockAppendsFor(long lockKey) {
    // 同一 OHID への append をトランザクション内で直列化する。
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public Optional<Instant> findLatestOccurredAt(UUID ohid) {
    final String sql = "SELECT max(occurred_at) AS latest FROM workflow_event WHERE ohid = :ohid";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ohid", ohid);
    final Timestamp latest =
        jdbcTemplate.queryForObject(sql, params, (rs, rowNum) -> rs.getTimestamp("latest"));
    return Optional.ofNullable(latest).map(Timestamp::toInstant);
  }

  /** 同じ id のイベントが既にあれば何もせず empty を返す。 */
  public Optional<WorkflowEventRecord> insertIfAbsent(
      UUID id,
      UUID ohid,
      String eventType,
      String payloadJson,
      Instant occurredAt,
      String sourceSystem) {
    final String sql =
        """
        INSERT INTO workflow_event (id, ohid, event_type, payload, occurred_at, source_system)
        VALUES (:id, :ohid, :eventType, :payload::jsonb, :occurredAt, :sourceSystem)
        ON CONFLICT (id) DO NOTHING
        RETURNING id, seq, ohid, event_type, payload::text AS payload_text, occurred_at, source_system
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("ohid", ohid)
            .addValue("eventType", eventType)
            .addValue("payload", payloadJson)
            .addValue("occurredAt", toTimestamp(occurredAt))
            .addValue("sourceSystem", sourceSystem);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<WorkflowEventRecord> findById(UUID id) {
    final String sql = "SELECT " + SELECT_COLUMNS + " FROM workflow_event WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<WorkflowEventRecord> findByOhid(UUID ohid, int limit) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """

            FROM workflow_event
            WHERE ohid = :ohid
            ORDER BY occurred_at, seq
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ohid", ohid).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<WorkflowEventRecord> findByOhidAndTypes(UUID ohid, Collection<String> eventTypes) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """

            FROM workflow_event
            WHERE ohid = :ohid AND event_type IN (:eventTypes)
            ORDER BY occurred_at, seq
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ohid", ohid).addValue("eventTypes", eventTypes);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private WorkflowEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new WorkflowEventRecord(
        rs.getObject("id", UUID.class),
        rs.getLong("seq"),
        rs.getObject("ohid", UUID.class),
        rs.getString("event_type"),
        rs.getString("payload_text"),
        rs.getTimestamp("occurred_at").toInstant(),
        rs.getString("source_system"));
  }
}
