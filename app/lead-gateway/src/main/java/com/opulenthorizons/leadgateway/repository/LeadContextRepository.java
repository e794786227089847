/*
 * どこで: Lead Gateway データアクセス
 * 何を: lead_context の登録と OHID 単位の読み出しを担う
 * なぜ: 取り込みペイロードと同意情報を監査可能な形で残すため
 */
package com.opulenthorizons.leadgateway.repository;

import static com.opulenthorizons.common.JdbcTimestampUtils.toTimestamp;

import com.opulenthorizons.leadgateway.model.LeadChannel;
import com.opulenthorizons.leadgateway.model.LeadContextRecord;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class LeadContextRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public LeadContextRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  public int insert(LeadContextRecord record) {
    final String sql =
        """
        INSERT INTO lead_context
            (id, ohid, source_system, source_lead_id, channel, payload, consent, created_at)
        VALUES
            (:id, :ohid, :sourceSystem, :sourceLeadId, :channel, :payload::jsonb, :consent::jsonb, :createdAt)
        ON CONFLICT DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("ohid", record.ohid())
            .addValue("sourceSystem", record.sourceSystem().name())
            .addValue("sourceLeadId", record.sourceLeadId())
            .addValue("channel", record.channel() == null ? null : record.channel().name())
            .addValue("payload", record.payloadJson())
            .addValue("consent", record.consentJson())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  public List<LeadContextRecord> findByOhid(UUID ohid) {
    final String sql =
        """
        SELECT id, ohid, source_system, source_lead_id, channel,
               payload::text AS payload_text, consent::text AS consent_text, created_at
        FROM lead_context
        WHERE ohid = :ohid
        ORDER BY created_at
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ohid", ohid);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<LeadContextRecord> findBySourceLeadId(
      SourceSystem sourceSystem, String sourceLeadId) {
    if (sourceLeadId == null) {
      return Optional.empty();
    }
    final String sql =
        """
        SELECT id, ohid, source_system, source_lead_id, channel,
               payload::text AS payload_text, consent::text AS consent_text, created_at
        FROM lead_context
        WHERE source_system = :sourceSystem AND source_lead_id = :sourceLeadId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sourceSystem", sourceSystem.name())
            .addValue("sourceLeadId", sourceLeadId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private LeadContextRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String channel = rs.getString("channel");
    return new LeadContextRecord(
        rs.getObject("id", UUID.class),
        rs.getObject("ohid", UUID.class),
        SourceSystem.valueOf(rs.getString("source_system")),
        rs.getString("source_lead_id"),
        channel == null ? null : LeadChannel.valueOf(channel),
        rs.getString("payload_text"),
        rs.getString("consent_text"),
        rs.getTimestamp("created_at").toInstant());
  }
}
