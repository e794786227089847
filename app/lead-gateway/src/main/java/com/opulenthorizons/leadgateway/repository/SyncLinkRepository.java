/*
 * どこで: Lead Gateway データアクセス
 * 何を: sync_link の参照/upsert/削除を担う
 * なぜ: CRM レコードとの対応と前回同期時のリモート値ダイジェストを保持するため
 */
package com.opulenthorizons.leadgateway.repository;

import static com.opulenthorizons.common.JdbcTimestampUtils.toInstant;
import static com.opulenthorizons.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opulenthorizons.leadgateway.model.ContactField;
import com.opulenthorizons.leadgateway.model.SyncLinkRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class SyncLinkRepository {

  private static final TypeReference<Map<String, String>> DIGESTS_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public Optional<SyncLinkRecord> find(UUID ohid, String remoteSystem) {
    final String sql =
        """
        SELECT ohid, remote_system, remote_record_id, last_synced_at, remote_modified_at,
               remote_field_digests::text AS digests_text
        FROM sync_link
        WHERE ohid = :ohid AND remote_system = :remoteSystem
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ohid", ohid).addValue("remoteSystem", remoteSystem);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int upsert(SyncLinkRecord link) {
    final String sql =
        """
        INSERT INTO sync_link
            (ohid, remote_system, remote_record_id, last_synced_at, remote_modified_at, remote_field_digests)
        VALUES
            (:ohid, :remoteSystem, :remoteRecordId, :lastSyncedAt, :remoteModifiedAt, :digests::jsonb)
        ON CONFLICT (ohid, remote_system) DO UPDATE
        SET remote_record_id = EXCLUDED.remote_record_id,
            last_synced_at = EXCLUDED.last_synced_at,
            remote_modified_at = EXCLUDED.remote_modified_at,
            remote_field_digests = EXCLUDED.remote_field_digests
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ohid", link.ohid())
            .addValue("remoteSystem", link.remoteSystem())
            .addValue("remoteRecordId", link.remoteRecordId())
            .addValue("lastSyncedAt", toTimestamp(link.lastSyncedAt()))
            .addValue("remoteModifiedAt", toTimestamp(link.remoteModifiedAt()))
            .addValue("digests", writeDigests(link.remoteFieldDigests()));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(UUID ohid, String remoteSystem) {
    final String sql =
        "DELETE FROM sync_link WHERE ohid = :ohid AND remote_system = :remoteSystem";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ohid", ohid).addValue("remoteSystem", remoteSystem);
    return jdbcTemplate.update(sql, params);
  }

  private String writeDigests(Map<ContactField, String> digests) {
    // キー順を固定して同じ内容なら同じ JSON になるようにする
    final Map<String, String> byColumn = new TreeMap<>();
    digests.forEach((field, digest) -> byColumn.put(field.column(), digest));
    try {
      return objectMapper.writeValueAsString(byColumn);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize sync digests", ex);
    }
  }

  private Map<ContactField, String> readDigests(String json) {
    final Map<ContactField, String> digests = new EnumMap<>(ContactField.class);
    if (json == null || json.isBlank()) {
      return digests;
    }
    try {
      objectMapper
          .readValue(json, DIGESTS_TYPE)
          .forEach((column, digest) -> digests.put(ContactField.fromColumn(column), digest));
      return digests;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse sync digests", ex);
    }
  }

  private SyncLinkRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SyncLinkRecord(
        rs.getObject("ohid", UUID.class),
        rs.getString("remote_system"),
        rs.getString("remote_record_id"),
        toInstant(rs.getTimestamp("last_synced_at")),
        toInstant(rs.getTimestamp("remote_modified_at")),
        readDigests(rs.getString("digests_text")));
  }
}
