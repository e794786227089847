package com.opulenthorizons.leadgateway.repository;

import static com.opulenthorizons.common.JdbcTimestampUtils.toTimestamp;

import com.opulenthorizons.leadgateway.model.CanonicalIdentity;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class CanonicalIdentityRepository {

  private static final String COLUMNS =
      "ohid, name, email, phone, origin_source_system, created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<CanonicalIdentity> findByOhid(UUID ohid) {
    final String sql = "SELECT " + COLUMNS + " FROM canonical_identity WHERE ohid = :ohid";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ohid", ohid);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CanonicalIdentity> findByOhidForUpdate(UUID ohid) {
    // enrich の前後比較を同一トランザクション内で確定させるため行ロックを取る
    final String sql =
        "SELECT " + COLUMNS + " FROM canonical_identity WHERE ohid = :ohid FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ohid", ohid);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int insertIfAbsent(CanonicalIdentity identity) {
    final String sql =
        """
        INSERT INTO canonical_identity (ohid, name, email, phone, origin_source_system, created_at, updated_at)
        VALUES (:ohid, :name, :email, :phone, :originSourceSystem, :createdAt, :updatedAt)
        ON CONFLICT (ohid) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ohid", identity.ohid())
            .addValue("name", identity.name())
            .addValue("email", identity.email())
            .addValue("phone", identity.phone())
            .addValue("originSourceSystem", identity.originSourceSystem())
            .addValue("createdAt", toTimestamp(identity.createdAt()))
            .addValue("updatedAt", toTimestamp(identity.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  /** null の属性だけを埋める。既存の非 null 値は上書きしない。 */
  public Optional<CanonicalIdentity> fillMissing(
      UUID ohid, String name, String email, String phone, Instant now) {
    final String sql =
        """
        UPDATE canonical_identity
        SET name = COALESCE(name, :name),
            email = COALESCE(email, :email),
            phone = COALESCE(phone, :phone),
            updated_at = :updatedAt
        WHERE ohid = :ohid
        RETURNING ohid, name, email, phone, origin_source_system, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ohid", ohid)
            .addValue("name", name)
            .addValue("email", email)
            .addValue("phone", phone)
            .addValue("updatedAt", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** CRM からの pull 用。非 null の引数だけを上書きし、null の引数は現状維持にする。 */
  public Optional<CanonicalIdentity> overwrite(
      UUID ohid, String name, String email, String phone, Instant now) {
    final String sql =
        """
        UPDATE canonical_identity
        SET name = COALESCE(:name, name),
            email = COALESCE(:email, email),
            phone = COALESCE(:phone, phone),
            updated_at = :updatedAt
        WHERE ohid = :ohid
        RETURNING ohid, name, email, phone, origin_source_system, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ohid", ohid)
            .addValue("name", name)
            .addValue("email", email)
            .addValue("phone", phone)
            .addValue("updatedAt", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private CanonicalIdentity mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CanonicalIdentity(
        rs.getObject("ohid", UUID.class),
        rs.getString("name"),
        rs.getString("email"),
        rs.getString("phone"),
        rs.getString("origin_source_system"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
