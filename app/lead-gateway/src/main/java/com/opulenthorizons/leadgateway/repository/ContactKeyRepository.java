/*
 * どこで: Lead Gateway データアクセス
 * 何を: identity_contact_key の参照と insert-if-absent を担う
 * なぜ: 連絡先値ごとの OHID 一意性を DB の主キー制約で線形化するため
 */
package com.opulenthorizons.leadgateway.repository;

import static com.opulenthorizons.common.JdbcTimestampUtils.toTimestamp;

import com.opulenthorizons.leadgateway.model.ContactKeyType;
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
public class ContactKeyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UUID> findOhid(ContactKeyType keyType, String keyValue) {
    if (keyValue == null) {
      return Optional.empty();
    }
    final String sql =
        """
        SELECT ohid
        FROM identity_contact_key
        WHERE key_type = :keyType AND key_value = :keyValue
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("keyType", keyType.name())
            .addValue("keyValue", keyValue);
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getObject("ohid", UUID.class))
        .stream()
        .findFirst();
  }

  /**
   * キーが未登録なら ohid で確保する。
   *
   * <p>競合時は同時実行側のコミットを待ってから何もしないため、戻り値が空なら勝者を {@link
   * #findOhid} で読み直すこと。
   */
  public boolean claimIfAbsent(ContactKeyType keyType, String keyValue, UUID ohid, Instant now) {
    final String sql =
        """
        INSERT INTO identity_contact_key (key_type, key_value, ohid, claimed_at)
        VALUES (:keyType, :keyValue, :ohid, :claimedAt)
        ON CONFLICT (key_type, key_value) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("keyType", keyType.name())
            .addValue("keyValue", keyValue)
            .addValue("ohid", ohid)
            .addValue("claimedAt", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }
}
