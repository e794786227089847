/*
 * どこで: Lead Gateway データアクセス
 * 何を: oauth_refresh_credential にリフレッシュトークンを保存/参照する
 * なぜ: ローテーションされたリフレッシュトークンを再起動後も使い続けるため
 */
package com.opulenthorizons.leadgateway.repository;

import static com.opulenthorizons.common.JdbcTimestampUtils.toTimestamp;

import com.opulenthorizons.leadgateway.crm.token.RefreshTokenStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class OAuthRefreshCredentialRepository implements RefreshTokenStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public Optional<String> find(String remoteSystem) {
    final String sql =
        "SELECT refresh_token FROM oauth_refresh_credential WHERE remote_system = :remoteSystem";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("remoteSystem", remoteSystem);
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getString("refresh_token"))
        .stream()
        .findFirst();
  }

  @Override
  public void save(String remoteSystem, String refreshToken) {
    final String sql =
        """
        INSERT INTO oauth_refresh_credential (remote_system, refresh_token, updated_at)
        VALUES (:remoteSystem, :refreshToken, :updatedAt)
        ON CONFLICT (remote_system) DO UPDATE
        SET refresh_token = EXCLUDED.refresh_token,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("remoteSystem", remoteSystem)
            .addValue("refreshToken", refreshToken)
            .addValue("updatedAt", toTimestamp(Instant.now(clock)));
    jdbcTemplate.update(sql, params);
  }
}
