/*
 * どこで: Lead Gateway 設定バインド
 * 何を: CRM の OAuth2 トークンエンドポイントと資格情報を保持する
 * なぜ: アクセストークンの更新条件(安全マージン/タイムアウト)を環境ごとに調整するため
 */
package com.opulenthorizons.leadgateway.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "lead-gateway.crm.oauth")
public record CrmOAuthProperties(
    @NotBlank String tokenUrl,
    String clientId,
    String clientSecret,
    String refreshToken,
    String staticAccessToken,
    Duration safetyMargin,
    Duration defaultExpiresIn,
    Duration refreshTimeout,
    Duration connectTimeout,
    Duration readTimeout) {

  public CrmOAuthProperties {
    tokenUrl =
        tokenUrl == null || tokenUrl.isBlank()
            ? "https://accounts.zoho.com/oauth/v2/token"
            : tokenUrl;
    clientId = clientId == null ? "" : clientId.trim();
    clientSecret = clientSecret == null ? "" : clientSecret.trim();
    refreshToken = refreshToken == null ? "" : refreshToken.trim();
    staticAccessToken = staticAccessToken == null ? "" : staticAccessToken.trim();
    safetyMargin = safetyMargin == null ? Duration.ofMinutes(5) : safetyMargin;
    defaultExpiresIn = defaultExpiresIn == null ? Duration.ofHours(1) : defaultExpiresIn;
    refreshTimeout = refreshTimeout == null ? Duration.ofSeconds(30) : refreshTimeout;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  /** client id/secret が揃っていればリフレッシュフローを使う。 */
  public boolean oauthConfigured() {
    return !clientId.isEmpty() && !clientSecret.isEmpty();
  }

  public boolean staticTokenConfigured() {
    return !staticAccessToken.isEmpty();
  }

  @AssertTrue(message = "lead-gateway.crm.oauth.safety-margin must not be negative")
  public boolean isSafetyMarginValid() {
    return safetyMargin != null && !safetyMargin.isNegative();
  }

  @AssertTrue(message = "lead-gateway.crm.oauth.refresh-timeout must be positive")
  public boolean isRefreshTimeoutPositive() {
    return isPositiveDuration(refreshTimeout);
  }

  @AssertTrue(message = "lead-gateway.crm.oauth.default-expires-in must be positive")
  public boolean isDefaultExpiresInPositive() {
    return isPositiveDuration(defaultExpiresIn);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
