/*
 * どこで: Lead Gateway 設定バインド
 * 何を: Webhook 送信元ごとの署名方式/共有秘密/ヘッダ名を保持する
 * なぜ: 送信元の追加や秘密のローテーションを設定だけで行うため
 */
package com.opulenthorizons.leadgateway.config;

import com.opulenthorizons.leadgateway.model.VerificationScheme;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lead-gateway.webhooks")
public record WebhookProperties(Map<String, Source> sources) {

  public WebhookProperties {
    final Map<String, Source> normalized = new TreeMap<>();
    if (sources != null) {
      sources.forEach((name, source) -> normalized.put(name.toLowerCase(Locale.ROOT), source));
    }
    sources = Map.copyOf(normalized);
  }

  public Optional<Source> find(String source) {
    if (source == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sources.get(source.toLowerCase(Locale.ROOT)));
  }

  public record Source(
      VerificationScheme scheme,
      String secret,
      String signatureHeader,
      String signaturePrefix,
      List<String> challengeFields) {

    public Source {
      scheme = scheme == null ? VerificationScheme.HMAC_SHA256 : scheme;
      secret = secret == null ? "" : secret;
      signatureHeader =
          signatureHeader == null || signatureHeader.isBlank() ? "X-Signature" : signatureHeader;
      signaturePrefix = signaturePrefix == null ? "" : signaturePrefix;
      challengeFields =
          challengeFields == null || challengeFields.isEmpty()
              ? List.of("verification_token", "challenge")
              : List.copyOf(challengeFields);
    }
  }
}
