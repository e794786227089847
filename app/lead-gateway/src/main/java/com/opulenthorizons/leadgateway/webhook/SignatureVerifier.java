/*
 * どこで: Lead Gateway Webhook 受信
 * 何を: 送信元ごとの方式 (HMAC-SHA256 / チャレンジ応答) で Webhook の真正性を判定する
 * なぜ: 未知の送信元や秘密未設定を含め、判定できないものはすべて不正として扱うため
 */
package com.opulenthorizons.leadgateway.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import com.opulenthorizons.leadgateway.config.WebhookProperties;
import com.opulenthorizons.leadgateway.model.VerificationScheme;
import com.opulenthorizons.leadgateway.service.LeadGatewayMetrics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(SignatureVerifier.class);
  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final BaseEncoding LOWER_HEX = BaseEncoding.base16().lowerCase();

  private final WebhookProperties properties;
  private final ObjectMapper objectMapper;
  private final LeadGatewayMetrics metrics;

  public VerificationResult verify(String source, HttpHeaders headers, byte[] body) {
    final VerificationResult result = evaluate(source, headers, body == null ? new byte[0] : body);
    // 未知の送信元名をタグにしない
    final String metricSource =
        properties.find(source).isPresent() ? source.toLowerCase(Locale.ROOT) : "unknown";
    metrics.recordSignatureVerification(
        metricSource, result.status().name().toLowerCase(Locale.ROOT));
    if (!result.isAuthentic()) {
      logger.debug("webhook verification failed source={} reason={}", source, result.reason());
    }
    return result;
  }

  private VerificationResult evaluate(String source, HttpHeaders headers, byte[] body) {
    final Optional<WebhookProperties.Source> configured = properties.find(source);
    if (configured.isEmpty()) {
      return VerificationResult.invalid("unknown source");
    }
    final WebhookProperties.Source config = configured.get();
    if (config.scheme() == VerificationScheme.CHALLENGE_RESPONSE) {
      final Optional<String> challenge = extractChallenge(config, body);
      if (challenge.isPresent()) {
        return VerificationResult.challenge(challenge.get());
      }
    }
    return verifyHmac(config, headers, body);
  }

  private VerificationResult verifyHmac(
      WebhookProperties.Source config, HttpHeaders headers, byte[] body) {
    if (config.secret().isBlank()) {
      return VerificationResult.invalid("secret not configured");
    }
    final String header = headers == null ? null : headers.getFirst(config.signatureHeader());
    if (header == null || header.isBlank()) {
      return VerificationResult.invalid("missing signature header");
    }
    String signature = header.trim();
    final String prefix = config.signaturePrefix();
    if (!prefix.isEmpty()) {
      if (!signature.startsWith(prefix)) {
        return VerificationResult.invalid("missing signature prefix");
      }
      signature = signature.substring(prefix.length());
    }
    if (signature.isEmpty() || !LOWER_HEX.canDecode(signature)) {
      return VerificationResult.invalid("malformed signature");
    }
    final String expected = LOWER_HEX.encode(hmac(config.secret(), body));
    // 小文字 16 進表記のまま一定時間で比較する
    if (!MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        signature.getBytes(StandardCharsets.UTF_8))) {
      return VerificationResult.invalid("signature mismatch");
    }
    return VerificationResult.valid();
  }

  private Optional<String> extractChallenge(WebhookProperties.Source config, byte[] body) {
    if (body.length == 0) {
      return Optional.empty();
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException ex) {
      // JSON でない本文はチャレンジではない。HMAC 検証に回す
      return Optional.empty();
    }
    if (root == null || !root.isObject()) {
      return Optional.empty();
    }
    for (String field : config.challengeFields()) {
      final JsonNode value = root.get(field);
      if (value != null && value.isTextual() && !value.asText().isEmpty()) {
        return Optional.of(value.asText());
      }
    }
    return Optional.empty();
  }

  static byte[] hmac(String secret, byte[] body) {
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      return mac.doFinal(body);
    } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
      // JVM が HmacSHA256 を提供しない場合は実行環境の前提が崩れているため即失敗させる。
      throw new IllegalStateException("HmacSHA256 not available", ex);
    }
  }
}
