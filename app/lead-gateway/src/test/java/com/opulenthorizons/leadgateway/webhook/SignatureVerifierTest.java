/*
 * どこで: SignatureVerifier のユニットテスト
 * 何を: HMAC 署名の一致/不一致、接頭辞、チャレンジ応答、判定不能時の拒否を検証する
 * なぜ: 1 ビットでも異なる署名や未設定の送信元を通さないことを保証するため
 */
package com.opulenthorizons.leadgateway.webhook;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import com.opulenthorizons.leadgateway.config.WebhookProperties;
import com.opulenthorizons.leadgateway.model.VerificationScheme;
import com.opulenthorizons.leadgateway.service.LeadGatewayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

class SignatureVerifierTest {

  private static final String CLOUDTALK_SECRET = "cloudtalk-secret";
  private static final String NOTION_SECRET = "notion-secret";
  private static final String CLOUDTALK_HEADER = "X-CloudTalk-Signature";
  private static final String NOTION_HEADER = "X-Notion-Signature";
  private static final byte[] BODY =
      "{\"event_type\":\"call.ended\",\"call_id\":\"c-1\"}".getBytes(StandardCharsets.UTF_8);

  private SimpleMeterRegistry registry;
  private SignatureVerifier verifier;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    final WebhookProperties properties =
        new WebhookProperties(
            Map.of(
                "CloudTalk",
                new WebhookProperties.Source(
                    VerificationScheme.HMAC_SHA256, CLOUDTALK_SECRET, CLOUDTALK_HEADER, null, null),
                "notion",
                new WebhookProperties.Source(
                    VerificationScheme.CHALLENGE_RESPONSE,
                    NOTION_SECRET,
                    NOTION_HEADER,
                    "sha256=",
                    List.of("verification_token", "challenge")),
                "unconfigured",
                new WebhookProperties.Source(null, "", null, null, null)));
    verifier =
        new SignatureVerifier(properties, new ObjectMapper(), new LeadGatewayMetrics(registry));
  }

  @Test
  void validSignatureIsAccepted() {
    final VerificationResult result =
        verifier.verify("cloudtalk", headers(CLOUDTALK_HEADER, sign(CLOUDTALK_SECRET, BODY)), BODY);

    assertThat(result.isValid()).isTrue();
  }

  @Test
  void uppercaseHexSignatureIsRejected() {
    final String signature = sign(CLOUDTALK_SECRET, BODY).toUpperCase(Locale.ROOT);

    assertThat(verifier.verify("cloudtalk", headers(CLOUDTALK_HEADER, signature), BODY).isValid())
        .isFalse();
  }

  @Test
  void singleCaseFlipOfOneHexLetterIsRejected() {
    final String signature = sign(CLOUDTALK_SECRET, BODY);
    final int letter = indexOfHexLetter(signature);
    final char[] chars = signature.toCharArray();
    chars[letter] ^= 0x20;

    final VerificationResult result =
        verifier.verify("cloudtalk", headers(CLOUDTALK_HEADER, new String(chars)), BODY);

    assertThat(result.isAuthentic()).isFalse();
  }

  @Test
  void everySingleBitFlipInSignatureHeaderIsRejected() {
    final String signature = sign(CLOUDTALK_SECRET, BODY);
    for (int bit = 0; bit < signature.length() * 8; bit++) {
      final char[] chars = signature.toCharArray();
      chars[bit / 8] ^= (char) (1 << (bit % 8));

      final VerificationResult result =
          verifier.verify("cloudtalk", headers(CLOUDTALK_HEADER, new String(chars)), BODY);

      assertThat(result.isAuthentic()).as("bit %d", bit).isFalse();
    }
  }

  @Test
  void everySingleBitFlipInPrefixedHeaderIsRejected() {
    final String header = "sha256=" + sign(NOTION_SECRET, BODY);
    for (int bit = 0; bit < header.length() * 8; bit++) {
      final char[] chars = header.toCharArray();
      chars[bit / 8] ^= (char) (1 << (bit % 8));

      final VerificationResult result =
          verifier.verify("notion", headers(NOTION_HEADER, new String(chars)), BODY);

      assertThat(result.isAuthentic()).as("bit %d", bit).isFalse();
    }
  }

  @Test
  void everySingleBitFlipInBodyIsRejected() {
    final String signature = sign(CLOUDTALK_SECRET, BODY);
    for (int bit = 0; bit < BODY.length * 8; bit++) {
      final byte[] tampered = BODY.clone();
      tampered[bit / 8] ^= (byte) (1 << (bit % 8));

      final VerificationResult result =
          verifier.verify("cloudtalk", headers(CLOUDTALK_HEADER, signature), tampered);

      assertThat(result.status()).as("bit %d", bit).isEqualTo(VerificationResult.Status.INVALID);
      assertThat(result.reason()).isEqualTo("signature mismatch");
    }
  }

  @Test
  void prefixedSignatureRequiresPrefix() {
    final String signature = sign(NOTION_SECRET, BODY);

    assertThat(verifier.verify("notion", headers(NOTION_HEADER, "sha256=" + signature), BODY))
        .extracting(VerificationResult::status)
        .isEqualTo(VerificationResult.Status.VALID);
    assertThat(verifier.verify("notion", headers(NOTION_HEADER, signature), BODY).reason())
        .isEqualTo("missing signature prefix");
  }

  @Test
  void challengeBodyIsAnsweredWithoutSignature() {
    final byte[] body =
        "{\"verification_token\":\"tok-123\"}".getBytes(StandardCharsets.UTF_8);

    final VerificationResult result = verifier.verify("notion", new HttpHeaders(), body);

    assertThat(result.isChallenge()).isTrue();
    assertThat(result.challenge()).isEqualTo("tok-123");
  }

  @Test
  void challengeFieldIsIgnoredForHmacOnlySource() {
    final byte[] body = "{\"challenge\":\"abc\"}".getBytes(StandardCharsets.UTF_8);

    final VerificationResult result = verifier.verify("cloudtalk", new HttpHeaders(), body);

    assertThat(result.isAuthentic()).isFalse();
    assertThat(result.reason()).isEqualTo("missing signature header");
  }

  @Test
  void unverifiableRequestsFailClosed() {
    final String signature = sign(CLOUDTALK_SECRET, BODY);

    assertThat(verifier.verify("zapier", headers(CLOUDTALK_HEADER, signature), BODY).reason())
        .isEqualTo("unknown source");
    assertThat(verifier.verify(null, headers(CLOUDTALK_HEADER, signature), BODY).reason())
        .isEqualTo("unknown source");
    assertThat(verifier.verify("unconfigured", headers("X-Signature", signature), BODY).reason())
        .isEqualTo("secret not configured");
    assertThat(verifier.verify("cloudtalk", headers(CLOUDTALK_HEADER, " "), BODY).reason())
        .isEqualTo("missing signature header");
    assertThat(verifier.verify("cloudtalk", headers(CLOUDTALK_HEADER, "zz-not-hex"), BODY).reason())
        .isEqualTo("malformed signature");
  }

  @Test
  void verificationOutcomesAreCounted() {
    verifier.verify("cloudtalk", headers(CLOUDTALK_HEADER, sign(CLOUDTALK_SECRET, BODY)), BODY);
    verifier.verify("cloudtalk", new HttpHeaders(), BODY);
    verifier.verify("zapier", new HttpHeaders(), BODY);

    assertThat(count("cloudtalk", "valid")).isEqualTo(1.0d);
    assertThat(count("cloudtalk", "invalid")).isEqualTo(1.0d);
    assertThat(count("unknown", "invalid")).isEqualTo(1.0d);
  }

  private double count(String source, String result) {
    return registry
        .get("lead_gateway.webhook.signature.total")
        .tags("source", source, "result", result)
        .counter()
        .count();
  }

  private static String sign(String secret, byte[] body) {
    return BaseEncoding.base16().lowerCase().encode(SignatureVerifier.hmac(secret, body));
  }

  private static int indexOfHexLetter(String hex) {
    for (int i = 0; i < hex.length(); i++) {
      if (hex.charAt(i) >= 'a' && hex.charAt(i) <= 'f') {
        return i;
      }
    }
    throw new IllegalStateException("no hex letter in " + hex);
  }

  private static HttpHeaders headers(String name, String value) {
    final HttpHeaders headers = new HttpHeaders();
    headers.add(name, value);
    return headers;
  }
}
