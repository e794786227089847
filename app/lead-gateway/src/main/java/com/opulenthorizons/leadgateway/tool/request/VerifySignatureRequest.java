/*
 * どこで: Lead Gateway ツール API
 * 何を: verify_signature の入力を保持する
 * なぜ: 受信済み Webhook の署名をオフラインで検証できるようにするため
 */
package com.opulenthorizons.leadgateway.tool.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** body はそのままの文字列、body_hex は 16 進エンコードした生バイト列。body_hex を優先する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VerifySignatureRequest(
    @NotBlank(message = "source is required") String source,
    Map<String, String> headers,
    String body,
    String bodyHex) {

  public VerifySignatureRequest {
    headers = headers == null ? Map.of() : headers;
  }
}
