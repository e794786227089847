/*
 * どこで: Lead Gateway Webhook 受信
 * 何を: 署名検証の結果 (正当/不正/チャレンジ応答) を表現する
 * なぜ: 検証処理を例外なしの純粋関数にし、HTTP 応答への変換を呼び出し側に任せるため
 */
package com.opulenthorizons.leadgateway.webhook;

public record VerificationResult(Status status, String reason, String challenge) {

  public enum Status {
    VALID,
    INVALID,
    CHALLENGE
  }

  public static VerificationResult valid() {
    return new VerificationResult(Status.VALID, null, null);
  }

  public static VerificationResult invalid(String reason) {
    return new VerificationResult(Status.INVALID, reason, null);
  }

  public static VerificationResult challenge(String value) {
    return new VerificationResult(Status.CHALLENGE, null, value);
  }

  public boolean isValid() {
    return status == Status.VALID;
  }

  public boolean isChallenge() {
    return status == Status.CHALLENGE;
  }

  public boolean isAuthentic() {
    return status != Status.INVALID;
  }
}
