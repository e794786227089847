package com.opulenthorizons.leadgateway.webhook;

import java.util.UUID;

/** Webhook 1 件の処理結果。challenge が非 null ならチャレンジ応答で、イベントは記録していない。 */
public record WebhookReceipt(
    String source, String challenge, UUID eventId, String eventType, UUID ohid, boolean accepted) {

  public static WebhookReceipt challenge(String source, String challenge) {
    return new WebhookReceipt(source, challenge, null, null, null, false);
  }

  public boolean isChallenge() {
    return challenge != null;
  }
}
