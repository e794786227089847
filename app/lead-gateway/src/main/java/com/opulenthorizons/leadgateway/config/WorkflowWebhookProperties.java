/*
 * どこで: Lead Gateway 設定バインド
 * 何を: ワークフロー連携 Webhook の送信先を保持する
 * なぜ: 後続のワークフロー基盤への通知を環境ごとに有効化するため
 */
package com.opulenthorizons.leadgateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lead-gateway.workflow-webhook")
public record WorkflowWebhookProperties(
    boolean enabled, String url, Duration connectTimeout, Duration readTimeout) {

  public WorkflowWebhookProperties {
    url = url == null ? "" : url.trim();
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
