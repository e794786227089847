/*
 * どこで: Lead Gateway 設定バインド
 * 何を: CRM レコード API の接続先と認可ヘッダ形式を保持する
 * なぜ: CRM のデータセンタ/モジュール差分をコード変更なしで切り替えるため
 */
package com.opulenthorizons.leadgateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lead-gateway.crm.api")
public record CrmApiProperties(
    String baseUrl,
    String module,
    String authScheme,
    String remoteSystem,
    Duration connectTimeout,
    Duration readTimeout) {

  public CrmApiProperties {
    baseUrl =
        baseUrl == null || baseUrl.isBlank() ? "https://www.zohoapis.com/crm/v2" : baseUrl;
    module = module == null || module.isBlank() ? "Leads" : module;
    authScheme = authScheme == null || authScheme.isBlank() ? "Bearer" : authScheme;
    remoteSystem = remoteSystem == null || remoteSystem.isBlank() ? "ZOHO_CRM" : remoteSystem;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(15) : readTimeout;
  }
}
