/*
 * どこで: Lead Gateway API
 * 何を: パイプラインと CRM 同期の設定状態を返す
 * なぜ: 運用者が資格情報の失効や Webhook 送信元の設定漏れをすぐ確認できるようにするため
 */
package com.opulenthorizons.leadgateway.api;

import com.opulenthorizons.leadgateway.api.response.CrmSyncStatusResponse;
import com.opulenthorizons.leadgateway.api.response.PipelineStatusResponse;
import com.opulenthorizons.leadgateway.config.CrmApiProperties;
import com.opulenthorizons.leadgateway.config.CrmOAuthProperties;
import com.opulenthorizons.leadgateway.config.WebhookProperties;
import com.opulenthorizons.leadgateway.config.WorkflowWebhookProperties;
import com.opulenthorizons.leadgateway.crm.token.AccessTokenManager;
import com.opulenthorizons.leadgateway.model.LeadChannel;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import com.opulenthorizons.leadgateway.model.SyncDirection;
import com.opulenthorizons.leadgateway.tool.ToolDefinition;
import com.opulenthorizons.leadgateway.tool.ToolRegistry;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final WebhookProperties webhookProperties;
  private final WorkflowWebhookProperties workflowWebhookProperties;
  private final CrmApiProperties crmApiProperties;
  private final CrmOAuthProperties crmOAuthProperties;
  private final AccessTokenManager accessTokenManager;
  private final ToolRegistry toolRegistry;

  @GetMapping("/")
  public String home() {
    return "lead-gateway: ok";
  }

  @GetMapping("/status/pipeline")
  public PipelineStatusResponse pipeline() {
    return new PipelineStatusResponse(
        "lead-gateway",
        Arrays.stream(SourceSystem.values()).map(Enum::name).toList(),
        Arrays.stream(LeadChannel.values()).map(Enum::name).toList(),
        webhookProperties.sources().keySet().stream().sorted().toList(),
        toolRegistry.definitions().stream().map(ToolDefinition::name).toList(),
        workflowWebhookProperties.enabled());
  }

  @GetMapping("/status/crm-sync")
  public CrmSyncStatusResponse crmSync() {
    return new CrmSyncStatusResponse(
        crmApiProperties.remoteSystem(),
        crmApiProperties.baseUrl(),
        crmApiProperties.module(),
        credentialMode(),
        accessTokenManager.state().name(),
        accessTokenManager.expiresAt().orElse(null),
        Arrays.stream(SyncDirection.values()).map(Enum::name).toList());
  }

  private String credentialMode() {
    if (crmOAuthProperties.oauthConfigured()) {
      return "OAUTH_REFRESH";
    }
    if (crmOAuthProperties.staticTokenConfigured()) {
      return "STATIC_TOKEN";
    }
    return "NOT_CONFIGURED";
  }
}
