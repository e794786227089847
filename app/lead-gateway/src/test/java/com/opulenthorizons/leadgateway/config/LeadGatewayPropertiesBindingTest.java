/*
 * どこで: Lead Gateway 設定バインドのテスト
 * 何を: CRM/OAuth/リトライ/Webhook 設定のバインドと、不正な OAuth 設定での起動失敗を検証する
 * なぜ: 負の安全マージンなどの設定ミスを、トークン更新の誤動作ではなく起動時に検出するため
 */
package com.opulenthorizons.leadgateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class LeadGatewayPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void contextBindsDurationsAndDefaults() {
    contextRunner
        .withPropertyValues(
            "lead-gateway.crm.oauth.client-id=client",
            "lead-gateway.crm.oauth.client-secret=secret",
            "lead-gateway.crm.oauth.safety-margin=2m",
            "lead-gateway.crm.api.base-url=https://www.zohoapis.eu/crm/v2",
            "lead-gateway.retry.remote.max-attempts=6",
            "lead-gateway.retry.remote.backoff-base=250ms",
            "lead-gateway.webhooks.sources.cloudtalk.secret=s1",
            "lead-gateway.tools.list-events-max-limit=0")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final CrmOAuthProperties oauth = context.getBean(CrmOAuthProperties.class);
              final CrmApiProperties api = context.getBean(CrmApiProperties.class);
              final RetryProperties retry = context.getBean(RetryProperties.class);
              final WebhookProperties webhooks = context.getBean(WebhookProperties.class);
              final ToolApiProperties tools = context.getBean(ToolApiProperties.class);

              assertThat(oauth.oauthConfigured()).isTrue();
              assertThat(oauth.staticTokenConfigured()).isFalse();
              assertThat(oauth.safetyMargin()).isEqualTo(Duration.ofMinutes(2));
              assertThat(oauth.refreshTimeout()).isEqualTo(Duration.ofSeconds(30));
              assertThat(api.baseUrl()).isEqualTo("https://www.zohoapis.eu/crm/v2");
              assertThat(api.module()).isEqualTo("Leads");
              assertThat(retry.remote().maxAttempts()).isEqualTo(6);
              assertThat(retry.remote().backoffBase()).isEqualTo(Duration.ofMillis(250));
              assertThat(retry.storage().maxAttempts()).isEqualTo(3);
              // 送信元名は大文字小文字を区別しない
              assertThat(webhooks.find("cloudtalk")).isPresent();
              assertThat(webhooks.find("CLOUDTALK").orElseThrow().secret()).isEqualTo("s1");
              assertThat(webhooks.find("stripe")).isEmpty();
              assertThat(tools.listEventsMaxLimit()).isEqualTo(500);
              assertThat(tools.headerName()).isEqualTo("Authorization");
            });
  }

  @Test
  void negativeSafetyMarginFailsStartup() {
    contextRunner
        .withPropertyValues("lead-gateway.crm.oauth.safety-margin=-1s")
        .run(
            context ->
                assertThat(context)
                    .hasFailed()
                    .getFailure()
                    .rootCause()
                    .hasMessageContaining("safety-margin must not be negative"));
  }

  @Test
  void zeroRefreshTimeoutFailsStartup() {
    contextRunner
        .withPropertyValues("lead-gateway.crm.oauth.refresh-timeout=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    CrmOAuthProperties.class,
    CrmApiProperties.class,
    RetryProperties.class,
    WebhookProperties.class,
    ToolApiProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
