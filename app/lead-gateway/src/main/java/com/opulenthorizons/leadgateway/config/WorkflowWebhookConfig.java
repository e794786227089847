package com.opulenthorizons.leadgateway.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "lead-gateway.workflow-webhook.enabled", havingValue = "true")
public class WorkflowWebhookConfig {

  @Bean
  RestClient workflowWebhookRestClient(
      RestClient.Builder builder, WorkflowWebhookProperties properties) {
    return builder
        .clone()
        .requestFactory(
            CrmClientConfig.requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }
}
