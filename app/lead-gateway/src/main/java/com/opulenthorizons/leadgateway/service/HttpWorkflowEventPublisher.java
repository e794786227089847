/*
 * どこで: Lead Gateway サービス層
 * 何を: コミット済みイベントをワークフロー基盤の Webhook URL へ POST する
 * なぜ: 後続の自動化 (架電予約/通知など) を取り込み処理から切り離して起動するため
 */
package com.opulenthorizons.leadgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opulenthorizons.leadgateway.config.WorkflowWebhookProperties;
import com.opulenthorizons.leadgateway.model.WorkflowEventRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
@ConditionalOnProperty(name = "lead-gateway.workflow-webhook.enabled", havingValue = "true")
public class HttpWorkflowEventPublisher implements WorkflowEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(HttpWorkflowEventPublisher.class);
  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

  private final RestClient workflowWebhookRestClient;
  private final WorkflowWebhookProperties properties;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient と ObjectMapper は Spring 管理の共有コンポーネントのため")
  public HttpWorkflowEventPublisher(
      @Qualifier("workflowWebhookRestClient") RestClient workflowWebhookRestClient,
      WorkflowWebhookProperties properties,
      ObjectMapper objectMapper) {
    this.workflowWebhookRestClient = workflowWebhookRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void publish(WorkflowEventRecord event) {
    if (properties.url().isEmpty()) {
      return;
    }
    try {
      workflowWebhookRestClient
          .post()
          .uri(properties.url())
          .contentType(MediaType.APPLICATION_JSON)
          .body(toBody(event))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientException | JsonProcessingException ex) {
      // 通知はベストエフォート。取り込み結果には影響させない
      logger.warn(
          "workflow webhook publish failed eventId={} eventType={}",
          event.id(),
          event.eventType(),
          ex);
    }
  }

  private Map<String, Object> toBody(WorkflowEventRecord event) throws JsonProcessingException {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("event_type", event.eventType());
    body.put("event_id", event.id().toString());
    if (event.ohid() != null) {
      body.put("ohid", event.ohid().toString());
    }
    body.put("occurred_at", event.occurredAt().toString());
    if (event.payloadJson() != null) {
      body.putAll(objectMapper.readValue(event.payloadJson(), PAYLOAD_TYPE));
    }
    return body;
  }
}
