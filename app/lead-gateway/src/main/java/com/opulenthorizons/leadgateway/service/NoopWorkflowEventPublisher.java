/*
 * どこで: Lead Gateway サービス層
 * 何を: ワークフロー連携無効時のダミー publisher を提供する
 * なぜ: 通知先がない環境でも取り込み処理を同じ経路で動かすため
 */
package com.opulenthorizons.leadgateway.service;

import com.opulenthorizons.leadgateway.model.WorkflowEventRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(
    name = "lead-gateway.workflow-webhook.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class NoopWorkflowEventPublisher implements WorkflowEventPublisher {

  @Override
  public void publish(WorkflowEventRecord event) {
    // no-op
  }
}
