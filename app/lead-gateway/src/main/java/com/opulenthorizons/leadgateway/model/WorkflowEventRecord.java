/*
 * どこで: app/lead-gateway/src/main/java/com/opulenthorizons/leadgateway/model/WorkflowEventRecord.java
 * 何を: workflow_event テーブル相当のドメインレコード
 * なぜ: 監査ログと同期の変更フィードを同じ append-only ログで扱うため
 */
package com.opulenthorizons.leadgateway.model;

import java.time.Instant;
import java.util.UUID;

public record WorkflowEventRecord(
        UUID id,
        long seq,
        UUID ohid,
        String eventType,
        String payloadJson,
        Instant occurredAt,
        String sourceSystem) {
}
