/*
 * どこで: app/lead-gateway/src/main/java/com/opulenthorizons/leadgateway/model/LeadContextRecord.java
 * 何を: lead_context テーブル相当のドメインレコード
 * なぜ: 取り込み 1 件ごとの生ペイロードと同意情報を不変で保持するため
 */
package com.opulenthorizons.leadgateway.model;

import java.time.Instant;
import java.util.UUID;

public record LeadContextRecord(
        UUID id,
        UUID ohid,
        SourceSystem sourceSystem,
        String sourceLeadId,
        LeadChannel channel,
        String payloadJson,
        String consentJson,
        Instant createdAt) {
}
