/*
 * どこで: app/lead-gateway/src/main/java/com/opulenthorizons/leadgateway/model/SyncLinkRecord.java
 * 何を: sync_link テーブル相当のドメインレコード
 * なぜ: OHID と CRM レコードの対応と、前回同期時点のリモート値ダイジェストを保持するため
 */
package com.opulenthorizons.leadgateway.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record SyncLinkRecord(
        UUID ohid,
        String remoteSystem,
        String remoteRecordId,
        Instant lastSyncedAt,
        Instant remoteModifiedAt,
        Map<ContactField, String> remoteFieldDigests) {

    public SyncLinkRecord {
        remoteFieldDigests = remoteFieldDigests == null ? Map.of() : Map.copyOf(remoteFieldDigests);
    }
}
