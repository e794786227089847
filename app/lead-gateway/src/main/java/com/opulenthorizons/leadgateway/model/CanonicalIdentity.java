/*
 * どこで: app/lead-gateway/src/main/java/com/opulenthorizons/leadgateway/model/CanonicalIdentity.java
 * 何を: canonical_identity テーブル相当のドメインレコード
 * なぜ: 複数チャネルのリードを 1 つの OHID に束ねた最新の連絡先属性を表すため
 */
package com.opulenthorizons.leadgateway.model;

import java.time.Instant;
import java.util.UUID;

public record CanonicalIdentity(
        UUID ohid,
        String name,
        String email,
        String phone,
        String originSourceSystem,
        Instant createdAt,
        Instant updatedAt) {

    public String valueOf(ContactField field) {
        return switch (field) {
            case NAME -> name;
            case EMAIL -> email;
            case PHONE -> phone;
        };
    }
}
