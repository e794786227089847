/*
 * どこで: app/lead-gateway/src/main/java/com/opulenthorizons/leadgateway/model/SourceSystem.java
 * 何を: リードの発生元システムを表す列挙型
 * なぜ: lead_context / workflow_event と CRM の Lead_Source 属性で同じ値を使うため
 */
package com.opulenthorizons.leadgateway.model;

import java.util.Locale;

public enum SourceSystem {
    META,
    WEB,
    TWILIO,
    CLOUDTALK,
    NOTION,
    ZOHO_SOCIAL,
    ZOHO_CRM;

    public static SourceSystem parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("source_system is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown source_system: " + value, ex);
        }
    }
}
