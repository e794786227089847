/*
 * どこで: app/lead-gateway/src/main/java/com/opulenthorizons/leadgateway/model/SyncDirection.java
 * 何を: CRM 同期の方向を表す列挙型
 * なぜ: reconcile 呼び出しごとに pull / push / merge を明示的に選ばせるため
 */
package com.opulenthorizons.leadgateway.model;

import java.util.Locale;

public enum SyncDirection {
    INBOUND,
    OUTBOUND,
    BIDIRECTIONAL;

    public boolean pulls() {
        return this != OUTBOUND;
    }

    public boolean pushes() {
        return this != INBOUND;
    }

    public static SyncDirection parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("direction is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown direction: " + value, ex);
        }
    }
}
