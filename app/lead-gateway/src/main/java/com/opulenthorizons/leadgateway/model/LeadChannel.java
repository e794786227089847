package com.opulenthorizons.leadgateway.model;

import java.util.Locale;

public enum LeadChannel {
    WEB_FORM,
    META_LEAD_AD,
    INBOUND_CALL,
    OUTBOUND_CALL,
    SOCIAL,
    CRM;

    public static LeadChannel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("channel is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown channel: " + value, ex);
        }
    }
}
