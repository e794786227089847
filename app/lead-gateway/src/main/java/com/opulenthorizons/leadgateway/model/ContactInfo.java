/*
 * どこで: app/lead-gateway/src/main/java/com/opulenthorizons/leadgateway/model/ContactInfo.java
 * 何を: 同定に使う (name, email, phone) の入力タプル
 * なぜ: 空文字と表記揺れを境界で正規化し、照合を完全一致で行えるようにするため
 */
package com.opulenthorizons.leadgateway.model;

import java.util.Locale;

public record ContactInfo(String name, String email, String phone) {

    public ContactInfo {
        name = normalizeName(name);
        email = normalizeEmail(email);
        phone = normalizePhone(phone);
    }

    public static ContactInfo of(String name, String email, String phone) {
        return new ContactInfo(name, email, phone);
    }

    public boolean hasEmail() {
        return email != null;
    }

    public boolean hasPhone() {
        return phone != null;
    }

    public boolean isKeyless() {
        return email == null && phone == null;
    }

    public String valueOf(ContactField field) {
        return switch (field) {
            case NAME -> name;
            case EMAIL -> email;
            case PHONE -> phone;
        };
    }

    private static String normalizeName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().replaceAll("\\s+", " ");
    }

    private static String normalizeEmail(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizePhone(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.replaceAll("\\s+", "");
    }
}
