package com.opulenthorizons.leadgateway.model;

public enum ContactField {
    NAME("name"),
    EMAIL("email"),
    PHONE("phone");

    private final String column;

    ContactField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public static ContactField fromColumn(String column) {
        for (ContactField field : values()) {
            if (field.column.equals(column)) {
                return field;
            }
        }
        throw new IllegalArgumentException("unknown contact field: " + column);
    }
}
