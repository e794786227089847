package com.opulenthorizons.leadgateway.model;

public enum ContactKeyType {
    EMAIL,
    PHONE
}
