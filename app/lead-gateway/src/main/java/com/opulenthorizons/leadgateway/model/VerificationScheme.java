package com.opulenthorizons.leadgateway.model;

public enum VerificationScheme {
    HMAC_SHA256,
    CHALLENGE_RESPONSE
}
