/*
 * どこで: Lead Gateway API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.opulenthorizons.leadgateway.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    AUTHENTICATION_FAILURE,
    UNKNOWN_TOOL,
    IDENTITY_NOT_FOUND,
    TRANSIENT_STORAGE_ERROR,
    TRANSIENT_REMOTE_ERROR,
    CREDENTIAL_EXPIRED,
    CRM_NOT_CONFIGURED,
    CRM_INTEGRATION_ERROR
}
