/*
 * どこで: Lead Gateway CRM 連携
 * 何を: CRM レコード API の恒久的な失敗を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換するため
 */
package com.opulenthorizons.leadgateway.crm;

public class CrmIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    UNAUTHORIZED,
    REJECTED,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public CrmIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CrmIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
