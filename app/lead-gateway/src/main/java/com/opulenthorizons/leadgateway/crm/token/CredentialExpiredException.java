/*
 * どこで: Lead Gateway トークン管理
 * 何を: リフレッシュトークンが失効/取り消しされたことを表現する
 * なぜ: 自動リトライでは回復しないため、運用者による再設定を促すため
 */
package com.opulenthorizons.leadgateway.crm.token;

public class CredentialExpiredException extends RuntimeException {

  public CredentialExpiredException(String message) {
    super(message);
  }

  public CredentialExpiredException(String message, Throwable cause) {
    super(message, cause);
  }
}
