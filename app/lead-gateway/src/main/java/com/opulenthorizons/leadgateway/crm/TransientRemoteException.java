/*
 * どこで: Lead Gateway CRM 連携
 * 何を: CRM/トークンエンドポイントの一時障害(5xx/タイムアウト/接続失敗)を表現する
 * なぜ: リトライ対象の失敗と恒久的な失敗を呼び出し側で区別するため
 */
package com.opulenthorizons.leadgateway.crm;

public class TransientRemoteException extends RuntimeException {

  public TransientRemoteException(String message) {
    super(message);
  }

  public TransientRemoteException(String message, Throwable cause) {
    super(message, cause);
  }
}
