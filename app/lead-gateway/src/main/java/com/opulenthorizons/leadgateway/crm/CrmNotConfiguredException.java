package com.opulenthorizons.leadgateway.crm;

/** OAuth 資格情報も静的トークンも設定されていない。 */
public class CrmNotConfiguredException extends RuntimeException {

  public CrmNotConfiguredException(String message) {
    super(message);
  }
}
