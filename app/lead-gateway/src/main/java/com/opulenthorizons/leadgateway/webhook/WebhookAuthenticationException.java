package com.opulenthorizons.leadgateway.webhook;

public class WebhookAuthenticationException extends RuntimeException {

  private final String source;

  public WebhookAuthenticationException(String source, String reason) {
    super("webhook authentication failed: " + reason);
    this.source = source;
  }

  public String source() {
    return source;
  }
}
