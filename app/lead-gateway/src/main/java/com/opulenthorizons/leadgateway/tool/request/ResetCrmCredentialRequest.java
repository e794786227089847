package com.opulenthorizons.leadgateway.tool.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResetCrmCredentialRequest(
    @NotBlank(message = "refresh_token is required") String refreshToken) {

  @Override
  public String toString() {
    return "ResetCrmCredentialRequest[refreshToken=***]";
  }
}
