package com.opulenthorizons.leadgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lead-gateway.tools")
public record ToolApiProperties(String headerName, String apiKey, int listEventsMaxLimit) {

  public ToolApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "Authorization" : headerName;
    apiKey = apiKey == null ? "" : apiKey;
    listEventsMaxLimit = listEventsMaxLimit <= 0 ? 500 : listEventsMaxLimit;
  }
}
