package com.opulenthorizons.leadgateway.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PipelineStatusResponse(
    String server,
    List<String> sources,
    List<String> channels,
    List<String> webhookSources,
    List<String> tools,
    boolean workflowWebhook) {

  public PipelineStatusResponse {
    sources = List.copyOf(sources);
    channels = List.copyOf(channels);
    webhookSources = List.copyOf(webhookSources);
    tools = List.copyOf(tools);
  }
}
