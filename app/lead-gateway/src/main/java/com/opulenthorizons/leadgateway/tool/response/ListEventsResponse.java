package com.opulenthorizons.leadgateway.tool.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ListEventsResponse(UUID ohid, List<WorkflowEventView> events) {

  public ListEventsResponse {
    events = events == null ? List.of() : List.copyOf(events);
  }
}
