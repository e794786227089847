package com.opulenthorizons.leadgateway.tool.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResolveIdentityResponse(
    UUID ohid, String outcome, boolean created, List<UUID> collisions) {

  public ResolveIdentityResponse {
    collisions = collisions == null ? List.of() : List.copyOf(collisions);
  }
}
