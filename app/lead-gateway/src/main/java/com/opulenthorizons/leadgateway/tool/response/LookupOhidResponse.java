package com.opulenthorizons.leadgateway.tool.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LookupOhidResponse(boolean found, UUID ohid, String message) {

  public static LookupOhidResponse found(UUID ohid) {
    return new LookupOhidResponse(true, ohid, null);
  }

  public static LookupOhidResponse notFound() {
    return new LookupOhidResponse(false, null, "No matching OHID found");
  }
}
