package com.opulenthorizons.leadgateway.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

/** トークン値そのものは含めない。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CrmSyncStatusResponse(
    String remoteSystem,
    String apiBaseUrl,
    String module,
    String credentialMode,
    String tokenState,
    Instant tokenExpiresAt,
    List<String> directions) {

  public CrmSyncStatusResponse {
    directions = List.copyOf(directions);
  }
}
