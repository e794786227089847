package com.opulenthorizons.leadgateway.tool.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

/** status は "ingested" か、同じ取り込みの再送なら "duplicate"。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestLeadResponse(
    UUID ohid, UUID ingestId, String sourceSystem, String status, String identityOutcome) {}
