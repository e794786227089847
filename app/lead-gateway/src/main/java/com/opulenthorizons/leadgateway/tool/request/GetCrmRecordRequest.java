package com.opulenthorizons.leadgateway.tool.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GetCrmRecordRequest(
    @NotBlank(message = "record_id is required") String recordId) {}
