/*
 * どこで: Lead Gateway ツール API
 * 何を: reconcile の入力を保持する
 * なぜ: 同期方向を呼び出しごとに明示させるため
 */
package com.opulenthorizons.leadgateway.tool.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReconcileRequest(
    @NotNull(message = "ohid is required") UUID ohid,
    @NotBlank(message = "direction is required") String direction) {}
