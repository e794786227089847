/*
 * どこで: Lead Gateway ツール API
 * 何を: resolve_identity の入力を保持する
 * なぜ: 連絡先と発生元システムを JSON から型付きで受け取るため
 */
package com.opulenthorizons.leadgateway.tool.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResolveIdentityRequest(
    String name,
    String email,
    String phone,
    @NotBlank(message = "source_system is required") String sourceSystem) {}
