/*
 * どこで: Lead Gateway ツール API
 * 何を: ingest_lead の入力を保持する
 * なぜ: フォーム/広告/CRM など各チャネルのリードを共通形式で受け取るため
 */
package com.opulenthorizons.leadgateway.tool.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestLeadRequest(
    @NotBlank(message = "source_system is required") String sourceSystem,
    @NotBlank(message = "source_lead_id is required") String sourceLeadId,
    @NotBlank(message = "channel is required") String channel,
    String firstName,
    String lastName,
    String email,
    String phone,
    @NotNull(message = "marketing_consent is required") Boolean marketingConsent,
    String consentSource,
    String budgetRange,
    String location,
    String propertyType,
    String freeText,
    Map<String, Object> rawPayload) {

  public IngestLeadRequest {
    rawPayload = rawPayload == null ? Map.of() : rawPayload;
  }

  public boolean hasLeadDetails() {
    return budgetRange != null || location != null || propertyType != null || freeText != null;
  }

  /** first_name と last_name を空白 1 つで連結する。両方空なら null。 */
  public String fullName() {
    final String first = firstName == null ? "" : firstName.trim();
    final String last = lastName == null ? "" : lastName.trim();
    final String joined = (first + " " + last).trim();
    return joined.isEmpty() ? null : joined;
  }
}
