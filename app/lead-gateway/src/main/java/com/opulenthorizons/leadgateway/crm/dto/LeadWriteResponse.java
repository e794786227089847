/*
 * どこで: Lead Gateway CRM 下流 DTO
 * 何を: CRM の作成/更新 API の応答を表現する
 * なぜ: 1 件ごとの成否と採番された id / 更新時刻を取り出すため
 */
package com.opulenthorizons.leadgateway.crm.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.List;

public record LeadWriteResponse(List<Result> data) {

  public LeadWriteResponse {
    data = data == null ? List.of() : List.copyOf(data);
  }

  public record Result(String code, String status, String message, Details details) {

    public boolean succeeded() {
      return "SUCCESS".equalsIgnoreCase(code);
    }
  }

  public record Details(
      @JsonProperty("id") String id,
      @JsonProperty("Modified_Time") OffsetDateTime modifiedTime) {}
}
