/*
 * どこで: Lead Gateway ツール API
 * 何を: reconcile の結果 (取り込み/書き込み項目と衝突解決) を返す
 * なぜ: 呼び出し側が同期で何が起きたかを機械的に判断できるようにするため
 */
package com.opulenthorizons.leadgateway.tool.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReconcileResponse(
    UUID ohid,
    String direction,
    String remoteRecordId,
    String remoteAction,
    List<String> pulledFields,
    List<String> pushedFields,
    List<Conflict> conflicts) {

  public ReconcileResponse {
    pulledFields = pulledFields == null ? List.of() : List.copyOf(pulledFields);
    pushedFields = pushedFields == null ? List.of() : List.copyOf(pushedFields);
    conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Conflict(
      String field, String winner, Instant localChangedAt, Instant remoteModifiedAt) {}
}
