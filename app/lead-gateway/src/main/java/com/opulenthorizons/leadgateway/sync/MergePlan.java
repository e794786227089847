package com.opulenthorizons.leadgateway.sync;

import com.opulenthorizons.leadgateway.model.ContactField;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 項目単位の同期計画。
 *
 * @param pull ローカルへ取り込む値
 * @param push リモートへ書き込む値
 */
public record MergePlan(
    Map<ContactField, String> pull, Map<ContactField, String> push, List<FieldConflict> conflicts) {

  public MergePlan {
    pull = copy(pull);
    push = copy(push);
    conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
  }

  private static Map<ContactField, String> copy(Map<ContactField, String> values) {
    if (values == null || values.isEmpty()) {
      return Map.of();
    }
    return Map.copyOf(new EnumMap<>(values));
  }
}
