package com.opulenthorizons.leadgateway.crm;

import com.opulenthorizons.leadgateway.model.ContactField;
import java.util.EnumMap;
import java.util.Map;

/**
 * CRM への作成/更新内容。
 *
 * @param fields 書き込む項目だけを含む。含まれない項目はリモート側の値を維持する
 */
public record CrmLeadWrite(Map<ContactField, String> fields, String leadSource, String externalId) {

  public CrmLeadWrite {
    final Map<ContactField, String> copy = new EnumMap<>(ContactField.class);
    if (fields != null) {
      fields.forEach(
          (field, value) -> {
            if (value != null) {
              copy.put(field, value);
            }
          });
    }
    fields = Map.copyOf(copy);
  }

  public boolean hasFieldChanges() {
    return !fields.isEmpty();
  }
}
