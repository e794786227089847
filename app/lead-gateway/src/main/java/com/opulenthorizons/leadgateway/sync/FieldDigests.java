package com.opulenthorizons.leadgateway.sync;

import com.google.common.hash.Hashing;
import com.opulenthorizons.leadgateway.model.ContactField;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/** リモート値の SHA-256 ダイジェスト。null の項目はダイジェストを持たない。 */
public final class FieldDigests {
  private FieldDigests() {}

  public static String digest(String value) {
    if (value == null) {
      return null;
    }
    return Hashing.sha256().hashString(value, StandardCharsets.UTF_8).toString();
  }

  public static Map<ContactField, String> of(Map<ContactField, String> values) {
    final Map<ContactField, String> digests = new EnumMap<>(ContactField.class);
    values.forEach(
        (field, value) -> {
          if (value != null) {
            digests.put(field, digest(value));
          }
        });
    return digests;
  }
}
