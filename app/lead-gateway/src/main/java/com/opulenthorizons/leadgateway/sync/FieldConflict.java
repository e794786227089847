package com.opulenthorizons.leadgateway.sync;

import com.opulenthorizons.leadgateway.model.ContactField;
import java.time.Instant;

/**
 * 双方で変更された項目の解決結果。
 *
 * @param localChangedAt ローカル変更イベントがない場合は null
 * @param remoteModifiedAt リモートが更新時刻を返さない場合は null
 */
public record FieldConflict(
    ContactField field, Winner winner, Instant localChangedAt, Instant remoteModifiedAt) {

  public enum Winner {
    LOCAL,
    REMOTE
  }
}
