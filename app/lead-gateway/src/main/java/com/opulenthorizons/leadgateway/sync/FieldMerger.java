/*
 * どこで: Lead Gateway CRM 同期
 * 何を: ローカル/リモートの値と前回同期時点の情報から、項目ごとの取り込み/書き込みを決める
 * なぜ: 双方が独立に更新された場合でも、毎回同じ入力から同じ結論を出すため
 */
package com.opulenthorizons.leadgateway.sync;

import com.opulenthorizons.leadgateway.crm.CrmLead;
import com.opulenthorizons.leadgateway.model.CanonicalIdentity;
import com.opulenthorizons.leadgateway.model.ContactField;
import com.opulenthorizons.leadgateway.model.SyncDirection;
import com.opulenthorizons.leadgateway.model.SyncLinkRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class FieldMerger {

  /**
   * 同期計画を作る。
   *
   * @param remote リモートにレコードがなければ null
   * @param link 対応する SyncLink がなければ null (初回同期として扱う)
   * @param localChanges 項目ごとのローカル最終変更時刻
   */
  public MergePlan plan(
      CanonicalIdentity local,
      CrmLead remote,
      SyncLinkRecord link,
      Map<ContactField, Instant> localChanges,
      SyncDirection direction) {
    final Map<ContactField, String> pull = new EnumMap<>(ContactField.class);
    final Map<ContactField, String> push = new EnumMap<>(ContactField.class);
    final List<FieldConflict> conflicts = new ArrayList<>();
    for (ContactField field : ContactField.values()) {
      final String localValue = local.valueOf(field);
      final String remoteValue = remote == null ? null : remote.valueOf(field);
      if (Objects.equals(localValue, remoteValue)) {
        continue;
      }
      switch (direction) {
        case INBOUND -> {
          if (remoteValue != null) {
            pull.put(field, remoteValue);
          }
        }
        case OUTBOUND -> {
          if (localValue != null) {
            push.put(field, localValue);
          }
        }
        case BIDIRECTIONAL ->
            mergeField(
                field, localValue, remoteValue, remote, link, localChanges, pull, push, conflicts);
      }
    }
    return new MergePlan(pull, push, conflicts);
  }

  private void mergeField(
      ContactField field,
      String localValue,
      String remoteValue,
      CrmLead remote,
      SyncLinkRecord link,
      Map<ContactField, Instant> localChanges,
      Map<ContactField, String> pull,
      Map<ContactField, String> push,
      List<FieldConflict> conflicts) {
    if (localValue == null) {
      pull.put(field, remoteValue);
      return;
    }
    if (remoteValue == null) {
      push.put(field, localValue);
      return;
    }
    final Instant localChangedAt = localChanges.get(field);
    final boolean remoteChanged =
        link == null
            || !Objects.equals(
                FieldDigests.digest(remoteValue), link.remoteFieldDigests().get(field));
    final boolean localChanged =
        link == null
            || (localChangedAt != null
                && (link.lastSyncedAt() == null || localChangedAt.isAfter(link.lastSyncedAt())));
    if (remoteChanged && localChanged) {
      final Instant remoteModifiedAt = remote.modifiedAt();
      // ローカルが厳密に新しい場合だけローカル勝ち。同時刻/時刻不明はリモート勝ち
      final boolean localWins =
          localChangedAt != null
              && remoteModifiedAt != null
              && localChangedAt.isAfter(remoteModifiedAt);
      if (localWins) {
        push.put(field, localValue);
      } else {
        pull.put(field, remoteValue);
      }
      conflicts.add(
          new FieldConflict(
              field,
              localWins ? FieldConflict.Winner.LOCAL : FieldConflict.Winner.REMOTE,
              localChangedAt,
              remoteModifiedAt));
      return;
    }
    if (remoteChanged) {
      pull.put(field, remoteValue);
      return;
    }
    // リモートは前回同期から変わっていないので、ローカルの値が新しい
    push.put(field, localValue);
  }
}
