/*
 * どこで: Lead Gateway CRM 同期
 * 何を: OHID 単位でローカルの identity と CRM のリードを突き合わせ、取り込み/書き込みを行う
 * なぜ: 再実行しても重複作成や不要な書き込みをせず、衝突を決定的に解決するため
 */
package com.opulenthorizons.leadgateway.sync;

import com.google.common.util.concurrent.Striped;
import com.opulenthorizons.common.event.WorkflowEventTypes;
import com.opulenthorizons.leadgateway.config.CrmApiProperties;
import com.opulenthorizons.leadgateway.crm.CrmGateway;
import com.opulenthorizons.leadgateway.crm.CrmLead;
import com.opulenthorizons.leadgateway.crm.CrmLeadWrite;
import com.opulenthorizons.leadgateway.crm.CrmWriteResult;
import com.opulenthorizons.leadgateway.model.CanonicalIdentity;
import com.opulenthorizons.leadgateway.model.ContactField;
import com.opulenthorizons.leadgateway.model.LeadContextRecord;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import com.opulenthorizons.leadgateway.model.SyncDirection;
import com.opulenthorizons.leadgateway.model.SyncLinkRecord;
import com.opulenthorizons.leadgateway.repository.SyncLinkRepository;
import com.opulenthorizons.leadgateway.service.EventStore;
import com.opulenthorizons.leadgateway.service.IdentityResolver;
import com.opulenthorizons.leadgateway.service.LeadGatewayMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SyncReconciler {

  private static final Logger logger = LoggerFactory.getLogger(SyncReconciler.class);
  private static final int LOCK_STRIPES = 64;

  private final IdentityResolver identityResolver;
  private final EventStore eventStore;
  private final SyncLinkRepository syncLinkRepository;
  private final CrmGateway crmGateway;
  private final FieldMerger fieldMerger;
  private final LeadGatewayMetrics metrics;
  private final Clock clock;
  private final String remoteSystem;
  // 同一プロセス内での同一 OHID の同時同期を直列化する (DB 接続は保持しない)
  private final Striped<Lock> ohidLocks = Striped.lock(LOCK_STRIPES);

  public SyncReconciler(
      IdentityResolver identityResolver,
      EventStore eventStore,
      SyncLinkRepository syncLinkRepository,
      CrmGateway crmGateway,
      FieldMerger fieldMerger,
      LeadGatewayMetrics metrics,
      CrmApiProperties apiProperties,
      Clock clock) {
    this.identityResolver = identityResolver;
    this.eventStore = eventStore;
    this.syncLinkRepository = syncLinkRepository;
    this.crmGateway = crmGateway;
    this.fieldMerger = fieldMerger;
    this.metrics = metrics;
    this.clock = clock;
    this.remoteSystem = apiProperties.remoteSystem();
  }

  public SyncResult reconcile(@NonNull UUID ohid, @NonNull SyncDirection direction) {
    final Lock lock = ohidLocks.get(ohid);
    lock.lock();
    try {
      // 先行した同期の取り込み結果を見るため、identity はロック取得後に読む
      final CanonicalIdentity identity = identityResolver.findIdentity(ohid);
      return reconcileRecorded(identity, direction);
    } finally {
      lock.unlock();
    }
  }

  private SyncResult reconcileRecorded(CanonicalIdentity identity, SyncDirection direction) {
    final UUID ohid = identity.ohid();
    try {
      final SyncResult result = reconcileLocked(identity, direction);
      metrics.recordReconcile(direction.name().toLowerCase(Locale.ROOT), "success");
      return result;
    } catch (RuntimeException ex) {
      metrics.recordReconcile(direction.name().toLowerCase(Locale.ROOT), "failure");
      logger.warn("crm reconcile failed ohid={} direction={}", ohid, direction, ex);
      recordFailure(ohid, direction, ex);
      throw ex;
    }
  }

  private SyncResult reconcileLocked(CanonicalIdentity identity, SyncDirection direction) {
    final UUID ohid = identity.ohid();
    SyncLinkRecord link = syncLinkRepository.find(ohid, remoteSystem).orElse(null);
    CrmLead remote = null;
    if (link != null) {
      remote = crmGateway.fetch(link.remoteRecordId()).orElse(null);
      if (remote == null) {
        // リモートで削除/統合されたレコード。リンクを捨てて検索からやり直す
        logger.info(
            "crm record behind sync link is gone ohid={} remoteRecordId={}",
            ohid,
            link.remoteRecordId());
        syncLinkRepository.delete(ohid, remoteSystem);
        link = null;
      }
    }
    if (remote == null) {
      remote = search(identity).orElse(null);
    }

    final Map<ContactField, Instant> localChanges = eventStore.lastLocalChanges(ohid);
    final MergePlan plan = fieldMerger.plan(identity, remote, link, localChanges, direction);

    CanonicalIdentity current = identity;
    if (!plan.pull().isEmpty() && remote != null) {
      current = identityResolver.applyRemoteValues(ohid, plan.pull(), remote.id());
    }

    RemoteAction action = RemoteAction.NONE;
    String remoteRecordId = remote == null ? null : remote.id();
    Instant remoteModifiedAt = remote == null ? null : remote.modifiedAt();
    if (direction.pushes()) {
      final String leadSource = originSourceSystem(current);
      if (remote == null) {
        final Map<ContactField, String> values = localValues(current);
        final CrmWriteResult created =
            crmGateway.create(new CrmLeadWrite(values, leadSource, ohid.toString()));
        action = RemoteAction.CREATED;
        remoteRecordId = created.id();
        remoteModifiedAt = created.modifiedAt();
      } else if (!plan.push().isEmpty()) {
        final CrmWriteResult updated =
            crmGateway.update(
                remote.id(), new CrmLeadWrite(plan.push(), leadSource, ohid.toString()));
        action = RemoteAction.UPDATED;
        remoteRecordId = updated.id();
        remoteModifiedAt =
            updated.modifiedAt() == null ? remote.modifiedAt() : updated.modifiedAt();
      }
    }

    if (remoteRecordId != null) {
      final Map<ContactField, String> finalRemote =
          finalRemoteValues(remote, current, plan, action);
      syncLinkRepository.upsert(
          new SyncLinkRecord(
              ohid,
              remoteSystem,
              remoteRecordId,
              Instant.now(clock),
              remoteModifiedAt,
              FieldDigests.of(finalRemote)));
    }

    for (FieldConflict conflict : plan.conflicts()) {
      recordConflict(ohid, remoteRecordId, conflict);
    }
    // 別 OHID のキーと衝突して書けなかった項目は取り込み済みに数えない
    final CanonicalIdentity applied = current;
    final List<ContactField> pulled =
        plan.pull().entrySet().stream()
            .filter(entry -> entry.getValue().equals(applied.valueOf(entry.getKey())))
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    final List<ContactField> pushed =
        action == RemoteAction.CREATED
            ? localValues(current).keySet().stream().sorted().toList()
            : plan.push().keySet().stream().sorted().toList();
    final SyncResult result =
        new SyncResult(ohid, direction, remoteRecordId, action, pulled, pushed, plan.conflicts());
    recordCompletion(result);
    logger.info(
        "crm reconcile completed ohid={} direction={} remoteRecordId={} action={} pulled={}"
            + " pushed={} conflicts={}",
        ohid,
        direction,
        remoteRecordId,
        action,
        pulled,
        pushed,
        plan.conflicts().size());
    return result;
  }

  private Optional<CrmLead> search(CanonicalIdentity identity) {
    // 作成前に email → phone の順で既存レコードを探し、重複作成を避ける
    if (identity.email() != null) {
      final Optional<CrmLead> byEmail = crmGateway.searchByEmail(identity.email());
      if (byEmail.isPresent()) {
        return byEmail;
      }
    }
    if (identity.phone() != null) {
      return crmGateway.searchByPhone(identity.phone());
    }
    return Optional.empty();
  }

  private Map<ContactField, String> finalRemoteValues(
      CrmLead remote, CanonicalIdentity current, MergePlan plan, RemoteAction action) {
    if (action == RemoteAction.CREATED) {
      return localValues(current);
    }
    final Map<ContactField, String> values = new EnumMap<>(ContactField.class);
    for (ContactField field : ContactField.values()) {
      final String value = remote == null ? null : remote.valueOf(field);
      if (value != null) {
        values.put(field, value);
      }
    }
    if (action == RemoteAction.UPDATED) {
      values.putAll(plan.push());
    }
    return values;
  }

  private Map<ContactField, String> localValues(CanonicalIdentity identity) {
    final Map<ContactField, String> values = new EnumMap<>(ContactField.class);
    for (ContactField field : ContactField.values()) {
      final String value = identity.valueOf(field);
      if (value != null) {
        values.put(field, value);
      }
    }
    return values;
  }

  private String originSourceSystem(CanonicalIdentity identity) {
    final List<LeadContextRecord> contexts = eventStore.listLeadContexts(identity.ohid());
    if (!contexts.isEmpty()) {
      return contexts.get(0).sourceSystem().name();
    }
    return identity.originSourceSystem();
  }

  private void recordConflict(UUID ohid, String remoteRecordId, FieldConflict conflict) {
    logger.warn(
        "crm sync conflict resolved ohid={} field={} winner={} localChangedAt={}"
            + " remoteModifiedAt={}",
        ohid,
        conflict.field().column(),
        conflict.winner(),
        conflict.localChangedAt(),
        conflict.remoteModifiedAt());
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("field", conflict.field().column());
    payload.put("winner", conflict.winner().name());
    payload.put("local_changed_at", toText(conflict.localChangedAt()));
    payload.put("remote_modified_at", toText(conflict.remoteModifiedAt()));
    payload.put("remote_record_id", remoteRecordId);
    eventStore.append(
        ohid, WorkflowEventTypes.SYNC_CONFLICT_RESOLVED, payload, SourceSystem.ZOHO_CRM.name());
  }

  private void recordCompletion(SyncResult result) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("direction", result.direction().name());
    payload.put("remote_system", remoteSystem);
    payload.put("remote_record_id", result.remoteRecordId());
    payload.put("remote_action", result.remoteAction().name());
    payload.put("pulled_fields", result.pulledFields().stream().map(ContactField::column).toList());
    payload.put("pushed_fields", result.pushedFields().stream().map(ContactField::column).toList());
    payload.put("conflicts", result.conflicts().size());
    eventStore.append(
        result.ohid(),
        WorkflowEventTypes.CRM_SYNC_COMPLETED,
        payload,
        SourceSystem.ZOHO_CRM.name());
  }

  private void recordFailure(UUID ohid, SyncDirection direction, RuntimeException failure) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("direction", direction.name());
    payload.put("remote_system", remoteSystem);
    payload.put("error_type", failure.getClass().getSimpleName());
    payload.put("error_message", String.valueOf(failure.getMessage()));
    try {
      eventStore.append(
          ohid, WorkflowEventTypes.CRM_SYNC_FAILED, payload, SourceSystem.ZOHO_CRM.name());
    } catch (RuntimeException ex) {
      // 記録に失敗しても元の失敗を優先して返す
      failure.addSuppressed(ex);
    }
  }

  private String toText(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
