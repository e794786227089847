/*
 * どこで: Lead Gateway サービス層
 * 何を: 連絡先 (email/phone) から canonical identity (OHID) を決定し、不足属性を補完する
 * なぜ: 同時取り込みでも連絡先値ごとに OHID を 1 つに保ち、既存の値を上書きしないため
 */
package com.opulenthorizons.leadgateway.service;

import com.opulenthorizons.common.event.WorkflowEventTypes;
import com.opulenthorizons.leadgateway.model.CanonicalIdentity;
import com.opulenthorizons.leadgateway.model.ContactField;
import com.opulenthorizons.leadgateway.model.ContactInfo;
import com.opulenthorizons.leadgateway.model.ContactKeyType;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import com.opulenthorizons.leadgateway.repository.CanonicalIdentityRepository;
import com.opulenthorizons.leadgateway.repository.ContactKeyRepository;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdentityResolver {

  private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);
  static final int MAX_RACE_ATTEMPTS = 3;

  private final CanonicalIdentityRepository identityRepository;
  private final ContactKeyRepository contactKeyRepository;
  private final EventStore eventStore;
  private final StorageTransactions storageTransactions;
  private final LeadGatewayMetrics metrics;
  private final Clock clock;

  /**
   * 連絡先を OHID に解決する。
   *
   * <p>呼び出し元のトランザクション外で呼ぶこと。キー確保の競合に負けた場合はトランザクションごとやり直す。
   */
  public IdentityResolution resolve(@NonNull ContactInfo contact, @NonNull SourceSystem source) {
    for (int attempt = 1; ; attempt++) {
      try {
        final IdentityResolution resolution =
            storageTransactions.execute(
                "resolve_identity", () -> resolveInTransaction(contact, source));
        metrics.recordIdentityResolution(resolution.outcome().name().toLowerCase(Locale.ROOT));
        logger.debug(
            "identity resolved ohid={} outcome={} source={}",
            resolution.ohid(),
            resolution.outcome(),
            source);
        return resolution;
      } catch (ContactKeyRaceException | DuplicateKeyException ex) {
        if (attempt >= MAX_RACE_ATTEMPTS) {
          throw new IllegalStateException("identity resolution did not converge", ex);
        }
        logger.info("identity resolution lost a contact key race; retrying attempt={}", attempt);
      }
    }
  }

  /** 既存の OHID を参照する。新規作成はしない。email 一致を優先する。 */
  public Optional<UUID> lookup(ContactInfo contact) {
    if (contact == null || contact.isKeyless()) {
      throw new IllegalArgumentException("email or phone is required");
    }
    final Optional<UUID> byEmail =
        contactKeyRepository.findOhid(ContactKeyType.EMAIL, contact.email());
    if (byEmail.isPresent()) {
      return byEmail;
    }
    return contactKeyRepository.findOhid(ContactKeyType.PHONE, contact.phone());
  }

  public CanonicalIdentity findIdentity(UUID ohid) {
    if (ohid == null) {
      throw new IllegalArgumentException("ohid is required");
    }
    return identityRepository
        .findByOhid(ohid)
        .orElseThrow(() -> new IdentityNotFoundException(ohid));
  }

  /**
   * CRM から取り込んだ値でローカルの属性を上書きする。
   *
   * <p>値は {@link ContactInfo} と同じ規則で正規化する。email/phone のキーが未確保なら確保し、
   * 別 OHID が保持していればその項目は書き込まず衝突として記録する。
   */
  public CanonicalIdentity applyRemoteValues(
      UUID ohid, Map<ContactField, String> values, String remoteRecordId) {
    final ContactInfo normalized =
        ContactInfo.of(
            values.get(ContactField.NAME),
            values.get(ContactField.EMAIL),
            values.get(ContactField.PHONE));
    if (normalized.name() == null && normalized.isKeyless()) {
      return findIdentity(ohid);
    }
    return storageTransactions.execute(
        "apply_remote_values",
        () -> {
          final Instant now = Instant.now(clock);
          final CanonicalIdentity before =
              identityRepository
                  .findByOhidForUpdate(ohid)
                  .orElseThrow(() -> new IdentityNotFoundException(ohid));
          final Map<UUID, ContactKeyType> collisions = new LinkedHashMap<>();
          claimForExistingIdentity(
              ContactKeyType.EMAIL, normalized.email(), ohid, collisions, now);
          claimForExistingIdentity(
              ContactKeyType.PHONE, normalized.phone(), ohid, collisions, now);
          // 別 OHID のキーになっている値は属性にも書かない
          final ContactInfo applicable =
              ContactInfo.of(
                  normalized.name(),
                  collisions.containsValue(ContactKeyType.EMAIL) ? null : normalized.email(),
                  collisions.containsValue(ContactKeyType.PHONE) ? null : normalized.phone());
          final List<ContactField> changed = new ArrayList<>();
          for (ContactField field : ContactField.values()) {
            final String value = applicable.valueOf(field);
            if (value != null && !value.equals(before.valueOf(field))) {
              changed.add(field);
            }
          }
          CanonicalIdentity updated = before;
          if (!changed.isEmpty()) {
            updated =
                identityRepository
                    .overwrite(
                        ohid, applicable.name(), applicable.email(), applicable.phone(), now)
                    .orElseThrow(() -> new IdentityNotFoundException(ohid));
            final Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("changed_fields", changed.stream().map(ContactField::column).toList());
            payload.put("remote_record_id", remoteRecordId);
            eventStore.append(
                ohid,
                WorkflowEventTypes.CRM_INBOUND_APPLIED,
                payload,
                SourceSystem.ZOHO_CRM.name());
          }
          recordCollisions(ohid, collisions, SourceSystem.ZOHO_CRM);
          return updated;
        });
  }

  static UUID candidateOhid(ContactInfo contact) {
    // 同じ連絡先を同時に新規作成しても同じ OHID になるよう、連絡先値から決定的に導出する
    final String seed =
        contact.hasEmail() ? "email:" + contact.email() : "phone:" + contact.phone();
    return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
  }

  private IdentityResolution resolveInTransaction(ContactInfo contact, SourceSystem source) {
    final Instant now = Instant.now(clock);
    if (contact.isKeyless()) {
      final UUID ohid = UUID.randomUUID();
      identityRepository.insertIfAbsent(
          new CanonicalIdentity(ohid, contact.name(), null, null, source.name(), now, now));
      appendChange(ohid, WorkflowEventTypes.IDENTITY_CREATED, presentFields(contact), source);
      return new IdentityResolution(ohid, IdentityResolution.Outcome.UNKEYED, List.of());
    }
    final Optional<UUID> byEmail =
        contactKeyRepository.findOhid(ContactKeyType.EMAIL, contact.email());
    final Optional<UUID> byPhone =
        contactKeyRepository.findOhid(ContactKeyType.PHONE, contact.phone());
    if (byEmail.isPresent()) {
      final Map<UUID, ContactKeyType> collisions = new LinkedHashMap<>();
      // email と phone が別の OHID を指す場合は email を優先し、phone 側は変更せず記録だけ残す
      byPhone
          .filter(owner -> !owner.equals(byEmail.get()))
          .ifPresent(owner -> collisions.put(owner, ContactKeyType.PHONE));
      return enrich(
          byEmail.get(),
          IdentityResolution.Outcome.MATCHED_EMAIL,
          contact,
          source,
          collisions,
          now);
    }
    if (byPhone.isPresent()) {
      return enrich(
          byPhone.get(),
          IdentityResolution.Outcome.MATCHED_PHONE,
          contact,
          source,
          new LinkedHashMap<>(),
          now);
    }
    return create(contact, source, now);
  }

  private IdentityResolution create(ContactInfo contact, SourceSystem source, Instant now) {
    final UUID candidate = candidateOhid(contact);
    final int inserted =
        identityRepository.insertIfAbsent(
            new CanonicalIdentity(
                candidate,
                contact.name(),
                contact.email(),
                contact.phone(),
                source.name(),
                now,
                now));
    if (inserted == 0) {
      // 同じ連絡先の同時作成が先にコミットされた。勝者を照合結果として扱う
      final IdentityResolution.Outcome outcome =
          contact.hasEmail()
              ? IdentityResolution.Outcome.MATCHED_EMAIL
              : IdentityResolution.Outcome.MATCHED_PHONE;
      return enrich(candidate, outcome, contact, source, new LinkedHashMap<>(), now);
    }
    claimForNewIdentity(ContactKeyType.EMAIL, contact.email(), candidate, now);
    claimForNewIdentity(ContactKeyType.PHONE, contact.phone(), candidate, now);
    appendChange(candidate, WorkflowEventTypes.IDENTITY_CREATED, presentFields(contact), source);
    logger.info("identity created ohid={} source={}", candidate, source);
    return new IdentityResolution(candidate, IdentityResolution.Outcome.CREATED, List.of());
  }

  private void claimForNewIdentity(
      ContactKeyType keyType, String keyValue, UUID candidate, Instant now) {
    if (keyValue == null || contactKeyRepository.claimIfAbsent(keyType, keyValue, candidate, now)) {
      return;
    }
    final Optional<UUID> owner = contactKeyRepository.findOhid(keyType, keyValue);
    if (owner.isPresent() && !owner.get().equals(candidate)) {
      // 別の OHID が先にキーを確保した。ロールバックして既存 OHID への照合からやり直す
      throw new ContactKeyRaceException(keyType, owner.get());
    }
  }

  private IdentityResolution enrich(
      UUID ohid,
      IdentityResolution.Outcome outcome,
      ContactInfo contact,
      SourceSystem source,
      Map<UUID, ContactKeyType> collisions,
      Instant now) {
    final CanonicalIdentity before =
        identityRepository
            .findByOhidForUpdate(ohid)
            .orElseThrow(
                () -> new IllegalStateException("contact key points to missing identity " + ohid));
    claimForExistingIdentity(ContactKeyType.EMAIL, contact.email(), ohid, collisions, now);
    claimForExistingIdentity(ContactKeyType.PHONE, contact.phone(), ohid, collisions, now);
    // 衝突した値も属性には補完する。キーは元の OHID のまま動かさない
    final List<ContactField> changed = new ArrayList<>();
    for (ContactField field : ContactField.values()) {
      if (before.valueOf(field) == null && contact.valueOf(field) != null) {
        changed.add(field);
      }
    }
    if (!changed.isEmpty()) {
      identityRepository.fillMissing(
          ohid, contact.name(), contact.email(), contact.phone(), now);
      appendChange(ohid, WorkflowEventTypes.IDENTITY_ENRICHED, changed, source);
    }
    recordCollisions(ohid, collisions, source);
    return new IdentityResolution(ohid, outcome, List.copyOf(collisions.keySet()));
  }

  private void recordCollisions(
      UUID ohid, Map<UUID, ContactKeyType> collisions, SourceSystem source) {
    collisions.forEach(
        (conflicting, keyType) -> {
          logger.warn(
              "identity collision detected ohid={} conflictingOhid={} keyType={}",
              ohid,
              conflicting,
              keyType);
          final Map<String, Object> payload = new LinkedHashMap<>();
          payload.put("ohid", ohid.toString());
          payload.put("conflicting_ohid", conflicting.toString());
          payload.put("key_type", keyType.name());
          payload.put("source_system", source.name());
          eventStore.append(
              ohid, WorkflowEventTypes.IDENTITY_COLLISION_DETECTED, payload, source.name());
        });
  }

  private void claimForExistingIdentity(
      ContactKeyType keyType,
      String keyValue,
      UUID ohid,
      Map<UUID, ContactKeyType> collisions,
      Instant now) {
    if (keyValue == null || contactKeyRepository.claimIfAbsent(keyType, keyValue, ohid, now)) {
      return;
    }
    contactKeyRepository
        .findOhid(keyType, keyValue)
        .filter(owner -> !owner.equals(ohid))
        .ifPresent(owner -> collisions.putIfAbsent(owner, keyType));
  }

  private void appendChange(
      UUID ohid, String eventType, List<ContactField> changed, SourceSystem source) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("changed_fields", changed.stream().map(ContactField::column).toList());
    payload.put("source_system", source.name());
    eventStore.append(ohid, eventType, payload, source.name());
  }

  private List<ContactField> presentFields(ContactInfo contact) {
    final List<ContactField> fields = new ArrayList<>();
    for (ContactField field : ContactField.values()) {
      if (contact.valueOf(field) != null) {
        fields.add(field);
      }
    }
    return fields;
  }

  /** キー確保の競合に負けたことを示す。トランザクションをロールバックさせるために投げる。 */
  static final class ContactKeyRaceException extends RuntimeException {

    ContactKeyRaceException(ContactKeyType keyType, UUID owner) {
      super("contact key " + keyType + " already claimed by " + owner);
    }
  }
}
