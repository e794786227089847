/*
 * どこで: SyncLinkRepository の統合テスト
 * 何を: sync_link の upsert/参照/削除とダイジェストの往復を検証する
 * なぜ: 前回同期時点のリモート値を失うと衝突判定が壊れるため
 */
package com.opulenthorizons.leadgateway.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.opulenthorizons.leadgateway.AbstractPostgresContainerTest;
import com.opulenthorizons.leadgateway.model.CanonicalIdentity;
import com.opulenthorizons.leadgateway.model.ContactField;
import com.opulenthorizons.leadgateway.model.SyncLinkRecord;
import com.opulenthorizons.leadgateway.sync.FieldDigests;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SyncLinkRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");
  private static final String REMOTE_SYSTEM = "ZOHO_CRM";

  @Autowired private SyncLinkRepository syncLinkRepository;
  @Autowired private CanonicalIdentityRepository identityRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private UUID ohid;

  @BeforeEach
  void setUp() {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM sync_link", params);
    jdbcTemplate.update("DELETE FROM identity_contact_key", params);
    jdbcTemplate.update("DELETE FROM canonical_identity", params);
    ohid = UUID.randomUUID();
    identityRepository.insertIfAbsent(
        new CanonicalIdentity(ohid, "Jane", null, null, "WEB", BASE_TIME, BASE_TIME));
  }

  @Test
  void upsertStoresAndReplacesLink() {
    syncLinkRepository.upsert(
        new SyncLinkRecord(
            ohid,
            REMOTE_SYSTEM,
            "rec-1",
            BASE_TIME,
            null,
            FieldDigests.of(Map.of(ContactField.NAME, "Jane"))));
    syncLinkRepository.upsert(
        new SyncLinkRecord(
            ohid,
            REMOTE_SYSTEM,
            "rec-2",
            BASE_TIME.plusSeconds(60),
            BASE_TIME.plusSeconds(30),
            FieldDigests.of(
                Map.of(ContactField.NAME, "Jane Doe", ContactField.EMAIL, "jane@example.com"))));

    final SyncLinkRecord link = syncLinkRepository.find(ohid, REMOTE_SYSTEM).orElseThrow();

    assertThat(link.remoteRecordId()).isEqualTo("rec-2");
    assertThat(link.lastSyncedAt()).isEqualTo(BASE_TIME.plusSeconds(60));
    assertThat(link.remoteModifiedAt()).isEqualTo(BASE_TIME.plusSeconds(30));
    assertThat(link.remoteFieldDigests())
        .containsEntry(ContactField.NAME, FieldDigests.digest("Jane Doe"))
        .containsEntry(ContactField.EMAIL, FieldDigests.digest("jane@example.com"))
        .doesNotContainKey(ContactField.PHONE);
  }

  @Test
  void deleteRemovesLink() {
    syncLinkRepository.upsert(
        new SyncLinkRecord(ohid, REMOTE_SYSTEM, "rec-1", BASE_TIME, null, Map.of()));

    assertThat(syncLinkRepository.delete(ohid, REMOTE_SYSTEM)).isEqualTo(1);
    assertThat(syncLinkRepository.find(ohid, REMOTE_SYSTEM)).isEmpty();
  }

  @Test
  void findIsScopedByRemoteSystem() {
    syncLinkRepository.upsert(
        new SyncLinkRecord(ohid, REMOTE_SYSTEM, "rec-1", BASE_TIME, null, Map.of()));

    assertThat(syncLinkRepository.find(ohid, "OTHER_CRM")).isEmpty();
  }
}
