/*
 * どこで: 共通イベント定義
 * 何を: workflow_event.event_type に保存するイベント種別を定義する
 * なぜ: 監査ログと同期の変更フィードで同じ文字列を参照するため
 */
package com.opulenthorizons.common.event;

import java.util.List;

public final class WorkflowEventTypes {
  private WorkflowEventTypes() {}

  public static final String LEAD_INGESTED = "LeadIngested";
  public static final String CALL_RECEIVED = "CallReceived";
  public static final String CALL_COMPLETED = "CallCompleted";
  public static final String NOTION_EVENT = "NotionEvent";
  public static final String IDENTITY_CREATED = "IdentityCreated";
  public static final String IDENTITY_ENRICHED = "IdentityEnriched";
  public static final String IDENTITY_COLLISION_DETECTED = "IdentityCollisionDetected";
  public static final String CRM_INBOUND_APPLIED = "CrmInboundApplied";
  public static final String SYNC_CONFLICT_RESOLVED = "SyncConflictResolved";
  public static final String CRM_SYNC_COMPLETED = "CrmSyncCompleted";
  public static final String CRM_SYNC_FAILED = "CrmSyncFailed";

  /**
   * ローカル起点の属性変更を表すイベント。payload.changed_fields を持つ。
   *
   * <p>CRM からの取り込み ({@link #CRM_INBOUND_APPLIED}) はリモート起点のため含めない。
   */
  public static final List<String> LOCAL_CHANGE_TYPES =
      List.of(IDENTITY_CREATED, IDENTITY_ENRICHED);
}
