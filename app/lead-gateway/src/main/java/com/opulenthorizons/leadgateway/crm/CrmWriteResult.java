package com.opulenthorizons.leadgateway.crm;

import java.time.Instant;

/** 作成/更新後のレコード id と、応答に含まれていればリモートの更新時刻。 */
public record CrmWriteResult(String id, Instant modifiedAt) {}
