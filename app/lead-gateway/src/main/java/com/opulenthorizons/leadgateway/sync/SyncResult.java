package com.opulenthorizons.leadgateway.sync;

import com.opulenthorizons.leadgateway.model.ContactField;
import com.opulenthorizons.leadgateway.model.SyncDirection;
import java.util.List;
import java.util.UUID;

public record SyncResult(
    UUID ohid,
    SyncDirection direction,
    String remoteRecordId,
    RemoteAction remoteAction,
    List<ContactField> pulledFields,
    List<ContactField> pushedFields,
    List<FieldConflict> conflicts) {

  public SyncResult {
    pulledFields = pulledFields == null ? List.of() : List.copyOf(pulledFields);
    pushedFields = pushedFields == null ? List.of() : List.copyOf(pushedFields);
    conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
  }
}
