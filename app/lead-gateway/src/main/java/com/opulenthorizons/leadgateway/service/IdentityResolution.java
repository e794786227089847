package com.opulenthorizons.leadgateway.service;

import java.util.List;
import java.util.UUID;

/**
 * 同定結果。
 *
 * @param collisions 照合した OHID とは別の OHID が同じ連絡先値を保持していた場合、その OHID
 */
public record IdentityResolution(UUID ohid, Outcome outcome, List<UUID> collisions) {

  public enum Outcome {
    CREATED,
    MATCHED_EMAIL,
    MATCHED_PHONE,
    UNKEYED
  }

  public IdentityResolution {
    collisions = collisions == null ? List.of() : List.copyOf(collisions);
  }

  public boolean created() {
    return outcome == Outcome.CREATED || outcome == Outcome.UNKEYED;
  }
}
