package com.opulenthorizons.leadgateway.crm.token;

public enum TokenState {
  UNLOADED,
  VALID,
  EXPIRING_SOON,
  REFRESHING,
  INVALIDATED,
  REVOKED
}
