package com.opulenthorizons.leadgateway.sync;

public enum RemoteAction {
  NONE,
  CREATED,
  UPDATED
}
