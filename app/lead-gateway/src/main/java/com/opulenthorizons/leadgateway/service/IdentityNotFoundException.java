package com.opulenthorizons.leadgateway.service;

import java.util.UUID;

public class IdentityNotFoundException extends RuntimeException {

  public IdentityNotFoundException(UUID ohid) {
    super("identity not found: " + ohid);
  }
}
