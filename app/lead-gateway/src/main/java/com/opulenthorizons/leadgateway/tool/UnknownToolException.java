package com.opulenthorizons.leadgateway.tool;

public class UnknownToolException extends RuntimeException {

  public UnknownToolException(String name) {
    super("unknown tool: " + name);
  }
}
