package com.opulenthorizons.leadgateway.service;

/** ストレージの一時障害がリトライ上限を超えた。 */
public class TransientStorageException extends RuntimeException {

  public TransientStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
