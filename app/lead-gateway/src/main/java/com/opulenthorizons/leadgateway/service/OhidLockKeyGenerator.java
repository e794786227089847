/*
 * どこで: Lead Gateway サービス補助
 * 何を: OHID から 64-bit advisory lock のキーを生成する
 * なぜ: 同一 OHID へのイベント追記を直列化し、hashtext(32-bit) の衝突による不要な直列化を避けるため
 */
package com.opulenthorizons.leadgateway.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class OhidLockKeyGenerator {

  static final int LOCK_KEY_BYTES = 8;
  // 他用途の advisory lock とキー空間を分ける
  private static final String NAMESPACE = "workflow_event:";

  public long generate(UUID ohid) {
    if (ohid == null) {
      throw new IllegalArgumentException("ohid is required");
    }
    final byte[] hashed = hash(NAMESPACE + ohid);
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String value) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
