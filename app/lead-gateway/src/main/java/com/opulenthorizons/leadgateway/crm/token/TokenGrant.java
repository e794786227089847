package com.opulenthorizons.leadgateway.crm.token;

import java.time.Duration;

/**
 * トークンエンドポイントの成功応答。
 *
 * @param refreshToken ローテーションされた場合のみ非 null
 * @param expiresIn 応答に含まれない場合は null
 */
public record TokenGrant(String accessToken, Duration expiresIn, String refreshToken) {

  @Override
  public String toString() {
    return "TokenGrant[expiresIn=" + expiresIn + ", rotated=" + (refreshToken != null) + "]";
  }
}
