package com.opulenthorizons.leadgateway.crm.token;

import java.util.Optional;

/** リフレッシュトークンの永続化先。ローテーション後の値を再起動後も引き継ぐ。 */
public interface RefreshTokenStore {

  Optional<String> find(String remoteSystem);

  void save(String remoteSystem, String refreshToken);
}
