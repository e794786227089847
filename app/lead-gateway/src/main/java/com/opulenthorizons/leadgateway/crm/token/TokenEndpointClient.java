/*
 * どこで: Lead Gateway トークン管理
 * 何を: OAuth2 トークンエンドポイントへ refresh_token グラントを送る
 * なぜ: HTTP 失敗を一時障害/資格情報失効/応答不正に分類して上位へ渡すため
 */
package com.opulenthorizons.leadgateway.crm.token;

import com.opulenthorizons.leadgateway.config.CrmOAuthProperties;
import com.opulenthorizons.leadgateway.crm.CrmIntegrationException;
import com.opulenthorizons.leadgateway.crm.TransientRemoteException;
import com.opulenthorizons.leadgateway.crm.dto.TokenEndpointResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class TokenEndpointClient {

  private static final Logger logger = LoggerFactory.getLogger(TokenEndpointClient.class);

  private final RestClient crmTokenRestClient;
  private final CrmOAuthProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public TokenEndpointClient(
      @Qualifier("crmTokenRestClient") RestClient crmTokenRestClient,
      CrmOAuthProperties properties) {
    this.crmTokenRestClient = crmTokenRestClient;
    this.properties = properties;
  }

  public TokenGrant refresh(String refreshToken) {
    if (refreshToken == null || refreshToken.isBlank()) {
      throw new IllegalArgumentException("refreshToken is required");
    }
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("refresh_token", refreshToken);
    form.add("client_id", properties.clientId());
    form.add("client_secret", properties.clientSecret());
    form.add("grant_type", "refresh_token");
    final TokenEndpointResponse response;
    try {
      response =
          crmTokenRestClient
              .post()
              .uri(properties.tokenUrl())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(TokenEndpointResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (RuntimeException ex) {
      logger.warn("token endpoint response parse failed", ex);
      throw new CrmIntegrationException(
          CrmIntegrationException.Reason.INVALID_RESPONSE, "token response parse failed", ex);
    }
    return toGrant(response);
  }

  private TokenGrant toGrant(TokenEndpointResponse response) {
    if (response == null) {
      throw new CrmIntegrationException(
          CrmIntegrationException.Reason.INVALID_RESPONSE, "token response is empty");
    }
    if (!isBlank(response.error())) {
      // 200 で error を返すプロバイダは資格情報の不備 (invalid_code など) を意味する
      logger.error("token endpoint rejected refresh credential error={}", response.error());
      throw new CredentialExpiredException("refresh credential rejected: " + response.error());
    }
    if (isBlank(response.accessToken())) {
      throw new CrmIntegrationException(
          CrmIntegrationException.Reason.INVALID_RESPONSE, "token response has no access_token");
    }
    final Duration expiresIn =
        response.expiresIn() == null || response.expiresIn() <= 0
            ? null
            : Duration.ofSeconds(response.expiresIn());
    final String rotated = isBlank(response.refreshToken()) ? null : response.refreshToken();
    return new TokenGrant(response.accessToken(), expiresIn, rotated);
  }

  private RuntimeException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "token endpoint failed with http status={} statusText={}", status, ex.getStatusText());
    if (status == 400 || status == 401) {
      return new CredentialExpiredException("refresh credential rejected status=" + status, ex);
    }
    if (status == 429 || ex.getStatusCode().is5xxServerError()) {
      return new TransientRemoteException("token endpoint unavailable status=" + status, ex);
    }
    return new CrmIntegrationException(
        CrmIntegrationException.Reason.REJECTED, "token request failed status=" + status, ex);
  }

  private TransientRemoteException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("token endpoint timed out");
      return new TransientRemoteException("token request timeout", ex);
    }
    logger.warn("token endpoint connection failed", ex);
    return new TransientRemoteException("token endpoint connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
