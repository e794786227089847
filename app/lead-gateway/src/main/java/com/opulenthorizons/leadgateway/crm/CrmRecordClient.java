/*
 * どこで: Lead Gateway CRM 連携
 * 何を: CRM の Leads API (取得/検索/作成/更新) を呼び出すクライアント
 * なぜ: HTTP 失敗を一時障害/認可失敗/恒久失敗に分類し、同期処理から HTTP の詳細を隠すため
 */
package com.opulenthorizons.leadgateway.crm;

import com.opulenthorizons.leadgateway.config.CrmApiProperties;
import com.opulenthorizons.leadgateway.crm.dto.LeadListResponse;
import com.opulenthorizons.leadgateway.crm.dto.LeadRecord;
import com.opulenthorizons.leadgateway.crm.dto.LeadWriteRequest;
import com.opulenthorizons.leadgateway.crm.dto.LeadWriteResponse;
import com.opulenthorizons.leadgateway.model.ContactField;
import com.opulenthorizons.leadgateway.model.ContactInfo;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class CrmRecordClient {

  private static final Logger logger = LoggerFactory.getLogger(CrmRecordClient.class);

  private final RestClient crmRestClient;
  private final CrmApiProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public CrmRecordClient(
      @Qualifier("crmRestClient") RestClient crmRestClient, CrmApiProperties properties) {
    this.crmRestClient = crmRestClient;
    this.properties = properties;
  }

  /** 存在しない id は空を返す。 */
  public Optional<CrmLead> fetch(String accessToken, String recordId) {
    if (isBlank(recordId)) {
      throw new IllegalArgumentException("recordId is required");
    }
    try {
      final ResponseEntity<LeadListResponse> response =
          call(
              "fetch",
              () ->
                  crmRestClient
                      .get()
                      .uri("/{module}/{id}", properties.module(), recordId)
                      .header(HttpHeaders.AUTHORIZATION, authorization(accessToken))
                      .retrieve()
                      .toEntity(LeadListResponse.class));
      return firstLead(response);
    } catch (CrmIntegrationException ex) {
      if (ex.reason() == CrmIntegrationException.Reason.NOT_FOUND) {
        return Optional.empty();
      }
      throw ex;
    }
  }

  public Optional<CrmLead> searchByEmail(String accessToken, String email) {
    return search(accessToken, "email", email);
  }

  public Optional<CrmLead> searchByPhone(String accessToken, String phone) {
    return search(accessToken, "phone", phone);
  }

  public CrmWriteResult create(String accessToken, CrmLeadWrite write) {
    final LeadWriteResponse response =
        call(
            "create",
            () ->
                crmRestClient
                    .post()
                    .uri("/{module}", properties.module())
                    .header(HttpHeaders.AUTHORIZATION, authorization(accessToken))
                    .body(LeadWriteRequest.of(toRecord(null, write)))
                    .retrieve()
                    .body(LeadWriteResponse.class));
    return requireWriteResult("create", response, null);
  }

  public CrmWriteResult update(String accessToken, String recordId, CrmLeadWrite write) {
    if (isBlank(recordId)) {
      throw new IllegalArgumentException("recordId is required");
    }
    final LeadWriteResponse response =
        call(
            "update",
            () ->
                crmRestClient
                    .put()
                    .uri("/{module}/{id}", properties.module(), recordId)
                    .header(HttpHeaders.AUTHORIZATION, authorization(accessToken))
                    .body(LeadWriteRequest.of(toRecord(recordId, write)))
                    .retrieve()
                    .body(LeadWriteResponse.class));
    return requireWriteResult("update", response, recordId);
  }

  private Optional<CrmLead> search(String accessToken, String criterion, String value) {
    if (isBlank(value)) {
      return Optional.empty();
    }
    final ResponseEntity<LeadListResponse> response =
        call(
            "search",
            () ->
                crmRestClient
                    .get()
                    .uri(
                        uriBuilder ->
                            uriBuilder
                                .path("/{module}/search")
                                // 値は変数として渡し、電話番号の + もエンコードさせる
                                .queryParam(criterion, "{value}")
                                .build(properties.module(), value))
                    .header(HttpHeaders.AUTHORIZATION, authorization(accessToken))
                    .retrieve()
                    .toEntity(LeadListResponse.class));
    return firstLead(response);
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (CrmIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("crm {} response parse failed", operation, ex);
      throw new CrmIntegrationException(
          CrmIntegrationException.Reason.INVALID_RESPONSE,
          "crm " + operation + " response parse failed",
          ex);
    }
  }

  private Optional<CrmLead> firstLead(ResponseEntity<LeadListResponse> response) {
    // 該当なしは 204 (本文なし) で返る
    if (response == null || response.getBody() == null) {
      return Optional.empty();
    }
    return response.getBody().data().stream().findFirst().map(this::toLead);
  }

  private CrmWriteResult requireWriteResult(
      String operation, LeadWriteResponse response, String fallbackId) {
    if (response == null || response.data().isEmpty()) {
      throw new CrmIntegrationException(
          CrmIntegrationException.Reason.INVALID_RESPONSE,
          "crm " + operation + " response is empty");
    }
    final LeadWriteResponse.Result result = response.data().get(0);
    if (!result.succeeded()) {
      logger.warn(
          "crm {} rejected code={} message={}", operation, result.code(), result.message());
      throw new CrmIntegrationException(
          CrmIntegrationException.Reason.REJECTED,
          "crm " + operation + " rejected: " + result.code());
    }
    final String id =
        result.details() == null || isBlank(result.details().id())
            ? fallbackId
            : result.details().id();
    if (isBlank(id)) {
      throw new CrmIntegrationException(
          CrmIntegrationException.Reason.INVALID_RESPONSE,
          "crm " + operation + " response has no record id");
    }
    final Instant modifiedAt =
        result.details() == null ? null : toInstant(result.details().modifiedTime());
    return new CrmWriteResult(id, modifiedAt);
  }

  private CrmLead toLead(LeadRecord record) {
    // ローカルの連絡先キーと同じ規則で正規化してから比較に回す
    final ContactInfo contact =
        ContactInfo.of(
            joinName(record.firstName(), record.lastName()), record.email(), record.phone());
    return new CrmLead(
        record.id(),
        contact.name(),
        contact.email(),
        contact.phone(),
        blankToNull(record.leadSource()),
        blankToNull(record.externalId()),
        toInstant(record.modifiedTime()));
  }

  private LeadRecord toRecord(String recordId, CrmLeadWrite write) {
    final String name = write.fields().get(ContactField.NAME);
    String firstName = null;
    String lastName = null;
    if (name != null) {
      // 最後の空白より前を First_Name、残りを Last_Name にする。単語 1 つなら Last_Name のみ。
      final int split = name.lastIndexOf(' ');
      firstName = split < 0 ? "" : name.substring(0, split);
      lastName = split < 0 ? name : name.substring(split + 1);
    }
    return new LeadRecord(
        recordId,
        firstName,
        lastName,
        write.fields().get(ContactField.EMAIL),
        write.fields().get(ContactField.PHONE),
        write.leadSource(),
        write.externalId(),
        null);
  }

  private String joinName(String firstName, String lastName) {
    final String first = blankToNull(firstName);
    final String last = blankToNull(lastName);
    if (first == null) {
      return last;
    }
    return last == null ? first : first + " " + last;
  }

  private String authorization(String accessToken) {
    return properties.authScheme() + " " + accessToken;
  }

  private RuntimeException mapResponseException(
      String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "crm {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 401) {
      return new CrmIntegrationException(
          CrmIntegrationException.Reason.UNAUTHORIZED, "crm rejected access token", ex);
    }
    if (status == 404) {
      return new CrmIntegrationException(
          CrmIntegrationException.Reason.NOT_FOUND, "crm record not found", ex);
    }
    if (status == 429 || ex.getStatusCode().is5xxServerError()) {
      return new TransientRemoteException("crm " + operation + " unavailable status=" + status, ex);
    }
    return new CrmIntegrationException(
        CrmIntegrationException.Reason.REJECTED,
        "crm " + operation + " failed status=" + status,
        ex);
  }

  private TransientRemoteException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("crm {} timed out", operation);
      return new TransientRemoteException("crm " + operation + " timeout", ex);
    }
    logger.warn("crm {} connection failed", operation, ex);
    return new TransientRemoteException("crm " + operation + " connection failed", ex);
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

  private Instant toInstant(OffsetDateTime value) {
    return value == null ? null : value.toInstant();
  }

  private String blankToNull(String value) {
    return isBlank(value) ? null : value;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
