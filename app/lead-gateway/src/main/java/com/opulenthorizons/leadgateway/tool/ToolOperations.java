/*
 * どこで: Lead Gateway ツール API
 * 何を: 各ツールのリクエストをサービス呼び出しに変換し、応答 DTO を組み立てる
 * なぜ: ツール契約 (snake_case の JSON) とドメイン型の変換をサービス層から切り離すため
 */
package com.opulenthorizons.leadgateway.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import com.opulenthorizons.leadgateway.config.CrmApiProperties;
import com.opulenthorizons.leadgateway.config.ToolApiProperties;
import com.opulenthorizons.leadgateway.crm.CrmGateway;
import com.opulenthorizons.leadgateway.crm.token.AccessTokenManager;
import com.opulenthorizons.leadgateway.model.ContactField;
import com.opulenthorizons.leadgateway.model.ContactInfo;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import com.opulenthorizons.leadgateway.model.SyncDirection;
import com.opulenthorizons.leadgateway.model.WorkflowEventRecord;
import com.opulenthorizons.leadgateway.service.EventStore;
import com.opulenthorizons.leadgateway.service.IdentityResolution;
import com.opulenthorizons.leadgateway.service.IdentityResolver;
import com.opulenthorizons.leadgateway.sync.SyncReconciler;
import com.opulenthorizons.leadgateway.sync.SyncResult;
import com.opulenthorizons.leadgateway.tool.request.GetAccessTokenRequest;
import com.opulenthorizons.leadgateway.tool.request.GetCrmRecordRequest;
import com.opulenthorizons.leadgateway.tool.request.ListEventsRequest;
import com.opulenthorizons.leadgateway.tool.request.LookupOhidRequest;
import com.opulenthorizons.leadgateway.tool.request.ReconcileRequest;
import com.opulenthorizons.leadgateway.tool.request.RecordEventRequest;
import com.opulenthorizons.leadgateway.tool.request.ResetCrmCredentialRequest;
import com.opulenthorizons.leadgateway.tool.request.ResolveIdentityRequest;
import com.opulenthorizons.leadgateway.tool.request.VerifySignatureRequest;
import com.opulenthorizons.leadgateway.tool.response.GetAccessTokenResponse;
import com.opulenthorizons.leadgateway.tool.response.GetCrmRecordResponse;
import com.opulenthorizons.leadgateway.tool.response.ListEventsResponse;
import com.opulenthorizons.leadgateway.tool.response.LookupOhidResponse;
import com.opulenthorizons.leadgateway.tool.response.ReconcileResponse;
import com.opulenthorizons.leadgateway.tool.response.RecordEventResponse;
import com.opulenthorizons.leadgateway.tool.response.ResetCrmCredentialResponse;
import com.opulenthorizons.leadgateway.tool.response.ResolveIdentityResponse;
import com.opulenthorizons.leadgateway.tool.response.VerifySignatureResponse;
import com.opulenthorizons.leadgateway.tool.response.WorkflowEventView;
import com.opulenthorizons.leadgateway.webhook.SignatureVerifier;
import com.opulenthorizons.leadgateway.webhook.VerificationResult;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ToolOperations {

  static final int DEFAULT_EVENT_LIMIT = 100;

  private final IdentityResolver identityResolver;
  private final EventStore eventStore;
  private final SignatureVerifier signatureVerifier;
  private final AccessTokenManager accessTokenManager;
  private final SyncReconciler syncReconciler;
  private final CrmGateway crmGateway;
  private final CrmApiProperties crmApiProperties;
  private final ToolApiProperties toolApiProperties;
  private final ObjectMapper objectMapper;

  public ResolveIdentityResponse resolveIdentity(ResolveIdentityRequest request) {
    final SourceSystem source = SourceSystem.parse(request.sourceSystem());
    final IdentityResolution resolution =
        identityResolver.resolve(
            ContactInfo.of(request.name(), request.email(), request.phone()), source);
    return new ResolveIdentityResponse(
        resolution.ohid(),
        resolution.outcome().name(),
        resolution.created(),
        resolution.collisions());
  }

  public RecordEventResponse recordEvent(RecordEventRequest request) {
    final SourceSystem source = SourceSystem.parse(request.sourceSystem());
    if (request.ohid() != null) {
      // 存在しない OHID へのイベントは受け付けない
      identityResolver.findIdentity(request.ohid());
    }
    final WorkflowEventRecord record =
        eventStore.append(request.ohid(), request.eventType(), request.payload(), source.name());
    return new RecordEventResponse(toView(record));
  }

  public VerifySignatureResponse verifySignature(VerifySignatureRequest request) {
    final HttpHeaders headers = new HttpHeaders();
    request.headers().forEach(headers::add);
    final VerificationResult result =
        signatureVerifier.verify(request.source(), headers, body(request));
    return new VerifySignatureResponse(
        request.source(),
        result.isAuthentic(),
        result.status().name(),
        result.reason(),
        result.challenge());
  }

  public GetAccessTokenResponse getAccessToken(GetAccessTokenRequest request) {
    final String token = accessTokenManager.getToken();
    return new GetAccessTokenResponse(
        token,
        crmApiProperties.authScheme(),
        accessTokenManager.state().name(),
        accessTokenManager.expiresAt().orElse(null));
  }

  /** 失効したリフレッシュトークンを差し替え、REVOKED 状態から復帰させる。 */
  public ResetCrmCredentialResponse resetCrmCredential(ResetCrmCredentialRequest request) {
    accessTokenManager.reset(request.refreshToken());
    return new ResetCrmCredentialResponse(
        crmApiProperties.remoteSystem(), accessTokenManager.state().name());
  }

  public ReconcileResponse reconcile(ReconcileRequest request) {
    final SyncResult result =
        syncReconciler.reconcile(request.ohid(), SyncDirection.parse(request.direction()));
    return new ReconcileResponse(
        result.ohid(),
        result.direction().name(),
        result.remoteRecordId(),
        result.remoteAction().name(),
        result.pulledFields().stream().map(ContactField::column).toList(),
        result.pushedFields().stream().map(ContactField::column).toList(),
        result.conflicts().stream()
            .map(
                conflict ->
                    new ReconcileResponse.Conflict(
                        conflict.field().column(),
                        conflict.winner().name(),
                        conflict.localChangedAt(),
                        conflict.remoteModifiedAt()))
            .toList());
  }

  /** CRM のレコードを ID で読む。同期もリンク更新もしない。 */
  public GetCrmRecordResponse getCrmRecord(GetCrmRecordRequest request) {
    final String recordId = request.recordId().trim();
    return crmGateway
        .fetch(recordId)
        .map(GetCrmRecordResponse::found)
        .orElseGet(() -> GetCrmRecordResponse.notFound(recordId));
  }

  public LookupOhidResponse lookupOhid(LookupOhidRequest request) {
    return identityResolver
        .lookup(ContactInfo.of(null, request.email(), request.phone()))
        .map(LookupOhidResponse::found)
        .orElseGet(LookupOhidResponse::notFound);
  }

  public ListEventsResponse listEvents(ListEventsRequest request) {
    identityResolver.findIdentity(request.ohid());
    final int requested = request.limit() == null ? DEFAULT_EVENT_LIMIT : request.limit();
    final int limit = Math.min(requested, toolApiProperties.listEventsMaxLimit());
    final List<WorkflowEventView> events =
        eventStore.listEvents(request.ohid(), limit).stream().map(this::toView).toList();
    return new ListEventsResponse(request.ohid(), events);
  }

  WorkflowEventView toView(WorkflowEventRecord record) {
    try {
      return new WorkflowEventView(
          record.id(),
          record.seq(),
          record.ohid(),
          record.eventType(),
          record.occurredAt(),
          record.sourceSystem(),
          objectMapper.readTree(record.payloadJson()));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored event payload is not JSON: " + record.id(), ex);
    }
  }

  private byte[] body(VerifySignatureRequest request) {
    if (request.bodyHex() != null) {
      try {
        return BaseEncoding.base16()
            .lowerCase()
            .decode(request.bodyHex().trim().toLowerCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("body_hex is not valid hex", ex);
      }
    }
    return request.body() == null ? new byte[0] : request.body().getBytes(StandardCharsets.UTF_8);
  }
}
