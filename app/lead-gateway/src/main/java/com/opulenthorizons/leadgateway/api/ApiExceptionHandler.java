/*
 * どこで: Lead Gateway API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: ツール/Webhook の失敗を種別ごとに一定のステータスとコードで返すため
 */
package com.opulenthorizons.leadgateway.api;

import com.opulenthorizons.leadgateway.crm.CrmIntegrationException;
import com.opulenthorizons.leadgateway.crm.CrmNotConfiguredException;
import com.opulenthorizons.leadgateway.crm.TransientRemoteException;
import com.opulenthorizons.leadgateway.crm.token.CredentialExpiredException;
import com.opulenthorizons.leadgateway.service.IdentityNotFoundException;
import com.opulenthorizons.leadgateway.service.TransientStorageException;
import com.opulenthorizons.leadgateway.tool.UnknownToolException;
import com.opulenthorizons.leadgateway.webhook.WebhookAuthenticationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Comparator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(WebhookAuthenticationException.class)
  public ResponseEntity<ApiErrorResponse> handleWebhookAuthentication(
      WebhookAuthenticationException ex) {
    // 失敗理由の詳細は送信元に返さない
    return error(HttpStatus.UNAUTHORIZED, ApiErrorCode.AUTHENTICATION_FAILURE, "invalid signature");
  }

  @ExceptionHandler(UnknownToolException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownTool(UnknownToolException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.UNKNOWN_TOOL, ex.getMessage());
  }

  @ExceptionHandler(IdentityNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleIdentityNotFound(IdentityNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.IDENTITY_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(TransientStorageException.class)
  public ResponseEntity<ApiErrorResponse> handleTransientStorage(TransientStorageException ex) {
    logger.warn("request failed on storage: {}", ex.getMessage(), ex);
    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiErrorCode.TRANSIENT_STORAGE_ERROR,
        "storage is temporarily unavailable");
  }

  @ExceptionHandler(TransientRemoteException.class)
  public ResponseEntity<ApiErrorResponse> handleTransientRemote(TransientRemoteException ex) {
    logger.warn("request failed on crm: {}", ex.getMessage(), ex);
    return error(HttpStatus.BAD_GATEWAY, ApiErrorCode.TRANSIENT_REMOTE_ERROR, ex.getMessage());
  }

  @ExceptionHandler(CredentialExpiredException.class)
  public ResponseEntity<ApiErrorResponse> handleCredentialExpired(CredentialExpiredException ex) {
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.CREDENTIAL_EXPIRED, ex.getMessage());
  }

  @ExceptionHandler(CrmNotConfiguredException.class)
  public ResponseEntity<ApiErrorResponse> handleCrmNotConfigured(CrmNotConfiguredException ex) {
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.CRM_NOT_CONFIGURED, ex.getMessage());
  }

  @ExceptionHandler(CrmIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleCrmIntegration(CrmIntegrationException ex) {
    logger.warn("crm call failed reason={}: {}", ex.reason(), ex.getMessage());
    return error(
        HttpStatus.BAD_GATEWAY,
        ApiErrorCode.CRM_INTEGRATION_ERROR,
        ex.reason() + ": " + ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    // 複数あっても応答を安定させるため、プロパティ名順で最初の 1 件を返す
    final String message =
        ex.getConstraintViolations().stream()
            .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
