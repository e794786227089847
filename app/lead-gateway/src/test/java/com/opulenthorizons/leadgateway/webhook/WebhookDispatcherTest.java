/*
 * どこで: WebhookDispatcher のユニットテスト
 * 何を: 検証結果ごとの振り分けと、不正な Webhook を処理しないことを検証する
 * なぜ: 署名検証を通らない呼び出しでイベントが記録される回帰を防ぐため
 */
package com.opulenthorizons.leadgateway.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opulenthorizons.common.event.WorkflowEventTypes;
import com.opulenthorizons.leadgateway.service.CallEventService;
import com.opulenthorizons.leadgateway.service.NotionEventService;
import com.opulenthorizons.leadgateway.tool.request.ProcessCallEventRequest;
import com.opulenthorizons.leadgateway.tool.response.ProcessCallEventResponse;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

@ExtendWith(MockitoExtension.class)
class WebhookDispatcherTest {

  private static final UUID EVENT_ID = UUID.fromString("cccccccc-0000-0000-0000-000000000003");
  private static final UUID OHID = UUID.fromString("dddddddd-0000-0000-0000-000000000004");

  @Mock private SignatureVerifier signatureVerifier;
  @Mock private CallEventService callEventService;
  @Mock private NotionEventService notionEventService;

  private WebhookDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher =
        new WebhookDispatcher(
            signatureVerifier, callEventService, notionEventService, new ObjectMapper());
  }

  @Test
  void invalidSignatureIsRejectedBeforeProcessing() {
    final byte[] body = bytes("{\"call_id\":\"c-1\"}");
    when(signatureVerifier.verify(eq("cloudtalk"), any(), eq(body)))
        .thenReturn(VerificationResult.invalid("signature mismatch"));

    assertThatThrownBy(() -> dispatcher.dispatch("CloudTalk", new HttpHeaders(), body))
        .isInstanceOf(WebhookAuthenticationException.class)
        .hasMessage("webhook authentication failed: signature mismatch");
    verifyNoInteractions(callEventService, notionEventService);
  }

  @Test
  void challengeIsAnsweredWithoutRecordingEvent() {
    final byte[] body = bytes("{\"verification_token\":\"tok\"}");
    when(signatureVerifier.verify(eq("notion"), any(), eq(body)))
        .thenReturn(VerificationResult.challenge("tok"));

    final WebhookReceipt receipt = dispatcher.dispatch("notion", new HttpHeaders(), body);

    assertThat(receipt.isChallenge()).isTrue();
    assertThat(receipt.challenge()).isEqualTo("tok");
    verifyNoInteractions(notionEventService);
  }

  @Test
  void cloudtalkEventIsMappedToCallEvent() {
    final byte[] body =
        bytes(
            "{\"event\":\"call.ended\",\"id\":\"c-9\",\"direction\":\"inbound\","
                + "\"from\":\"+15550100\",\"to\":\"+15550999\",\"recording_url\":\"https://r/1\"}");
    when(signatureVerifier.verify(eq("cloudtalk"), any(), eq(body)))
        .thenReturn(VerificationResult.valid());
    when(callEventService.process(any()))
        .thenReturn(
            new ProcessCallEventResponse(
                EVENT_ID, WorkflowEventTypes.CALL_COMPLETED, OHID, true));

    final WebhookReceipt receipt = dispatcher.dispatch("cloudtalk", new HttpHeaders(), body);

    final ArgumentCaptor<ProcessCallEventRequest> request =
        ArgumentCaptor.forClass(ProcessCallEventRequest.class);
    verify(callEventService).process(request.capture());
    assertThat(request.getValue().eventType()).isEqualTo("call.ended");
    assertThat(request.getValue().callId()).isEqualTo("c-9");
    assertThat(request.getValue().fromNumber()).isEqualTo("+15550100");
    assertThat(request.getValue().toNumber()).isEqualTo("+15550999");
    assertThat(request.getValue().recordingUrl()).isEqualTo("https://r/1");
    assertThat(request.getValue().raw()).containsEntry("id", "c-9");
    assertThat(receipt.eventId()).isEqualTo(EVENT_ID);
    assertThat(receipt.ohid()).isEqualTo(OHID);
    assertThat(receipt.accepted()).isTrue();
  }

  @Test
  void cloudtalkEventWithoutCallIdIsRejected() {
    final byte[] body = bytes("{\"event_type\":\"call.ended\",\"direction\":\"inbound\"}");
    when(signatureVerifier.verify(eq("cloudtalk"), any(), eq(body)))
        .thenReturn(VerificationResult.valid());

    assertThatThrownBy(() -> dispatcher.dispatch("cloudtalk", new HttpHeaders(), body))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("call event requires event_type and call_id");
    verifyNoInteractions(callEventService);
  }

  @Test
  void notionEventIsRecorded() {
    final byte[] body = bytes("{\"id\":\"n-1\",\"type\":\"page.created\"}");
    when(signatureVerifier.verify(eq("notion"), any(), eq(body)))
        .thenReturn(VerificationResult.valid());
    when(notionEventService.record(any(JsonNode.class)))
        .thenReturn(new NotionEventService.Recorded(EVENT_ID, "page.created", false));

    final WebhookReceipt receipt = dispatcher.dispatch("notion", new HttpHeaders(), body);

    assertThat(receipt.eventType()).isEqualTo(WorkflowEventTypes.NOTION_EVENT);
    assertThat(receipt.accepted()).isFalse();
  }

  @Test
  void verifiedSourceWithoutHandlerIsRejected() {
    final byte[] body = bytes("{}");
    when(signatureVerifier.verify(eq("meta"), any(), eq(body)))
        .thenReturn(VerificationResult.valid());

    assertThatThrownBy(() -> dispatcher.dispatch("meta", new HttpHeaders(), body))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("no handler for webhook source: meta");
  }

  @Test
  void nonJsonBodyIsRejected() {
    final byte[] body = bytes("not json");
    when(signatureVerifier.verify(eq("notion"), any(), eq(body)))
        .thenReturn(VerificationResult.valid());

    assertThatThrownBy(() -> dispatcher.dispatch("notion", new HttpHeaders(), body))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("request body is invalid");
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
