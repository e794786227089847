/*
 * どこで: CallEventService のユニットテスト
 * 何を: 通話方向ごとの相手番号の選択、イベント種別の対応付け、再送時の重複排除を検証する
 * なぜ: 発信/着信で別人の OHID に通話履歴が付く回帰を防ぐため
 */
package com.opulenthorizons.leadgateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.opulenthorizons.common.event.WorkflowEventTypes;
import com.opulenthorizons.leadgateway.model.ContactInfo;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import com.opulenthorizons.leadgateway.model.WorkflowEventRecord;
import com.opulenthorizons.leadgateway.tool.request.ProcessCallEventRequest;
import com.opulenthorizons.leadgateway.tool.response.ProcessCallEventResponse;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CallEventServiceTest {

  private static final UUID OHID = UUID.fromString("11111111-2222-3333-4444-555555555555");

  @Mock private IdentityResolver identityResolver;
  @Mock private EventStore eventStore;

  private CallEventService service;

  @BeforeEach
  void setUp() {
    service = new CallEventService(identityResolver, eventStore);
  }

  @Test
  void inboundCallResolvesCallerNumber() {
    when(identityResolver.resolve(any(), eq(SourceSystem.CLOUDTALK)))
        .thenReturn(new IdentityResolution(OHID, IdentityResolution.Outcome.CREATED, List.of()));
    when(eventStore.appendOnce(any(), eq(OHID), any(), anyMap(), eq("CLOUDTALK")))
        .thenAnswer(invocation -> Optional.of(record(invocation.getArgument(0))));

    final ProcessCallEventResponse response =
        service.process(
            new ProcessCallEventRequest(
                "call.ended", "call-1", "incoming", "+1 555 0100", "+15550999", null, null));

    final ArgumentCaptor<ContactInfo> contact = ArgumentCaptor.forClass(ContactInfo.class);
    verify(identityResolver).resolve(contact.capture(), eq(SourceSystem.CLOUDTALK));
    assertThat(contact.getValue().phone()).isEqualTo("+15550100");
    assertThat(response.ohid()).isEqualTo(OHID);
    assertThat(response.eventType()).isEqualTo(WorkflowEventTypes.CALL_COMPLETED);
    assertThat(response.accepted()).isTrue();
    assertThat(response.eventId()).isEqualTo(CallEventService.eventIdFor("call-1", "call.ended"));
  }

  @Test
  void outboundCallResolvesDialedNumber() {
    when(identityResolver.resolve(any(), eq(SourceSystem.CLOUDTALK)))
        .thenReturn(
            new IdentityResolution(OHID, IdentityResolution.Outcome.MATCHED_PHONE, List.of()));
    when(eventStore.appendOnce(any(), eq(OHID), any(), anyMap(), eq("CLOUDTALK")))
        .thenReturn(Optional.empty());

    final ProcessCallEventResponse response =
        service.process(
            new ProcessCallEventRequest(
                "call.started", "call-2", "OUTBOUND", "+15550999", "+15550123", null, null));

    final ArgumentCaptor<ContactInfo> contact = ArgumentCaptor.forClass(ContactInfo.class);
    verify(identityResolver).resolve(contact.capture(), eq(SourceSystem.CLOUDTALK));
    assertThat(contact.getValue().phone()).isEqualTo("+15550123");
    assertThat(response.eventType()).isEqualTo(WorkflowEventTypes.CALL_RECEIVED);
    // 既に記録済みの再送
    assertThat(response.accepted()).isFalse();
  }

  @Test
  void callWithoutCounterpartNumberIsRecordedWithoutOhid() {
    when(eventStore.appendOnce(any(), isNull(), any(), anyMap(), eq("CLOUDTALK")))
        .thenAnswer(invocation -> Optional.of(record(invocation.getArgument(0))));

    final ProcessCallEventResponse response =
        service.process(
            new ProcessCallEventRequest("call.ended", "call-3", "inbound", " ", null, null, null));

    verifyNoInteractions(identityResolver);
    assertThat(response.ohid()).isNull();
    assertThat(response.accepted()).isTrue();
  }

  @Test
  void unknownDirectionIsRejected() {
    assertThatThrownBy(
            () ->
                service.process(
                    new ProcessCallEventRequest(
                        "call.ended", "call-4", "sideways", "+15550100", null, null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("unknown call direction: sideways");
    verifyNoInteractions(eventStore);
  }

  @Test
  void eventIdIsStablePerCallAndProviderEventType() {
    assertThat(CallEventService.eventIdFor("call-1", "call.ended"))
        .isEqualTo(CallEventService.eventIdFor("call-1", "call.ended"))
        .isNotEqualTo(CallEventService.eventIdFor("call-1", "call.started"))
        .isNotEqualTo(CallEventService.eventIdFor("call-2", "call.ended"));
  }

  @Test
  void internalEventTypeMapsRingingToCallReceived() {
    assertThat(CallEventService.internalEventType("CALL.RINGING"))
        .isEqualTo(WorkflowEventTypes.CALL_RECEIVED);
    assertThat(CallEventService.internalEventType("call.recording_ready"))
        .isEqualTo(WorkflowEventTypes.CALL_COMPLETED);
    assertThat(CallEventService.internalEventType(null))
        .isEqualTo(WorkflowEventTypes.CALL_COMPLETED);
  }

  private WorkflowEventRecord record(UUID eventId) {
    return new WorkflowEventRecord(
        eventId,
        1L,
        OHID,
        WorkflowEventTypes.CALL_COMPLETED,
        "{}",
        Instant.parse("2026-02-01T00:00:00Z"),
        "CLOUDTALK");
  }
}
