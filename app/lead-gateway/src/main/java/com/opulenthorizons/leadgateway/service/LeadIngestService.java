/*
 * どこで: Lead Gateway サービス層
 * 何を: リード 1 件を OHID に解決し、lead_context と LeadIngested イベントを記録する
 * なぜ: 同じリードの再送でも lead_context とイベントを 1 件に保つため
 */
package com.opulenthorizons.leadgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opulenthorizons.common.event.WorkflowEventTypes;
import com.opulenthorizons.leadgateway.model.ContactInfo;
import com.opulenthorizons.leadgateway.model.LeadChannel;
import com.opulenthorizons.leadgateway.model.LeadContextRecord;
import com.opulenthorizons.leadgateway.model.SourceSystem;
import com.opulenthorizons.leadgateway.tool.request.IngestLeadRequest;
import com.opulenthorizons.leadgateway.tool.response.IngestLeadResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LeadIngestService {

  private static final Logger logger = LoggerFactory.getLogger(LeadIngestService.class);
  static final String STATUS_INGESTED = "ingested";
  static final String STATUS_DUPLICATE = "duplicate";

  private final IdentityResolver identityResolver;
  private final EventStore eventStore;
  private final StorageTransactions storageTransactions;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public IngestLeadResponse ingest(IngestLeadRequest request) {
    final SourceSystem source = SourceSystem.parse(request.sourceSystem());
    final LeadChannel channel = LeadChannel.parse(request.channel());

    final LeadContextRecord existing =
        eventStore.findLeadContext(source, request.sourceLeadId()).orElse(null);
    if (existing != null) {
      logger.info(
          "lead already ingested source={} sourceLeadId={} ohid={}",
          source,
          request.sourceLeadId(),
          existing.ohid());
      return duplicate(existing, null);
    }

    final ContactInfo contact =
        ContactInfo.of(request.fullName(), request.email(), request.phone());
    // 同定は独立したトランザクションで確定させ、その後に記録する
    final IdentityResolution resolution = identityResolver.resolve(contact, source);
    final Instant now = Instant.now(clock);
    final UUID ingestId = UUID.randomUUID();
    final Map<String, Object> leadPayload = leadPayload(request, contact, source, channel, now);
    final LeadContextRecord record =
        new LeadContextRecord(
            ingestId,
            resolution.ohid(),
            source,
            request.sourceLeadId(),
            channel,
            toJson(leadPayload),
            toJson(consent(request, now)),
            now);

    final boolean inserted =
        storageTransactions.execute(
            "ingest_lead",
            () -> {
              if (!eventStore.recordLeadContext(record)) {
                return false;
              }
              final Map<String, Object> event = new LinkedHashMap<>();
              event.put("ingest_id", ingestId.toString());
              event.put("ohid", resolution.ohid().toString());
              event.put("lead_ingest", leadPayload);
              eventStore.appendOnce(
                  ingestId,
                  resolution.ohid(),
                  WorkflowEventTypes.LEAD_INGESTED,
                  event,
                  source.name());
              return true;
            });
    if (!inserted) {
      // 同時に届いた同じリードに負けた。勝者の記録を返す
      final LeadContextRecord winner =
          eventStore
              .findLeadContext(source, request.sourceLeadId())
              .orElseThrow(
                  () ->
                      new IllegalStateException(
                          "lead context vanished: " + request.sourceLeadId()));
      return duplicate(winner, resolution);
    }

    logger.info(
        "lead ingested ohid={} ingestId={} source={} channel={} outcome={}",
        resolution.ohid(),
        ingestId,
        source,
        channel,
        resolution.outcome());
    return new IngestLeadResponse(
        resolution.ohid(), ingestId, source.name(), STATUS_INGESTED, resolution.outcome().name());
  }

  private IngestLeadResponse duplicate(LeadContextRecord existing, IdentityResolution resolution) {
    return new IngestLeadResponse(
        existing.ohid(),
        existing.id(),
        existing.sourceSystem().name(),
        STATUS_DUPLICATE,
        resolution == null ? null : resolution.outcome().name());
  }

  private Map<String, Object> leadPayload(
      IngestLeadRequest request,
      ContactInfo contact,
      SourceSystem source,
      LeadChannel channel,
      Instant now) {
    final Map<String, Object> person = new LinkedHashMap<>();
    person.put("first_name", request.firstName());
    person.put("last_name", request.lastName());
    // payload の email/phone 索引と連絡先キーを同じ正規化で揃える
    person.put("email", contact.email());
    person.put("phone", contact.phone());

    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("source_system", source.name());
    payload.put("source_lead_id", request.sourceLeadId());
    payload.put("channel", channel.name());
    payload.put("person", person);
    if (request.hasLeadDetails()) {
      final Map<String, Object> details = new LinkedHashMap<>();
      details.put("budget_range", request.budgetRange());
      details.put("location", request.location());
      details.put("property_type", request.propertyType());
      details.put("free_text", request.freeText());
      payload.put("lead_details", details);
    } else {
      payload.put("lead_details", null);
    }
    payload.put("consent", consent(request, now));
    payload.put("raw_payload", request.rawPayload());
    payload.put("timestamp", now.toString());
    return payload;
  }

  private Map<String, Object> consent(IngestLeadRequest request, Instant now) {
    final Map<String, Object> consent = new LinkedHashMap<>();
    consent.put("marketing", request.marketingConsent());
    consent.put("source", request.consentSource());
    consent.put("timestamp", now.toString());
    return consent;
  }

  private String toJson(Map<String, Object> value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("lead payload is not serializable", ex);
    }
  }
}
