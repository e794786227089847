/*
 * どこで: Lead Gateway ツール API
 * 何を: 公開するツールを名前と型付き契約で登録する
 * なぜ: 公開面をこの 1 か所で見渡せるようにし、起動時に検証させるため
 */
package com.opulenthorizons.leadgateway.tool;

import com.opulenthorizons.leadgateway.service.CallEventService;
import com.opulenthorizons.leadgateway.service.LeadIngestService;
import com.opulenthorizons.leadgateway.tool.request.GetAccessTokenRequest;
import com.opulenthorizons.leadgateway.tool.request.GetCrmRecordRequest;
import com.opulenthorizons.leadgateway.tool.request.IngestLeadRequest;
import com.opulenthorizons.leadgateway.tool.request.ListEventsRequest;
import com.opulenthorizons.leadgateway.tool.request.LookupOhidRequest;
import com.opulenthorizons.leadgateway.tool.request.ProcessCallEventRequest;
import com.opulenthorizons.leadgateway.tool.request.ReconcileRequest;
import com.opulenthorizons.leadgateway.tool.request.RecordEventRequest;
import com.opulenthorizons.leadgateway.tool.request.ResetCrmCredentialRequest;
import com.opulenthorizons.leadgateway.tool.request.ResolveIdentityRequest;
import com.opulenthorizons.leadgateway.tool.request.VerifySignatureRequest;
import com.opulenthorizons.leadgateway.tool.response.GetAccessTokenResponse;
import com.opulenthorizons.leadgateway.tool.response.GetCrmRecordResponse;
import com.opulenthorizons.leadgateway.tool.response.IngestLeadResponse;
import com.opulenthorizons.leadgateway.tool.response.ListEventsResponse;
import com.opulenthorizons.leadgateway.tool.response.LookupOhidResponse;
import com.opulenthorizons.leadgateway.tool.response.ProcessCallEventResponse;
import com.opulenthorizons.leadgateway.tool.response.ReconcileResponse;
import com.opulenthorizons.leadgateway.tool.response.RecordEventResponse;
import com.opulenthorizons.leadgateway.tool.response.ResetCrmCredentialResponse;
import com.opulenthorizons.leadgateway.tool.response.ResolveIdentityResponse;
import com.opulenthorizons.leadgateway.tool.response.VerifySignatureResponse;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistryConfig {

  @Bean
  ToolRegistry toolRegistry(
      ToolOperations operations,
      LeadIngestService leadIngestService,
      CallEventService callEventService) {
    return new ToolRegistry(
        List.of(
            ToolDefinition.of(
                "resolve_identity",
                "Resolve contact data (name, email, phone) to an OHID, creating one if needed.",
                ResolveIdentityRequest.class,
                ResolveIdentityResponse.class,
                operations::resolveIdentity),
            ToolDefinition.of(
                "record_event",
                "Append a workflow event, optionally bound to an OHID.",
                RecordEventRequest.class,
                RecordEventResponse.class,
                operations::recordEvent),
            ToolDefinition.of(
                "verify_signature",
                "Verify a webhook signature for a configured source.",
                VerifySignatureRequest.class,
                VerifySignatureResponse.class,
                operations::verifySignature),
            ToolDefinition.of(
                "get_access_token",
                "Return a valid CRM access token, refreshing it when needed.",
                GetAccessTokenRequest.class,
                GetAccessTokenResponse.class,
                operations::getAccessToken),
            ToolDefinition.of(
                "reconcile",
                "Synchronize an OHID with its CRM lead (INBOUND, OUTBOUND or BIDIRECTIONAL).",
                ReconcileRequest.class,
                ReconcileResponse.class,
                operations::reconcile),
            ToolDefinition.of(
                "ingest_lead",
                "Ingest a lead: resolve its OHID, store its context and emit LeadIngested.",
                IngestLeadRequest.class,
                IngestLeadResponse.class,
                leadIngestService::ingest),
            ToolDefinition.of(
                "lookup_ohid",
                "Look up an existing OHID by email or phone without creating one.",
                LookupOhidRequest.class,
                LookupOhidResponse.class,
                operations::lookupOhid),
            ToolDefinition.of(
                "list_events",
                "List workflow events of an OHID in occurrence order.",
                ListEventsRequest.class,
                ListEventsResponse.class,
                operations::listEvents),
            ToolDefinition.of(
                "process_call_event",
                "Record a telephony call event and resolve the caller to an OHID.",
                ProcessCallEventRequest.class,
                ProcessCallEventResponse.class,
                callEventService::process),
            ToolDefinition.of(
                "reset_crm_credential",
                "Replace a revoked CRM refresh token and resume token refreshes.",
                ResetCrmCredentialRequest.class,
                ResetCrmCredentialResponse.class,
                operations::resetCrmCredential),
            ToolDefinition.of(
                "get_crm_record",
                "Fetch one CRM lead by record id without synchronizing it.",
                GetCrmRecordRequest.class,
                GetCrmRecordResponse.class,
                operations::getCrmRecord)));
  }
}
