/*
 * どこで: Lead Gateway の HTTP 統合テスト
 * 何を: リード取り込み → 通話 Webhook → イベント一覧の流れを、認証と本物の Postgres を通して検証する
 * なぜ: 異なる経路から届いた同じ連絡先が 1 つの OHID にまとまり、再送が二重記録されないことを保証するため
 */
package com.opulenthorizons.leadgateway.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.opulenthorizons.leadgateway.AbstractPostgresContainerTest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class LeadGatewayFlowIntegrationTest extends AbstractPostgresContainerTest {

  private static final String TOOL_KEY = "Bearer test-tool-key";
  private static final String CLOUDTALK_SECRET = "test-cloudtalk-secret";

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM workflow_event", params);
    jdbcTemplate.update("DELETE FROM lead_context", params);
    jdbcTemplate.update("DELETE FROM sync_link", params);
    jdbcTemplate.update("DELETE FROM identity_contact_key", params);
    jdbcTemplate.update("DELETE FROM canonical_identity", params);
  }

  @Test
  void leadAndCallFromSamePhoneShareOneOhid() throws Exception {
    final String lead =
        """
        {"source_system":"web","source_lead_id":"form-42","channel":"web_form",
         "first_name":"Jane","last_name":"Doe","email":"Jane@Example.com",
         "phone":"+1 555 010 0123","marketing_consent":true,"consent_source":"form"}
        """;
    final JsonNode ingested = readJson(callTool("ingest_lead", lead).andExpect(status().isOk()));
    final String ohid = ingested.path("ohid").asText();
    assertThat(ingested.path("status").asText()).isEqualTo("ingested");
    assertThat(ingested.path("identity_outcome").asText()).isEqualTo("CREATED");

    // 同じリードの再送は重複として同じ記録を返す
    callTool("ingest_lead", lead)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("duplicate"))
        .andExpect(jsonPath("$.ohid").value(ohid))
        .andExpect(jsonPath("$.ingest_id").value(ingested.path("ingest_id").asText()));

    final String call =
        """
        {"event_type":"call.ended","call_id":"ct-9","direction":"inbound",
         "from_number":"+15550100123","to_number":"+15550999000"}""";
    postSignedCall(call)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.event_type").value("CallCompleted"))
        .andExpect(jsonPath("$.ohid").value(ohid))
        .andExpect(jsonPath("$.accepted").value(true));
    postSignedCall(call).andExpect(status().isOk()).andExpect(jsonPath("$.accepted").value(false));

    callTool("lookup_ohid", "{\"email\":\"jane@example.com\"}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.found").value(true))
        .andExpect(jsonPath("$.ohid").value(ohid));

    final JsonNode events =
        readJson(
            callTool("list_events", "{\"ohid\":\"" + ohid + "\"}").andExpect(status().isOk()));
    final List<String> types = new ArrayList<>();
    events.path("events").forEach(event -> types.add(event.path("event_type").asText()));
    assertThat(types).containsExactly("IdentityCreated", "LeadIngested", "CallCompleted");
  }

  @Test
  void tamperedWebhookIsRejectedAndNothingIsRecorded() throws Exception {
    final String call =
        """
        {"event_type":"call.ended","call_id":"ct-10","direction":"inbound"}""";

    mockMvc
        .perform(
            post("/webhooks/cloudtalk")
                .header("X-CloudTalk-Signature", sign(call + " "))
                .contentType(MediaType.APPLICATION_JSON)
                .content(call))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("AUTHENTICATION_FAILURE"));

    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM workflow_event", new MapSqlParameterSource(), Integer.class);
    assertThat(count).isZero();
  }

  @Test
  void toolValidationErrorsReturn400() throws Exception {
    callTool("reconcile", "{\"direction\":\"inbound\"}")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("ohid is required"));
    callTool("resolve_identity", "{\"email\":\"a@example.com\",\"source_system\":\"fax\"}")
        .andExpect(status().isBadRequest());
  }

  private ResultActions callTool(String name, String body) throws Exception {
    return mockMvc.perform(
        post("/tools/" + name)
            .header("Authorization", TOOL_KEY)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body));
  }

  private ResultActions postSignedCall(String body) throws Exception {
    return mockMvc.perform(
        post("/webhooks/cloudtalk")
            .header("X-CloudTalk-Signature", sign(body))
            .contentType(MediaType.APPLICATION_JSON)
            .content(body));
  }

  private String sign(String body) {
    return Hashing.hmacSha256(CLOUDTALK_SECRET.getBytes(StandardCharsets.UTF_8))
        .hashString(body, StandardCharsets.UTF_8)
        .toString();
  }

  private JsonNode readJson(ResultActions actions) throws Exception {
    return objectMapper.readTree(actions.andReturn().getResponse().getContentAsString());
  }
}
