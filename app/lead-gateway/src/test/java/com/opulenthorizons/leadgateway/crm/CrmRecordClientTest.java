/*
 * どこで: CrmRecordClient のユニットテスト
 * 何を: Leads API の URL/本文/認可ヘッダと、応答の写像および HTTP 失敗の分類を検証する
 * なぜ: 氏名の分割や該当なし応答の扱いを誤ると、重複作成や値の欠落につながるため
 */
package com.opulenthorizons.leadgateway.crm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

import com.opulenthorizons.leadgateway.config.CrmApiProperties;
import com.opulenthorizons.leadgateway.model.ContactField;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class CrmRecordClientTest {

  private static final String BASE_URL = "http://crm.test/crm/v2";
  private static final String TOKEN = "access-1";

  @Test
  void fetchMapsRecordAndJoinsName() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads/4001"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Zoho-oauthtoken " + TOKEN))
        .andRespond(
            withSuccess(
                "{\"data\":[{\"id\":\"4001\",\"First_Name\":\"Mary Ann\",\"Last_Name\":\"Lee\","
                    + "\"Email\":\"mary@example.com\",\"Phone\":\"\","
                    + "\"Modified_Time\":\"2026-03-01T10:00:00+04:00\"}]}",
                MediaType.APPLICATION_JSON));

    final CrmLead lead = fixture.client().fetch(TOKEN, "4001").orElseThrow();

    assertThat(lead.id()).isEqualTo("4001");
    assertThat(lead.name()).isEqualTo("Mary Ann Lee");
    assertThat(lead.email()).isEqualTo("mary@example.com");
    assertThat(lead.phone()).isNull();
    assertThat(lead.modifiedAt()).isEqualTo(Instant.parse("2026-03-01T06:00:00Z"));
    fixture.server().verify();
  }

  @Test
  void fetchNormalizesContactValuesLikeLocalKeys() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads/4002"))
        .andRespond(
            withSuccess(
                "{\"data\":[{\"id\":\"4002\",\"Last_Name\":\"  Lee  \","
                    + "\"Email\":\" Mary@Example.COM \",\"Phone\":\"+1 555 0100\"}]}",
                MediaType.APPLICATION_JSON));

    final CrmLead lead = fixture.client().fetch(TOKEN, "4002").orElseThrow();

    assertThat(lead.name()).isEqualTo("Lee");
    assertThat(lead.email()).isEqualTo("mary@example.com");
    assertThat(lead.phone()).isEqualTo("+15550100");
  }

  @Test
  void fetchOfMissingRecordIsEmpty() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads/404"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThat(fixture.client().fetch(TOKEN, "404")).isEmpty();
  }

  @Test
  void searchWithoutMatchIsEmpty() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads/search?email=nobody%40example.com"))
        .andRespond(withNoContent());

    final Optional<CrmLead> lead = fixture.client().searchByEmail(TOKEN, "nobody@example.com");

    assertThat(lead).isEmpty();
    fixture.server().verify();
  }

  @Test
  void searchByPhoneReturnsFirstMatch() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads/search?phone=%2B15550100"))
        .andRespond(
            withSuccess(
                "{\"data\":[{\"id\":\"1\",\"Last_Name\":\"Cher\"},{\"id\":\"2\"}]}",
                MediaType.APPLICATION_JSON));

    final CrmLead lead = fixture.client().searchByPhone(TOKEN, "+15550100").orElseThrow();

    assertThat(lead.id()).isEqualTo("1");
    assertThat(lead.name()).isEqualTo("Cher");
  }

  @Test
  void searchWithBlankValueSkipsCall() {
    final ClientFixture fixture = createFixture();

    assertThat(fixture.client().searchByPhone(TOKEN, " ")).isEmpty();
    fixture.server().verify();
  }

  @Test
  void createSplitsNameOnLastSpace() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.data[0].First_Name").value("Mary Ann"))
        .andExpect(jsonPath("$.data[0].Last_Name").value("Lee"))
        .andExpect(jsonPath("$.data[0].Email").value("mary@example.com"))
        .andExpect(jsonPath("$.data[0].Lead_Source").value("WEB"))
        .andExpect(jsonPath("$.data[0].External_Id").value("ohid-1"))
        .andExpect(jsonPath("$.data[0].Phone").doesNotExist())
        .andRespond(
            withSuccess(
                "{\"data\":[{\"code\":\"SUCCESS\",\"status\":\"success\",\"details\":"
                    + "{\"id\":\"5001\",\"Modified_Time\":\"2026-03-02T00:00:00Z\"}}]}",
                MediaType.APPLICATION_JSON));

    final CrmWriteResult result =
        fixture
            .client()
            .create(
                TOKEN,
                new CrmLeadWrite(
                    Map.of(
                        ContactField.NAME, "Mary Ann Lee",
                        ContactField.EMAIL, "mary@example.com"),
                    "WEB",
                    "ohid-1"));

    assertThat(result.id()).isEqualTo("5001");
    assertThat(result.modifiedAt()).isEqualTo(Instant.parse("2026-03-02T00:00:00Z"));
    fixture.server().verify();
  }

  @Test
  void updateSendsOnlyChangedFieldsAndFallsBackToRecordId() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads/4001"))
        .andExpect(method(HttpMethod.PUT))
        .andExpect(jsonPath("$.data[0].id").value("4001"))
        .andExpect(jsonPath("$.data[0].Phone").value("+15550100"))
        .andExpect(jsonPath("$.data[0].Email").doesNotExist())
        .andRespond(
            withSuccess("{\"data\":[{\"code\":\"SUCCESS\"}]}", MediaType.APPLICATION_JSON));

    final CrmWriteResult result =
        fixture
            .client()
            .update(
                TOKEN,
                "4001",
                new CrmLeadWrite(Map.of(ContactField.PHONE, "+15550100"), "WEB", "ohid-1"));

    assertThat(result.id()).isEqualTo("4001");
    assertThat(result.modifiedAt()).isNull();
  }

  @Test
  void rejectedWriteIsReported() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads"))
        .andRespond(
            withSuccess(
                "{\"data\":[{\"code\":\"MANDATORY_NOT_FOUND\",\"message\":\"Last_Name\"}]}",
                MediaType.APPLICATION_JSON));

    assertThatThrownBy(
            () ->
                fixture
                    .client()
                    .create(
                        TOKEN,
                        new CrmLeadWrite(Map.of(ContactField.EMAIL, "a@example.com"), null, null)))
        .isInstanceOfSatisfying(
            CrmIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(CrmIntegrationException.Reason.REJECTED));
  }

  @Test
  void httpFailuresAreClassified() {
    final ClientFixture fixture = createFixture();
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads/1"))
        .andRespond(withUnauthorizedRequest());
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads/2"))
        .andRespond(withStatus(HttpStatus.BAD_GATEWAY));
    fixture
        .server()
        .expect(requestTo(BASE_URL + "/Leads/3"))
        .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

    assertThatThrownBy(() -> fixture.client().fetch(TOKEN, "1"))
        .isInstanceOfSatisfying(
            CrmIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(CrmIntegrationException.Reason.UNAUTHORIZED));
    assertThatThrownBy(() -> fixture.client().fetch(TOKEN, "2"))
        .isInstanceOf(TransientRemoteException.class);
    assertThatThrownBy(() -> fixture.client().fetch(TOKEN, "3"))
        .isInstanceOfSatisfying(
            CrmIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(CrmIntegrationException.Reason.REJECTED));
    fixture.server().verify();
  }

  private ClientFixture createFixture() {
    final RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final CrmApiProperties properties =
        new CrmApiProperties(BASE_URL, "Leads", "Zoho-oauthtoken", "ZOHO_CRM", null, null);
    return new ClientFixture(new CrmRecordClient(builder.build(), properties), server);
  }

  private record ClientFixture(CrmRecordClient client, MockRestServiceServer server) {}
}
