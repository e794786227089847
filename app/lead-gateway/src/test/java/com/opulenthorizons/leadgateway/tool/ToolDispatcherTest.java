/*
 * どこで: ToolDispatcher のユニットテスト
 * 何を: JSON 本文の型変換、Bean Validation、未知ツールと不正本文の拒否を検証する
 * なぜ: どのツールでも入力エラーが同じ例外で返り、ハンドラに不正な入力が届かないことを保証するため
 */
package com.opulenthorizons.leadgateway.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opulenthorizons.leadgateway.tool.request.ReconcileRequest;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ToolDispatcherTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final List<ReconcileRequest> received = new ArrayList<>();
  private ValidatorFactory validatorFactory;
  private ToolDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    final Validator validator = validatorFactory.getValidator();
    final List<ToolDefinition<?, ?>> definitions = new ArrayList<>();
    for (String name : ToolRegistry.REQUIRED_TOOLS) {
      if (!name.equals("reconcile")) {
        definitions.add(ToolDefinition.of(name, "", String.class, String.class, value -> value));
      }
    }
    definitions.add(
        ToolDefinition.of(
            "reconcile",
            "",
            ReconcileRequest.class,
            String.class,
            request -> {
              received.add(request);
              return "reconciled " + request.direction();
            }));
    dispatcher = new ToolDispatcher(new ToolRegistry(definitions), objectMapper, validator);
  }

  @AfterEach
  void tearDown() {
    validatorFactory.close();
  }

  @Test
  void dispatchBindsSnakeCaseBodyAndInvokesHandler() throws Exception {
    final UUID ohid = UUID.randomUUID();
    final JsonNode body =
        objectMapper.readTree("{\"ohid\":\"" + ohid + "\",\"direction\":\"inbound\"}");

    final Object result = dispatcher.dispatch("reconcile", body);

    assertThat(result).isEqualTo("reconciled inbound");
    assertThat(received).singleElement().extracting(ReconcileRequest::ohid).isEqualTo(ohid);
  }

  @Test
  void dispatchRejectsConstraintViolations() throws Exception {
    final JsonNode body = objectMapper.readTree("{\"direction\":\" \"}");

    assertThatThrownBy(() -> dispatcher.dispatch("reconcile", body))
        .isInstanceOfSatisfying(
            ConstraintViolationException.class,
            ex ->
                assertThat(ex.getConstraintViolations())
                    .extracting(violation -> violation.getMessage())
                    .containsExactlyInAnyOrder("ohid is required", "direction is required"));
    assertThat(received).isEmpty();
  }

  @Test
  void dispatchTreatsMissingBodyAsEmptyObject() {
    assertThatThrownBy(() -> dispatcher.dispatch("reconcile", null))
        .isInstanceOf(ConstraintViolationException.class);
  }

  @Test
  void dispatchRejectsNonObjectAndMistypedBodies() throws Exception {
    final JsonNode array = objectMapper.readTree("[]");
    final JsonNode badUuid = objectMapper.readTree("{\"ohid\":\"not-a-uuid\",\"direction\":\"x\"}");

    assertThatThrownBy(() -> dispatcher.dispatch("reconcile", array))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("request body must be a JSON object");
    assertThatThrownBy(() -> dispatcher.dispatch("reconcile", badUuid))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("request body is invalid for tool reconcile");
  }

  @Test
  void dispatchRejectsUnknownTool() {
    assertThatThrownBy(() -> dispatcher.dispatch("unknown_tool", objectMapper.createObjectNode()))
        .isInstanceOf(UnknownToolException.class);
  }
}
