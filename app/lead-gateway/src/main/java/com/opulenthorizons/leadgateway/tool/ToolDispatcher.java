/*
 * どこで: Lead Gateway ツール API
 * 何を: JSON のリクエストをツールの型へ変換・検証してハンドラを呼ぶ
 * なぜ: すべてのツールで入力エラーを同じ 400 応答にそろえるため
 */
package com.opulenthorizons.leadgateway.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ToolDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);

  private final ToolRegistry toolRegistry;
  private final ObjectMapper objectMapper;
  private final Validator validator;

  public Object dispatch(String name, JsonNode body) {
    final ToolDefinition<?, ?> definition = toolRegistry.require(name);
    final Object request = bind(definition, body);
    final Set<ConstraintViolation<Object>> violations = validator.validate(request);
    if (!violations.isEmpty()) {
      throw new ConstraintViolationException(violations);
    }
    logger.debug("invoking tool name={}", name);
    return definition.invoke(request);
  }

  private Object bind(ToolDefinition<?, ?> definition, JsonNode body) {
    final JsonNode source =
        body == null || body.isNull() || body.isMissingNode()
            ? objectMapper.createObjectNode()
            : body;
    if (!source.isObject()) {
      throw new IllegalArgumentException("request body must be a JSON object");
    }
    try {
      return objectMapper.treeToValue(source, definition.requestType());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException(
          "request body is invalid for tool " + definition.name(), ex);
    }
  }
}
