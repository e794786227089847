/*
 * どこで: Lead Gateway ツール API
 * 何を: ツール名からツール定義を引く明示的なレジストリ
 * なぜ: 名前の重複や必須ツールの欠落を起動時に検出するため
 */
package com.opulenthorizons.leadgateway.tool;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ToolRegistry {

  /** 呼び出し側に公開を約束しているツール。欠けていれば起動させない。 */
  public static final List<String> REQUIRED_TOOLS =
      List.of(
          "resolve_identity", "record_event", "verify_signature", "get_access_token", "reconcile");

  private final Map<String, ToolDefinition<?, ?>> definitions;
  private final List<String> order;

  public ToolRegistry(List<ToolDefinition<?, ?>> definitions) {
    final Map<String, ToolDefinition<?, ?>> byName = new LinkedHashMap<>();
    for (ToolDefinition<?, ?> definition : definitions) {
      validate(definition);
      if (byName.putIfAbsent(definition.name(), definition) != null) {
        throw new IllegalStateException("duplicate tool name: " + definition.name());
      }
    }
    for (String required : REQUIRED_TOOLS) {
      if (!byName.containsKey(required)) {
        throw new IllegalStateException("required tool is not registered: " + required);
      }
    }
    this.definitions = Map.copyOf(byName);
    this.order = List.copyOf(byName.keySet());
  }

  public Optional<ToolDefinition<?, ?>> find(String name) {
    return Optional.ofNullable(definitions.get(name));
  }

  public ToolDefinition<?, ?> require(String name) {
    return find(name).orElseThrow(() -> new UnknownToolException(name));
  }

  /** 登録順に返す。 */
  public Collection<ToolDefinition<?, ?>> definitions() {
    return order.stream().<ToolDefinition<?, ?>>map(definitions::get).toList();
  }

  private static void validate(ToolDefinition<?, ?> definition) {
    if (definition == null) {
      throw new IllegalStateException("tool definition must not be null");
    }
    if (definition.name() == null || !definition.name().matches("[a-z][a-z0-9_]*")) {
      throw new IllegalStateException("invalid tool name: " + definition.name());
    }
    if (definition.requestType() == null
        || definition.responseType() == null
        || definition.handler() == null) {
      throw new IllegalStateException("tool " + definition.name() + " is missing its contract");
    }
  }
}
