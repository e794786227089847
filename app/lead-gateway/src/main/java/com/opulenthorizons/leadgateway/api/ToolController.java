/*
 * どこで: Lead Gateway API
 * 何を: ツールの一覧と呼び出しのエンドポイントを提供する
 * なぜ: エージェントやワークフローから同じ契約で各操作を呼べるようにするため
 */
package com.opulenthorizons.leadgateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.opulenthorizons.leadgateway.tool.ToolDispatcher;
import com.opulenthorizons.leadgateway.tool.ToolRegistry;
import com.opulenthorizons.leadgateway.tool.response.ToolDescriptor;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tools")
@RequiredArgsConstructor
public class ToolController {

  private final ToolRegistry toolRegistry;
  private final ToolDispatcher toolDispatcher;

  @GetMapping
  public List<ToolDescriptor> list() {
    return toolRegistry.definitions().stream()
        .map(
            definition ->
                new ToolDescriptor(
                    definition.name(),
                    definition.description(),
                    definition.requestType().getSimpleName(),
                    definition.responseType().getSimpleName()))
        .toList();
  }

  @PostMapping("/{name}")
  public ResponseEntity<Object> invoke(
      @PathVariable("name") String name, @RequestBody(required = false) JsonNode body) {
    return ResponseEntity.ok(toolDispatcher.dispatch(name, body));
  }
}
