package io.intellixity.semgate.server.web;

import io.intellixity.semgate.governance.handler.DatabaseHandlerCache;
import io.intellixity.semgate.registry.DatabaseRegistry;
import io.intellixity.semgate.server.service.GatewayTools;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public final class ToolController {
  private final GatewayTools tools;
  private final DatabaseRegistry registry;
  private final DatabaseHandlerCache handlers;

  public ToolController(GatewayTools tools, DatabaseRegistry registry, DatabaseHandlerCache handlers) {
    this.tools = tools;
    this.registry = registry;
    this.handlers = handlers;
  }

  @PostMapping("/databases/{databaseId}/tools/{tool}")
  public Object call(@PathVariable("databaseId") String databaseId,
                     @PathVariable("tool") String tool,
                     @RequestBody(required = false) Map<String, Object> args) {
    return tools.call(databaseId, tool, args);
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("status", "ok");
    out.put("store", registry.storeKind());
    out.put("handlers", handlers.size());
    return out;
  }
}
