package com.example.focusroom.controller;

import com.example.focusroom.handler.WebSocketEventTransport;
import com.example.focusroom.service.RoomRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final RoomRegistry registry;
  private final WebSocketEventTransport transport;

  @Value("${spring.application.name:focusroom}")
  private String appName = "focusroom";

  @Value("${app.version:1.0.0}")
  private String version = "1.0.0";

  public HealthController(RoomRegistry registry, WebSocketEventTransport transport) {
    this.registry = registry;
    this.transport = transport;
  }

  /** Liveness check, no state touched. */
  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "healthy");
    m.put("service", appName);
    return m;
  }

  @GetMapping("/")
  public Map<String, Object> info() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("name", appName);
    m.put("version", version);
    m.put("rooms", registry.size());
    m.put("connections", transport.connectionCount());
    return m;
  }
}
