package com.finalsentence.interfaces.rest;

import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final int minPlayers;
  private final int maxPlayers;
  private final int roundDurationSeconds;
  private final int maxErrors;
  private final int reconnectGraceSeconds;

  public ConfigController(
      @Value("${finalsentence.min-players:2}") int minPlayers,
      @Value("${finalsentence.max-players:10}") int maxPlayers,
      @Value("${finalsentence.round-duration-seconds:45}") int roundDurationSeconds,
      @Value("${finalsentence.max-errors:3}") int maxErrors,
      @Value("${finalsentence.reconnect-grace-seconds:25}") int reconnectGraceSeconds) {
    this.minPlayers = minPlayers;
    this.maxPlayers = maxPlayers;
    this.roundDurationSeconds = roundDurationSeconds;
    this.maxErrors = maxErrors;
    this.reconnectGraceSeconds = reconnectGraceSeconds;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "minPlayers", minPlayers,
        "maxPlayers", maxPlayers,
        "roundDurationSeconds", roundDurationSeconds,
        "maxErrors", maxErrors,
        "reconnectGraceSeconds", reconnectGraceSeconds,
        "protocolVersion", 1);
  }
}
