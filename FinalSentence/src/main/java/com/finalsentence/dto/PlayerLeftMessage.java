package com.finalsentence.dto;

public record PlayerLeftMessage(String type, String playerId) implements OutboundMessage {
  public PlayerLeftMessage(String playerId) {
    this("player_left", playerId);
  }
}
