package com.finalsentence.dto;

public record PlayerErrorMessage(String type, String playerId, int errorCount)
    implements OutboundMessage {
  public PlayerErrorMessage(String playerId, int errorCount) {
    this("player_error", playerId, errorCount);
  }
}
