package com.finalsentence.dto;

public record PlayerCompletedMessage(String type, String playerId, double wpm)
    implements OutboundMessage {
  public PlayerCompletedMessage(String playerId, double wpm) {
    this("player_completed", playerId, wpm);
  }
}
