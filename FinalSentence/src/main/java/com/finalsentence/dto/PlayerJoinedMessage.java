package com.finalsentence.dto;

public record PlayerJoinedMessage(String type, PlayerView player) implements OutboundMessage {
  public PlayerJoinedMessage(PlayerView player) {
    this("player_joined", player);
  }
}
