package com.finalsentence.dto;

public record RoundStartedMessage(
    String type, String phrase, int durationSeconds, int roundNumber) implements OutboundMessage {
  public RoundStartedMessage(String phrase, int durationSeconds, int roundNumber) {
    this("round_started", phrase, durationSeconds, roundNumber);
  }
}
