package com.finalsentence.dto;

import java.util.List;

public record RoundFinishedMessage(
    String type, String winnerId, int roundNumber, List<PlayerView> stats)
    implements OutboundMessage {
  public RoundFinishedMessage(String winnerId, int roundNumber, List<PlayerView> stats) {
    this("round_finished", winnerId, roundNumber, stats);
  }
}
