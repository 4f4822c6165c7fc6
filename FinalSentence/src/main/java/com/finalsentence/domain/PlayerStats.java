package com.finalsentence.domain;

public record PlayerStats(
    String playerId,
    String displayName,
    int gamesPlayed,
    int gamesWon,
    double avgWpm,
    double bestWpm,
    int totalErrors) {

  public static PlayerStats empty(String playerId) {
    return new PlayerStats(playerId, "", 0, 0, 0.0, 0.0, 0);
  }
}
