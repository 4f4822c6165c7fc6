package com.finalsentence.domain;

public enum PlayerStatus {
  CONNECTED,
  PLAYING,
  COMPLETED,
  ELIMINATED;

  /** Completed and Eliminated are final for the current round. */
  public boolean terminal() {
    return this == COMPLETED || this == ELIMINATED;
  }
}
