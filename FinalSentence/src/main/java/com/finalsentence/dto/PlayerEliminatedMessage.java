package com.finalsentence.dto;

import com.finalsentence.domain.EliminationReason;
import java.util.Locale;

public record PlayerEliminatedMessage(String type, String playerId, String reason)
    implements OutboundMessage {
  public PlayerEliminatedMessage(String playerId, EliminationReason reason) {
    this("player_eliminated", playerId, reason.name().toLowerCase(Locale.ROOT));
  }
}
