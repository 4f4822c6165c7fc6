package com.finalsentence.dto;

import com.finalsentence.domain.RoomSnapshot;
import java.util.List;
import java.util.Locale;

public record RoomStateMessage(
    String type,
    String roomId,
    String code,
    String kind,
    String status,
    String hostId,
    int maxPlayers,
    int roundNumber,
    int roundDurationSeconds,
    String phrase,
    List<PlayerView> players)
    implements OutboundMessage {

  public static RoomStateMessage of(RoomSnapshot s) {
    return new RoomStateMessage(
        "room_state",
        s.id(),
        s.code(),
        s.kind().name().toLowerCase(Locale.ROOT),
        s.status().name().toLowerCase(Locale.ROOT),
        s.hostId(),
        s.maxPlayers(),
        s.roundNumber(),
        s.roundDurationSeconds(),
        s.phrase(),
        s.players().stream().map(PlayerView::of).toList());
  }
}
