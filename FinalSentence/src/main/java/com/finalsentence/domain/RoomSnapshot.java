package com.finalsentence.domain;

import java.time.Instant;
import java.util.List;

/** Immutable copy of a room's visible state, safe to hand to other threads. */
public record RoomSnapshot(
    String id,
    String code,
    RoomKind kind,
    RoomStatus status,
    String hostId,
    int maxPlayers,
    int roundNumber,
    int roundDurationSeconds,
    String phrase,
    Instant roundStartedAt,
    List<PlayerSnapshot> players) {}
