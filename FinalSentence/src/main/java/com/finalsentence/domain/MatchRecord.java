package com.finalsentence.domain;

import java.time.Instant;
import java.util.List;

public record MatchRecord(
    String id,
    String roomId,
    List<PlayerSnapshot> players,
    List<Phrase> phrasesUsed,
    String winnerId,
    int durationSeconds,
    Instant playedAt) {}
