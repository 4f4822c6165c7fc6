package com.finalsentence.domain;

public record PlayerSnapshot(
    String id,
    String displayName,
    String avatar,
    PlayerStatus status,
    int errors,
    double wpm,
    double progress,
    boolean connected,
    EliminationReason eliminationReason) {}
