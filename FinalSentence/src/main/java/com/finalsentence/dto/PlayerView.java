package com.finalsentence.dto;

import com.finalsentence.domain.PlayerSnapshot;
import java.util.Locale;

public record PlayerView(
    String id,
    String displayName,
    String avatar,
    String status,
    int errors,
    double wpm,
    double progress,
    boolean connected,
    String reason) {

  public static PlayerView of(PlayerSnapshot p) {
    return new PlayerView(
        p.id(),
        p.displayName(),
        p.avatar(),
        p.status().name().toLowerCase(Locale.ROOT),
        p.errors(),
        p.wpm(),
        p.progress(),
        p.connected(),
        p.eliminationReason() == null
            ? null
            : p.eliminationReason().name().toLowerCase(Locale.ROOT));
  }
}
