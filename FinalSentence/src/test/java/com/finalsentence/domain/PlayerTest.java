package com.finalsentence.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlayerTest {
  private Player p;

  @BeforeEach
  void setUp() {
    p = new Player("p1", "Ana");
    p.resetForRound();
  }

  @Test
  void newPlayerIsConnectedAndNotInContention() {
    Player fresh = new Player("p2", "Bo");
    assertThat(fresh.status()).isEqualTo(PlayerStatus.CONNECTED);
    assertThat(fresh.connected()).isTrue();
    assertThat(fresh.playing()).isFalse();
  }

  @Test
  void completeSetsFullProgressAndOrder() {
    p.complete(72.5, 1);

    assertThat(p.status()).isEqualTo(PlayerStatus.COMPLETED);
    assertThat(p.progress()).isEqualTo(100);
    assertThat(p.wpm()).isEqualTo(72.5);
    assertThat(p.completionOrder()).isEqualTo(1);
  }

  @Test
  void errorsCostProgressFlooredAtZero() {
    assertThat(p.recordError(10, 3)).isFalse();
    assertThat(p.errors()).isEqualTo(1);
    assertThat(p.progress()).isZero();
  }

  @Test
  void thirdErrorEliminates() {
    p.recordError(10, 3);
    p.recordError(10, 3);
    assertThat(p.recordError(10, 3)).isTrue();

    assertThat(p.status()).isEqualTo(PlayerStatus.ELIMINATED);
    assertThat(p.eliminationReason()).isEqualTo(EliminationReason.ERRORS);
    assertThat(p.errors()).isEqualTo(3);
  }

  @Test
  void terminalStatesDoNotMoveBack() {
    p.complete(50, 1);

    assertThatThrownBy(() -> p.recordError(10, 3)).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> p.eliminate(EliminationReason.TIMEOUT))
        .isInstanceOf(IllegalStateException.class);
    assertThat(p.status()).isEqualTo(PlayerStatus.COMPLETED);
  }

  @Test
  void resetClearsRoundState() {
    p.recordError(10, 1);
    p.connected(false);

    p.resetForRound();

    assertThat(p.status()).isEqualTo(PlayerStatus.PLAYING);
    assertThat(p.errors()).isZero();
    assertThat(p.eliminationReason()).isNull();
    assertThat(p.connected()).isFalse();
  }

  @Test
  void snapshotCopiesState() {
    p.recordError(10, 3);
    PlayerSnapshot s = p.snapshot();

    assertThat(s.id()).isEqualTo("p1");
    assertThat(s.displayName()).isEqualTo("Ana");
    assertThat(s.status()).isEqualTo(PlayerStatus.PLAYING);
    assertThat(s.errors()).isEqualTo(1);
  }
}
