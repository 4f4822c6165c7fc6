package com.finalsentence.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class RoomTest {
  private static final Phrase PHRASE = new Phrase("1", "El espejo mintió.", "media", "terror");
  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

  private final Room room = new Room("room_1", "ABC123", RoomKind.PUBLIC, 2, 45);

  @Test
  void firstPlayerBecomesHost() {
    room.addPlayer(new Player("a", "A"));
    room.addPlayer(new Player("b", "B"));

    assertThat(room.hostId()).isEqualTo("a");
    assertThat(room.full()).isTrue();
  }

  @Test
  void rejectsDuplicateAndOverflow() {
    room.addPlayer(new Player("a", "A"));

    assertThatThrownBy(() -> room.addPlayer(new Player("a", "A2")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Player already in room");

    room.addPlayer(new Player("b", "B"));
    assertThatThrownBy(() -> room.addPlayer(new Player("c", "C")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Room full");
    assertThat(room.players()).hasSize(2);
  }

  @Test
  void beginRoundResetsPlayersAndBumpsGeneration() {
    room.addPlayer(new Player("a", "A"));
    room.addPlayer(new Player("b", "B"));
    long before = room.generation();

    long gen = room.beginRound(PHRASE, T0);

    assertThat(gen).isEqualTo(before + 1);
    assertThat(room.status()).isEqualTo(RoomStatus.PLAYING);
    assertThat(room.roundNumber()).isEqualTo(1);
    assertThat(room.currentPhrase()).isEqualTo(PHRASE);
    assertThat(room.roundStartedAt()).isEqualTo(T0);
    assertThat(room.players()).allMatch(Player::playing);
  }

  @Test
  void endRoundClearsPhraseAndInvalidatesDeadline() {
    room.addPlayer(new Player("a", "A"));
    long gen = room.beginRound(PHRASE, T0);

    long next = room.endRound();

    assertThat(next).isGreaterThan(gen);
    assertThat(room.status()).isEqualTo(RoomStatus.FINISHED);
    assertThat(room.currentPhrase()).isNull();
    assertThat(room.snapshot().phrase()).isNull();
  }

  @Test
  void lateJoinerIsNotAParticipant() {
    Room big = new Room("room_2", "XYZ789", RoomKind.PRIVATE, 4, 45);
    big.addPlayer(new Player("a", "A"));
    big.addPlayer(new Player("b", "B"));
    big.beginRound(PHRASE, T0);
    big.addPlayer(new Player("c", "C"));

    assertThat(big.participants()).extracting(Player::id).containsExactly("a", "b");
  }

  @Test
  void removePlayerKeepsOrder() {
    Room big = new Room("room_3", "QWE456", RoomKind.PUBLIC, 4, 45);
    big.addPlayer(new Player("a", "A"));
    big.addPlayer(new Player("b", "B"));
    big.addPlayer(new Player("c", "C"));

    assertThat(big.removePlayer("a")).isPresent();
    assertThat(big.removePlayer("zzz")).isEmpty();
    assertThat(big.players()).extracting(Player::id).containsExactly("b", "c");
  }

  @Test
  void wordCountSplitsOnWhitespace() {
    assertThat(new Phrase("x", "  La   sombra avanzaba sin ruido. ", "media", "terror").wordCount())
        .isEqualTo(5);
  }
}
