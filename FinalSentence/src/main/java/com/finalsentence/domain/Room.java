package com.finalsentence.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory room aggregate.
 *
 * <p>All reads and writes go through {@link #lock()}. The generation counter identifies the
 * currently scheduled round deadline; any bump invalidates callbacks tagged with an older value.
 */
public class Room {
  private final String id;
  private final String code;
  private final RoomKind kind;
  private final int maxPlayers;
  private final int roundDurationSeconds;
  private final List<Player> players = new ArrayList<>();
  private final ReentrantLock lock = new ReentrantLock();

  private String hostId;
  private RoomStatus status = RoomStatus.WAITING;
  private int roundNumber;
  private Phrase currentPhrase;
  private Instant roundStartedAt;
  private long generation;
  private int completions;

  public Room(String id, String code, RoomKind kind, int maxPlayers, int roundDurationSeconds) {
    this.id = id;
    this.code = code;
    this.kind = kind;
    this.maxPlayers = maxPlayers;
    this.roundDurationSeconds = roundDurationSeconds;
  }

  public String id() {
    return id;
  }

  public String code() {
    return code;
  }

  public RoomKind kind() {
    return kind;
  }

  public int maxPlayers() {
    return maxPlayers;
  }

  public int roundDurationSeconds() {
    return roundDurationSeconds;
  }

  public ReentrantLock lock() {
    return lock;
  }

  public String hostId() {
    return hostId;
  }

  public void hostId(String id) {
    hostId = id;
  }

  public RoomStatus status() {
    return status;
  }

  public int roundNumber() {
    return roundNumber;
  }

  public Phrase currentPhrase() {
    return currentPhrase;
  }

  public Instant roundStartedAt() {
    return roundStartedAt;
  }

  public long generation() {
    return generation;
  }

  public List<Player> players() {
    return Collections.unmodifiableList(players);
  }

  public boolean full() {
    return players.size() >= maxPlayers;
  }

  public boolean empty() {
    return players.isEmpty();
  }

  public Optional<Player> player(String playerId) {
    return players.stream().filter(p -> p.id().equals(playerId)).findFirst();
  }

  /**
   * Append a player at the end of the list.
   *
   * @throws IllegalStateException if the room is full or already holds that id
   */
  public void addPlayer(Player p) {
    if (player(p.id()).isPresent()) {
      throw new IllegalStateException("Player already in room");
    }
    if (full()) {
      throw new IllegalStateException("Room full");
    }
    players.add(p);
    if (hostId == null) {
      hostId = p.id();
    }
  }

  public Optional<Player> removePlayer(String playerId) {
    Optional<Player> p = player(playerId);
    p.ifPresent(players::remove);
    return p;
  }

  /** Players taking part in the running round; late joiners are still CONNECTED. */
  public List<Player> participants() {
    return players.stream().filter(p -> p.status() != PlayerStatus.CONNECTED).toList();
  }

  /**
   * Enter PLAYING with the given phrase and reset every player.
   *
   * @return generation tag for this round's deadline
   */
  public long beginRound(Phrase phrase, Instant now) {
    status = RoomStatus.PLAYING;
    roundNumber++;
    currentPhrase = phrase;
    roundStartedAt = now;
    completions = 0;
    players.forEach(Player::resetForRound);
    return ++generation;
  }

  /** Next 1-based completion position in this round. */
  public int nextCompletion() {
    return ++completions;
  }

  /**
   * Leave PLAYING. Bumps the generation so that a pending deadline becomes stale.
   *
   * @return the generation the drain removal should be tagged with
   */
  public long endRound() {
    status = RoomStatus.FINISHED;
    currentPhrase = null;
    roundStartedAt = null;
    return ++generation;
  }

  public RoomSnapshot snapshot() {
    return new RoomSnapshot(
        id,
        code,
        kind,
        status,
        hostId,
        maxPlayers,
        roundNumber,
        roundDurationSeconds,
        currentPhrase == null ? null : currentPhrase.text(),
        roundStartedAt,
        players.stream().map(Player::snapshot).toList());
  }
}
