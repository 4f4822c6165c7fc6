package com.finalsentence.application;

import com.finalsentence.domain.EliminationReason;
import com.finalsentence.domain.MatchRecord;
import com.finalsentence.domain.Phrase;
import com.finalsentence.domain.Player;
import com.finalsentence.domain.PlayerSnapshot;
import com.finalsentence.domain.PlayerStatus;
import com.finalsentence.domain.Room;
import com.finalsentence.domain.RoomStatus;
import com.finalsentence.dto.PlayerCompletedMessage;
import com.finalsentence.dto.PlayerEliminatedMessage;
import com.finalsentence.dto.PlayerErrorMessage;
import com.finalsentence.dto.PlayerView;
import com.finalsentence.dto.RoundFinishedMessage;
import com.finalsentence.dto.RoundStartedMessage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Round flow for a room: start, submissions, termination and timeout.
 *
 * <p>Every public method takes the room lock, mutates, enqueues broadcasts in mutation order and
 * hands persistence to the {@link PersistenceWriter}, all before releasing the lock. Deadlines
 * are armed on the {@link RoundTimer} with the room's generation and re-enter through {@link
 * #onDeadline}; a deadline whose generation is no longer current does nothing.
 */
@Service
public class RoundController {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final RoomRegistry registry;
  private final PhrasePool phrases;
  private final RoundTimer timer;
  private final BroadcastHub hub;
  private final PersistenceWriter writer;
  private final RoomReaper reaper;
  private final Clock clock;
  private final int minPlayers;
  private final int maxErrors;
  private final double errorPenalty;
  private final Duration drainDelay;

  public RoundController(
      RoomRegistry registry,
      PhrasePool phrases,
      RoundTimer timer,
      BroadcastHub hub,
      PersistenceWriter writer,
      RoomReaper reaper,
      Clock clock,
      @Value("${finalsentence.min-players:2}") int minPlayers,
      @Value("${finalsentence.max-errors:3}") int maxErrors,
      @Value("${finalsentence.error-progress-penalty:10}") double errorPenalty,
      @Value("${finalsentence.room-drain-seconds:30}") int drainSeconds) {
    this.registry = registry;
    this.phrases = phrases;
    this.timer = timer;
    this.hub = hub;
    this.writer = writer;
    this.reaper = reaper;
    this.clock = clock;
    this.minPlayers = minPlayers;
    this.maxErrors = maxErrors;
    this.errorPenalty = errorPenalty;
    this.drainDelay = Duration.ofSeconds(drainSeconds);
  }

  /**
   * Start the next round with a random phrase.
   *
   * @param roomId room to start
   * @throws java.util.NoSuchElementException if the room does not exist
   * @throws IllegalStateException if a round is already running or there are too few players
   */
  public void startRound(String roomId) {
    Room room = registry.require(roomId);
    room.lock().lock();
    try {
      if (room.status() == RoomStatus.PLAYING) {
        throw new IllegalStateException("Round already in progress");
      }
      if (room.players().size() < minPlayers) {
        throw new IllegalStateException("Need at least " + minPlayers + " players to start");
      }
      Phrase phrase = phrases.draw();
      long gen = room.beginRound(phrase, clock.instant());
      timer.arm(
          roomId,
          gen,
          Duration.ofSeconds(room.roundDurationSeconds()),
          g -> onDeadline(roomId, g));
      hub.broadcast(
          roomId,
          new RoundStartedMessage(phrase.text(), room.roundDurationSeconds(), room.roundNumber()));
      writer.updateRoom(room.snapshot());
      log.info("Room {} round {} started with phrase {}", roomId, room.roundNumber(), phrase.id());
    } finally {
      room.lock().unlock();
    }
  }

  /**
   * Score one submission. Unknown rooms or players, and players no longer in contention, are
   * ignored without a reply.
   *
   * @param elapsedSeconds client-reported typing time; non-positive values score 0 wpm
   */
  public void submit(String roomId, String playerId, String text, double elapsedSeconds) {
    Optional<Room> found = registry.findById(roomId);
    if (found.isEmpty()) {
      log.debug("Submission for unknown room {} ignored", roomId);
      return;
    }
    Room room = found.get();
    room.lock().lock();
    try {
      if (room.status() != RoomStatus.PLAYING) {
        log.debug("Room {} not playing, submission from {} ignored", roomId, playerId);
        return;
      }
      Player p = room.player(playerId).orElse(null);
      if (p == null || !p.playing()) {
        log.debug("Player {} not in contention in room {}, submission ignored", playerId, roomId);
        return;
      }

      Phrase phrase = room.currentPhrase();
      if (text != null && text.trim().equals(phrase.text().trim())) {
        double wpm = elapsedSeconds > 0 ? phrase.wordCount() / elapsedSeconds * 60 : 0;
        p.complete(wpm, room.nextCompletion());
        hub.broadcast(roomId, new PlayerCompletedMessage(playerId, p.wpm()));
      } else {
        boolean out = p.recordError(errorPenalty, maxErrors);
        hub.broadcast(roomId, new PlayerErrorMessage(playerId, p.errors()));
        if (out) {
          hub.broadcast(roomId, new PlayerEliminatedMessage(playerId, EliminationReason.ERRORS));
        }
      }
      evaluate(room);
    } finally {
      room.lock().unlock();
    }
  }

  /**
   * Finish the round if its outcome is decided. Caller holds the room lock.
   *
   * <p>All participants final: the fastest completer wins, earlier completion breaking ties, or
   * nobody if no one completed. One participant still typing while every other participant was
   * eliminated: that participant wins by default.
   */
  public void evaluate(Room room) {
    if (room.status() != RoomStatus.PLAYING) return;
    List<Player> ps = room.participants();
    if (ps.isEmpty()) {
      conclude(room, null);
      return;
    }
    if (ps.stream().allMatch(p -> p.status().terminal())) {
      String winner =
          ps.stream()
              .filter(p -> p.status() == PlayerStatus.COMPLETED)
              .min(
                  Comparator.<Player>comparingDouble(Player::wpm)
                      .reversed()
                      .thenComparingInt(Player::completionOrder))
              .map(Player::id)
              .orElse(null);
      conclude(room, winner);
      return;
    }
    List<Player> playing = ps.stream().filter(Player::playing).toList();
    boolean anyCompleted = ps.stream().anyMatch(p -> p.status() == PlayerStatus.COMPLETED);
    if (playing.size() == 1 && ps.size() > 1 && !anyCompleted) {
      conclude(room, playing.get(0).id());
    }
  }

  /** Round deadline callback. */
  void onDeadline(String roomId, long generation) {
    Optional<Room> found = registry.findById(roomId);
    if (found.isEmpty()) return;
    Room room = found.get();
    room.lock().lock();
    try {
      if (room.generation() != generation || room.status() != RoomStatus.PLAYING) {
        log.debug("Stale deadline for room {} (generation {}) ignored", roomId, generation);
        return;
      }
      List<Player> ps = room.participants();
      for (Player p : ps) {
        if (p.playing()) {
          p.eliminate(EliminationReason.TIMEOUT);
          hub.broadcast(roomId, new PlayerEliminatedMessage(p.id(), EliminationReason.TIMEOUT));
        }
      }
      conclude(room, bestByProgress(ps));
    } finally {
      room.lock().unlock();
    }
  }

  /** Drain-delay callback: remove a finished room nobody restarted. */
  void onDrainExpired(String roomId, long generation) {
    Optional<Room> found = registry.findById(roomId);
    if (found.isEmpty()) return;
    Room room = found.get();
    room.lock().lock();
    try {
      if (room.generation() != generation || room.status() != RoomStatus.FINISHED) return;
      reaper.close(room);
    } finally {
      room.lock().unlock();
    }
  }

  /**
   * Highest progress, then highest wpm, earlier list position on ties. Nobody qualifies without
   * some progress.
   */
  static String bestByProgress(List<Player> ps) {
    Player best = null;
    for (Player p : ps) {
      if (p.progress() <= 0) continue;
      if (best == null
          || p.progress() > best.progress()
          || (p.progress() == best.progress() && p.wpm() > best.wpm())) {
        best = p;
      }
    }
    return best == null ? null : best.id();
  }

  private void conclude(Room room, String winnerId) {
    Instant now = clock.instant();
    Phrase phrase = room.currentPhrase();
    Instant started = room.roundStartedAt();
    int round = room.roundNumber();
    List<PlayerSnapshot> stats = room.participants().stream().map(Player::snapshot).toList();

    long gen = room.endRound();

    int duration = started == null ? 0 : (int) Duration.between(started, now).getSeconds();
    writer.saveMatch(
        new MatchRecord(
            UUID.randomUUID().toString(),
            room.id(),
            stats,
            phrase == null ? List.of() : List.of(phrase),
            winnerId,
            duration,
            now));
    writer.updateRoom(room.snapshot());
    hub.broadcast(
        room.id(),
        new RoundFinishedMessage(winnerId, round, stats.stream().map(PlayerView::of).toList()));
    timer.arm(room.id(), gen, drainDelay, g -> onDrainExpired(room.id(), g));
    log.info("Room {} round {} finished, winner {}", room.id(), round, winnerId);
  }
}
