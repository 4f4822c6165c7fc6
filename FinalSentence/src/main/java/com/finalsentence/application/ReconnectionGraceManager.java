package com.finalsentence.application;

import com.finalsentence.domain.Player;
import com.finalsentence.domain.Room;
import com.finalsentence.domain.RoomStatus;
import com.finalsentence.dto.HostChangedMessage;
import com.finalsentence.dto.PlayerLeftMessage;
import com.finalsentence.dto.RoomStateMessage;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Keeps dropped players in their room for a grace window.
 *
 * <p>Each drop gets a fresh token. Expiry evicts the player only if its token is still the
 * pending one when the room lock is taken; a reconnect or a newer drop replaces or clears the
 * token, so a late expiry cannot evict a player who came back.
 */
@Component
public class ReconnectionGraceManager {
  private static final Logger log = LoggerFactory.getLogger(ReconnectionGraceManager.class);

  private final RoomRegistry registry;
  private final RoundController rounds;
  private final BroadcastHub hub;
  private final PersistenceWriter writer;
  private final RoomReaper reaper;
  private final TaskScheduler scheduler;
  private final Clock clock;
  private final Duration grace;

  private final AtomicLong tokens = new AtomicLong();
  private final Map<String, Pending> pending = new ConcurrentHashMap<>();

  public ReconnectionGraceManager(
      RoomRegistry registry,
      RoundController rounds,
      BroadcastHub hub,
      PersistenceWriter writer,
      RoomReaper reaper,
      @Qualifier("gameTaskScheduler") TaskScheduler scheduler,
      Clock clock,
      @Value("${finalsentence.reconnect-grace-seconds:25}") int graceSeconds) {
    this.registry = registry;
    this.rounds = rounds;
    this.hub = hub;
    this.writer = writer;
    this.reaper = reaper;
    this.scheduler = scheduler;
    this.clock = clock;
    this.grace = Duration.ofSeconds(graceSeconds);
  }

  /** Connection for the player dropped: keep it, flagged disconnected, until the window ends. */
  public void disconnected(String roomId, String playerId) {
    Optional<Room> found = registry.findById(roomId);
    if (found.isEmpty()) return;
    Room room = found.get();
    room.lock().lock();
    try {
      Player p = room.player(playerId).orElse(null);
      if (p == null) return;
      p.connected(false);

      long token = tokens.incrementAndGet();
      ScheduledFuture<?> f =
          scheduler.schedule(
              () -> expire(roomId, playerId, token), clock.instant().plus(grace));
      Pending prev = pending.put(key(roomId, playerId), new Pending(token, f));
      if (prev != null) {
        prev.future().cancel(false);
      }
      hub.broadcast(roomId, RoomStateMessage.of(room.snapshot()));
      log.info(
          "Player {} disconnected from room {}, grace {}s", playerId, roomId, grace.getSeconds());
    } finally {
      room.lock().unlock();
    }
  }

  /**
   * Player is back. Clears any pending eviction and restores the connected flag; round state is
   * untouched.
   *
   * @return true if the player was inside a grace window
   */
  public boolean reconnected(Room room, String playerId) {
    room.lock().lock();
    try {
      Pending p = pending.remove(key(room.id(), playerId));
      if (p != null) {
        p.future().cancel(false);
      }
      room.player(playerId).ifPresent(pl -> pl.connected(true));
      return p != null;
    } finally {
      room.lock().unlock();
    }
  }

  /**
   * Remove a player now: host hand-over, empty-room cleanup, and a termination re-check if a
   * round is running. Caller holds the room lock.
   */
  public void evict(Room room, String playerId) {
    Pending p = pending.remove(key(room.id(), playerId));
    if (p != null) {
      p.future().cancel(false);
    }
    if (room.removePlayer(playerId).isEmpty()) return;

    if (room.empty()) {
      reaper.close(room);
      return;
    }
    if (playerId.equals(room.hostId())) {
      String next = room.players().get(0).id();
      room.hostId(next);
      hub.broadcast(room.id(), new HostChangedMessage(playerId, next));
    }
    hub.broadcast(room.id(), new PlayerLeftMessage(playerId));
    hub.broadcast(room.id(), RoomStateMessage.of(room.snapshot()));
    writer.updateRoom(room.snapshot());
    log.info("Player {} left room {}", playerId, room.id());

    if (room.status() == RoomStatus.PLAYING) {
      rounds.evaluate(room);
    }
  }

  public boolean inGrace(String roomId, String playerId) {
    return pending.containsKey(key(roomId, playerId));
  }

  private void expire(String roomId, String playerId, long token) {
    String k = key(roomId, playerId);
    Optional<Room> found = registry.findById(roomId);
    if (found.isEmpty()) {
      pending.computeIfPresent(k, (x, p) -> p.token() == token ? null : p);
      return;
    }
    Room room = found.get();
    room.lock().lock();
    try {
      Pending p = pending.get(k);
      if (p == null || p.token() != token) return;
      log.info("Grace expired for player {} in room {}", playerId, roomId);
      evict(room, playerId);
    } catch (RuntimeException e) {
      log.error("Grace expiry for player {} in room {} failed", playerId, roomId, e);
    } finally {
      room.lock().unlock();
    }
  }

  private static String key(String roomId, String playerId) {
    return roomId + "|" + playerId;
  }

  private record Pending(long token, ScheduledFuture<?> future) {}
}
