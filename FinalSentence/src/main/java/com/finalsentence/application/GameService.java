package com.finalsentence.application;

import com.finalsentence.application.port.OutboundChannel;
import com.finalsentence.application.port.PersistenceGateway;
import com.finalsentence.domain.Player;
import com.finalsentence.domain.PlayerProfile;
import com.finalsentence.domain.PlayerStats;
import com.finalsentence.domain.Room;
import com.finalsentence.domain.RoomKind;
import com.finalsentence.domain.RoomSnapshot;
import com.finalsentence.dto.PlayerJoinedMessage;
import com.finalsentence.dto.PlayerView;
import com.finalsentence.dto.RoomStateMessage;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Session-facing entry point of the orchestrator.
 *
 * <p>Responsibilities:
 * - Create rooms and manage membership (join, reconnect, leave)
 * - Bind client sessions to a room's broadcast channels
 * - Route round commands to the {@link RoundController}
 * - Hand dropped sessions to the {@link ReconnectionGraceManager}
 *
 * <p>Validation failures throw before anything is mutated: {@link NoSuchElementException} for
 * unknown rooms or players, {@link IllegalStateException} for a full room or a round that cannot
 * start, {@link IllegalArgumentException} for bad input. Submissions that no longer apply are
 * dropped silently by the round controller.
 */
@Service
public class GameService {
  private final Logger log = LoggerFactory.getLogger(getClass());

  /** Session id to the room/player it speaks for. */
  private final Map<String, Binding> sessions = new ConcurrentHashMap<>();

  private final RoomRegistry registry;
  private final RoundController rounds;
  private final ReconnectionGraceManager grace;
  private final BroadcastHub hub;
  private final PersistenceWriter writer;
  private final PersistenceGateway store;
  private final int defaultMaxPlayers;

  public GameService(
      RoomRegistry registry,
      RoundController rounds,
      ReconnectionGraceManager grace,
      BroadcastHub hub,
      PersistenceWriter writer,
      PersistenceGateway store,
      @Value("${finalsentence.max-players:10}") int defaultMaxPlayers) {
    this.registry = registry;
    this.rounds = rounds;
    this.grace = grace;
    this.hub = hub;
    this.writer = writer;
    this.store = store;
    this.defaultMaxPlayers = defaultMaxPlayers;
  }

  /**
   * Create a room with the given player as host.
   *
   * @param maxPlayers capacity, or null for the configured maximum
   * @throws IllegalArgumentException if the capacity is out of range
   */
  public RoomSnapshot createRoom(
      String hostId, String hostName, RoomKind kind, Integer maxPlayers) {
    Room room =
        registry.create(
            new Player(hostId, hostName),
            kind,
            maxPlayers == null ? defaultMaxPlayers : maxPlayers);
    room.lock().lock();
    try {
      RoomSnapshot s = room.snapshot();
      writer.savePlayer(new PlayerProfile(hostId, hostName));
      writer.createRoom(s);
      return s;
    } finally {
      room.lock().unlock();
    }
  }

  /**
   * Add a player to the room behind a join-code.
   *
   * @throws NoSuchElementException if no active room has that code
   * @throws IllegalStateException if the room is full
   */
  public RoomSnapshot joinByCode(String code, String playerId, String displayName) {
    return joinByCode(code, playerId, displayName, null);
  }

  /**
   * Add a player to the room behind a join-code.
   *
   * @param avatar avatar key, or null for the default
   */
  public RoomSnapshot joinByCode(
      String code, String playerId, String displayName, String avatar) {
    Room room =
        registry.findByCode(code).orElseThrow(() -> new NoSuchElementException("Room not found"));
    return addMember(room, playerId, displayName, avatar, null);
  }

  public RoomSnapshot snapshot(String roomId) {
    return snapshot(registry.require(roomId));
  }

  private static RoomSnapshot snapshot(Room room) {
    room.lock().lock();
    try {
      return room.snapshot();
    } finally {
      room.lock().unlock();
    }
  }

  public PlayerStats stats(String playerId) {
    return store.getPlayerStats(playerId);
  }

  /**
   * Apply one client command for a room.
   *
   * @param roomId room the message is addressed to
   * @param channel sender's outbound channel; bound to the room on join and reconnect
   * @param cmd decoded command
   */
  public void handle(String roomId, OutboundChannel channel, RoomCommand cmd) {
    if (cmd instanceof RoomCommand.Join j) {
      addMember(registry.require(roomId), j.playerId(), j.displayName(), j.avatar(), channel);
    } else if (cmd instanceof RoomCommand.Reconnect r) {
      reconnect(registry.require(roomId), r.playerId(), channel);
    } else if (cmd instanceof RoomCommand.StartRound s) {
      requireMember(registry.require(roomId), s.playerId());
      rounds.startRound(roomId);
    } else if (cmd instanceof RoomCommand.SubmitText t) {
      rounds.submit(roomId, t.playerId(), t.text(), t.elapsedSeconds());
    } else if (cmd instanceof RoomCommand.Leave l) {
      leave(roomId, l.playerId(), channel);
    }
  }

  /** A client session closed without leaving. */
  public void disconnect(String sessionId) {
    Binding b = sessions.remove(sessionId);
    if (b == null) return;
    hub.unregister(b.roomId(), b.channel());
    release(b);
  }

  private RoomSnapshot addMember(
      Room room, String playerId, String displayName, String avatar, OutboundChannel channel) {
    Binding replaced;
    RoomSnapshot s;
    room.lock().lock();
    try {
      if (registry.findById(room.id()).isEmpty()) {
        throw new NoSuchElementException("Room not found");
      }
      Player existing = room.player(playerId).orElse(null);
      if (existing == null) {
        if (room.full()) {
          throw new IllegalStateException("Room full");
        }
        Player p = new Player(playerId, displayName, avatar);
        room.addPlayer(p);
        replaced = bind(room, playerId, channel);
        hub.broadcast(room.id(), new PlayerJoinedMessage(PlayerView.of(p.snapshot())));
        log.info(
            "Player {} joined room {} ({}/{})",
            playerId,
            room.id(),
            room.players().size(),
            room.maxPlayers());
      } else {
        // Joining again from a new connection is a reconnect.
        if (avatar != null) {
          existing.avatar(avatar);
        }
        replaced = bind(room, playerId, channel);
        grace.reconnected(room, playerId);
      }
      s = room.snapshot();
      hub.broadcast(room.id(), RoomStateMessage.of(s));
      writer.savePlayer(new PlayerProfile(playerId, displayName));
      writer.updateRoom(s);
    } finally {
      room.lock().unlock();
    }
    release(replaced);
    return s;
  }

  private void reconnect(Room room, String playerId, OutboundChannel channel) {
    Binding replaced;
    room.lock().lock();
    try {
      requireMember(room, playerId);
      replaced = bind(room, playerId, channel);
      boolean wasAway = grace.reconnected(room, playerId);
      hub.broadcast(room.id(), RoomStateMessage.of(room.snapshot()));
      log.info(
          "Player {} reconnected to room {} (within grace: {})", playerId, room.id(), wasAway);
    } finally {
      room.lock().unlock();
    }
    release(replaced);
  }

  private void leave(String roomId, String playerId, OutboundChannel channel) {
    if (channel != null) {
      Binding b = sessions.get(channel.id());
      if (b != null && b.roomId().equals(roomId) && b.playerId().equals(playerId)) {
        sessions.remove(channel.id(), b);
        hub.unregister(roomId, channel);
      }
    }
    Room room = registry.findById(roomId).orElse(null);
    if (room == null) return;
    room.lock().lock();
    try {
      grace.evict(room, playerId);
    } finally {
      room.lock().unlock();
    }
  }

  /**
   * Point the session at this room and player. Caller holds the room lock.
   *
   * @return the binding the session had for another room or player, or null
   */
  private Binding bind(Room room, String playerId, OutboundChannel channel) {
    if (channel == null) return null;
    Binding prev = sessions.put(channel.id(), new Binding(room.id(), playerId, channel));
    hub.register(room.id(), channel);
    if (prev == null) return null;
    if (!prev.roomId().equals(room.id())) {
      hub.unregister(prev.roomId(), prev.channel());
      return prev;
    }
    return prev.playerId().equals(playerId) ? null : prev;
  }

  /**
   * A session stopped speaking for the binding's player. Starts the grace window unless another
   * session still serves that player; checked under the room lock that binding also takes.
   */
  private void release(Binding b) {
    if (b == null) return;
    Room room = registry.findById(b.roomId()).orElse(null);
    if (room == null) return;
    room.lock().lock();
    try {
      boolean stillBound =
          sessions.values().stream()
              .anyMatch(o -> o.roomId().equals(b.roomId()) && o.playerId().equals(b.playerId()));
      if (!stillBound) {
        grace.disconnected(b.roomId(), b.playerId());
      }
    } finally {
      room.lock().unlock();
    }
  }

  private static void requireMember(Room room, String playerId) {
    room.lock().lock();
    try {
      if (room.player(playerId).isEmpty()) {
        throw new NoSuchElementException("Player not in room");
      }
    } finally {
      room.lock().unlock();
    }
  }

  private record Binding(String roomId, String playerId, OutboundChannel channel) {}
}
