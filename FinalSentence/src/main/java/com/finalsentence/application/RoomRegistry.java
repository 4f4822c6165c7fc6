package com.finalsentence.application;

import com.finalsentence.domain.Player;
import com.finalsentence.domain.Room;
import com.finalsentence.domain.RoomKind;
import java.security.SecureRandom;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Active rooms by id and by join-code.
 *
 * <p>Lookups are lock-free. {@link #create} and {@link #remove} are serialized on the registry
 * so a code can never be handed to two live rooms.
 */
@Component
public class RoomRegistry {
  private static final String CODE_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
  static final int CODE_LENGTH = 6;

  private final Logger log = LoggerFactory.getLogger(getClass());
  private final SecureRandom rnd = new SecureRandom();

  private final Map<String, Room> rooms = new ConcurrentHashMap<>();
  /** Join-code to room id. */
  private final Map<String, String> codes = new ConcurrentHashMap<>();

  private final int minPlayers;
  private final int maxPlayers;
  private final int roundDurationSeconds;

  public RoomRegistry(
      @Value("${finalsentence.min-players:2}") int minPlayers,
      @Value("${finalsentence.max-players:10}") int maxPlayers,
      @Value("${finalsentence.round-duration-seconds:45}") int roundDurationSeconds) {
    this.minPlayers = minPlayers;
    this.maxPlayers = maxPlayers;
    this.roundDurationSeconds = roundDurationSeconds;
  }

  /**
   * Create a room in WAITING state holding only its host.
   *
   * @param host first player and host
   * @param kind public or private
   * @param capacity maximum number of players
   * @throws IllegalArgumentException if the capacity is outside [min-players, max-players]
   */
  public synchronized Room create(Player host, RoomKind kind, int capacity) {
    if (capacity < minPlayers || capacity > maxPlayers) {
      throw new IllegalArgumentException(
          "maxPlayers must be between " + minPlayers + " and " + maxPlayers);
    }
    String id = "room_" + UUID.randomUUID();
    String code = newCode();
    Room room =
        new Room(id, code, kind == null ? RoomKind.PUBLIC : kind, capacity, roundDurationSeconds);
    room.addPlayer(host);
    rooms.put(id, room);
    codes.put(code, id);
    log.info("Created room {} ({}) host {}", id, code, host.id());
    return room;
  }

  public Optional<Room> findById(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(rooms.get(id));
  }

  public Optional<Room> findByCode(String code) {
    String id = codes.get(norm(code));
    return id == null ? Optional.empty() : findById(id);
  }

  /** Room by id or throw. */
  public Room require(String id) {
    return findById(id).orElseThrow(() -> new NoSuchElementException("Room not found"));
  }

  public synchronized Optional<Room> remove(String id) {
    Room r = rooms.remove(id);
    if (r == null) return Optional.empty();
    codes.remove(r.code(), id);
    log.info("Room {} removed.", id);
    return Optional.of(r);
  }

  public Collection<Room> activeRooms() {
    return List.copyOf(rooms.values());
  }

  /** Normalize a join-code (trim and upper-case). */
  private static String norm(String code) {
    return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
  }

  /** Random code not held by any active room. Caller holds the registry monitor. */
  private String newCode() {
    while (true) {
      StringBuilder sb = new StringBuilder(CODE_LENGTH);
      for (int j = 0; j < CODE_LENGTH; j++) {
        sb.append(CODE_CHARS.charAt(rnd.nextInt(CODE_CHARS.length())));
      }
      String code = sb.toString();
      if (!codes.containsKey(code)) return code;
    }
  }
}
