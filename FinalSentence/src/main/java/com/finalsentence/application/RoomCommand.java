package com.finalsentence.application;

import java.util.Map;

/** Typed form of a room-scoped client message. */
public sealed interface RoomCommand
    permits RoomCommand.Join,
        RoomCommand.Reconnect,
        RoomCommand.StartRound,
        RoomCommand.SubmitText,
        RoomCommand.Leave,
        RoomCommand.Ping {

  String playerId();

  record Join(String playerId, String displayName, String avatar) implements RoomCommand {
    public Join(String playerId, String displayName) {
      this(playerId, displayName, null);
    }
  }

  record Reconnect(String playerId) implements RoomCommand {}

  record StartRound(String playerId) implements RoomCommand {}

  record SubmitText(String playerId, String text, double elapsedSeconds) implements RoomCommand {}

  record Leave(String playerId) implements RoomCommand {}

  record Ping(String playerId) implements RoomCommand {}

  /**
   * Decode a wire message into its command.
   *
   * @throws IllegalArgumentException for an unknown type or a malformed payload
   */
  static RoomCommand parse(String type, String playerId, Map<String, Object> payload) {
    if (type == null || playerId == null || playerId.isBlank()) {
      throw new IllegalArgumentException("Message needs a type and a playerId");
    }
    Map<String, Object> p = payload == null ? Map.of() : payload;
    return switch (type) {
      case "join" ->
          new Join(playerId, text(p, "displayName", playerId), text(p, "avatar", null));
      case "reconnect" -> new Reconnect(playerId);
      case "start_round" -> new StartRound(playerId);
      case "submit_text" ->
          new SubmitText(playerId, text(p, "text", ""), number(p, "elapsedSeconds"));
      case "leave" -> new Leave(playerId);
      case "ping" -> new Ping(playerId);
      default -> throw new IllegalArgumentException("Unknown message type: " + type);
    };
  }

  private static String text(Map<String, Object> p, String key, String fallback) {
    Object v = p.get(key);
    if (v == null) return fallback;
    if (!(v instanceof String s)) {
      throw new IllegalArgumentException(key + " must be a string");
    }
    return s;
  }

  private static double number(Map<String, Object> p, String key) {
    Object v = p.get(key);
    if (v == null) return 0;
    if (!(v instanceof Number n)) {
      throw new IllegalArgumentException(key + " must be a number");
    }
    return n.doubleValue();
  }
}
