package com.finalsentence.dto;

public record RoomDeletedMessage(String type, String roomId) implements OutboundMessage {
  public RoomDeletedMessage(String roomId) {
    this("room_deleted", roomId);
  }
}
