package com.finalsentence.application;

import com.finalsentence.domain.Room;
import com.finalsentence.dto.RoomDeletedMessage;
import org.springframework.stereotype.Component;

/** Takes a room out of service: registry, timers, channels and store. */
@Component
public class RoomReaper {
  private final RoomRegistry registry;
  private final RoundTimer timer;
  private final BroadcastHub hub;
  private final PersistenceWriter writer;

  public RoomReaper(
      RoomRegistry registry, RoundTimer timer, BroadcastHub hub, PersistenceWriter writer) {
    this.registry = registry;
    this.timer = timer;
    this.hub = hub;
    this.writer = writer;
  }

  /** Caller holds the room lock. */
  public void close(Room room) {
    if (registry.remove(room.id()).isEmpty()) return;
    timer.disarm(room.id());
    hub.broadcast(room.id(), new RoomDeletedMessage(room.id()));
    hub.closeRoom(room.id());
    writer.deleteRoom(room.id());
  }
}
