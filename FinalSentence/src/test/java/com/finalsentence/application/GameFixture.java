package com.finalsentence.application;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.finalsentence.application.port.PersistenceGateway;
import com.finalsentence.domain.Phrase;
import com.finalsentence.domain.Player;
import com.finalsentence.domain.Room;
import com.finalsentence.domain.RoomKind;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Executor;
import org.springframework.core.task.SyncTaskExecutor;

/** Orchestrator wired with a mocked store and manual timers; synchronous delivery by default. */
final class GameFixture {
  static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  static final Phrase PHRASE =
      new Phrase("p1", "La sombra avanzaba sin ruido.", "media", "terror");

  final ManualScheduler timers = new ManualScheduler();
  final PersistenceGateway store = mock(PersistenceGateway.class);
  final PhrasePool phrases = mock(PhrasePool.class);
  final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  final RoomRegistry registry = new RoomRegistry(2, 10, 45);
  final RoundTimer timer = new RoundTimer(timers.scheduler, clock);
  final BroadcastHub hub;
  final PersistenceWriter writer;
  final RoomReaper reaper;
  final RoundController rounds;
  final ReconnectionGraceManager grace;
  final GameService game;

  GameFixture() {
    this(new SyncTaskExecutor(), new SyncTaskExecutor());
  }

  /**
   * @param delivery runs the broadcast drains
   * @param writes runs the write-behind store calls
   */
  GameFixture(Executor delivery, Executor writes) {
    hub = new BroadcastHub(delivery);
    writer = new PersistenceWriter(store, writes);
    reaper = new RoomReaper(registry, timer, hub, writer);
    rounds =
        new RoundController(registry, phrases, timer, hub, writer, reaper, clock, 2, 3, 10, 30);
    grace =
        new ReconnectionGraceManager(
            registry, rounds, hub, writer, reaper, timers.scheduler, clock, 25);
    game = new GameService(registry, rounds, grace, hub, writer, store, 10);
    when(phrases.draw()).thenReturn(PHRASE);
  }

  /** Room with the given players (first is host) and a listening channel. */
  Room room(int capacity, RecordingChannel listener, String... playerIds) {
    Room room =
        registry.create(new Player(playerIds[0], name(playerIds[0])), RoomKind.PUBLIC, capacity);
    for (int i = 1; i < playerIds.length; i++) {
      room.addPlayer(new Player(playerIds[i], name(playerIds[i])));
    }
    if (listener != null) {
      hub.register(room.id(), listener);
    }
    return room;
  }

  static String name(String id) {
    return id.toUpperCase();
  }
}
