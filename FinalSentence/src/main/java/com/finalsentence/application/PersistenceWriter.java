package com.finalsentence.application;

import com.finalsentence.application.port.PersistenceGateway;
import com.finalsentence.domain.MatchRecord;
import com.finalsentence.domain.PlayerProfile;
import com.finalsentence.domain.RoomSnapshot;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Write-behind access to the {@link PersistenceGateway}.
 *
 * <p>Every write is handed to the persistence executor and returns at once. Failures are
 * logged; in-memory state is never rolled back and writes are never retried.
 */
@Component
public class PersistenceWriter {
  private static final Logger log = LoggerFactory.getLogger(PersistenceWriter.class);

  private final PersistenceGateway store;
  private final Executor executor;

  public PersistenceWriter(
      PersistenceGateway store, @Qualifier("persistenceExecutor") Executor executor) {
    this.store = store;
    this.executor = executor;
  }

  public void savePlayer(PlayerProfile p) {
    submit("savePlayer " + p.id(), s -> s.savePlayer(p));
  }

  public void createRoom(RoomSnapshot r) {
    submit("createRoom " + r.id(), s -> s.createRoom(r));
  }

  public void updateRoom(RoomSnapshot r) {
    submit("updateRoom " + r.id(), s -> s.updateRoom(r));
  }

  public void deleteRoom(String roomId) {
    submit("deleteRoom " + roomId, s -> s.deleteRoom(roomId));
  }

  public void saveMatch(MatchRecord m) {
    submit("saveMatch " + m.id(), s -> s.saveMatch(m));
  }

  private void submit(String op, Consumer<PersistenceGateway> write) {
    try {
      executor.execute(
          () -> {
            try {
              write.accept(store);
            } catch (RuntimeException e) {
              log.warn("Persistence {} failed: {}", op, e.getMessage());
            }
          });
    } catch (RejectedExecutionException e) {
      log.warn("Persistence {} rejected: {}", op, e.getMessage());
    }
  }
}
