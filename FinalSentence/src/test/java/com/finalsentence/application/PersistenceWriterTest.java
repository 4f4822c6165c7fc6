package com.finalsentence.application;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.finalsentence.application.port.PersistenceGateway;
import com.finalsentence.domain.PlayerProfile;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;

class PersistenceWriterTest {
  private final PersistenceGateway store = mock(PersistenceGateway.class);

  @Test
  void forwardsWritesToTheStore() {
    PersistenceWriter writer = new PersistenceWriter(store, new SyncTaskExecutor());

    writer.savePlayer(new PlayerProfile("p1", "Ana"));
    writer.deleteRoom("room_1");

    verify(store).savePlayer(new PlayerProfile("p1", "Ana"));
    verify(store).deleteRoom("room_1");
  }

  @Test
  void storeFailureIsContained() {
    doThrow(new IllegalStateException("disk full")).when(store).deleteRoom(any());
    PersistenceWriter writer = new PersistenceWriter(store, new SyncTaskExecutor());

    assertThatCode(() -> writer.deleteRoom("room_1")).doesNotThrowAnyException();
  }

  @Test
  void rejectedWriteIsContained() {
    Executor full =
        r -> {
          throw new RejectedExecutionException("queue full");
        };
    PersistenceWriter writer = new PersistenceWriter(store, full);

    assertThatCode(() -> writer.deleteRoom("room_1")).doesNotThrowAnyException();
    verifyNoInteractions(store);
  }
}
