package com.finalsentence.application;

import com.finalsentence.application.port.OutboundChannel;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Per-room fan-out of outbound messages.
 *
 * <p>{@link #broadcast} only enqueues; callers invoke it while holding the room lock, so the
 * queue order is the mutation order. Each room has at most one drain running at a time on the
 * messaging executor, which keeps delivery order per channel equal to queue order while
 * different rooms deliver in parallel. A channel whose send fails is dropped on the spot.
 */
@Component
public class BroadcastHub {
  private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

  private final Map<String, Outbox> outboxes = new ConcurrentHashMap<>();
  private final Executor executor;

  public BroadcastHub(@Qualifier("messagingExecutor") Executor executor) {
    this.executor = executor;
  }

  public void register(String roomId, OutboundChannel channel) {
    outboxes.computeIfAbsent(roomId, Outbox::new).channels.add(channel);
  }

  public void unregister(String roomId, OutboundChannel channel) {
    Outbox o = outboxes.get(roomId);
    if (o != null) {
      o.channels.remove(channel);
    }
  }

  /** Queue a message for every channel currently registered for the room. */
  public void broadcast(String roomId, Object message) {
    Outbox o = outboxes.get(roomId);
    if (o == null) return;
    o.pending.add(message);
    o.schedule();
  }

  /** Forget the room's channels once any queued messages have gone out. */
  public void closeRoom(String roomId) {
    Outbox o = outboxes.get(roomId);
    if (o == null) return;
    o.closed = true;
    o.schedule();
  }

  public Set<OutboundChannel> channels(String roomId) {
    Outbox o = outboxes.get(roomId);
    return o == null ? Set.of() : Set.copyOf(o.channels);
  }

  private static boolean deliver(OutboundChannel channel, Object message) {
    try {
      return channel.send(message);
    } catch (RuntimeException e) {
      log.debug("Send on channel {} failed: {}", channel.id(), e.getMessage());
      return false;
    }
  }

  private final class Outbox {
    private final String roomId;
    private final Set<OutboundChannel> channels = new CopyOnWriteArraySet<>();
    private final Queue<Object> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private volatile boolean closed;

    private Outbox(String roomId) {
      this.roomId = roomId;
    }

    private void schedule() {
      if (draining.compareAndSet(false, true)) {
        executor.execute(this::drain);
      }
    }

    private void drain() {
      try {
        Object m;
        while ((m = pending.poll()) != null) {
          for (OutboundChannel c : channels) {
            if (!deliver(c, m)) {
              channels.remove(c);
              log.debug("Dropped dead channel {} from room {}", c.id(), roomId);
            }
          }
        }
        if (closed) {
          outboxes.remove(roomId, this);
          channels.clear();
        }
      } finally {
        draining.set(false);
        // A close or a message that landed after the last check still needs a drain.
        if (!pending.isEmpty() || (closed && outboxes.get(roomId) == this)) {
          schedule();
        }
      }
    }
  }
}
