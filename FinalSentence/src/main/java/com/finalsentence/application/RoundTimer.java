package com.finalsentence.application;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.LongConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * One pending deadline per room, tagged with the room's generation.
 *
 * <p>Arming a new deadline replaces the previous one. The replaced future is cancelled without
 * interrupting, but the callback still receives its generation tag and must compare it with the
 * room's current generation under the room lock: a deadline that already started running when
 * it was replaced is stale and must do nothing.
 */
@Component
public class RoundTimer {
  private static final Logger log = LoggerFactory.getLogger(RoundTimer.class);

  private final TaskScheduler scheduler;
  private final Clock clock;
  private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

  public RoundTimer(@Qualifier("gameTaskScheduler") TaskScheduler scheduler, Clock clock) {
    this.scheduler = scheduler;
    this.clock = clock;
  }

  /**
   * Schedule {@code onExpiry} for the room after {@code delay}.
   *
   * @param roomId room the deadline belongs to
   * @param generation tag passed back to the callback
   * @param delay time until expiry
   * @param onExpiry invoked with {@code generation} on a scheduler thread
   */
  public void arm(String roomId, long generation, Duration delay, LongConsumer onExpiry) {
    Runnable task =
        () -> {
          try {
            onExpiry.accept(generation);
          } catch (RuntimeException e) {
            log.error("Deadline for room {} (generation {}) failed", roomId, generation, e);
          }
        };
    ScheduledFuture<?> f = scheduler.schedule(task, clock.instant().plus(delay));
    ScheduledFuture<?> prev = pending.put(roomId, f);
    if (prev != null) {
      prev.cancel(false);
    }
  }

  public void disarm(String roomId) {
    ScheduledFuture<?> f = pending.remove(roomId);
    if (f != null) {
      f.cancel(false);
    }
  }
}
