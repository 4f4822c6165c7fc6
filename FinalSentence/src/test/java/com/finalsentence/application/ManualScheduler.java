package com.finalsentence.application;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.springframework.scheduling.TaskScheduler;

/** TaskScheduler stand-in that only runs tasks when a test says so. */
final class ManualScheduler {
  final TaskScheduler scheduler = mock(TaskScheduler.class);
  private final List<Task> tasks = new CopyOnWriteArrayList<>();

  ManualScheduler() {
    when(scheduler.schedule(any(Runnable.class), any(Instant.class)))
        .thenAnswer(
            inv -> {
              Task t = new Task(inv.getArgument(0), inv.getArgument(1));
              tasks.add(t);
              return t;
            });
  }

  /** Tasks neither run nor cancelled, in scheduling order. */
  List<Task> pending() {
    return tasks.stream().filter(t -> !t.cancelled && !t.done).toList();
  }

  List<Task> all() {
    return List.copyOf(tasks);
  }

  Task last() {
    return tasks.get(tasks.size() - 1);
  }

  /** Run every pending task due at or before {@code now}. */
  void runDue(Instant now) {
    for (Task t : pending()) {
      if (!t.at.isAfter(now)) {
        t.run();
      }
    }
  }

  static final class Task implements ScheduledFuture<Object> {
    final Runnable body;
    final Instant at;
    volatile boolean cancelled;
    volatile boolean done;

    Task(Runnable body, Instant at) {
      this.body = body;
      this.at = at;
    }

    /** Runs the body even if the task was cancelled, like a timer that already fired. */
    void run() {
      done = true;
      body.run();
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
      if (done) return false;
      cancelled = true;
      return true;
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }

    @Override
    public boolean isDone() {
      return done || cancelled;
    }

    @Override
    public Object get() {
      return null;
    }

    @Override
    public Object get(long timeout, TimeUnit unit) {
      return null;
    }

    @Override
    public long getDelay(TimeUnit unit) {
      return 0;
    }

    @Override
    public int compareTo(Delayed o) {
      return 0;
    }
  }
}
