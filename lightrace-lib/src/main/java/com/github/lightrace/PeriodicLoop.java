// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

import static com.github.lightrace.LightraceLogger.LOGGER;

/// Runs a task on its own named platform thread, sleeping for whatever remains of the interval after each run. A
/// zero interval runs the task back to back which suits a task that blocks on its own, such as polling the network.
///
/// A runtime exception escaping the task is a programmer error. It is logged as severe and ends this loop only.
class PeriodicLoop implements AutoCloseable {
  private final String name;
  private final Duration interval;
  private final Runnable task;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile Thread thread;

  PeriodicLoop(String name, Duration interval, Runnable task) {
    if (interval.isNegative()) {
      throw new IllegalArgumentException(name + " interval must not be negative: " + interval);
    }
    this.name = name;
    this.interval = interval;
    this.task = task;
  }

  void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    LOGGER.fine(() -> "Starting " + name + " every " + interval.toMillis() + "ms");
    final var t = new Thread(this::loop, name);
    t.setDaemon(true);
    thread = t;
    t.start();
  }

  private void loop() {
    try {
      while (running.get()) {
        final long start = System.nanoTime();
        task.run();
        final long sleepTime = interval.toNanos() - (System.nanoTime() - start);
        if (sleepTime > 0 && running.get()) {
          //noinspection BusyWait
          Thread.sleep(sleepTime / 1_000_000, (int) (sleepTime % 1_000_000));
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Stopping " + name + " after unexpected error: " + e, e);
      running.set(false);
    }
    LOGGER.fine(() -> name + " stopped");
  }

  boolean isRunning() {
    return running.get();
  }

  /// Asks the loop to stop. When called from another thread the loop is woken from its sleep.
  void stop() {
    if (running.compareAndSet(true, false)) {
      final var t = thread;
      if (t != null && t != Thread.currentThread()) {
        t.interrupt();
      }
    }
  }

  @Override
  public void close() {
    stop();
  }
}
