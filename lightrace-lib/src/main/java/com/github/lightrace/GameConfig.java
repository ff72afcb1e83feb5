// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/// The tunables of a game. All peers in a room must run with the same grid size and start table or their boards
/// will not agree.
///
/// `fromProperties` reads the following keys and falls back to [#defaults()] for anything missing:
///
/// | key                                    | meaning                                            |
/// |----------------------------------------|----------------------------------------------------|
/// | `lightrace.tickIntervalMillis`         | time between simulation ticks                      |
/// | `lightrace.broadcastIntervalMillis`    | time between heartbeats and leader state updates   |
/// | `lightrace.failureThresholdMultiplier` | silence tolerated as a multiple of the broadcast   |
/// | `lightrace.gridSize`                   | width and height of the square board               |
/// | `lightrace.roomSize`                   | most peers allowed on one roster                   |
/// | `lightrace.start.<id>`                 | `x,y,H` start cell and heading code of a peer      |
///
/// Any `lightrace.start.*` key replaces the whole default start table.
public record GameConfig(Duration tickInterval,
                         Duration broadcastInterval,
                         double failureThresholdMultiplier,
                         int gridSize,
                         int roomSize,
                         Map<PeerId, StartPosition> startPositions) {

  public static final String PREFIX = "lightrace.";
  static final String START_PREFIX = PREFIX + "start.";

  /// Where a peer begins and which way it initially faces.
  public record StartPosition(Position position, Direction heading) {
    public StartPosition {
      if (position == null || heading == null) {
        throw new IllegalArgumentException("position and heading are required");
      }
    }

    /// Parses `x,y,H` such as `1,1,R`.
    public static StartPosition parse(String text) {
      final var parts = text.trim().split(",");
      if (parts.length != 3 || parts[2].trim().length() != 1) {
        throw new IllegalArgumentException("Expected x,y,H but got: " + text);
      }
      try {
        return new StartPosition(
            new Position(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())),
            Direction.fromCode(parts[2].trim().charAt(0)));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Expected x,y,H but got: " + text, e);
      }
    }
  }

  public GameConfig {
    if (tickInterval == null || tickInterval.isNegative() || tickInterval.isZero()) {
      throw new IllegalArgumentException("tickInterval must be positive: " + tickInterval);
    }
    if (broadcastInterval == null || broadcastInterval.isNegative() || broadcastInterval.isZero()) {
      throw new IllegalArgumentException("broadcastInterval must be positive: " + broadcastInterval);
    }
    if (!(failureThresholdMultiplier > 1.0)) {
      throw new IllegalArgumentException("failureThresholdMultiplier must be greater than 1: " + failureThresholdMultiplier);
    }
    if (gridSize < 2) {
      throw new IllegalArgumentException("gridSize must be at least 2: " + gridSize);
    }
    if (roomSize < 2) {
      throw new IllegalArgumentException("roomSize must be at least 2: " + roomSize);
    }
    if (startPositions == null) {
      throw new IllegalArgumentException("startPositions is required");
    }
    startPositions.forEach((id, start) -> {
      final var p = start.position();
      if (p.x() < 0 || p.y() < 0 || p.x() >= gridSize || p.y() >= gridSize) {
        throw new IllegalArgumentException("Start position of " + id + " is off the board: " + p);
      }
    });
    startPositions = Collections.unmodifiableMap(new LinkedHashMap<>(startPositions));
  }

  /// The silence after which a peer is suspected dead.
  public Duration failureThreshold() {
    return Duration.ofNanos(Math.round(broadcastInterval.toNanos() * failureThresholdMultiplier));
  }

  /// 500 ms ticks and broadcasts, a 10x10 board and six start slots along the left and right edges.
  public static GameConfig defaults() {
    final var start = new LinkedHashMap<PeerId, StartPosition>();
    start.put(new PeerId("p1"), new StartPosition(new Position(1, 1), Direction.RIGHT));
    start.put(new PeerId("p2"), new StartPosition(new Position(8, 8), Direction.LEFT));
    start.put(new PeerId("p3"), new StartPosition(new Position(8, 1), Direction.LEFT));
    start.put(new PeerId("p4"), new StartPosition(new Position(1, 8), Direction.RIGHT));
    start.put(new PeerId("p5"), new StartPosition(new Position(4, 1), Direction.RIGHT));
    start.put(new PeerId("p6"), new StartPosition(new Position(5, 8), Direction.LEFT));
    return new GameConfig(Duration.ofMillis(500), Duration.ofMillis(500), 2.5, 10, 6, start);
  }

  public static GameConfig fromProperties(Properties properties) {
    final var defaults = defaults();
    final var start = new LinkedHashMap<PeerId, StartPosition>();
    properties.stringPropertyNames().stream()
        .filter(key -> key.startsWith(START_PREFIX))
        .sorted()
        .forEach(key -> start.put(new PeerId(key.substring(START_PREFIX.length())),
            StartPosition.parse(properties.getProperty(key))));
    return new GameConfig(
        millis(properties, "tickIntervalMillis", defaults.tickInterval()),
        millis(properties, "broadcastIntervalMillis", defaults.broadcastInterval()),
        Double.parseDouble(properties.getProperty(PREFIX + "failureThresholdMultiplier",
            Double.toString(defaults.failureThresholdMultiplier()))),
        Integer.parseInt(properties.getProperty(PREFIX + "gridSize", Integer.toString(defaults.gridSize()))),
        Integer.parseInt(properties.getProperty(PREFIX + "roomSize", Integer.toString(defaults.roomSize()))),
        start.isEmpty() ? defaults.startPositions() : start);
  }

  public static GameConfig fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  private static Duration millis(Properties properties, String key, Duration fallback) {
    final var value = properties.getProperty(PREFIX + key);
    return value == null ? fallback : Duration.ofMillis(Long.parseLong(value.trim()));
  }
}
