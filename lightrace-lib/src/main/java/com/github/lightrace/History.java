// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/// The trail of every peer since the start of the game. The last position of a trail is the peer's head.
/// Only the current leader appends. Followers hold a cached copy that each leader broadcast replaces wholesale.
public class History {
  private final Map<PeerId, List<Position>> trails = new LinkedHashMap<>();

  public void append(PeerId id, Position position) {
    trails.computeIfAbsent(id, k -> new ArrayList<>()).add(position);
  }

  /// The last recorded position of `id`.
  public Optional<Position> head(PeerId id) {
    final var trail = trails.get(id);
    return trail == null || trail.isEmpty() ? Optional.empty() : Optional.of(trail.get(trail.size() - 1));
  }

  public List<Position> trail(PeerId id) {
    return List.copyOf(trails.getOrDefault(id, List.of()));
  }

  /// Last-writer-wins replacement with the leader's copy.
  public void replaceWith(Map<PeerId, List<Position>> leaderCopy) {
    trails.clear();
    leaderCopy.forEach((id, positions) -> trails.put(id, new ArrayList<>(positions)));
  }

  /// An immutable deep copy suitable for putting on the wire.
  public Map<PeerId, List<Position>> snapshot() {
    return trails.entrySet().stream()
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
  }

  public boolean isEmpty() {
    return trails.isEmpty();
  }

  @Override
  public String toString() {
    return trails.toString();
  }
}
