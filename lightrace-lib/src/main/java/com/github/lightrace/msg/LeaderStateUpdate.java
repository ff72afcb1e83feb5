// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.msg;

import com.github.lightrace.Peer;
import com.github.lightrace.PeerId;
import com.github.lightrace.Position;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/// The leader's periodic broadcast of authoritative state. Receivers replace their cached history with this copy
/// and remove every dead node from their roster.
///
/// @param sender the leader's own snapshot
/// @param deadNodes the peers the leader has evicted during this session
/// @param history the trail of each peer in time order where the last position is the head
public record LeaderStateUpdate(Peer sender,
                                Set<PeerId> deadNodes,
                                Map<PeerId, List<Position>> history) implements Envelope {
  public LeaderStateUpdate {
    deadNodes = Set.copyOf(deadNodes);
    history = history.entrySet().stream()
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
  }
}
