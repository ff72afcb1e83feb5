// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static com.github.lightrace.LightraceLogger.LOGGER;

/// The ordered roster of peers that are believed to be alive. Insertion order is roster order and the peer at
/// index 0 is the leader. There is no election message: removing the leader shifts every later peer left so
/// that whoever is now first leads. Leadership is always computed from the live roster and never cached.
///
/// Not thread safe. The session mutex guards it together with the rest of the shared state so that a removal
/// and the leader read that follows it cannot interleave with another loop.
public class Membership {
  private final List<Peer> roster = new ArrayList<>();

  /// Adds a peer at the end of the roster.
  ///
  /// @return false if a peer with the same identity is already registered, in which case nothing changes
  public boolean register(Peer peer) {
    if (contains(peer.id())) {
      LOGGER.fine(() -> "Ignoring duplicate registration of " + peer.id());
      return false;
    }
    roster.add(peer);
    return true;
  }

  public Optional<PeerId> leader() {
    return roster.isEmpty() ? Optional.empty() : Optional.of(roster.get(0).id());
  }

  public boolean isLeader(PeerId id) {
    return leader().map(id::equals).orElse(false);
  }

  /// Removes a peer. Removing an identity that is not on the roster is a no-op.
  ///
  /// @return true if the roster changed
  public boolean remove(PeerId id) {
    return roster.removeIf(p -> p.id().equals(id));
  }

  /// Replaces the stored snapshot of a member keeping its roster position.
  ///
  /// @return false if the peer is not on the roster
  public boolean update(Peer peer) {
    final var index = indexOf(peer.id());
    if (index < 0) {
      return false;
    }
    roster.set(index, peer);
    return true;
  }

  public Optional<Peer> peer(PeerId id) {
    final var index = indexOf(id);
    return index < 0 ? Optional.empty() : Optional.of(roster.get(index));
  }

  public boolean contains(PeerId id) {
    return indexOf(id) >= 0;
  }

  /// A copy of the roster in roster order.
  public List<Peer> peers() {
    return List.copyOf(roster);
  }

  public List<Peer> others(PeerId self) {
    return roster.stream().filter(p -> !p.id().equals(self)).toList();
  }

  public int size() {
    return roster.size();
  }

  private int indexOf(PeerId id) {
    return IntStream.range(0, roster.size())
        .filter(i -> roster.get(i).id().equals(id))
        .findFirst()
        .orElse(-1);
  }

  @Override
  public String toString() {
    return roster.stream().map(p -> p.id().id()).toList().toString();
  }
}
