// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.github.lightrace.LightraceLogger.LOGGER;

/// Heartbeat based failure detection. Every decoded envelope refreshes the sender's last-seen time. A periodic
/// check evicts peers whose silence exceeds the threshold with a policy that depends on the role of this peer:
///
/// - The leader evicts every timed out follower and records it in the dead-node set so that its next broadcast
///   carries the eviction to everyone else.
/// - A follower only watches the peer at roster index 0. When that leader times out it is evicted locally which
///   promotes the next peer in the roster. Followers never evict each other. That judgement is left to whoever
///   leads so that followers with partial visibility do not end up with divergent rosters.
///
/// Not thread safe, called under the session mutex.
public class FailureDetector {
  private final Duration threshold;
  private final Map<PeerId, Instant> lastSeen = new HashMap<>();

  public FailureDetector(Duration threshold) {
    if (threshold.isNegative() || threshold.isZero()) {
      throw new IllegalArgumentException("threshold must be positive: " + threshold);
    }
    this.threshold = threshold;
  }

  public Duration threshold() {
    return threshold;
  }

  /// Refreshes the last-seen clock of a peer.
  public void heartbeat(PeerId id, Instant now) {
    lastSeen.put(id, now);
  }

  public boolean hasExpired(PeerId id, Instant now) {
    final var seen = lastSeen.get(id);
    return seen != null && Duration.between(seen, now).compareTo(threshold) > 0;
  }

  /// Runs one failure check and evicts according to the role of `self`.
  ///
  /// @param membership the roster to evict from
  /// @param self the local peer which is never evicted
  /// @param deadNodes the leader's dead-node set which grows when the leader evicts
  /// @param now the time of the check
  /// @return the identities evicted in roster order
  public List<PeerId> evictExpired(Membership membership, PeerId self, Set<PeerId> deadNodes, Instant now) {
    final var evicted = new ArrayList<PeerId>();
    if (membership.isLeader(self)) {
      LOGGER.finer(() -> self + " checking followers as leader");
      for (Peer peer : membership.others(self)) {
        if (hasExpired(peer.id(), now)) {
          LOGGER.info(() -> self + " leader evicting silent follower " + peer.id());
          membership.remove(peer.id());
          lastSeen.remove(peer.id());
          deadNodes.add(peer.id());
          evicted.add(peer.id());
        }
      }
    } else {
      membership.leader().ifPresent(leader -> {
        LOGGER.finer(() -> self + " checking leader " + leader);
        if (hasExpired(leader, now)) {
          LOGGER.info(() -> self + " follower evicting silent leader " + leader);
          membership.remove(leader);
          lastSeen.remove(leader);
          evicted.add(leader);
        }
      });
    }
    return evicted;
  }

  public void forget(PeerId id) {
    lastSeen.remove(id);
  }
}
