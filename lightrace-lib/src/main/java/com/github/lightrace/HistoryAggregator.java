// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import com.github.lightrace.msg.LeaderStateUpdate;

import java.util.List;
import java.util.Set;

import static com.github.lightrace.LightraceLogger.LOGGER;

/// The leader's view of the game. While this peer leads it records the position reported in every follower
/// envelope, and its own position on every broadcast cycle, then ships the full history and dead-node set in a
/// `LeaderStateUpdate`. Followers apply that update as a full replacement which makes it idempotent under
/// duplicated or reordered delivery.
public class HistoryAggregator {

  /// Appends the reported position of a peer to its trail unless it repeats the last one. A stalled or dead peer
  /// keeps reporting the same cell on every heartbeat and the history has to fit in one datagram.
  public void record(History history, Peer peer) {
    if (history.head(peer.id()).filter(peer.position()::equals).isPresent()) {
      LOGGER.finest(() -> "Already recorded " + peer.id() + " at " + peer.position());
      return;
    }
    history.append(peer.id(), peer.position());
    LOGGER.finest(() -> "Recorded " + peer.id() + " at " + peer.position() + " trail length " + history.trail(peer.id()).size());
  }

  public LeaderStateUpdate leaderState(Peer self, Set<PeerId> deadNodes, History history) {
    return new LeaderStateUpdate(self, deadNodes, history.snapshot());
  }

  /// Applies the leader's authoritative state on a follower: drops every reported dead node from the roster,
  /// replaces the cached history and overlays it onto the board.
  ///
  /// @return the identities that were removed from the roster
  public List<PeerId> apply(LeaderStateUpdate update, PeerId self, Membership membership, History history, Board board) {
    final var removed = update.deadNodes().stream()
        .filter(dead -> {
          if (dead.equals(self)) {
            LOGGER.warning(() -> self + " ignoring leader " + update.sender().id() + " reporting this peer as dead");
            return false;
          }
          return membership.remove(dead);
        })
        .toList();
    if (!removed.isEmpty()) {
      LOGGER.info(() -> self + " removed dead nodes " + removed + " reported by leader " + update.sender().id());
    }
    history.replaceWith(update.history());
    recompute(history, membership, board);
    return removed;
  }

  /// Marks every trail position as `TRAIL` and each last position as `HEAD` for the peers on the roster. Cells are
  /// only ever overwritten, never cleared, so trails drawn by local simulation stay on the board. Dead markers win.
  public void recompute(History history, Membership membership, Board board) {
    for (Peer peer : membership.peers()) {
      final var trail = history.trail(peer.id());
      for (int i = 0; i < trail.size(); i++) {
        final var position = trail.get(i);
        if (!board.inBounds(position)) {
          LOGGER.warning(() -> "Ignoring history position " + position + " of " + peer.id() + " outside the board");
          continue;
        }
        if (board.get(position).marker() == Cell.Marker.DEAD) {
          continue;
        }
        board.mark(position, i == trail.size() - 1 ? Cell.head(peer.id()) : Cell.trail(peer.id()));
      }
    }
  }
}
