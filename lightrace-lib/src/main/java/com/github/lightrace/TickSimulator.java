// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.github.lightrace.LightraceLogger.LOGGER;

/// Advances every locally known peer by one cell per tick independently of any network traffic.
///
/// Peers are evaluated one after another in roster order and each sees the board changes already made by the
/// peers before it in the same tick. Collisions are therefore resolved sequentially rather than simultaneously
/// which keeps every tick reproducible.
///
/// A peer first turns its current cell into trail. The candidate cell is one step along its heading clamped to the
/// grid. The peer collides if the candidate is outside the grid or is not empty. A peer pinned against a wall has
/// a clamped candidate equal to its own fresh trail and so collides in place. A collided peer keeps its position,
/// its cell becomes dead and it is skipped for as long as it stays in the crashed set. For a remote peer the
/// collision is only a prediction and the session releases it again when the peer's own next fix arrives.
public class TickSimulator {

  /// The outcome of moving one peer one step.
  public record Step(Peer peer, boolean collided) {
  }

  /// Moves a single peer one step. Not thread safe, called under the session mutex.
  public Step step(Board board, Peer peer) {
    final var current = peer.position();
    board.mark(current, Cell.trail(peer.id()));
    final var candidate = current.step(peer.heading()).clamp(board.size());
    if (!board.inBounds(candidate) || !board.isEmpty(candidate)) {
      LOGGER.fine(() -> "Peer " + peer.id() + " collided at " + current + " moving " + peer.heading() + " into "
          + candidate + " " + board.get(candidate));
      board.mark(current, Cell.dead(peer.id()));
      return new Step(peer, true);
    }
    board.mark(candidate, Cell.head(peer.id()));
    return new Step(peer.withPosition(candidate), false);
  }

  /// Runs one tick over the whole roster.
  ///
  /// @param membership the roster which receives the new positions
  /// @param board the board to move the peers on
  /// @param crashed peers that collided and have not been released, which are skipped and to which new collisions
  ///                are added
  /// @return the peers that collided during this tick in roster order
  public List<PeerId> tick(Membership membership, Board board, Set<PeerId> crashed) {
    final var collided = new ArrayList<PeerId>();
    for (Peer peer : membership.peers()) {
      if (crashed.contains(peer.id())) {
        continue;
      }
      final var step = step(board, peer);
      if (step.collided()) {
        crashed.add(peer.id());
        collided.add(peer.id());
      } else {
        membership.update(step.peer());
      }
    }
    return collided;
  }
}
