// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.util.Optional;

import static com.github.lightrace.LightraceLogger.LOGGER;

/// Reconstructs the path a remote peer took between two fixes. A direction change announces the position at which
/// the peer turned. Starting from the last known position and heading we walk one cell at a time marking trail
/// until we reach the announced position which becomes the head, then adopt the announced heading.
///
/// Tolerates a single lost update only. If the announced position is not ahead of us on the old heading then we
/// jump straight to it. When our own head for the peer is the cell we jump from, the local simulation overshot the
/// turn and that head is cleared since the peer never reached it. Any other old cell is kept as trail.
public class DeadReckoning {

  /// @param board the board to draw the reconstructed path on
  /// @param known our last snapshot of the peer
  /// @param announced the snapshot carried by the direction change
  /// @return the peer snapshot to store, or empty if the announced position is not on the board
  public Optional<Peer> reconstruct(Board board, Peer known, Peer announced) {
    final var from = known.position();
    final var to = announced.position();
    if (!board.inBounds(to)) {
      LOGGER.warning(() -> "Ignoring direction change of " + known.id() + " to " + to + " outside the board");
      return Optional.empty();
    }
    if (from.equals(to)) {
      LOGGER.finer(() -> known.id() + " turned in place at " + to + " to " + announced.heading());
      return Optional.of(known.withHeading(announced.heading()));
    }
    final var trail = Cell.trail(known.id());
    final var steps = stepsAlong(from, to, known.heading());
    if (steps > 0 && board.inBounds(from)) {
      var cursor = from;
      for (int i = 0; i < steps; i++) {
        board.mark(cursor, trail);
        cursor = cursor.step(known.heading());
      }
    } else {
      LOGGER.fine(() -> known.id() + " announced " + to + " which is not ahead of " + from + " heading "
          + known.heading() + " so jumping");
      if (board.inBounds(from)) {
        board.mark(from, board.get(from).equals(Cell.head(known.id())) ? Cell.EMPTY : trail);
      }
    }
    board.mark(to, Cell.head(known.id()));
    return Optional.of(known.withPosition(to).withHeading(announced.heading()));
  }

  /// The number of single steps along `heading` that lead from `from` to `to`, or zero if `to` does not lie
  /// ahead on that ray.
  static int stepsAlong(Position from, Position to, Direction heading) {
    final int dx = to.x() - from.x();
    final int dy = to.y() - from.y();
    if (heading.dx() != 0 && dy == 0 && Integer.signum(dx) == heading.dx()) {
      return Math.abs(dx);
    }
    if (heading.dy() != 0 && dx == 0 && Integer.signum(dy) == heading.dy()) {
      return Math.abs(dy);
    }
    return 0;
  }
}
