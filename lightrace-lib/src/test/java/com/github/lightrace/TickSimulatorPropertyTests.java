// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import com.github.lightrace.network.NetworkAddress;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;

class TickSimulatorPropertyTests {
  static final int SIZE = 10;

  @Property
  void collisionFreeTicksMoveOneCellEach(@ForAll @IntRange(max = SIZE - 1) int x,
                                         @ForAll @IntRange(max = SIZE - 1) int y,
                                         @ForAll Direction heading,
                                         @ForAll @IntRange(max = SIZE - 1) int ticks) {
    final var start = new Position(x, y);
    final var end = new Position(x + heading.dx() * ticks, y + heading.dy() * ticks);
    final var board = new Board(SIZE);
    if (!board.inBounds(end)) {
      return;
    }
    final var id = new PeerId("p1");
    final var membership = new Membership();
    membership.register(new Peer(id, new NetworkAddress(7001), start, heading));
    board.mark(start, Cell.head(id));
    final var crashed = new HashSet<PeerId>();

    for (int i = 0; i < ticks; i++) {
      assertThat(new TickSimulator().tick(membership, board, crashed)).isEmpty();
    }

    assertThat(membership.peer(id).orElseThrow().position()).isEqualTo(end);
    assertThat(board.get(end)).isEqualTo(Cell.head(id));
    assertThat(DeadReckoningPropertyTests.count(board, Cell.trail(id))).isEqualTo(ticks);
  }

  @Property
  void blockedCandidateStallsAndDiesOnce(@ForAll @IntRange(min = 1, max = SIZE - 2) int x,
                                         @ForAll @IntRange(min = 1, max = SIZE - 2) int y,
                                         @ForAll Direction heading) {
    final var board = new Board(SIZE);
    final var id = new PeerId("p1");
    final var other = new PeerId("p2");
    final var start = new Position(x, y);
    board.mark(start.step(heading), Cell.trail(other));
    final var membership = new Membership();
    membership.register(new Peer(id, new NetworkAddress(7001), start, heading));
    final var crashed = new HashSet<PeerId>();
    final var simulator = new TickSimulator();

    assertThat(simulator.tick(membership, board, crashed)).containsExactly(id);
    assertThat(simulator.tick(membership, board, crashed)).isEmpty();
    assertThat(membership.peer(id).orElseThrow().position()).isEqualTo(start);
    assertThat(board.get(start)).isEqualTo(Cell.dead(id));
    assertThat(DeadReckoningPropertyTests.count(board, Cell.dead(id))).isEqualTo(1);
  }
}
