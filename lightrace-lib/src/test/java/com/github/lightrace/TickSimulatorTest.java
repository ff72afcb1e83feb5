// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import com.github.lightrace.network.NetworkAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TickSimulatorTest {
  final TickSimulator simulator = new TickSimulator();
  final Peer p1 = start("p1", 7001, 1, 1, Direction.RIGHT);
  final Peer p2 = start("p2", 7002, 8, 8, Direction.LEFT);
  final Peer p3 = start("p3", 7003, 8, 1, Direction.LEFT);

  Membership membership;
  Board board;
  Set<PeerId> crashed;

  static Peer start(String id, int port, int x, int y, Direction heading) {
    return new Peer(new PeerId(id), new NetworkAddress(port), new Position(x, y), heading);
  }

  @BeforeEach
  void setup() {
    membership = new Membership();
    board = new Board(10);
    crashed = new HashSet<>();
    for (Peer peer : new Peer[]{p1, p2, p3}) {
      membership.register(peer);
      board.mark(peer.position(), Cell.head(peer.id()));
    }
  }

  Position at(Peer peer) {
    return membership.peer(peer.id()).orElseThrow().position();
  }

  @Test
  void firstTickOfTheThreePeerRace() {
    assertThat(simulator.tick(membership, board, crashed)).isEmpty();

    assertThat(at(p1)).isEqualTo(new Position(2, 1));
    assertThat(board.get(new Position(2, 1))).isEqualTo(Cell.head(p1.id()));
    assertThat(board.get(new Position(1, 1))).isEqualTo(Cell.trail(p1.id()));
    assertThat(at(p2)).isEqualTo(new Position(7, 8));
    assertThat(at(p3)).isEqualTo(new Position(7, 1));
    assertThat(board.get(new Position(8, 1))).isEqualTo(Cell.trail(p3.id()));
  }

  @Test
  void peerDrivingIntoAnotherHeadDiesWhereItStands() {
    simulator.tick(membership, board, crashed);
    var p3 = membership.peer(this.p3.id()).orElseThrow();
    TickSimulator.Step step;
    do {
      step = simulator.step(board, p3);
      p3 = step.peer();
    } while (!step.collided());

    assertThat(p3.position()).isEqualTo(new Position(3, 1));
    assertThat(board.get(new Position(3, 1))).isEqualTo(Cell.dead(this.p3.id()));
    assertThat(board.get(new Position(2, 1))).isEqualTo(Cell.head(p1.id()));
  }

  @Test
  void headOnCollisionResolvesInRosterOrder() {
    for (int i = 0; i < 3; i++) {
      assertThat(simulator.tick(membership, board, crashed)).isEmpty();
    }
    assertThat(simulator.tick(membership, board, crashed)).containsExactly(p1.id(), p3.id());

    assertThat(board.get(new Position(4, 1))).isEqualTo(Cell.dead(p1.id()));
    assertThat(board.get(new Position(5, 1))).isEqualTo(Cell.dead(p3.id()));
    assertThat(crashed).containsExactlyInAnyOrder(p1.id(), p3.id());
  }

  @Test
  void crashedPeersAreMarkedDeadExactlyOnce() {
    for (int i = 0; i < 4; i++) {
      simulator.tick(membership, board, crashed);
    }
    final var afterDeath = board.copy();
    assertThat(simulator.tick(membership, board, crashed)).isEmpty();
    assertThat(board.get(new Position(4, 1))).isEqualTo(afterDeath.get(new Position(4, 1)));
    assertThat(at(p1)).isEqualTo(new Position(4, 1));
    assertThat(at(p2)).isEqualTo(new Position(3, 8));
  }

  @Test
  void peerPinnedAgainstTheWallCollidesWithItsOwnTrail() {
    final var wall = start("p4", 7004, 0, 5, Direction.LEFT);
    final var step = simulator.step(board, wall);
    assertThat(step.collided()).isTrue();
    assertThat(step.peer().position()).isEqualTo(new Position(0, 5));
    assertThat(board.get(new Position(0, 5))).isEqualTo(Cell.dead(wall.id()));
  }

  @Test
  void trailBlocksLaterPeers() {
    board.mark(new Position(6, 8), Cell.trail(p1.id()));
    simulator.tick(membership, board, crashed);
    final var collided = simulator.tick(membership, board, crashed);
    assertThat(collided).containsExactly(p2.id());
    assertThat(at(p2)).isEqualTo(new Position(7, 8));
  }
}
