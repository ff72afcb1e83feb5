// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoardTest {
  final PeerId p1 = new PeerId("p1");

  @Test
  void newBoardIsEmpty() {
    final var board = new Board(10);
    for (int y = 0; y < 10; y++) {
      for (int x = 0; x < 10; x++) {
        assertThat(board.isEmpty(new Position(x, y))).isTrue();
      }
    }
  }

  @Test
  void markReplacesTheSingleMarkerOfACell() {
    final var board = new Board(10);
    final var cell = new Position(3, 7);
    board.mark(cell, Cell.head(p1));
    board.mark(cell, Cell.trail(p1));
    assertThat(board.get(cell)).isEqualTo(Cell.trail(p1));
    assertThat(board.isEmpty(new Position(7, 3))).isTrue();
  }

  @Test
  void outOfRangeAccessIsRejected() {
    final var board = new Board(10);
    assertThat(board.inBounds(new Position(10, 0))).isFalse();
    assertThat(board.inBounds(new Position(0, -1))).isFalse();
    assertThatThrownBy(() -> board.get(new Position(10, 0))).isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> board.mark(new Position(-1, 2), Cell.trail(p1)))
        .isInstanceOf(IndexOutOfBoundsException.class);
  }

  @Test
  void copyIsDetached() {
    final var board = new Board(4);
    board.mark(new Position(1, 1), Cell.head(p1));
    final var copy = board.copy();
    assertThat(copy).isEqualTo(board);
    board.mark(new Position(2, 2), Cell.dead(p1));
    assertThat(copy).isNotEqualTo(board);
    assertThat(copy.isEmpty(new Position(2, 2))).isTrue();
  }

  @Test
  void cellOwnershipIsValidated() {
    assertThatThrownBy(() -> new Cell(Cell.Marker.EMPTY, p1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Cell(Cell.Marker.TRAIL, null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void stepAndClamp() {
    assertThat(new Position(0, 0).step(Direction.UP)).isEqualTo(new Position(0, -1));
    assertThat(new Position(0, -1).clamp(10)).isEqualTo(new Position(0, 0));
    assertThat(new Position(12, 4).clamp(10)).isEqualTo(new Position(9, 4));
    assertThat(Direction.fromCode('L')).isEqualTo(Direction.LEFT);
    assertThatThrownBy(() -> Direction.fromCode('X')).isInstanceOf(IllegalArgumentException.class);
  }
}
