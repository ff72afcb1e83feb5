// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.util.Arrays;
import java.util.stream.Collectors;

/// A fixed size square grid of cell markers indexed by `[y][x]`. The board is derived state that is rebuilt
/// by the tick simulator, the dead-reckoning predictor and by applying leader history. It is not thread safe and
/// is only touched while holding the session mutex. Touching a cell outside the grid is a programmer error.
public class Board {
  private final int size;
  private final Cell[][] cells;

  public Board(int size) {
    if (size < 2) {
      throw new IllegalArgumentException("Board size must be at least 2: " + size);
    }
    this.size = size;
    this.cells = new Cell[size][size];
    for (Cell[] row : cells) {
      Arrays.fill(row, Cell.EMPTY);
    }
  }

  private Board(Board other) {
    this.size = other.size;
    this.cells = new Cell[size][];
    for (int y = 0; y < size; y++) {
      cells[y] = other.cells[y].clone();
    }
  }

  public int size() {
    return size;
  }

  public boolean inBounds(Position position) {
    return position.x() >= 0 && position.y() >= 0 && position.x() < size && position.y() < size;
  }

  public Cell get(Position position) {
    checkBounds(position);
    return cells[position.y()][position.x()];
  }

  public boolean isEmpty(Position position) {
    return get(position).isEmpty();
  }

  public void mark(Position position, Cell cell) {
    checkBounds(position);
    cells[position.y()][position.x()] = cell;
  }

  /// A detached copy that is safe to hand to observers outside the session mutex.
  public Board copy() {
    return new Board(this);
  }

  private void checkBounds(Position position) {
    if (!inBounds(position)) {
      throw new IndexOutOfBoundsException(position + " is outside a board of size " + size);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Board)) return false;
    Board other = (Board) o;
    return size == other.size && Arrays.deepEquals(cells, other.cells);
  }

  @Override
  public int hashCode() {
    return 31 * size + Arrays.deepHashCode(cells);
  }

  @Override
  public String toString() {
    return Arrays.stream(cells)
        .map(row -> Arrays.stream(row).map(Cell::toString).collect(Collectors.joining(" ", "[", "]")))
        .collect(Collectors.joining("\n"));
  }
}
