// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

/// An immutable grid coordinate. Values may lie outside a board until they are checked against it.
public record Position(int x, int y) {

  public Position step(Direction direction) {
    return new Position(x + direction.dx, y + direction.dy);
  }

  /// Pins both coordinates into `[0, size - 1]`.
  public Position clamp(int size) {
    return new Position(Math.max(0, Math.min(size - 1, x)), Math.max(0, Math.min(size - 1, y)));
  }

  @Override
  public String toString() {
    return "(" + x + "," + y + ")";
  }
}
