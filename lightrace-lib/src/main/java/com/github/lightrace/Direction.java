// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.util.Arrays;

/// The four cardinal headings. The y axis grows downwards so `UP` decrements y.
public enum Direction {
  UP('U', 0, -1),
  DOWN('D', 0, 1),
  LEFT('L', -1, 0),
  RIGHT('R', 1, 0);

  final char code;
  final int dx;
  final int dy;

  Direction(char code, int dx, int dy) {
    this.code = code;
    this.dx = dx;
    this.dy = dy;
  }

  public char code() {
    return code;
  }

  public int dx() {
    return dx;
  }

  public int dy() {
    return dy;
  }

  public static Direction fromCode(char code) {
    return Arrays.stream(values())
        .filter(d -> d.code == code)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown direction code: " + code));
  }
}
