// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

/// Stable identity of a peer for the duration of a session such as `p1`.
public record PeerId(String id) {
  public PeerId {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id required");
    }
  }

  @Override
  public String toString() {
    return id;
  }
}
