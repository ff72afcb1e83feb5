// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import com.github.lightrace.network.NetworkAddress;

/// One line of the ordered roster handed over by matchmaking when a room is full.
public record RosterEntry(PeerId id, NetworkAddress endpoint) {
  public RosterEntry {
    if (id == null || endpoint == null) {
      throw new IllegalArgumentException("id and endpoint are required");
    }
  }

  public static RosterEntry of(String id, NetworkAddress endpoint) {
    return new RosterEntry(new PeerId(id), endpoint);
  }
}
