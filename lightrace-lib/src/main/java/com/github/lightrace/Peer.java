// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import com.github.lightrace.network.NetworkAddress;

/// An immutable snapshot of one participant: identity, the endpoint it listens on, its grid position and heading.
/// The roster holds the latest snapshot of each peer and replaces it as the peer moves or turns.
public record Peer(PeerId id, NetworkAddress endpoint, Position position, Direction heading) {
  public Peer {
    if (id == null || endpoint == null || position == null || heading == null) {
      throw new IllegalArgumentException("all peer fields are required");
    }
  }

  public Peer withPosition(Position position) {
    return new Peer(id, endpoint, position, heading);
  }

  public Peer withHeading(Direction heading) {
    return new Peer(id, endpoint, position, heading);
  }
}
