// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.udp;

import com.github.lightrace.GameConfig;
import com.github.lightrace.LightraceSession;
import com.github.lightrace.RosterEntry;
import com.github.lightrace.SimulationListener;
import com.github.lightrace.network.NetworkAddress;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

import static com.github.lightrace.udp.UdpLogger.LOGGER;

/// Binds a [LightraceSession] to a UDP socket and starts it.
public final class UdpLightrace {
  private UdpLightrace() {
  }

  /// @param config the game configuration shared by the room
  /// @param roster the ordered roster from matchmaking
  /// @param self this peer's endpoint exactly as it appears on the roster
  /// @param listener the presentation layer
  /// @return a running session which the caller must close
  /// @throws IOException if the socket cannot be bound
  /// @throws IllegalArgumentException if the roster is invalid for this peer
  public static LightraceSession start(GameConfig config,
                                       List<RosterEntry> roster,
                                       NetworkAddress self,
                                       SimulationListener listener) throws IOException {
    final var transport = UdpTransport.bind(self);
    final LightraceSession session;
    try {
      session = LightraceSession.bootstrap(config, roster, self, transport, Clock.systemUTC(), listener);
    } catch (RuntimeException e) {
      LOGGER.severe(() -> "Failed to bootstrap " + self + ": " + e.getMessage());
      transport.close();
      throw e;
    }
    session.start();
    return session;
  }
}
