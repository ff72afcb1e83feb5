// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.util.Optional;

/// One-way notifications to the presentation layer. They are fired after the session mutex has been released and
/// anything a listener throws is logged and otherwise ignored.
public interface SimulationListener {

  SimulationListener NOOP = new SimulationListener() {
  };

  /// The local peer collided. Fired at most once.
  default void onLocalDeath() {
  }

  /// The board changed. The board passed in is a copy that the listener may keep.
  default void onBoardUpdated(Board board) {
  }

  /// The alive tally reached one. Fired at most once.
  default void onVictory() {
  }

  default void onLeaderChange(Optional<PeerId> leader) {
  }
}
