// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

import static com.github.lightrace.LightraceLogger.LOGGER;

/// Everything the four session loops share. The roster, the last-seen clock, the history, the dead-node set, the
/// board, the alive tally and the local status are only ever touched while holding the one mutex. Each loop does
/// its whole read-modify-write under a single acquisition so that, for example, a leader eviction and the leader
/// read that follows it are never torn by a concurrent tick.
///
/// The accessors return the live mutable structures and must only be used inside [#underMutex(Supplier)] or
/// [#runUnderMutex(Runnable)].
public class SessionState {

  /// The local peer's own participation. `DEAD_REPORTED` is terminal.
  public enum Status {
    ALIVE_PLAYING,
    DEAD_REPORTED
  }

  /// The Semaphore acts as a mutex that is not reentrant. Callbacks into the host application must therefore run
  /// after it has been released.
  private final Semaphore mutex = new Semaphore(1);

  private final PeerId self;
  private final Membership membership;
  private final FailureDetector detector;
  private final History history = new History();
  private final Board board;
  /// The leader's record of evicted followers which it broadcasts on every cycle.
  private final Set<PeerId> deadNodes = new LinkedHashSet<>();
  /// Peers that collided on the local board, or reported their own death, and are not simulated. A remote entry
  /// without a death report is only a prediction and may be released.
  private final Set<PeerId> crashed = new HashSet<>();
  /// Deaths known for certain: the local one and every peer that reported its own.
  private final Set<PeerId> reportedDeaths = new HashSet<>();

  private Status status = Status.ALIVE_PLAYING;
  private int aliveTally;
  private boolean gameOver;
  private Optional<PeerId> observedLeader;

  SessionState(PeerId self, Membership membership, FailureDetector detector, Board board) {
    this.self = self;
    this.membership = membership;
    this.detector = detector;
    this.board = board;
    this.aliveTally = membership.size();
    this.observedLeader = membership.leader();
  }

  public <T> T underMutex(Supplier<T> action) {
    mutex.acquireUninterruptibly();
    try {
      return action.get();
    } finally {
      mutex.release();
    }
  }

  public void runUnderMutex(Runnable action) {
    mutex.acquireUninterruptibly();
    try {
      action.run();
    } finally {
      mutex.release();
    }
  }

  PeerId self() {
    return self;
  }

  Peer selfPeer() {
    return membership.peer(self)
        .orElseThrow(() -> new IllegalStateException(self + " is missing from its own roster " + membership));
  }

  Membership membership() {
    return membership;
  }

  FailureDetector detector() {
    return detector;
  }

  History history() {
    return history;
  }

  Board board() {
    return board;
  }

  Set<PeerId> deadNodes() {
    return deadNodes;
  }

  Set<PeerId> crashed() {
    return crashed;
  }

  Status status() {
    return status;
  }

  int aliveTally() {
    return aliveTally;
  }

  boolean gameOver() {
    return gameOver;
  }

  /// Moves the local peer to `DEAD_REPORTED` and counts it out of the tally.
  ///
  /// @return false if the local death was already recorded
  boolean recordLocalDeath() {
    if (status == Status.DEAD_REPORTED) {
      return false;
    }
    status = Status.DEAD_REPORTED;
    reportedDeaths.add(self);
    crashed.add(self);
    aliveTally--;
    LOGGER.info(() -> self + " died, alive tally now " + aliveTally);
    return true;
  }

  /// Counts a remote death report. Repeated reports from the same peer are counted once as the report is gossiped
  /// without any delivery guarantee.
  ///
  /// @return false if that peer's death was already counted
  boolean recordDeathReport(PeerId dead) {
    if (!reportedDeaths.add(dead)) {
      LOGGER.finer(() -> self + " ignoring repeated death report from " + dead);
      return false;
    }
    crashed.add(dead);
    aliveTally--;
    LOGGER.info(() -> self + " received death report from " + dead + ", alive tally now " + aliveTally);
    return true;
  }

  boolean confirmedDead(PeerId id) {
    return reportedDeaths.contains(id);
  }

  /// Releases a remote peer whose collision was predicted by the local simulation but never confirmed by a death
  /// report, so that it is simulated again from its next fix.
  ///
  /// @return true if the peer was held as a predicted crash
  boolean releasePredictedCrash(PeerId id) {
    if (id.equals(self) || reportedDeaths.contains(id) || !crashed.remove(id)) {
      return false;
    }
    LOGGER.fine(() -> self + " releasing predicted crash of " + id);
    return true;
  }

  /// Ends the game the first time the alive tally drops to one or below.
  ///
  /// @return true exactly once when the game has just ended
  boolean declareGameOverIfLastStanding() {
    if (gameOver || aliveTally > 1) {
      return false;
    }
    gameOver = true;
    LOGGER.info(() -> self + " game over with alive tally " + aliveTally);
    return true;
  }

  /// Compares the roster's current leader with the one seen at the last call.
  ///
  /// @return true if leadership moved since the last call
  boolean refreshLeader() {
    final var current = membership.leader();
    if (current.equals(observedLeader)) {
      return false;
    }
    final var previous = observedLeader;
    observedLeader = current;
    LOGGER.info(() -> self + " observed leader change from " + previous.map(PeerId::id).orElse("none")
        + " to " + current.map(PeerId::id).orElse("none"));
    return true;
  }

  Optional<PeerId> observedLeader() {
    return observedLeader;
  }
}
