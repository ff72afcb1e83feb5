// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import com.github.lightrace.msg.DeathReport;
import com.github.lightrace.msg.DirectionChange;
import com.github.lightrace.msg.Envelope;
import com.github.lightrace.msg.IntervalUpdate;
import com.github.lightrace.msg.LeaderStateUpdate;
import com.github.lightrace.network.Gossip;
import com.github.lightrace.network.NetworkAddress;
import com.github.lightrace.network.Transport;
import org.jetbrains.annotations.TestOnly;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static com.github.lightrace.LightraceLogger.LOGGER;

/// ## Lightrace Session
///
/// One peer's participation in a game. The session owns the [SessionState] and drives it from four loops each on
/// its own platform thread:
///
/// 1. **listen** polls the [Gossip] for envelopes. Every envelope from a roster member refreshes its last-seen
///    clock and is then routed by type: a `LeaderStateUpdate` is applied to the roster, history and board; a
///    `DirectionChange` is reconstructed onto the board by [DeadReckoning]; a `DeathReport` is counted against the
///    alive tally. While this peer leads it also records the sender's position into the history.
/// 2. **broadcast** sends an `IntervalUpdate` to every other peer or, while this peer leads, a `LeaderStateUpdate`
///    carrying the full history and the dead-node set.
/// 3. **tick** advances every peer one cell with the [TickSimulator]. A local collision is reported to all peers.
/// 4. **failure check** runs the [FailureDetector] on the broadcast interval. A follower that evicts a silent leader
///    promotes the next peer on the roster without any election messages.
///
/// Each loop does its read-modify-write under one acquisition of the state mutex. Sends and [SimulationListener]
/// callbacks are collected while the mutex is held and run after it is released.
///
/// When the alive tally reaches one the tick and broadcast loops stop. The listen and failure loops run until
/// [#close()].
public class LightraceSession implements AutoCloseable {
  static final Duration LISTEN_POLL = Duration.ofMillis(100);

  private final GameConfig config;
  private final SessionState state;
  private final Gossip gossip;
  private final Clock clock;
  private final SimulationListener listener;

  private final TickSimulator simulator = new TickSimulator();
  private final HistoryAggregator aggregator = new HistoryAggregator();
  private final DeadReckoning deadReckoning = new DeadReckoning();

  private final PeriodicLoop listenLoop;
  private final PeriodicLoop broadcastLoop;
  private final PeriodicLoop tickLoop;
  private final PeriodicLoop failureLoop;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  LightraceSession(GameConfig config, SessionState state, Gossip gossip, Clock clock, SimulationListener listener) {
    this.config = config;
    this.state = state;
    this.gossip = gossip;
    this.clock = clock;
    this.listener = listener;
    final var self = state.self().id();
    this.listenLoop = new PeriodicLoop("lightrace-listen-" + self, Duration.ZERO, () -> listenOnce(LISTEN_POLL));
    this.broadcastLoop = new PeriodicLoop("lightrace-broadcast-" + self, config.broadcastInterval(), this::broadcastOnce);
    this.tickLoop = new PeriodicLoop("lightrace-tick-" + self, config.tickInterval(), this::tickOnce);
    this.failureLoop = new PeriodicLoop("lightrace-failure-" + self, config.broadcastInterval(), this::checkFailuresOnce);
  }

  /// Builds a session from the ordered roster handed over by matchmaking. Nothing is started.
  ///
  /// @param config the game configuration shared by every peer in the room
  /// @param roster the ordered roster where index 0 is the initial leader
  /// @param local the endpoint this peer listens on which identifies it in the roster
  /// @param transport the datagram transport already bound to `local`
  /// @param clock the time source of the failure detector
  /// @param listener the presentation layer
  /// @throws IllegalArgumentException if the roster is larger than the room, has a duplicate identity or endpoint,
  ///                                  has no start position for a member, or does not contain `local`
  public static LightraceSession bootstrap(GameConfig config,
                                           List<RosterEntry> roster,
                                           NetworkAddress local,
                                           Transport transport,
                                           Clock clock,
                                           SimulationListener listener) {
    final var state = initialState(config, roster, local, clock);
    LOGGER.info(() -> state.self() + " bootstrapped at " + local + " with roster " + state.membership()
        + " leader " + state.membership().leader().map(PeerId::id).orElse("none"));
    return new LightraceSession(config, state, new Gossip(transport), clock, listener);
  }

  static SessionState initialState(GameConfig config, List<RosterEntry> roster, NetworkAddress local, Clock clock) {
    if (roster.isEmpty()) {
      throw new IllegalArgumentException("Roster is empty");
    }
    if (roster.size() > config.roomSize()) {
      throw new IllegalArgumentException("Roster of " + roster.size() + " exceeds room size " + config.roomSize());
    }
    final var endpoints = new HashSet<NetworkAddress>();
    final var membership = new Membership();
    final var board = new Board(config.gridSize());
    PeerId self = null;
    for (RosterEntry entry : roster) {
      final var start = config.startPositions().get(entry.id());
      if (start == null) {
        throw new IllegalArgumentException("No start position configured for " + entry.id());
      }
      if (!endpoints.add(entry.endpoint())) {
        throw new IllegalArgumentException("Duplicate endpoint " + entry.endpoint() + " in roster");
      }
      if (!membership.register(new Peer(entry.id(), entry.endpoint(), start.position(), start.heading()))) {
        throw new IllegalArgumentException("Duplicate identity " + entry.id() + " in roster");
      }
      board.mark(start.position(), Cell.head(entry.id()));
      if (entry.endpoint().equals(local)) {
        self = entry.id();
      }
    }
    if (self == null) {
      throw new IllegalArgumentException("Local endpoint " + local + " is not on the roster " + roster);
    }
    final var detector = new FailureDetector(config.failureThreshold());
    final var now = clock.instant();
    for (Peer peer : membership.others(self)) {
      detector.heartbeat(peer.id(), now);
    }
    return new SessionState(self, membership, detector, board);
  }

  /// Starts the four loops. Calling it again does nothing.
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    LOGGER.info(() -> state.self() + " starting session as " + (isLeader() ? "leader" : "follower"));
    final var initial = state.underMutex(() -> state.board().copy());
    notifyListener("onBoardUpdated", l -> l.onBoardUpdated(initial));
    listenLoop.start();
    broadcastLoop.start();
    tickLoop.start();
    failureLoop.start();
  }

  /// Steers the local peer. Does nothing if the peer is dead, the game is over or the heading is unchanged.
  /// Otherwise the new heading is adopted immediately and announced to every other peer with the current position
  /// so that they can reconstruct the path taken since their last update.
  public void changeDirection(Direction heading) {
    runThenFire(effects -> {
      if (state.status() != SessionState.Status.ALIVE_PLAYING || state.gameOver()) {
        LOGGER.fine(() -> state.self() + " ignoring direction change to " + heading + " while " + state.status());
        return;
      }
      final var me = state.selfPeer();
      if (me.heading() == heading) {
        return;
      }
      final var turned = me.withHeading(heading);
      state.membership().update(turned);
      LOGGER.fine(() -> state.self() + " turned from " + me.heading() + " to " + heading + " at " + me.position());
      final var envelope = new DirectionChange(turned);
      final var destinations = otherEndpoints();
      effects.add(() -> gossip.broadcast(envelope, destinations));
    });
  }

  /// Advances the simulation by one tick.
  @TestOnly
  public void tickOnce() {
    runThenFire(effects -> {
      if (state.gameOver()) {
        return;
      }
      final var collided = simulator.tick(state.membership(), state.board(), state.crashed());
      if (!collided.isEmpty()) {
        LOGGER.fine(() -> state.self() + " tick collisions " + collided);
      }
      if (collided.contains(state.self()) && state.recordLocalDeath()) {
        final var report = new DeathReport(state.selfPeer());
        final var destinations = otherEndpoints();
        effects.add(() -> gossip.broadcast(report, destinations));
        effects.add(() -> notifyListener("onLocalDeath", SimulationListener::onLocalDeath));
      }
      final var board = state.board().copy();
      effects.add(() -> notifyListener("onBoardUpdated", l -> l.onBoardUpdated(board)));
      checkGameOver(effects);
    });
  }

  /// Sends one heartbeat, or one leader state update while this peer leads.
  @TestOnly
  public void broadcastOnce() {
    runThenFire(effects -> {
      if (state.gameOver()) {
        return;
      }
      final var me = state.selfPeer();
      final Envelope envelope;
      if (state.membership().isLeader(state.self())) {
        aggregator.record(state.history(), me);
        envelope = aggregator.leaderState(me, state.deadNodes(), state.history());
      } else {
        envelope = new IntervalUpdate(me);
      }
      final var destinations = otherEndpoints();
      effects.add(() -> gossip.broadcast(envelope, destinations));
    });
  }

  /// Runs one failure check against the session clock.
  @TestOnly
  public void checkFailuresOnce() {
    runThenFire(effects -> {
      final var evicted = state.detector().evictExpired(
          state.membership(), state.self(), state.deadNodes(), clock.instant());
      if (!evicted.isEmpty()) {
        checkLeaderChange(effects);
      }
    });
  }

  /// Waits up to `timeout` for one envelope and handles it.
  ///
  /// @return true if an envelope was received and decoded
  @TestOnly
  public boolean listenOnce(Duration timeout) {
    final var envelope = gossip.poll(timeout);
    envelope.ifPresent(this::handle);
    return envelope.isPresent();
  }

  void handle(Envelope envelope) {
    try {
      runThenFire(effects -> route(envelope, effects));
    } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
      LOGGER.warning(() -> state.self() + " dropping " + envelope.getClass().getSimpleName() + " from "
          + envelope.sender().id() + ": " + e);
    }
  }

  private void route(Envelope envelope, List<Runnable> effects) {
    final var sender = envelope.sender();
    final var self = state.self();
    if (sender.id().equals(self)) {
      LOGGER.finer(() -> self + " dropping own envelope");
      return;
    }
    final var membership = state.membership();
    if (!membership.contains(sender.id())) {
      LOGGER.fine(() -> self + " ignoring " + envelope.getClass().getSimpleName() + " from " + sender.id()
          + " which is not on the roster " + membership);
      return;
    }
    state.detector().heartbeat(sender.id(), clock.instant());
    LOGGER.finer(() -> self + " <~ " + envelope);

    if (envelope instanceof LeaderStateUpdate update) {
      if (!membership.isLeader(sender.id())) {
        LOGGER.fine(() -> self + " accepting leader state from " + sender.id() + " while roster leader is "
            + membership.leader().map(PeerId::id).orElse("none"));
      }
      final var removed = aggregator.apply(update, self, membership, state.history(), state.board());
      removed.forEach(state.detector()::forget);
      boardUpdated(effects);
      if (!removed.isEmpty()) {
        checkLeaderChange(effects);
      }
      return;
    }

    if (membership.isLeader(self) && (envelope instanceof IntervalUpdate || envelope instanceof DirectionChange)) {
      aggregator.record(state.history(), sender);
    }

    if (envelope instanceof DirectionChange) {
      if (state.confirmedDead(sender.id())) {
        LOGGER.fine(() -> self + " ignoring direction change from dead " + sender.id());
        return;
      }
      final var known = membership.peer(sender.id()).orElseThrow();
      if (state.releasePredictedCrash(sender.id()) && state.board().inBounds(known.position())) {
        // the peer is still playing so the dead cell we predicted is its head
        state.board().mark(known.position(), Cell.head(sender.id()));
      }
      deadReckoning.reconstruct(state.board(), known, sender).ifPresent(reckoned -> {
        membership.update(reckoned);
        boardUpdated(effects);
      });
    } else if (envelope instanceof DeathReport) {
      if (state.recordDeathReport(sender.id())) {
        checkGameOver(effects);
      }
    }
  }

  private void boardUpdated(List<Runnable> effects) {
    final var board = state.board().copy();
    effects.add(() -> notifyListener("onBoardUpdated", l -> l.onBoardUpdated(board)));
  }

  private void checkLeaderChange(List<Runnable> effects) {
    if (state.refreshLeader()) {
      final var leader = state.observedLeader();
      if (leader.map(state.self()::equals).orElse(false)) {
        LOGGER.info(() -> state.self() + " is now the leader");
      }
      effects.add(() -> notifyListener("onLeaderChange", l -> l.onLeaderChange(leader)));
    }
  }

  private void checkGameOver(List<Runnable> effects) {
    if (state.declareGameOverIfLastStanding()) {
      effects.add(this::stopSimulation);
      effects.add(() -> notifyListener("onVictory", SimulationListener::onVictory));
    }
  }

  private void stopSimulation() {
    LOGGER.info(() -> state.self() + " stopping tick and broadcast loops");
    tickLoop.stop();
    broadcastLoop.stop();
  }

  private List<NetworkAddress> otherEndpoints() {
    return state.membership().others(state.self()).stream().map(Peer::endpoint).toList();
  }

  /// Runs `body` under the mutex then runs the effects it collected once the mutex is released.
  private void runThenFire(Consumer<List<Runnable>> body) {
    final var effects = new ArrayList<Runnable>();
    state.runUnderMutex(() -> body.accept(effects));
    effects.forEach(Runnable::run);
  }

  private void notifyListener(String event, Consumer<SimulationListener> callback) {
    try {
      callback.accept(listener);
    } catch (RuntimeException e) {
      LOGGER.warning(() -> state.self() + " listener failed on " + event + ": " + e);
    }
  }

  public PeerId self() {
    return state.self();
  }

  public Optional<PeerId> leader() {
    return state.underMutex(() -> state.membership().leader());
  }

  public boolean isLeader() {
    return state.underMutex(() -> state.membership().isLeader(state.self()));
  }

  public SessionState.Status status() {
    return state.underMutex(state::status);
  }

  public int aliveCount() {
    return state.underMutex(state::aliveTally);
  }

  public boolean isGameOver() {
    return state.underMutex(state::gameOver);
  }

  /// A copy of the local board.
  public Board board() {
    return state.underMutex(() -> state.board().copy());
  }

  /// The current roster in roster order.
  public List<Peer> roster() {
    return state.underMutex(() -> state.membership().peers());
  }

  public NetworkAddress localAddress() {
    return gossip.localAddress();
  }

  public GameConfig config() {
    return config;
  }

  boolean isSimulating() {
    return tickLoop.isRunning() || broadcastLoop.isRunning();
  }

  /// Stops every loop then closes the gossip and its transport.
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    LOGGER.info(() -> state.self() + " closing session");
    tickLoop.close();
    broadcastLoop.close();
    failureLoop.close();
    listenLoop.close();
    gossip.close();
  }
}
