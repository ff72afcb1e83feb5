// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static com.github.lightrace.MembershipTest.peer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FailureDetectorTest {
  final Peer p1 = peer("p1", 7001);
  final Peer p2 = peer("p2", 7002);
  final Peer p3 = peer("p3", 7003);
  final Duration threshold = Duration.ofMillis(700);
  final Instant start = Instant.parse("2025-01-01T00:00:00Z");

  Membership membership;
  FailureDetector detector;

  @BeforeEach
  void setup() {
    membership = new Membership();
    membership.register(p1);
    membership.register(p2);
    membership.register(p3);
    detector = new FailureDetector(threshold);
    membership.peers().forEach(p -> detector.heartbeat(p.id(), start));
  }

  @Test
  void silenceUpToTheThresholdIsTolerated() {
    assertThat(detector.hasExpired(p2.id(), start.plus(threshold))).isFalse();
    assertThat(detector.hasExpired(p2.id(), start.plus(threshold).plusMillis(1))).isTrue();
    assertThat(detector.hasExpired(new PeerId("unknown"), start.plusSeconds(60))).isFalse();
  }

  @Test
  void heartbeatRefreshes() {
    detector.heartbeat(p2.id(), start.plusMillis(600));
    assertThat(detector.hasExpired(p2.id(), start.plusMillis(1000))).isFalse();
  }

  @Test
  void leaderEvictsEveryTimedOutFollower() {
    final Set<PeerId> deadNodes = new HashSet<>();
    detector.heartbeat(p2.id(), start.plusMillis(500));
    final var evicted = detector.evictExpired(membership, p1.id(), deadNodes, start.plusMillis(800));
    assertThat(evicted).containsExactly(p3.id());
    assertThat(deadNodes).containsExactly(p3.id());
    assertThat(membership.peers()).containsExactly(p1, p2);
  }

  @Test
  void followerOnlyEvictsTheLeader() {
    final Set<PeerId> deadNodes = new HashSet<>();
    final var evicted = detector.evictExpired(membership, p3.id(), deadNodes, start.plusSeconds(5));
    assertThat(evicted).containsExactly(p1.id());
    assertThat(membership.leader()).contains(p2.id());
    assertThat(membership.contains(p2.id())).isTrue();
    assertThat(deadNodes).isEmpty();
  }

  @Test
  void followerPromotedByEvictionStartsActingAsLeader() {
    final Set<PeerId> deadNodes = new HashSet<>();
    final var later = start.plusSeconds(5);
    assertThat(detector.evictExpired(membership, p2.id(), deadNodes, later)).containsExactly(p1.id());
    assertThat(membership.isLeader(p2.id())).isTrue();
    assertThat(detector.evictExpired(membership, p2.id(), deadNodes, later)).containsExactly(p3.id());
    assertThat(deadNodes).containsExactly(p3.id());
  }

  @Test
  void evictionIsIdempotent() {
    final Set<PeerId> deadNodes = new HashSet<>();
    final var later = start.plusSeconds(1);
    detector.evictExpired(membership, p1.id(), deadNodes, later);
    final var roster = membership.peers();
    assertThat(detector.evictExpired(membership, p1.id(), deadNodes, later)).isEmpty();
    assertThat(membership.peers()).isEqualTo(roster);
  }

  @Test
  void selfIsNeverEvicted() {
    final Set<PeerId> deadNodes = new HashSet<>();
    detector.evictExpired(membership, p1.id(), deadNodes, start.plusSeconds(30));
    assertThat(membership.peers()).containsExactly(p1);
  }

  @Test
  void thresholdMustBePositive() {
    assertThatThrownBy(() -> new FailureDetector(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
  }
}
