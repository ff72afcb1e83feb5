// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.network;

import com.github.lightrace.Direction;
import com.github.lightrace.Peer;
import com.github.lightrace.PeerId;
import com.github.lightrace.Position;
import com.github.lightrace.msg.DeathReport;
import com.github.lightrace.msg.DirectionChange;
import com.github.lightrace.msg.Envelope;
import com.github.lightrace.msg.IntervalUpdate;
import com.github.lightrace.msg.LeaderStateUpdate;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EnvelopePicklerTests {
  final EnvelopePickler pickler = EnvelopePickler.INSTANCE;
  final Peer p1 = new Peer(new PeerId("p1"), new NetworkAddress("10.0.0.1", 7001), new Position(2, 1), Direction.RIGHT);
  final Peer p2 = new Peer(new PeerId("p2"), new NetworkAddress(7002), new Position(7, 8), Direction.UP);

  Envelope roundTrip(Envelope envelope) {
    final var bytes = pickler.pickle(envelope);
    assertThat(bytes).hasSize(pickler.sizeOf(envelope));
    return pickler.unpickle(bytes);
  }

  @Test
  public void testIntervalUpdate() {
    final var envelope = new IntervalUpdate(p2);
    assertThat(roundTrip(envelope)).isEqualTo(envelope);
  }

  @Test
  public void testDirectionChange() {
    final var envelope = new DirectionChange(p1.withHeading(Direction.DOWN));
    assertThat(roundTrip(envelope)).isEqualTo(envelope);
  }

  @Test
  public void testDeathReport() {
    final var envelope = new DeathReport(p2);
    assertThat(roundTrip(envelope)).isEqualTo(envelope);
  }

  @Test
  public void testLeaderStateUpdate() {
    final var envelope = new LeaderStateUpdate(p1, Set.of(new PeerId("p3"), new PeerId("p4")), Map.of(
        p1.id(), List.of(new Position(1, 1), new Position(2, 1)),
        p2.id(), List.of(new Position(8, 8), new Position(8, 8), new Position(7, 8)),
        new PeerId("p5"), List.of()));
    assertThat(roundTrip(envelope)).isEqualTo(envelope);
  }

  @Test
  public void testEmptyLeaderStateUpdate() {
    final var envelope = new LeaderStateUpdate(p1, Set.of(), Map.of());
    assertThat(roundTrip(envelope)).isEqualTo(envelope);
  }

  @Test
  public void testFlagsAndAbsentSections() {
    assertThat(EnvelopePickler.flags(new IntervalUpdate(p1))).isZero();
    assertThat(EnvelopePickler.flags(new DeathReport(p1))).isEqualTo(EnvelopePickler.DEATH_REPORT);

    // a leader flag without dead-node or history sections decodes to empty collections
    final var buffer = ByteBuffer.allocate(2 + EnvelopePickler.sizeOf(p1));
    buffer.put(EnvelopePickler.MAGIC);
    buffer.put((byte) EnvelopePickler.LEADER);
    EnvelopePickler.write(p1, buffer);
    final var decoded = pickler.unpickle(buffer.array());
    assertThat(decoded).isEqualTo(new LeaderStateUpdate(p1, Set.of(), Map.of()));
  }

  @Test
  public void testUnicodeIdentities() {
    final var peer = new Peer(new PeerId("spieler-ü"), new NetworkAddress("host-ß", 1), new Position(0, 0), Direction.LEFT);
    final var envelope = new IntervalUpdate(peer);
    assertThat(roundTrip(envelope)).isEqualTo(envelope);
  }

  @Test
  public void testBadMagic() {
    final var bytes = pickler.pickle(new IntervalUpdate(p1));
    bytes[0] = 0x00;
    assertThatThrownBy(() -> pickler.unpickle(bytes))
        .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("magic");
  }

  @Test
  public void testTruncated() {
    final var bytes = pickler.pickle(new LeaderStateUpdate(p1, Set.of(p2.id()), Map.of(p1.id(), List.of(p1.position()))));
    for (int length = 0; length < bytes.length; length++) {
      final var truncated = Arrays.copyOf(bytes, length);
      assertThatThrownBy(() -> pickler.unpickle(truncated)).isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  public void testTrailingGarbage() {
    final var bytes = pickler.pickle(new DeathReport(p2));
    final var padded = Arrays.copyOf(bytes, bytes.length + 3);
    assertThatThrownBy(() -> pickler.unpickle(padded))
        .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("trailing");
  }

  @Test
  public void testImpossibleCountIsRejected() {
    final var buffer = ByteBuffer.allocate(2 + EnvelopePickler.sizeOf(p1) + Integer.BYTES);
    buffer.put(EnvelopePickler.MAGIC);
    buffer.put((byte) (EnvelopePickler.LEADER | EnvelopePickler.DEAD_NODES));
    EnvelopePickler.write(p1, buffer);
    buffer.putInt(Integer.MAX_VALUE);
    assertThatThrownBy(() -> pickler.unpickle(buffer.array()))
        .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Invalid count");
  }

  @Test
  public void testUnknownHeading() {
    final var bytes = pickler.pickle(new IntervalUpdate(p1));
    bytes[bytes.length - 1] = 'X';
    assertThatThrownBy(() -> pickler.unpickle(bytes)).isInstanceOf(IllegalArgumentException.class);
  }
}
