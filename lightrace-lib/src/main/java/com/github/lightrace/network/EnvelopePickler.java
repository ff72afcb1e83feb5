// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.network;

import com.github.lightrace.Direction;
import com.github.lightrace.Peer;
import com.github.lightrace.PeerId;
import com.github.lightrace.Pickler;
import com.github.lightrace.Position;
import com.github.lightrace.msg.*;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.*;

/// Binary wire format of an [Envelope].
///
/// ```
/// magic:        1 byte  - 0x4C
/// flags:        1 byte  - bit 0 leader, bit 1 direction change, bit 2 death report,
///                         bit 3 dead-node section follows, bit 4 history section follows
/// sender:       id, host, port(4), x(4), y(4), heading(1)
/// dead nodes:   count(4) then count ids                          (only if bit 3)
/// history:      count(4) then per peer id, length(4), length x (x(4), y(4))  (only if bit 4)
/// ```
///
/// Strings are UTF-8 prefixed with a 2 byte length. Absent sections decode as empty and absent flags as false.
/// When more than one kind flag is set the leader flag wins, then direction change, then death report.
public class EnvelopePickler implements Pickler<Envelope> {
  public static final EnvelopePickler INSTANCE = new EnvelopePickler();

  static final byte MAGIC = 0x4C;
  static final int LEADER = 1;
  static final int DIRECTION_CHANGE = 1 << 1;
  static final int DEATH_REPORT = 1 << 2;
  static final int DEAD_NODES = 1 << 3;
  static final int HISTORY = 1 << 4;

  private static final int POSITION_SIZE = Integer.BYTES * 2;

  protected EnvelopePickler() {
  }

  @Override
  public void serialize(Envelope envelope, ByteBuffer buffer) {
    buffer.put(MAGIC);
    buffer.put((byte) flags(envelope));
    write(envelope.sender(), buffer);
    if (envelope instanceof LeaderStateUpdate) {
      final var update = (LeaderStateUpdate) envelope;
      buffer.putInt(update.deadNodes().size());
      update.deadNodes().forEach(id -> writeString(id.id(), buffer));
      buffer.putInt(update.history().size());
      update.history().forEach((id, positions) -> {
        writeString(id.id(), buffer);
        buffer.putInt(positions.size());
        positions.forEach(p -> write(p, buffer));
      });
    }
  }

  @Override
  public Envelope deserialize(ByteBuffer buffer) {
    try {
      final var magic = buffer.get();
      if (magic != MAGIC) {
        throw new IllegalArgumentException("Not an envelope, bad magic: " + magic);
      }
      final int flags = buffer.get();
      final var sender = readPeer(buffer);
      final Set<PeerId> deadNodes = (flags & DEAD_NODES) != 0 ? readDeadNodes(buffer) : Set.of();
      final Map<PeerId, List<Position>> history = (flags & HISTORY) != 0 ? readHistory(buffer) : Map.of();
      if (buffer.hasRemaining()) {
        throw new IllegalArgumentException(buffer.remaining() + " trailing bytes after envelope");
      }
      if ((flags & LEADER) != 0) {
        return new LeaderStateUpdate(sender, deadNodes, history);
      } else if ((flags & DIRECTION_CHANGE) != 0) {
        return new DirectionChange(sender);
      } else if ((flags & DEATH_REPORT) != 0) {
        return new DeathReport(sender);
      }
      return new IntervalUpdate(sender);
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Truncated envelope", e);
    }
  }

  @Override
  public int sizeOf(Envelope envelope) {
    int size = 2 + sizeOf(envelope.sender());
    if (envelope instanceof LeaderStateUpdate) {
      final var update = (LeaderStateUpdate) envelope;
      size += Integer.BYTES;
      size += update.deadNodes().stream().mapToInt(id -> sizeOf(id.id())).sum();
      size += Integer.BYTES;
      size += update.history().entrySet().stream()
          .mapToInt(e -> sizeOf(e.getKey().id()) + Integer.BYTES + e.getValue().size() * POSITION_SIZE)
          .sum();
    }
    return size;
  }

  static int flags(Envelope envelope) {
    if (envelope instanceof LeaderStateUpdate) {
      return LEADER | DEAD_NODES | HISTORY;
    } else if (envelope instanceof DirectionChange) {
      return DIRECTION_CHANGE;
    } else if (envelope instanceof DeathReport) {
      return DEATH_REPORT;
    } else if (envelope instanceof IntervalUpdate) {
      return 0;
    }
    throw new IllegalArgumentException("Unknown envelope type: " + envelope.getClass());
  }

  static void write(Peer peer, ByteBuffer buffer) {
    writeString(peer.id().id(), buffer);
    writeString(peer.endpoint().host(), buffer);
    buffer.putInt(peer.endpoint().port());
    write(peer.position(), buffer);
    buffer.put((byte) peer.heading().code());
  }

  static Peer readPeer(ByteBuffer buffer) {
    final var id = new PeerId(readString(buffer));
    final var host = readString(buffer);
    final var port = buffer.getInt();
    final var position = readPosition(buffer);
    final var heading = Direction.fromCode((char) buffer.get());
    return new Peer(id, new NetworkAddress(host, port), position, heading);
  }

  static int sizeOf(Peer peer) {
    return sizeOf(peer.id().id()) + sizeOf(peer.endpoint().host()) + Integer.BYTES + POSITION_SIZE + 1;
  }

  static void write(Position position, ByteBuffer buffer) {
    buffer.putInt(position.x());
    buffer.putInt(position.y());
  }

  static Position readPosition(ByteBuffer buffer) {
    return new Position(buffer.getInt(), buffer.getInt());
  }

  private static Set<PeerId> readDeadNodes(ByteBuffer buffer) {
    final var count = readCount(buffer, 2);
    final var deadNodes = new LinkedHashSet<PeerId>();
    for (int i = 0; i < count; i++) {
      deadNodes.add(new PeerId(readString(buffer)));
    }
    return deadNodes;
  }

  private static Map<PeerId, List<Position>> readHistory(ByteBuffer buffer) {
    final var count = readCount(buffer, 2 + Integer.BYTES);
    final var history = new LinkedHashMap<PeerId, List<Position>>();
    for (int i = 0; i < count; i++) {
      final var id = new PeerId(readString(buffer));
      final var length = readCount(buffer, POSITION_SIZE);
      final var positions = new ArrayList<Position>(length);
      for (int j = 0; j < length; j++) {
        positions.add(readPosition(buffer));
      }
      if (history.put(id, positions) != null) {
        throw new IllegalArgumentException("Duplicate history entry for " + id);
      }
    }
    return history;
  }

  /// Reads a count and rejects values that cannot possibly fit in what is left of the buffer.
  private static int readCount(ByteBuffer buffer, int minimumElementSize) {
    final var count = buffer.getInt();
    if (count < 0 || (long) count * minimumElementSize > buffer.remaining()) {
      throw new IllegalArgumentException("Invalid count " + count + " with " + buffer.remaining() + " bytes left");
    }
    return count;
  }

  static void writeString(String value, ByteBuffer buffer) {
    final var bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length > Short.MAX_VALUE) {
      throw new IllegalArgumentException("String too long to pickle: " + bytes.length + " bytes");
    }
    buffer.putShort((short) bytes.length);
    buffer.put(bytes);
  }

  static String readString(ByteBuffer buffer) {
    final var length = buffer.getShort();
    if (length < 0 || length > buffer.remaining()) {
      throw new IllegalArgumentException("Invalid string length " + length);
    }
    final var bytes = new byte[length];
    buffer.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  static int sizeOf(String value) {
    return Short.BYTES + value.getBytes(StandardCharsets.UTF_8).length;
  }
}
