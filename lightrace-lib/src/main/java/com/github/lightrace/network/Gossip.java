// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.network;

import com.github.lightrace.Pickler;
import com.github.lightrace.msg.Envelope;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

import static com.github.lightrace.LightraceLogger.LOGGER;

/// Gossip over an unreliable [Transport]. Outbound envelopes are serialized once and then handed to one
/// fire-and-forget task per destination on an unbounded pool so a slow or failing peer never holds up the others.
/// Inbound datagrams are decoded and anything malformed is logged and dropped.
public class Gossip implements AutoCloseable {
  /// The largest payload that fits into a single UDP datagram.
  public static final int MAX_PAYLOAD_SIZE = 65507;

  private final Transport transport;
  private final Pickler<Envelope> pickler;
  private final ExecutorService senders;

  public Gossip(Transport transport) {
    this(transport, EnvelopePickler.INSTANCE, Executors.newCachedThreadPool(senderThreads(transport.localAddress())));
  }

  public Gossip(Transport transport, Pickler<Envelope> pickler, ExecutorService senders) {
    this.transport = transport;
    this.pickler = pickler;
    this.senders = senders;
  }

  /// Serializes an outbound envelope. A failure here is a programmer error and is thrown to the caller.
  public byte[] encode(Envelope envelope) {
    final var bytes = pickler.pickle(envelope);
    if (bytes.length > MAX_PAYLOAD_SIZE) {
      throw new IllegalArgumentException("Envelope from %s too large: %d bytes".formatted(envelope.sender().id(), bytes.length));
    }
    return bytes;
  }

  /// Sends the envelope to every destination. Each send runs as its own task and its failure is logged.
  ///
  /// @return one future per destination which callers may ignore
  public List<Future<?>> broadcast(Envelope envelope, Collection<NetworkAddress> destinations) {
    final var bytes = encode(envelope);
    LOGGER.finest(() -> String.format("%s sending %s of %d bytes to %s",
        transport.localAddress(), envelope.getClass().getSimpleName(), bytes.length, destinations));
    final var futures = new ArrayList<Future<?>>(destinations.size());
    for (NetworkAddress to : destinations) {
      try {
        futures.add(senders.submit(() -> sendQuietly(to, bytes)));
      } catch (RejectedExecutionException e) {
        LOGGER.fine(() -> String.format("Not sending to %s as gossip is closed", to));
      }
    }
    return futures;
  }

  private void sendQuietly(NetworkAddress to, byte[] bytes) {
    try {
      transport.send(to, bytes);
    } catch (ClosedChannelException e) {
      LOGGER.fine(() -> String.format("Failed to send to %s: %s", to, "Channel closed"));
    } catch (IOException | RuntimeException e) {
      LOGGER.log(Level.WARNING, e, () -> String.format("Failed to send to %s: %s", to, e.getMessage()));
    }
  }

  /// Waits up to `timeout` for the next envelope that decodes. Receive errors and malformed payloads are logged and
  /// yield empty so that the caller simply polls again.
  public Optional<Envelope> poll(Duration timeout) {
    final Optional<Datagram> datagram;
    try {
      datagram = transport.receive(timeout);
    } catch (ClosedChannelException e) {
      LOGGER.fine("Receive on closed transport");
      return Optional.empty();
    } catch (IOException e) {
      LOGGER.warning(() -> String.format("Error receiving on %s: %s", transport.localAddress(), e.getMessage()));
      return Optional.empty();
    }
    return datagram.flatMap(this::decode);
  }

  Optional<Envelope> decode(Datagram datagram) {
    try {
      final var envelope = pickler.unpickle(datagram.payload());
      LOGGER.finest(() -> String.format("Received %s from %s", envelope, datagram.sender()));
      return Optional.of(envelope);
    } catch (IllegalArgumentException e) {
      LOGGER.warning(() -> String.format("Dropping malformed datagram of %d bytes from %s: %s",
          datagram.payload().length, datagram.sender(), e.getMessage()));
      return Optional.empty();
    }
  }

  public NetworkAddress localAddress() {
    return transport.localAddress();
  }

  /// Lets in-flight sends finish or fail on their own then closes the transport.
  @Override
  public void close() {
    senders.shutdown();
    try {
      if (!senders.awaitTermination(1, TimeUnit.SECONDS)) {
        LOGGER.fine("Abandoning sends still in flight at close");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    try {
      transport.close();
    } catch (IOException e) {
      LOGGER.warning("Error closing transport: " + e.getMessage());
    }
  }

  private static ThreadFactory senderThreads(NetworkAddress local) {
    final var counter = new AtomicInteger();
    return runnable -> {
      final var thread = new Thread(runnable, "gossip-send-" + local.port() + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
