// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.udp;

import com.github.lightrace.network.Datagram;
import com.github.lightrace.network.NetworkAddress;
import com.github.lightrace.network.Transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.DatagramChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.time.Duration;
import java.util.Optional;

import static com.github.lightrace.udp.UdpLogger.LOGGER;

/// A [Transport] over a non-blocking `DatagramChannel`. Each envelope travels as exactly one datagram with no
/// framing of its own. Receiving waits on a `Selector` so that the listen loop can time out and notice a close.
///
/// Sends may come from many threads at once. Receives must come from a single thread as they share one read buffer.
public class UdpTransport implements Transport {
  static final int MAX_PACKET_SIZE = 65507;

  private final DatagramChannel channel;
  private final Selector selector;
  private final NetworkAddress localAddress;
  private final ByteBuffer readBuffer = ByteBuffer.allocateDirect(MAX_PACKET_SIZE);

  UdpTransport(DatagramChannel channel, Selector selector, NetworkAddress localAddress) {
    this.channel = channel;
    this.selector = selector;
    this.localAddress = localAddress;
  }

  /// Opens a channel bound to `address`. Port 0 binds an ephemeral port which [#localAddress()] then reports.
  ///
  /// @throws IOException if the socket cannot be bound, which is fatal to a session
  public static UdpTransport bind(NetworkAddress address) throws IOException {
    LOGGER.fine(() -> "Binding UDP transport to " + address);
    final var channel = DatagramChannel.open();
    try {
      channel.configureBlocking(false);
      channel.bind(new InetSocketAddress(address.host(), address.port()));
      final var selector = Selector.open();
      channel.register(selector, SelectionKey.OP_READ);
      final var bound = (InetSocketAddress) channel.getLocalAddress();
      final var local = new NetworkAddress(address.host(), bound.getPort());
      LOGGER.info(() -> "UDP transport listening on " + local);
      return new UdpTransport(channel, selector, local);
    } catch (IOException e) {
      channel.close();
      throw e;
    }
  }

  @Override
  public void send(NetworkAddress to, byte[] payload) throws IOException {
    if (payload.length > MAX_PACKET_SIZE) {
      throw new IllegalArgumentException("Payload of " + payload.length + " bytes exceeds " + MAX_PACKET_SIZE);
    }
    final int sent = channel.send(ByteBuffer.wrap(payload), new InetSocketAddress(to.host(), to.port()));
    if (sent == 0) {
      LOGGER.fine(() -> "Send buffer full, dropped " + payload.length + " bytes to " + to);
    } else {
      LOGGER.finest(() -> String.format("Sent %d bytes to %s", sent, to));
    }
  }

  @Override
  public synchronized Optional<Datagram> receive(Duration timeout) throws IOException {
    var datagram = readOne();
    if (datagram.isPresent()) {
      return datagram;
    }
    try {
      // select(0) would block forever
      if (selector.select(Math.max(1L, timeout.toMillis())) > 0) {
        selector.selectedKeys().clear();
        datagram = readOne();
      }
    } catch (ClosedSelectorException e) {
      // close() raced the listen loop
      final var closed = new ClosedChannelException();
      closed.initCause(e);
      throw closed;
    }
    return datagram;
  }

  private Optional<Datagram> readOne() throws IOException {
    readBuffer.clear();
    final SocketAddress sender = channel.receive(readBuffer);
    if (sender == null) {
      return Optional.empty();
    }
    readBuffer.flip();
    final var payload = new byte[readBuffer.remaining()];
    readBuffer.get(payload);
    final var from = sender instanceof InetSocketAddress inet
        ? new NetworkAddress(inet.getHostString(), inet.getPort())
        : NetworkAddress.parse(sender.toString());
    LOGGER.finest(() -> String.format("Received %d bytes from %s", payload.length, from));
    return Optional.of(new Datagram(payload, from));
  }

  @Override
  public NetworkAddress localAddress() {
    return localAddress;
  }

  @Override
  public void close() throws IOException {
    LOGGER.fine(() -> "Closing UDP transport on " + localAddress);
    try {
      selector.close();
    } finally {
      channel.close();
    }
  }
}
