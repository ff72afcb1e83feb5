// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.network;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/// Lightrace is agnostic to the underlying network. This interface abstracts an unreliable point-to-point datagram
/// channel. It makes no ordering or delivery promise: datagrams may be lost, duplicated or reordered.
public interface Transport extends Closeable {

  /// Transmits one datagram. Implementations must allow concurrent calls from many sender threads.
  void send(NetworkAddress to, byte[] payload) throws IOException;

  /// Waits up to `timeout` for the next inbound datagram. Calling it again continues the inbound sequence so a
  /// failed or empty receive can simply be retried. Only one thread receives at a time.
  Optional<Datagram> receive(Duration timeout) throws IOException;

  NetworkAddress localAddress();
}
