// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.network;

public record NetworkAddress(String host, int port) {
  public NetworkAddress {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("host required");
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
  }

  public NetworkAddress(int port) {
    this("localhost", port);
  }

  /// Parses `host:port`.
  public static NetworkAddress parse(String hostAndPort) {
    final var colon = hostAndPort.lastIndexOf(':');
    if (colon <= 0 || colon == hostAndPort.length() - 1) {
      throw new IllegalArgumentException("Expected host:port but got " + hostAndPort);
    }
    try {
      return new NetworkAddress(hostAndPort.substring(0, colon), Integer.parseInt(hostAndPort.substring(colon + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port in " + hostAndPort, e);
    }
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
