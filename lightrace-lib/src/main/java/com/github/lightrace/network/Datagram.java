// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.network;

/// Raw bytes as received from the network together with the address they came from.
public record Datagram(byte[] payload, NetworkAddress sender) {
}
