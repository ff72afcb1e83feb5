// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The network package provides the gossip layer over an unreliable transport.
///
/// Key types:
/// - `Transport`: send and receive raw datagrams. A UDP implementation lives in the `lightrace-udp` module.
/// - `EnvelopePickler`: the binary wire format of every envelope.
/// - `Gossip`: fans one envelope out to many peers with one fire-and-forget send each and decodes inbound
///   datagrams, dropping anything malformed.
/// - `NetworkAddress`: the endpoint a peer listens on.
///
/// Design characteristics:
/// 1. A failed send to one peer never blocks or aborts the sends to the others.
/// 2. Undecodable datagrams are logged and dropped without ending the inbound sequence.
/// 3. Nothing above this layer may rely on ordering or delivery.
package com.github.lightrace.network;
