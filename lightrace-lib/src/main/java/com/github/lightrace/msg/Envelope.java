// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.msg;

import com.github.lightrace.Peer;

/// A gossip message. Every envelope carries a snapshot of the peer that sent it which refreshes that peer's
/// last-seen clock at the receiver. Exactly one kind is meaningful per message.
public sealed interface Envelope permits IntervalUpdate, LeaderStateUpdate, DirectionChange, DeathReport {
  Peer sender();
}
