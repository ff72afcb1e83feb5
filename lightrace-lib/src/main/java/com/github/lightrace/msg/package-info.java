// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The gossip envelopes exchanged between peers.
///
/// | Envelope            | Sent by          | When                                   | Receiver effect                          |
/// |---------------------|------------------|----------------------------------------|------------------------------------------|
/// | `IntervalUpdate`    | follower         | every broadcast interval               | heartbeat, leader appends to history     |
/// | `LeaderStateUpdate` | roster index 0   | every broadcast interval               | heartbeat, roster and history replaced   |
/// | `DirectionChange`   | any peer         | when the local player turns            | heartbeat, dead reckoning of the path    |
/// | `DeathReport`       | any peer         | once, when it collides                 | heartbeat, alive tally decremented       |
///
/// There is no delivery or ordering guarantee for any of them.
package com.github.lightrace.msg;
