// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.msg;

import com.github.lightrace.Peer;

/// The periodic heartbeat a follower broadcasts with its current position.
public record IntervalUpdate(Peer sender) implements Envelope {
}
