// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.msg;

import com.github.lightrace.Peer;

/// Sent once by a peer that has collided.
public record DeathReport(Peer sender) implements Envelope {
}
