// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.msg;

import com.github.lightrace.Peer;

/// Sent when a peer turns. The snapshot holds the position where it turned and the new heading.
public record DirectionChange(Peer sender) implements Envelope {
}
