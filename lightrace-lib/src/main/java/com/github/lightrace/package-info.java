// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Core of a peer-to-peer light-trail race.
///
/// A room of peers each run a `LightraceSession` over the same ordered roster. The peer at roster index 0 leads
/// and is the only one that aggregates history. Every peer runs the tick simulation locally and corrects its board
/// from the leader's broadcasts and from the direction changes other peers announce. There is no election: when
/// the leader falls silent the followers evict it and the next peer on the roster leads.
///
/// The session is transport agnostic. It only needs a `com.github.lightrace.network.Transport`.
package com.github.lightrace;
