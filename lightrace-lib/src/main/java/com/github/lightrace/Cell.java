// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

/// The marker held by one board cell. Every marker other than `EMPTY` names the peer that owns it.
public record Cell(Marker marker, PeerId owner) {

  public enum Marker {EMPTY, TRAIL, HEAD, DEAD}

  public static final Cell EMPTY = new Cell(Marker.EMPTY, null);

  public Cell {
    if (marker == null) {
      throw new IllegalArgumentException("marker required");
    }
    if ((marker == Marker.EMPTY) != (owner == null)) {
      throw new IllegalArgumentException("only an empty cell has no owner: " + marker + " " + owner);
    }
  }

  public static Cell trail(PeerId owner) {
    return new Cell(Marker.TRAIL, owner);
  }

  public static Cell head(PeerId owner) {
    return new Cell(Marker.HEAD, owner);
  }

  public static Cell dead(PeerId owner) {
    return new Cell(Marker.DEAD, owner);
  }

  public boolean isEmpty() {
    return marker == Marker.EMPTY;
  }

  @Override
  public String toString() {
    return switch (marker) {
      case EMPTY -> "__";
      case TRAIL -> "t:" + owner;
      case HEAD -> "h:" + owner;
      case DEAD -> "d:" + owner;
    };
  }
}
