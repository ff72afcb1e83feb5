// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.nio.ByteBuffer;

/// Interface for serializing and deserializing objects to ByteBuffers
public interface Pickler<T> {
  /// Serializes the given object into the provided ByteBuffer
  ///
  /// @param object The object to serialize
  /// @param buffer The ByteBuffer to write to
  void serialize(T object, ByteBuffer buffer);

  /// Deserializes an object from the provided ByteBuffer
  ///
  /// @param buffer The ByteBuffer to read from
  /// @return The deserialized object
  /// @throws IllegalArgumentException if the bytes are not a valid encoding
  T deserialize(ByteBuffer buffer);

  /// Calculates the size in bytes required to serialize the given object so that buffers can be allocated
  /// exactly without serializing twice.
  int sizeOf(T value);

  default byte[] pickle(T value) {
    final var buffer = ByteBuffer.allocate(sizeOf(value));
    serialize(value, buffer);
    return buffer.array();
  }

  default T unpickle(byte[] bytes) {
    return deserialize(ByteBuffer.wrap(bytes));
  }
}
