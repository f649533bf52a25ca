package com.github.simbo1905.nfp.books;

import java.nio.ByteBuffer;

/// Header at byte 0 of the data file.
///
/// - firstEmptyPosition (int): 4 bytes
/// - headEmptyPosition (int): 4 bytes
///
/// Total: 8 bytes. Book slots start right after it.
record DataFileHeader(int firstEmptyPosition, int headEmptyPosition) {

  static final int SIZE = Integer.BYTES + Integer.BYTES;

  static DataFileHeader initial() {
    return of(FreeList.empty(SIZE));
  }

  static DataFileHeader of(FreeList freeList) {
    return new DataFileHeader(freeList.firstEmptyPosition(), freeList.headEmptyPosition());
  }

  FreeList freeList() {
    return new FreeList(firstEmptyPosition, headEmptyPosition);
  }

  byte[] toBytes() {
    ByteBuffer buffer = ByteBuffer.allocate(SIZE);
    buffer.putInt(firstEmptyPosition);
    buffer.putInt(headEmptyPosition);
    return buffer.array();
  }

  static DataFileHeader fromBytes(byte[] bytes) {
    if (bytes.length != SIZE) {
      throw new IllegalArgumentException(
          String.format("data file header is %d bytes, got %d", SIZE, bytes.length));
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    return new DataFileHeader(buffer.getInt(), buffer.getInt());
  }
}
