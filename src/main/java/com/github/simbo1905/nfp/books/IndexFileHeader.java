package com.github.simbo1905.nfp.books;

import java.nio.ByteBuffer;

/// Header at byte 0 of the index file.
///
/// - rootAddress (int): 4 bytes, offset of the root node or -1 when the tree is empty
/// - firstEmptyPosition (int): 4 bytes
/// - headEmptyPosition (int): 4 bytes
///
/// Total: 12 bytes. Node slots start right after it.
record IndexFileHeader(int rootAddress, int firstEmptyPosition, int headEmptyPosition) {

  static final int SIZE = Integer.BYTES + Integer.BYTES + Integer.BYTES;

  static IndexFileHeader initial() {
    return of(SlotAllocator.NULL_OFFSET, FreeList.empty(SIZE));
  }

  static IndexFileHeader of(int rootAddress, FreeList freeList) {
    return new IndexFileHeader(
        rootAddress, freeList.firstEmptyPosition(), freeList.headEmptyPosition());
  }

  FreeList freeList() {
    return new FreeList(firstEmptyPosition, headEmptyPosition);
  }

  IndexFileHeader withRootAddress(int newRootAddress) {
    return new IndexFileHeader(newRootAddress, firstEmptyPosition, headEmptyPosition);
  }

  IndexFileHeader withFreeList(FreeList freeList) {
    return of(rootAddress, freeList);
  }

  byte[] toBytes() {
    ByteBuffer buffer = ByteBuffer.allocate(SIZE);
    buffer.putInt(rootAddress);
    buffer.putInt(firstEmptyPosition);
    buffer.putInt(headEmptyPosition);
    return buffer.array();
  }

  static IndexFileHeader fromBytes(byte[] bytes) {
    if (bytes.length != SIZE) {
      throw new IllegalArgumentException(
          String.format("index file header is %d bytes, got %d", SIZE, bytes.length));
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    return new IndexFileHeader(buffer.getInt(), buffer.getInt(), buffer.getInt());
  }
}
