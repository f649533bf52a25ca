package com.github.simbo1905.nfp.books;

import java.nio.ByteBuffer;

/// The overlay written into a slot when it is put on a free list. The first word is
/// the tag `-1`, which lands on `Book.code` in the data file and on `Node23.nKeys` in
/// the index file. Neither can be `-1` for a live payload so the first word alone
/// tells a live slot from a free one.
///
/// Layout (big-endian, zero padded up to the slot width):
/// - tag (int): always [#TAG]
/// - offset (int): the slot's own byte offset, informational
/// - nextOffset (int): the next free slot or [SlotAllocator#NULL_OFFSET]
record FreeSlot(int offset, int nextOffset) {

  static final int TAG = -1;

  static final int SIZE = Integer.BYTES + Integer.BYTES + Integer.BYTES;

  byte[] toBytes(int slotSize) {
    if (slotSize < SIZE) {
      throw new IllegalArgumentException(
          String.format("slot size %d is smaller than a free slot of %d bytes", slotSize, SIZE));
    }
    ByteBuffer buffer = ByteBuffer.allocate(slotSize);
    buffer.putInt(TAG);
    buffer.putInt(offset);
    buffer.putInt(nextOffset);
    return buffer.array();
  }

  static FreeSlot fromBytes(byte[] bytes, int expectedOffset) {
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    final int tag = buffer.getInt();
    if (tag != TAG) {
      throw new IllegalStateException(
          String.format(
              "slot at %d is not a free slot, found tag %d expected %d",
              expectedOffset, tag, TAG));
    }
    return new FreeSlot(buffer.getInt(), buffer.getInt());
  }

  static boolean isFreeTag(int firstWord) {
    return firstWord == TAG;
  }
}
