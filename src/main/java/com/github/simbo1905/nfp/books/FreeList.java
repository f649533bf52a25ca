package com.github.simbo1905.nfp.books;

/// Free-list state carried by both file headers. Both values are byte offsets.
///
/// @param firstEmptyPosition the next never used slot, grows by one slot width per append
/// @param headEmptyPosition the most recently freed slot or [SlotAllocator#NULL_OFFSET]
record FreeList(int firstEmptyPosition, int headEmptyPosition) {

  static FreeList empty(int headerSize) {
    return new FreeList(headerSize, SlotAllocator.NULL_OFFSET);
  }

  FreeList withHead(int newHead) {
    return new FreeList(firstEmptyPosition, newHead);
  }

  FreeList withFirstEmptyPosition(int newFirstEmptyPosition) {
    return new FreeList(newFirstEmptyPosition, headEmptyPosition);
  }

  boolean hasFreeSlot() {
    return headEmptyPosition != SlotAllocator.NULL_OFFSET;
  }
}
