package com.github.simbo1905.nfp.books;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Hands out fixed-width slots that follow a fixed header. A slot is either appended at
/// `firstEmptyPosition` or popped from a LIFO free list threaded through freed slots
/// themselves (see [FreeSlot]). One allocator exists per file.
///
/// Both [#allocate()] and [#free(int)] rewrite the owning header before returning.
/// When any write fails the [FreeListOwner] keeps its previous state.
final class SlotAllocator {

  private static final Logger logger = Logger.getLogger(SlotAllocator.class.getName());

  /// Sentinel for "no slot": empty free list, missing child, empty tree.
  static final int NULL_OFFSET = -1;

  private final String name;
  private final FileOperations fileOperations;
  private final int headerSize;
  private final int slotSize;
  private final FreeListOwner owner;

  SlotAllocator(
      String name,
      FileOperations fileOperations,
      int headerSize,
      int slotSize,
      FreeListOwner owner) {
    if (slotSize < FreeSlot.SIZE) {
      throw new IllegalArgumentException(
          String.format("%s slot size %d cannot hold a free slot", name, slotSize));
    }
    this.name = name;
    this.fileOperations = fileOperations;
    this.headerSize = headerSize;
    this.slotSize = slotSize;
    this.owner = owner;
  }

  /// Returns the offset of a slot ready for a new payload. A reused slot is returned by
  /// its own offset, not by the link stored inside it.
  ///
  /// The returned slot still carries a [FreeSlot] tag, so if the payload write never
  /// happens the slot is leaked rather than read back as live.
  int allocate() throws IOException {
    final var current = owner.freeList();
    if (current.hasFreeSlot()) {
      final int offset = current.headEmptyPosition();
      final var freeSlot = readFreeSlot(offset);
      owner.commitFreeList(current.withHead(freeSlot.nextOffset()));
      logger.log(
          Level.FINE,
          () ->
              String.format(
                  "%s allocate reused offset:%d next head:%d", name, offset, freeSlot.nextOffset()));
      return offset;
    }

    final int offset = current.firstEmptyPosition();
    final long end = (long) offset + slotSize;
    if (end > Integer.MAX_VALUE) {
      throw new IllegalStateException(
          String.format("%s cannot grow beyond %d bytes", name, Integer.MAX_VALUE));
    }
    if (fileOperations.length() < end) {
      fileOperations.setLength(end);
    }
    // tagged so an unfilled slot never reads back as live
    fileOperations.writeAt(offset, new FreeSlot(offset, NULL_OFFSET).toBytes(slotSize));
    owner.commitFreeList(current.withFirstEmptyPosition((int) end));
    logger.log(Level.FINE, () -> String.format("%s allocate appended offset:%d", name, offset));
    return offset;
  }

  /// Pushes a live slot onto the free list. The slot is overwritten with a [FreeSlot]
  /// before the header is moved to point at it.
  void free(int offset) throws IOException {
    checkOffset(offset);
    if (isFree(offset)) {
      throw new IllegalStateException(
          String.format("%s slot %d is already on the free list", name, offset));
    }
    final var current = owner.freeList();
    final var freeSlot = new FreeSlot(offset, current.headEmptyPosition());
    fileOperations.writeAt(offset, freeSlot.toBytes(slotSize));
    owner.commitFreeList(current.withHead(offset));
    logger.log(
        Level.FINE,
        () -> String.format("%s free offset:%d next:%d", name, offset, freeSlot.nextOffset()));
  }

  /// Whether the slot at `offset` currently holds a free-list link.
  boolean isFree(int offset) throws IOException {
    checkOffset(offset);
    fileOperations.seek(offset);
    return FreeSlot.isFreeTag(fileOperations.readInt());
  }

  /// Walks the free list from its head. The first element is the next slot that
  /// [#allocate()] will hand out.
  List<Integer> freeSlots() throws IOException {
    final List<Integer> result = new ArrayList<>();
    final Set<Integer> seen = new HashSet<>();
    int next = owner.freeList().headEmptyPosition();
    while (next != NULL_OFFSET) {
      checkOffset(next);
      if (!seen.add(next)) {
        throw new IllegalStateException(
            String.format("%s free list has a cycle at offset %d after %s", name, next, result));
      }
      result.add(next);
      next = readFreeSlot(next).nextOffset();
    }
    return result;
  }

  /// Number of slots ever appended to the file, live or free.
  int slotCount() {
    return indexOf(owner.freeList().firstEmptyPosition());
  }

  int offsetOf(int slotIndex) {
    if (slotIndex < 0) {
      throw new IllegalArgumentException("negative slot index " + slotIndex);
    }
    return headerSize + slotIndex * slotSize;
  }

  int indexOf(int offset) {
    return (offset - headerSize) / slotSize;
  }

  int slotSize() {
    return slotSize;
  }

  int headerSize() {
    return headerSize;
  }

  /// Rejects offsets that are not the start of a slot that has been handed out.
  void checkOffset(int offset) {
    final int firstEmpty = owner.freeList().firstEmptyPosition();
    if (offset < headerSize || offset >= firstEmpty || (offset - headerSize) % slotSize != 0) {
      throw new IllegalArgumentException(
          String.format(
              "%s offset %d is not an allocated slot (header:%d slot:%d firstEmpty:%d)",
              name, offset, headerSize, slotSize, firstEmpty));
    }
  }

  private FreeSlot readFreeSlot(int offset) throws IOException {
    checkOffset(offset);
    final byte[] bytes = new byte[FreeSlot.SIZE];
    fileOperations.readFullyAt(offset, bytes);
    final var freeSlot = FreeSlot.fromBytes(bytes, offset);
    logger.log(
        Level.FINEST,
        () -> String.format("%s <free fp:%d bytes:%s", name, offset, FileHeaders.print(bytes)));
    return freeSlot;
  }
}
