package com.github.simbo1905.nfp.books;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The data file: a [DataFileHeader] followed by fixed-width [Book] slots. Deleted slots
/// are overwritten with a [FreeSlot] and recycled by the next insert. The record file
/// knows nothing about code uniqueness; callers check the index first.
final class RecordFile implements FreeListOwner {

  private static final Logger logger = Logger.getLogger(RecordFile.class.getName());

  private final FileOperations fileOperations;
  private final SlotAllocator allocator;
  private DataFileHeader header;

  private RecordFile(FileOperations fileOperations, DataFileHeader header) {
    this.fileOperations = fileOperations;
    this.header = header;
    this.allocator =
        new SlotAllocator("data", fileOperations, DataFileHeader.SIZE, Book.SIZE, this);
  }

  /// Initialises an empty data file.
  static RecordFile create(FileOperations fileOperations) throws IOException {
    return new RecordFile(fileOperations, FileHeaders.createDataHeader(fileOperations));
  }

  /// Opens a data file that already has a header.
  static RecordFile open(FileOperations fileOperations) throws IOException {
    final var header =
        DataFileHeader.fromBytes(FileHeaders.readHeader(fileOperations, DataFileHeader.SIZE));
    validate(header, fileOperations.length());
    logger.log(Level.FINE, () -> String.format("open data file header:%s", header));
    return new RecordFile(fileOperations, header);
  }

  private static void validate(DataFileHeader header, long fileLength) {
    final int first = header.firstEmptyPosition();
    final int head = header.headEmptyPosition();
    final boolean firstOk =
        first >= DataFileHeader.SIZE
            && (first - DataFileHeader.SIZE) % Book.SIZE == 0
            && first <= fileLength;
    final boolean headOk =
        head == SlotAllocator.NULL_OFFSET
            || (head >= DataFileHeader.SIZE
                && head < first
                && (head - DataFileHeader.SIZE) % Book.SIZE == 0);
    if (!firstOk || !headOk) {
      throw new IllegalStateException(
          String.format("corrupt data file header %s for file length %d", header, fileLength));
    }
  }

  /// Allocates a slot, preferring a recycled one, and writes the book into it.
  ///
  /// @return the byte offset of the slot now holding the book
  int insert(Book book) throws IOException {
    final int offset = allocator.allocate();
    writeSlot(offset, book);
    logger.log(Level.FINE, () -> String.format("insert code:%d offset:%d", book.code(), offset));
    return offset;
  }

  /// Reads the live book at `offset`.
  ///
  /// @throws IllegalStateException if the slot is on the free list or does not decode
  Book read(int offset) throws IOException {
    allocator.checkOffset(offset);
    final byte[] bytes = new byte[Book.SIZE];
    fileOperations.readFullyAt(offset, bytes);
    if (FreeSlot.isFreeTag(readTag(bytes))) {
      throw new IllegalStateException(
          String.format("data slot %d is on the free list", offset));
    }
    logger.log(
        Level.FINEST, () -> String.format("<book fp:%d bytes:%s", offset, FileHeaders.print(bytes)));
    return decode(offset, bytes);
  }

  /// Rewrites a live slot in place.
  void write(int offset, Book book) throws IOException {
    if (allocator.isFree(offset)) {
      throw new IllegalStateException(
          String.format("cannot write code %d to free data slot %d", book.code(), offset));
    }
    writeSlot(offset, book);
    logger.log(Level.FINE, () -> String.format("write code:%d offset:%d", book.code(), offset));
  }

  /// Returns the slot at `offset` to the free list.
  void delete(int offset) throws IOException {
    allocator.free(offset);
  }

  /// Visits every live book in file order, skipping slots on the free list.
  void forEachLive(BiConsumer<Integer, Book> visitor) throws IOException {
    final byte[] bytes = new byte[Book.SIZE];
    final int slots = allocator.slotCount();
    for (int index = 0; index < slots; index++) {
      final int offset = allocator.offsetOf(index);
      fileOperations.readFullyAt(offset, bytes);
      if (!FreeSlot.isFreeTag(readTag(bytes))) {
        visitor.accept(offset, decode(offset, bytes));
      }
    }
  }

  /// Free data slots, the next one to be reused first.
  List<Integer> freeSlots() throws IOException {
    return allocator.freeSlots();
  }

  int slotCount() {
    return allocator.slotCount();
  }

  DataFileHeader header() {
    return header;
  }

  @Override
  public FreeList freeList() {
    return header.freeList();
  }

  @Override
  public void commitFreeList(FreeList updated) throws IOException {
    final var updatedHeader = DataFileHeader.of(updated);
    FileHeaders.writeHeader(fileOperations, updatedHeader.toBytes());
    header = updatedHeader;
  }

  void sync() throws IOException {
    fileOperations.sync();
  }

  void close() throws IOException {
    fileOperations.close();
  }

  private void writeSlot(int offset, Book book) throws IOException {
    final byte[] bytes = book.toBytes();
    fileOperations.writeAt(offset, bytes);
    logger.log(
        Level.FINEST, () -> String.format(">book fp:%d bytes:%s", offset, FileHeaders.print(bytes)));
  }

  private static Book decode(int offset, byte[] bytes) {
    try {
      return Book.fromBytes(bytes);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(
          String.format("corrupt book record in data slot %d: %s", offset, e.getMessage()), e);
    }
  }

  private static int readTag(byte[] slot) {
    return ByteBuffer.wrap(slot).getInt();
  }
}
