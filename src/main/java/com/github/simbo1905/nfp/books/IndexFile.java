package com.github.simbo1905.nfp.books;

import java.io.IOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The index file: an [IndexFileHeader] followed by [Node23] slots. Owns the header and
/// therefore both the root pointer and the free list of deleted nodes. Every header
/// change is written before it is adopted in memory.
final class IndexFile implements FreeListOwner {

  private static final Logger logger = Logger.getLogger(IndexFile.class.getName());

  private final FileOperations fileOperations;
  private final SlotAllocator allocator;
  private IndexFileHeader header;

  private IndexFile(FileOperations fileOperations, IndexFileHeader header) {
    this.fileOperations = fileOperations;
    this.header = header;
    this.allocator =
        new SlotAllocator("index", fileOperations, IndexFileHeader.SIZE, Node23.SIZE, this);
  }

  /// Initialises an empty index file holding an empty tree.
  static IndexFile create(FileOperations fileOperations) throws IOException {
    return new IndexFile(fileOperations, FileHeaders.createIndexHeader(fileOperations));
  }

  /// Opens an index file that already has a header.
  static IndexFile open(FileOperations fileOperations) throws IOException {
    final var header =
        IndexFileHeader.fromBytes(FileHeaders.readHeader(fileOperations, IndexFileHeader.SIZE));
    validate(header, fileOperations.length());
    logger.log(Level.FINE, () -> String.format("open index file header:%s", header));
    return new IndexFile(fileOperations, header);
  }

  private static void validate(IndexFileHeader header, long fileLength) {
    final int first = header.firstEmptyPosition();
    final boolean firstOk =
        first >= IndexFileHeader.SIZE
            && (first - IndexFileHeader.SIZE) % Node23.SIZE == 0
            && first <= fileLength;
    if (!firstOk
        || !isSlotOrNull(header.headEmptyPosition(), first)
        || !isSlotOrNull(header.rootAddress(), first)) {
      throw new IllegalStateException(
          String.format("corrupt index file header %s for file length %d", header, fileLength));
    }
  }

  private static boolean isSlotOrNull(int offset, int firstEmptyPosition) {
    return offset == SlotAllocator.NULL_OFFSET
        || (offset >= IndexFileHeader.SIZE
            && offset < firstEmptyPosition
            && (offset - IndexFileHeader.SIZE) % Node23.SIZE == 0);
  }

  Node23 load(int offset) throws IOException {
    allocator.checkOffset(offset);
    final byte[] bytes = new byte[Node23.SIZE];
    fileOperations.readFullyAt(offset, bytes);
    logger.log(
        Level.FINEST, () -> String.format("<node fp:%d bytes:%s", offset, FileHeaders.print(bytes)));
    return Node23.fromBytes(bytes, offset);
  }

  void save(int offset, Node23 node) throws IOException {
    allocator.checkOffset(offset);
    final byte[] bytes = node.toBytes();
    fileOperations.writeAt(offset, bytes);
    logger.log(
        Level.FINEST, () -> String.format(">node fp:%d bytes:%s", offset, FileHeaders.print(bytes)));
  }

  /// Writes `node` into a fresh or recycled slot.
  ///
  /// @return the slot's own offset
  int create(Node23 node) throws IOException {
    final int offset = allocator.allocate();
    save(offset, node);
    logger.log(Level.FINE, () -> String.format("create node offset:%d %s", offset, node));
    return offset;
  }

  void free(int offset) throws IOException {
    allocator.free(offset);
  }

  int rootAddress() {
    return header.rootAddress();
  }

  void setRootAddress(int rootAddress) throws IOException {
    if (rootAddress != SlotAllocator.NULL_OFFSET) {
      allocator.checkOffset(rootAddress);
    }
    final var updated = header.withRootAddress(rootAddress);
    FileHeaders.writeHeader(fileOperations, updated.toBytes());
    header = updated;
    logger.log(Level.FINE, () -> String.format("root address:%d", rootAddress));
  }

  /// Free node slots, the next one to be reused first.
  List<Integer> freeNodes() throws IOException {
    return allocator.freeSlots();
  }

  int slotCount() {
    return allocator.slotCount();
  }

  IndexFileHeader header() {
    return header;
  }

  @Override
  public FreeList freeList() {
    return header.freeList();
  }

  @Override
  public void commitFreeList(FreeList updated) throws IOException {
    final var updatedHeader = header.withFreeList(updated);
    FileHeaders.writeHeader(fileOperations, updatedHeader.toBytes());
    header = updatedHeader;
  }

  void sync() throws IOException {
    fileOperations.sync();
  }

  void close() throws IOException {
    fileOperations.close();
  }
}
