package com.github.simbo1905.nfp.books;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// A book catalogue kept in two files: a data file of fixed-width [Book] records and an
/// index file holding a 2-3 tree from book code to record offset. Both files recycle
/// deleted slots through their own free list.
///
/// The store is single threaded. Any I/O failure or detected corruption moves it to
/// [StoreState#UNKNOWN] after which every call fails. Rejected arguments such as a
/// duplicate code leave it open.
///
/// Use [BookStoreBuilder] to open one.
public class BookStore implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(BookStore.class.getName());

  /// Store state tracking for lifecycle management
  /// <ul>
  ///   <li><b>NEW</b> - files not yet validated</li>
  ///   <li><b>OPEN</b> - both files opened and operational</li>
  ///   <li><b>CLOSED</b> - cleanly closed via close()</li>
  ///   <li><b>UNKNOWN</b> - an operation failed part way, file state is uncertain</li>
  /// </ul>
  enum StoreState {
    NEW,
    OPEN,
    CLOSED,
    UNKNOWN
  }

  @Getter private final Path dataPath;
  @Getter private final Path indexPath;
  @Getter private final boolean readOnly;
  @Getter private final boolean syncOnWrite;

  private final RecordFile records;
  private final IndexFile index;
  private final TwoThreeTree tree;

  private StoreState state = StoreState.NEW;

  BookStore(
      Path dataPath,
      Path indexPath,
      FileOperations dataFile,
      FileOperations indexFile,
      boolean readOnly,
      boolean syncOnWrite)
      throws IOException {
    this.dataPath = dataPath;
    this.indexPath = indexPath;
    this.readOnly = readOnly;
    this.syncOnWrite = syncOnWrite;
    try {
      final boolean dataEmpty = dataFile.length() == 0;
      final boolean indexEmpty = indexFile.length() == 0;
      if (dataEmpty != indexEmpty) {
        throw new IllegalStateException(
            String.format(
                "data file %s and index file %s must both be new or both existing",
                dataPath, indexPath));
      }
      if (dataEmpty) {
        if (readOnly) {
          throw new IllegalStateException("cannot create a new store in read-only mode");
        }
        logger.log(Level.FINE, () -> String.format("creating store %s %s", dataPath, indexPath));
        this.records = RecordFile.create(dataFile);
        this.index = IndexFile.create(indexFile);
      } else {
        this.records = RecordFile.open(dataFile);
        this.index = IndexFile.open(indexFile);
      }
      this.tree = new TwoThreeTree(index);
      state = StoreState.OPEN;
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  /// Adds a book whose code is not yet in the store.
  ///
  /// @throws IllegalArgumentException if the code is already present; nothing is written
  public void addBook(Book book) throws IOException {
    ensureOpen();
    ensureNotReadOnly();
    if (locate(book.code()).isPresent()) {
      throw new IllegalArgumentException("Book code exists: " + book.code());
    }
    try {
      logger.log(Level.FINE, () -> String.format("addBook code:%d", book.code()));
      // the record goes first so the index never points at an unwritten slot
      final int offset = records.insert(book);
      tree.insert(book.code(), offset);
      syncIfRequired();
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  public Optional<Book> findBook(int code) throws IOException {
    ensureOpen();
    final var offset = locate(code);
    if (offset.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(records.read(offset.getAsInt()));
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  /// Removes the book with `code`. The index entry is removed before the record slot is
  /// freed.
  ///
  /// @return false if no such book exists
  public boolean removeBook(int code) throws IOException {
    ensureOpen();
    ensureNotReadOnly();
    final var offset = locate(code);
    if (offset.isEmpty()) {
      return false;
    }
    try {
      logger.log(
          Level.FINE, () -> String.format("removeBook code:%d offset:%d", code, offset.getAsInt()));
      tree.delete(code);
      records.delete(offset.getAsInt());
      syncIfRequired();
      return true;
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  /// Rewrites the record of an existing book in place. The index is unchanged.
  ///
  /// @throws IllegalArgumentException if no book has this code
  public void updateBook(Book book) throws IOException {
    ensureOpen();
    ensureNotReadOnly();
    final var offset = locate(book.code());
    if (offset.isEmpty()) {
      throw new IllegalArgumentException("Book code not found: " + book.code());
    }
    try {
      records.write(offset.getAsInt(), book);
      syncIfRequired();
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  /// Number of books, counted from the index.
  public int countBooks() throws IOException {
    ensureOpen();
    try {
      return tree.size();
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  /// Sum of the stock quantity of every indexed book.
  public long totalStock() throws IOException {
    long total = 0;
    for (Book book : scan(any -> true)) {
      total += book.stockQuantity();
    }
    return total;
  }

  /// Books whose author matches ignoring case, ordered by code.
  public List<Book> findByAuthor(String author) throws IOException {
    final var wanted = author.toLowerCase(Locale.ROOT);
    return scan(book -> book.author().toLowerCase(Locale.ROOT).equals(wanted));
  }

  /// The lowest coded book whose title matches ignoring case.
  public Optional<Book> findByTitle(String title) throws IOException {
    final var wanted = title.toLowerCase(Locale.ROOT);
    return scan(book -> book.title().toLowerCase(Locale.ROOT).equals(wanted)).stream()
        .findFirst();
  }

  /// Every book ordered by code.
  public List<Book> listBooks() throws IOException {
    return scan(book -> true);
  }

  /// Reads the books the index points at in code order. A record the index does not
  /// reach, such as one left behind by a failed add, is never returned.
  private List<Book> scan(Predicate<Book> filter) throws IOException {
    ensureOpen();
    try {
      final List<Book> matches = new ArrayList<>();
      for (int offset : indexedOffsets()) {
        final var book = records.read(offset);
        if (filter.test(book)) {
          matches.add(book);
        }
      }
      return matches;
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  /// Loads books from `;` separated lines in the layout read by [BookLineParser]. Blank
  /// lines are skipped. A line whose code is already stored is logged and skipped.
  ///
  /// @return the number of books added
  /// @throws IllegalArgumentException on a malformed line; books before it stay added
  public int importBooks(Reader source) throws IOException {
    ensureOpen();
    ensureNotReadOnly();
    final var reader = new BufferedReader(source);
    int added = 0;
    int lineNumber = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      final var book = BookLineParser.parse(line, lineNumber);
      if (locate(book.code()).isPresent()) {
        final int skipped = lineNumber;
        logger.log(
            Level.WARNING,
            () -> String.format("skipping line %d: book code %d exists", skipped, book.code()));
        continue;
      }
      addBook(book);
      added++;
    }
    final int count = added;
    logger.log(Level.FINE, () -> String.format("imported %d books", count));
    return count;
  }

  /// Record slots waiting for reuse, the next to be reused first.
  public List<Integer> freeRecordSlots() throws IOException {
    ensureOpen();
    try {
      return records.freeSlots();
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  /// Index node slots waiting for reuse, the next to be reused first.
  public List<Integer> freeIndexNodes() throws IOException {
    ensureOpen();
    try {
      return index.freeNodes();
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  /// Walks the whole index and fails with [IllegalStateException] if it is not a valid
  /// 2-3 tree or if an entry does not point at a live record carrying its code.
  public void checkIndex() throws IOException {
    ensureOpen();
    try {
      tree.checkInvariants();
      final Map<Integer, Integer> entries = new LinkedHashMap<>();
      tree.forEachInOrder(entries::put);
      for (Map.Entry<Integer, Integer> entry : entries.entrySet()) {
        final var book = records.read(entry.getValue());
        if (book.code() != entry.getKey()) {
          throw new IllegalStateException(
              String.format(
                  "index maps code %d to data slot %d holding code %d",
                  entry.getKey(), entry.getValue(), book.code()));
        }
      }
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  /// Flushes both files to the storage device.
  public void fsync() throws IOException {
    ensureOpen();
    try {
      logger.log(Level.FINE, () -> String.format("fsync called on %s", this));
      records.sync();
      index.sync();
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  @Override
  public void close() throws IOException {
    logger.log(Level.FINE, () -> String.format("close called on %s", this));
    if (state == StoreState.CLOSED) {
      return;
    }
    try {
      try {
        if (!readOnly && state == StoreState.OPEN) {
          records.sync();
          index.sync();
        }
      } finally {
        try {
          records.close();
        } finally {
          index.close();
        }
      }
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    } finally {
      state = StoreState.CLOSED;
    }
  }

  public boolean isClosed() {
    return state != StoreState.OPEN;
  }

  StoreState getState() {
    return state;
  }

  TwoThreeTree tree() {
    return tree;
  }

  RecordFile records() {
    return records;
  }

  IndexFile index() {
    return index;
  }

  @Override
  public String toString() {
    return String.format("BookStore[data=%s, index=%s, state=%s]", dataPath, indexPath, state);
  }

  private OptionalInt locate(int code) throws IOException {
    try {
      return tree.search(code);
    } catch (Exception e) {
      state = StoreState.UNKNOWN;
      throw e;
    }
  }

  private List<Integer> indexedOffsets() throws IOException {
    final List<Integer> offsets = new ArrayList<>();
    tree.forEachInOrder((code, offset) -> offsets.add(offset));
    return offsets;
  }

  private void syncIfRequired() throws IOException {
    if (syncOnWrite) {
      records.sync();
      index.sync();
    }
  }

  private void ensureOpen() {
    if (state != StoreState.OPEN) {
      throw new IllegalStateException("Store is in state " + state + ", expected OPEN");
    }
  }

  private void ensureNotReadOnly() {
    if (readOnly) {
      throw new UnsupportedOperationException("Cannot modify read-only store");
    }
  }
}
