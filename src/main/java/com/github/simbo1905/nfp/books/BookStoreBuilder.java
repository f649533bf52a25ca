package com.github.simbo1905.nfp.books;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for opening a [BookStore] with a fluent API.
///
/// Example usage:
/// <pre>
/// BookStore store = new BookStoreBuilder()
///     .dataPath("/path/to/books.dat")
///     .indexPath("/path/to/books.idx")
///     .syncOnWrite(true)
///     .open();
/// </pre>
///
/// Two empty or missing files create a new store. Two existing files are opened and their
/// headers validated.
public class BookStoreBuilder {

  private static final Logger logger = Logger.getLogger(BookStoreBuilder.class.getName());

  /// Name of the system property or environment variable giving the default for
  /// [#syncOnWrite(boolean)]. The system property wins.
  public static final String SYNC_ON_WRITE_KEY =
      String.format("%s.%s", BookStore.class.getName(), "SYNC_ON_WRITE");

  /// Access mode for the underlying files.
  @SuppressWarnings("LombokGetterMayBeUsed")
  public enum AccessMode {
    READ_ONLY("r"),
    READ_WRITE("rw");

    final String mode;

    AccessMode(String mode) {
      this.mode = mode;
    }

    public String getMode() {
      return mode;
    }
  }

  private Path dataPath;
  private Path indexPath;
  private String tempFilePrefix;
  private AccessMode accessMode = AccessMode.READ_WRITE;
  private boolean syncOnWrite = getSyncOnWriteOrDefault();

  /// Sets the path of the data file holding the book records.
  ///
  /// @param dataPath the path to the data file
  /// @return this builder for chaining
  public BookStoreBuilder dataPath(Path dataPath) {
    this.dataPath = dataPath;
    return this;
  }

  /// Sets the data file path using a string. The string is converted to a normalized Path.
  ///
  /// @param dataPath the path string to the data file
  /// @return this builder for chaining
  public BookStoreBuilder dataPath(String dataPath) {
    this.dataPath = Paths.get(dataPath).normalize();
    return this;
  }

  /// Sets the path of the index file holding the 2-3 tree.
  ///
  /// @param indexPath the path to the index file
  /// @return this builder for chaining
  public BookStoreBuilder indexPath(Path indexPath) {
    this.indexPath = indexPath;
    return this;
  }

  public BookStoreBuilder indexPath(String indexPath) {
    this.indexPath = Paths.get(indexPath).normalize();
    return this;
  }

  /// Creates a new store in two temporary files deleted on JVM exit.
  ///
  /// @param prefix the prefix for both temporary file names
  /// @return this builder for chaining
  public BookStoreBuilder tempFiles(String prefix) {
    this.tempFilePrefix = prefix;
    return this;
  }

  /// Opens the store in read-only mode.
  ///
  /// @param readOnly true for read-only access
  /// @return this builder for chaining
  public BookStoreBuilder readOnly(boolean readOnly) {
    this.accessMode = readOnly ? AccessMode.READ_ONLY : AccessMode.READ_WRITE;
    return this;
  }

  public BookStoreBuilder accessMode(AccessMode accessMode) {
    this.accessMode = accessMode;
    return this;
  }

  /// Forces both files to the storage device after every add, remove and update.
  ///
  /// @param syncOnWrite true to sync after each change
  /// @return this builder for chaining
  public BookStoreBuilder syncOnWrite(boolean syncOnWrite) {
    this.syncOnWrite = syncOnWrite;
    return this;
  }

  static boolean getSyncOnWriteOrDefault() {
    String value =
        System.getenv(SYNC_ON_WRITE_KEY) == null
            ? Boolean.FALSE.toString()
            : System.getenv(SYNC_ON_WRITE_KEY);
    value = System.getProperty(SYNC_ON_WRITE_KEY, value);
    return Boolean.parseBoolean(value);
  }

  /// Opens the store, creating it if both files are empty or missing.
  ///
  /// @return a new BookStore instance
  /// @throws IOException if either file cannot be opened
  /// @throws IllegalStateException if the existing files are not a valid store
  public BookStore open() throws IOException {
    if (tempFilePrefix != null) {
      dataPath = Files.createTempFile(tempFilePrefix, ".dat");
      indexPath = Files.createTempFile(tempFilePrefix, ".idx");
      dataPath.toFile().deleteOnExit();
      indexPath.toFile().deleteOnExit();
    }
    if (dataPath == null || indexPath == null) {
      throw new IllegalStateException("Either both dataPath and indexPath or tempFiles must be set");
    }
    if (dataPath.toAbsolutePath().normalize().equals(indexPath.toAbsolutePath().normalize())) {
      throw new IllegalArgumentException("dataPath and indexPath must differ: " + dataPath);
    }
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "open data:%s index:%s mode:%s syncOnWrite:%s",
                dataPath, indexPath, accessMode, syncOnWrite));

    final var dataFile = new RandomAccessFile(dataPath.toFile(), accessMode.getMode());
    RandomAccessFile indexFile = null;
    try {
      indexFile = new RandomAccessFile(indexPath.toFile(), accessMode.getMode());
      return new BookStore(
          dataPath,
          indexPath,
          new DirectFileOperations(dataFile),
          new DirectFileOperations(indexFile),
          accessMode == AccessMode.READ_ONLY,
          syncOnWrite);
    } catch (Exception e) {
      // close what was opened without masking the original exception
      closeQuietly(dataFile);
      if (indexFile != null) {
        closeQuietly(indexFile);
      }
      throw e;
    }
  }

  private static void closeQuietly(RandomAccessFile file) {
    try {
      file.close();
    } catch (IOException closeException) {
      logger.log(
          Level.WARNING, "Failed to close RandomAccessFile during open failure", closeException);
    }
  }
}
