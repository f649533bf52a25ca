package com.github.simbo1905.nfp.books;

import java.io.IOException;

/// Random access I/O over one of the two store files. Everything the slot allocators,
/// headers and codecs need goes through this seam so that tests can count or fail
/// individual operations.
interface FileOperations {

  /// Forces buffered modifications to the storage device. For direct I/O this is
  /// FileChannel.force(false).
  void sync() throws IOException;

  void readFully(byte[] b) throws IOException;

  void write(byte[] b, int off, int len) throws IOException;

  void seek(long pos) throws IOException;

  long length() throws IOException;

  void setLength(long newLength) throws IOException;

  void close() throws IOException;

  int readInt() throws IOException;

  /// Reads exactly `b.length` bytes starting at `pos`.
  default void readFullyAt(long pos, byte[] b) throws IOException {
    seek(pos);
    readFully(b);
  }

  /// Writes all of `b` starting at `pos`.
  default void writeAt(long pos, byte[] b) throws IOException {
    seek(pos);
    write(b, 0, b.length);
  }
}
