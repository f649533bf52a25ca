package com.github.simbo1905.nfp.books;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Reads and writes the fixed headers at byte 0 of the data and index files.
final class FileHeaders {

  private static final Logger logger = Logger.getLogger(FileHeaders.class.getName());

  private FileHeaders() {}

  /// Writes an empty-tree index header: no root, no free nodes, first node slot right
  /// after the header.
  static IndexFileHeader createIndexHeader(FileOperations file) throws IOException {
    final var header = IndexFileHeader.initial();
    writeHeader(file, header.toBytes());
    return header;
  }

  /// Writes an empty data header: no free slots, first book slot right after the header.
  static DataFileHeader createDataHeader(FileOperations file) throws IOException {
    final var header = DataFileHeader.initial();
    writeHeader(file, header.toBytes());
    return header;
  }

  static byte[] readHeader(FileOperations file, int size) throws IOException {
    if (file.length() < size) {
      throw new IllegalStateException(
          String.format("file of %d bytes is too short for a %d byte header", file.length(), size));
    }
    final byte[] bytes = new byte[size];
    file.readFullyAt(0, bytes);
    logger.log(Level.FINEST, () -> String.format("<header len:%d bytes:%s", size, print(bytes)));
    return bytes;
  }

  static void writeHeader(FileOperations file, byte[] bytes) throws IOException {
    file.writeAt(0, bytes);
    logger.log(
        Level.FINEST, () -> String.format(">header len:%d bytes:%s", bytes.length, print(bytes)));
  }

  static String print(byte[] bytes) {
    StringBuilder sb = new StringBuilder();
    sb.append("[ ");
    for (byte b : bytes) {
      sb.append(String.format("0x%02X ", b));
    }
    sb.append("]");
    return sb.toString();
  }
}
