package com.github.simbo1905.nfp.books;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// A fixed-width book record as stored in a data file slot.
///
/// Layout (big-endian):
/// - code (int): 4 bytes, the unique key; -1 is the free-slot tag
/// - title: 151 bytes, UTF-8 zero padded
/// - author: 201 bytes, UTF-8 zero padded
/// - publisher: 51 bytes, UTF-8 zero padded
/// - edition (int): 4 bytes
/// - year (int): 4 bytes
/// - price (double): 8 bytes
/// - stockQuantity (int): 4 bytes
///
/// Total: 427 bytes. Each text field keeps at least one trailing zero so the longest
/// title is 150 encoded bytes.
public record Book(
    int code,
    String title,
    String author,
    String publisher,
    int edition,
    int year,
    double price,
    int stockQuantity) {

  static final int TITLE_WIDTH = 151;
  static final int AUTHOR_WIDTH = 201;
  static final int PUBLISHER_WIDTH = 51;

  public static final int SIZE =
      Integer.BYTES
          + TITLE_WIDTH
          + AUTHOR_WIDTH
          + PUBLISHER_WIDTH
          + Integer.BYTES
          + Integer.BYTES
          + Double.BYTES
          + Integer.BYTES;

  public Book {
    if (FreeSlot.isFreeTag(code)) {
      throw new IllegalArgumentException("book code " + code + " is reserved for free slots");
    }
    Objects.requireNonNull(title, "title cannot be null");
    Objects.requireNonNull(author, "author cannot be null");
    Objects.requireNonNull(publisher, "publisher cannot be null");
    checkWidth("title", title, TITLE_WIDTH);
    checkWidth("author", author, AUTHOR_WIDTH);
    checkWidth("publisher", publisher, PUBLISHER_WIDTH);
  }

  private static void checkWidth(String field, String value, int width) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(field + " cannot contain a NUL character");
    }
    final int encoded = value.getBytes(StandardCharsets.UTF_8).length;
    if (encoded > width - 1) {
      throw new IllegalArgumentException(
          String.format(
              "%s is %d UTF-8 bytes but at most %d fit in the record", field, encoded, width - 1));
    }
  }

  byte[] toBytes() {
    ByteBuffer buffer = ByteBuffer.allocate(SIZE);
    buffer.putInt(code);
    putText(buffer, title, TITLE_WIDTH);
    putText(buffer, author, AUTHOR_WIDTH);
    putText(buffer, publisher, PUBLISHER_WIDTH);
    buffer.putInt(edition);
    buffer.putInt(year);
    buffer.putDouble(price);
    buffer.putInt(stockQuantity);
    return buffer.array();
  }

  static Book fromBytes(byte[] bytes) {
    if (bytes.length != SIZE) {
      throw new IllegalArgumentException(
          String.format("book record is %d bytes, got %d", SIZE, bytes.length));
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    final int code = buffer.getInt();
    final String title = getText(buffer, TITLE_WIDTH);
    final String author = getText(buffer, AUTHOR_WIDTH);
    final String publisher = getText(buffer, PUBLISHER_WIDTH);
    final int edition = buffer.getInt();
    final int year = buffer.getInt();
    final double price = buffer.getDouble();
    final int stockQuantity = buffer.getInt();
    return new Book(code, title, author, publisher, edition, year, price, stockQuantity);
  }

  private static void putText(ByteBuffer buffer, String value, int width) {
    final byte[] encoded = value.getBytes(StandardCharsets.UTF_8);
    buffer.put(encoded);
    // ByteBuffer.allocate zero fills so skipping the padding leaves it zeroed
    buffer.position(buffer.position() + width - encoded.length);
  }

  private static String getText(ByteBuffer buffer, int width) {
    final byte[] field = new byte[width];
    buffer.get(field);
    int len = 0;
    while (len < width && field[len] != 0) {
      len++;
    }
    return new String(field, 0, len, StandardCharsets.UTF_8);
  }
}
