package com.github.simbo1905.nfp.books;

/// Parses one line of a batch import file:
///
/// `code;title;author;publisher;edition;year;price;stock`
///
/// Fields are trimmed. The price may use a comma as its decimal separator.
final class BookLineParser {

  static final int FIELDS = 8;

  private BookLineParser() {}

  /// @throws IllegalArgumentException naming `lineNumber` if a field is missing or not a
  ///     number, or if the book itself is invalid
  static Book parse(String line, int lineNumber) {
    final String[] fields = line.split(";", -1);
    if (fields.length != FIELDS) {
      throw new IllegalArgumentException(
          String.format("line %d has %d fields, expected %d", lineNumber, fields.length, FIELDS));
    }
    try {
      return new Book(
          Integer.parseInt(fields[0].trim()),
          fields[1].trim(),
          fields[2].trim(),
          fields[3].trim(),
          Integer.parseInt(fields[4].trim()),
          Integer.parseInt(fields[5].trim()),
          Double.parseDouble(fields[6].trim().replace(',', '.')),
          Integer.parseInt(fields[7].trim()));
    } catch (IllegalArgumentException e) {
      // NumberFormatException is an IllegalArgumentException
      throw new IllegalArgumentException("line " + lineNumber + ": " + e.getMessage(), e);
    }
  }
}
