package com.github.simbo1905.nfp.books;

/// Sample books for tests. Field values are derived from the code so a read back can be
/// compared with a freshly built copy.
final class TestBooks {

  private TestBooks() {}

  static Book book(int code) {
    return new Book(
        code,
        "Title " + code,
        "Author " + (code % 7),
        "Publisher " + (code % 3),
        1 + code % 5,
        1950 + code % 70,
        9.5 + code,
        code % 11);
  }

  static Book book(int code, String title, String author, int stock) {
    return new Book(code, title, author, "Editora Abril", 2, 2001, 49.9, stock);
  }
}
