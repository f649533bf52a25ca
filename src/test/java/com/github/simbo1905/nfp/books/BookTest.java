package com.github.simbo1905.nfp.books;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.nio.ByteBuffer;
import org.junit.Assert;
import org.junit.Test;

public class BookTest extends JulLoggingConfig {

  @Test
  public void recordIsFixedWidth() {
    assertThat(Book.SIZE, is(427));
    assertThat(TestBooks.book(1).toBytes().length, is(Book.SIZE));
    assertThat(new Book(2, "", "", "", 0, 0, 0.0, 0).toBytes().length, is(Book.SIZE));
  }

  @Test
  public void multiByteTextSurvivesTheFixedWidthFields() {
    final var book =
        new Book(7, "Memórias Póstumas", "Machado de Assis", "Garnier", 1, 1881, 34.5, 3);
    assertThat(Book.fromBytes(book.toBytes()), is(book));
  }

  @Test
  public void codeIsTheFirstWord() {
    final var bytes = TestBooks.book(123456).toBytes();
    assertThat(ByteBuffer.wrap(bytes).getInt(), is(123456));
  }

  @Test
  public void longestTitleLeavesOneTerminatingZero() {
    final var title = "t".repeat(Book.TITLE_WIDTH - 1);
    final var book = new Book(1, title, "a", "p", 1, 2000, 1.0, 1);
    assertThat(Book.fromBytes(book.toBytes()).title(), is(title));
  }

  @Test(expected = IllegalArgumentException.class)
  public void titleOneByteTooLongIsRejected() {
    new Book(1, "t".repeat(Book.TITLE_WIDTH), "a", "p", 1, 2000, 1.0, 1);
  }

  @Test
  public void widthIsCountedInEncodedBytes() {
    // 'é' is two bytes in UTF-8
    new Book(1, "é".repeat(75), "a", "p", 1, 2000, 1.0, 1);
    Assert.assertThrows(
        IllegalArgumentException.class,
        () -> new Book(1, "é".repeat(76), "a", "p", 1, 2000, 1.0, 1));
    Assert.assertThrows(
        IllegalArgumentException.class,
        () -> new Book(1, "t", "a", "p".repeat(Book.PUBLISHER_WIDTH), 1, 2000, 1.0, 1));
    Assert.assertThrows(
        IllegalArgumentException.class,
        () -> new Book(1, "t", "a".repeat(Book.AUTHOR_WIDTH), "p", 1, 2000, 1.0, 1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void freeSlotTagIsNotAValidCode() {
    new Book(FreeSlot.TAG, "t", "a", "p", 1, 2000, 1.0, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void nulCharacterIsRejected() {
    new Book(1, "bad\0title", "a", "p", 1, 2000, 1.0, 1);
  }

  @Test(expected = NullPointerException.class)
  public void nullAuthorIsRejected() {
    new Book(1, "t", null, "p", 1, 2000, 1.0, 1);
  }
}
