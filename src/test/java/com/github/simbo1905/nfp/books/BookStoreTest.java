package com.github.simbo1905.nfp.books;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.stream.Collectors;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class BookStoreTest extends JulLoggingConfig {

  private Path dataPath;
  private Path indexPath;
  private BookStore store;

  @Before
  public void setUp() throws Exception {
    dataPath = Files.createTempFile("books-", ".dat");
    indexPath = Files.createTempFile("books-", ".idx");
    store = open();
  }

  @After
  public void tearDown() throws Exception {
    store.close();
    Files.deleteIfExists(dataPath);
    Files.deleteIfExists(indexPath);
  }

  private BookStore open() throws IOException {
    return new BookStoreBuilder().dataPath(dataPath).indexPath(indexPath).open();
  }

  private static List<Integer> codes(List<Book> books) {
    return books.stream().map(Book::code).collect(Collectors.toList());
  }

  @Test
  public void addedBookIsFoundByCode() throws Exception {
    final var book = TestBooks.book(1001);
    store.addBook(book);
    assertThat(store.findBook(1001), is(Optional.of(book)));
    assertThat(store.findBook(1002), is(Optional.empty()));
    assertThat(store.countBooks(), is(1));
  }

  @Test
  public void duplicateCodeIsRejectedAndTheStoreStaysOpen() throws Exception {
    store.addBook(TestBooks.book(7));
    final var dataHeader = store.records().header();
    final var indexHeader = store.index().header();

    Assert.assertThrows(
        IllegalArgumentException.class,
        () -> store.addBook(TestBooks.book(7, "Other", "Other", 1)));

    assertThat(store.isClosed(), is(false));
    assertThat(store.records().header(), is(dataHeader));
    assertThat(store.index().header(), is(indexHeader));
    assertThat(store.findBook(7), is(Optional.of(TestBooks.book(7))));
  }

  @Test
  public void removedBookSlotIsReused() throws Exception {
    for (int code = 1; code <= 3; code++) {
      store.addBook(TestBooks.book(code));
    }
    final int middle = DataFileHeader.SIZE + Book.SIZE;

    assertThat(store.removeBook(2), is(true));
    assertThat(store.removeBook(2), is(false));
    assertThat(store.findBook(2), is(Optional.empty()));
    assertThat(store.freeRecordSlots(), contains(middle));

    store.addBook(TestBooks.book(4));
    assertThat(store.freeRecordSlots(), is(empty()));
    assertThat(store.tree().search(4).getAsInt(), is(middle));
    assertThat(store.records().slotCount(), is(3));
  }

  @Test
  public void updateRewritesTheRecord() throws Exception {
    store.addBook(TestBooks.book(5));
    final var changed = TestBooks.book(5, "Second Edition", "New Author", 40);
    store.updateBook(changed);
    assertThat(store.findBook(5), is(Optional.of(changed)));
    assertThat(store.records().slotCount(), is(1));

    Assert.assertThrows(IllegalArgumentException.class, () -> store.updateBook(TestBooks.book(6)));
    assertThat(store.isClosed(), is(false));
  }

  @Test
  public void totalsAndSearches() throws Exception {
    store.addBook(TestBooks.book(30, "Dom Casmurro", "Machado de Assis", 5));
    store.addBook(TestBooks.book(10, "Quincas Borba", "MACHADO DE ASSIS", 2));
    store.addBook(TestBooks.book(20, "Vidas Secas", "Graciliano Ramos", 7));
    store.addBook(TestBooks.book(40, "Sao Bernardo", "Graciliano Ramos", 1));
    store.removeBook(40);

    assertThat(store.countBooks(), is(3));
    assertThat(store.totalStock(), is(14L));
    assertThat(codes(store.findByAuthor("machado de assis")), contains(10, 30));
    assertThat(codes(store.findByAuthor("Machado")), is(empty()));
    assertThat(store.findByTitle("vidas secas").map(Book::code), is(Optional.of(20)));
    assertThat(store.findByTitle("Sao Bernardo"), is(Optional.empty()));
    assertThat(codes(store.listBooks()), contains(10, 20, 30));
  }

  @Test
  public void booksSurviveReopen() throws Exception {
    for (int code = 1; code <= 50; code++) {
      store.addBook(TestBooks.book(code));
    }
    for (int code = 5; code <= 50; code += 5) {
      store.removeBook(code);
    }
    final var freeSlots = store.freeRecordSlots();
    final var freeNodes = store.freeIndexNodes();
    store.close();
    assertThat(store.isClosed(), is(true));

    store = open();

    store.checkIndex();
    assertThat(store.countBooks(), is(40));
    assertThat(store.freeRecordSlots(), is(freeSlots));
    assertThat(store.freeIndexNodes(), is(freeNodes));
    assertThat(store.findBook(12), is(Optional.of(TestBooks.book(12))));
    assertThat(store.findBook(15), is(Optional.empty()));
  }

  @Test
  public void importSkipsExistingCodes() throws Exception {
    store.addBook(TestBooks.book(2));
    final String lines =
        "1; Grande Sertao: Veredas ; Joao Guimaraes Rosa ; Jose Olympio ;1;1956;59,90;4\n"
            + "\n"
            + "2;Duplicate;Someone;Somewhere;1;2000;1.0;1\n"
            + "3;Macunaima;Mario de Andrade;Agir;2;1928;35.5;6\n";

    assertThat(store.importBooks(new StringReader(lines)), is(2));

    final var book = store.findBook(1).orElseThrow();
    assertThat(book.title(), is("Grande Sertao: Veredas"));
    assertThat(book.author(), is("Joao Guimaraes Rosa"));
    assertThat(book.price(), is(59.90));
    assertThat(store.findBook(2), is(Optional.of(TestBooks.book(2))));
    assertThat(store.countBooks(), is(3));
  }

  @Test
  public void malformedImportLineNamesTheLine() throws Exception {
    final String lines = "1;A;B;C;1;2000;1.0;1\n2;only three;fields\n";
    final var thrown =
        Assert.assertThrows(
            IllegalArgumentException.class, () -> store.importBooks(new StringReader(lines)));
    assertThat(thrown.getMessage().startsWith("line 2"), is(true));
    assertThat(store.countBooks(), is(1));
  }

  @Test
  public void readOnlyStoreRejectsChanges() throws Exception {
    store.addBook(TestBooks.book(1));
    store.close();

    store = new BookStoreBuilder().dataPath(dataPath).indexPath(indexPath).readOnly(true).open();

    assertThat(store.isReadOnly(), is(true));
    assertThat(store.findBook(1), is(Optional.of(TestBooks.book(1))));
    Assert.assertThrows(UnsupportedOperationException.class, () -> store.addBook(TestBooks.book(2)));
    Assert.assertThrows(UnsupportedOperationException.class, () -> store.removeBook(1));
  }

  @Test
  public void mismatchedFilesAreRejected() throws Exception {
    store.addBook(TestBooks.book(1));
    store.close();
    Files.write(indexPath, new byte[0]);

    Assert.assertThrows(IllegalStateException.class, this::open);
  }

  @Test
  public void ioFailureMovesTheStoreToUnknown() throws Exception {
    store.close();
    final var dataFile = new RandomAccessFile(dataPath.toFile(), "rw");
    final var indexFile = new RandomAccessFile(indexPath.toFile(), "rw");
    final var failingIndex =
        new DelegatingExceptionOperations(new DirectFileOperations(indexFile), Integer.MAX_VALUE);
    store =
        new BookStore(
            dataPath, indexPath, new DirectFileOperations(dataFile), failingIndex, false, false);
    store.addBook(TestBooks.book(1));

    failingIndex.throwAfter(1);
    Assert.assertThrows(IOException.class, () -> store.addBook(TestBooks.book(2)));
    logger.log(Level.FINE, () -> "after failure " + store);

    assertThat(store.getState(), is(BookStore.StoreState.UNKNOWN));
    assertThat(store.isClosed(), is(true));
    Assert.assertThrows(IllegalStateException.class, () -> store.findBook(1));
  }

  @Test
  public void closedStoreRejectsCalls() throws Exception {
    store.close();
    assertThat(store.getState(), is(BookStore.StoreState.CLOSED));
    Assert.assertThrows(IllegalStateException.class, () -> store.countBooks());
    store.close();
  }
}
