package com.github.simbo1905.nfp.books;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// Wraps a [FileOperations], counting every call and throwing an [IOException] from the
/// call numbered `throwAtOperation`. Pass [Integer#MAX_VALUE] to only count. Calls after
/// the failing one go through again so a test can inspect the file afterwards.
class DelegatingExceptionOperations implements FileOperations {

  private static final Logger logger =
      Logger.getLogger(DelegatingExceptionOperations.class.getName());

  private final FileOperations delegate;

  @Getter private int operationCount = 0;

  @Getter private int throwAtOperation;

  private boolean didThrow = false;

  DelegatingExceptionOperations(FileOperations delegate, int throwAtOperation) {
    this.delegate = delegate;
    this.throwAtOperation = throwAtOperation;
  }

  /// Arms the wrapper to fail `operationsFromNow` calls later, counting from 1.
  void throwAfter(int operationsFromNow) {
    operationCount = 0;
    didThrow = false;
    throwAtOperation = operationsFromNow;
  }

  boolean didThrow() {
    return didThrow;
  }

  private void checkOperation() throws IOException {
    operationCount++;
    if (operationCount == throwAtOperation) {
      didThrow = true;
      logger.log(
          Level.FINE, () -> String.format("THROWING EXCEPTION at operation %d", operationCount));
      throw new IOException("Simulated exception at operation " + operationCount);
    }
  }

  @Override
  public void sync() throws IOException {
    checkOperation();
    delegate.sync();
  }

  @Override
  public void readFully(byte[] b) throws IOException {
    checkOperation();
    delegate.readFully(b);
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    checkOperation();
    delegate.write(b, off, len);
  }

  @Override
  public void seek(long pos) throws IOException {
    checkOperation();
    delegate.seek(pos);
  }

  @Override
  public long length() throws IOException {
    checkOperation();
    return delegate.length();
  }

  @Override
  public void setLength(long newLength) throws IOException {
    checkOperation();
    delegate.setLength(newLength);
  }

  @Override
  public void close() throws IOException {
    checkOperation();
    delegate.close();
  }

  @Override
  public int readInt() throws IOException {
    checkOperation();
    return delegate.readInt();
  }
}
