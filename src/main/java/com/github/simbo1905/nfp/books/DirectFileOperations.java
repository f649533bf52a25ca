package com.github.simbo1905.nfp.books;

import java.io.IOException;
import java.io.RandomAccessFile;

/// FileOperations backed directly by a RandomAccessFile with no buffering of its own.
record DirectFileOperations(RandomAccessFile randomAccessFile) implements FileOperations {

  @Override
  public void sync() throws IOException {
    randomAccessFile.getChannel().force(false);
  }

  @Override
  public void readFully(byte[] b) throws IOException {
    randomAccessFile.readFully(b);
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    randomAccessFile.write(b, off, len);
  }

  @Override
  public void seek(long pos) throws IOException {
    randomAccessFile.seek(pos);
  }

  @Override
  public long length() throws IOException {
    return randomAccessFile.length();
  }

  @Override
  public void setLength(long newLength) throws IOException {
    randomAccessFile.setLength(newLength);
  }

  @Override
  public void close() throws IOException {
    randomAccessFile.close();
  }

  @Override
  public int readInt() throws IOException {
    return randomAccessFile.readInt();
  }
}
