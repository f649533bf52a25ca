package com.github.simbo1905.nfp.books;

import static com.github.simbo1905.nfp.books.SlotAllocator.NULL_OFFSET;

import java.nio.ByteBuffer;
import java.util.Arrays;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/// A 2-3 tree node. Each key is paired with the data file offset of its book. A leaf
/// has no children; an internal node has exactly `nKeys + 1`.
///
/// Layout in an index file slot (big-endian):
/// - nKeys (int): 1 or 2; -1 marks a [FreeSlot]
/// - left_key, right_key (int)
/// - leftBook, rightBook (int)
/// - left_child, middle_child, right_child (int)
///
/// Total: 32 bytes.
///
/// In memory the arrays have room for one extra key and child so that an insert can
/// overflow the node before [#splitOverflow()] cuts it in two. An overflowing node is
/// never written.
@ToString
@EqualsAndHashCode
final class Node23 {

  static final int SIZE = 8 * Integer.BYTES;

  static final int MAX_KEYS = 2;

  private int nKeys;
  private final int[] keys = new int[MAX_KEYS + 1];
  private final int[] books = new int[MAX_KEYS + 1];
  private final int[] children = new int[MAX_KEYS + 2];

  private Node23() {
    Arrays.fill(children, NULL_OFFSET);
  }

  static Node23 leaf(int key, int book) {
    Node23 node = new Node23();
    node.nKeys = 1;
    node.keys[0] = key;
    node.books[0] = book;
    return node;
  }

  static Node23 internal(int key, int book, int leftChild, int middleChild) {
    Node23 node = leaf(key, book);
    node.children[0] = leftChild;
    node.children[1] = middleChild;
    return node;
  }

  /// The result of splitting an overflowing node: the middle pair moves up to the parent
  /// and the right-hand part becomes a new sibling.
  record Split(int promotedKey, int promotedBook, Node23 sibling) {}

  int nKeys() {
    return nKeys;
  }

  int key(int i) {
    return keys[i];
  }

  int book(int i) {
    return books[i];
  }

  int child(int i) {
    return children[i];
  }

  boolean isLeaf() {
    return children[0] == NULL_OFFSET;
  }

  boolean isEmpty() {
    return nKeys == 0;
  }

  /// Position of `key` in this node or -1.
  int indexOfKey(int key) {
    for (int i = 0; i < nKeys; i++) {
      if (keys[i] == key) {
        return i;
      }
    }
    return -1;
  }

  /// Which child to descend into when looking for `key`: 0 left, 1 middle, 2 right.
  int childIndexFor(int key) {
    if (key < keys[0]) {
      return 0;
    }
    if (nKeys == 1 || key < keys[1]) {
      return 1;
    }
    return 2;
  }

  /// Position of the child pointer equal to `childOffset` or -1.
  int childIndexOf(int childOffset) {
    for (int i = 0; i <= nKeys; i++) {
      if (children[i] == childOffset) {
        return i;
      }
    }
    return -1;
  }

  void setPair(int i, int key, int book) {
    keys[i] = key;
    books[i] = book;
  }

  void setChild(int i, int childOffset) {
    children[i] = childOffset;
  }

  /// Adds a pair in key order. `rightChild` becomes the child immediately to the right
  /// of the new key; pass [SlotAllocator#NULL_OFFSET] at a leaf.
  void insertPair(int key, int book, int rightChild) {
    int position = 0;
    while (position < nKeys && keys[position] < key) {
      position++;
    }
    insertPairAt(position, key, book);
    if (!isLeaf() || rightChild != NULL_OFFSET) {
      insertChildAt(position + 1, rightChild);
    }
  }

  /// Inserts a pair at `position` shifting larger pairs right. Children are untouched.
  void insertPairAt(int position, int key, int book) {
    System.arraycopy(keys, position, keys, position + 1, nKeys - position);
    System.arraycopy(books, position, books, position + 1, nKeys - position);
    keys[position] = key;
    books[position] = book;
    nKeys++;
  }

  /// Inserts a child pointer at `position` shifting the following children right.
  /// The caller keeps the child count at `nKeys + 1`.
  void insertChildAt(int position, int childOffset) {
    System.arraycopy(children, position, children, position + 1, children.length - 1 - position);
    children[position] = childOffset;
  }

  /// Removes the pair at `position` shifting larger pairs left. Children are untouched.
  void removePairAt(int position) {
    System.arraycopy(keys, position + 1, keys, position, nKeys - position - 1);
    System.arraycopy(books, position + 1, books, position, nKeys - position - 1);
    nKeys--;
    keys[nKeys] = 0;
    books[nKeys] = 0;
  }

  /// Removes the child pointer at `position` shifting the following children left.
  void removeChildAt(int position) {
    System.arraycopy(children, position + 1, children, position, children.length - 1 - position);
    children[children.length - 1] = NULL_OFFSET;
  }

  boolean isOverflowing() {
    return nKeys > MAX_KEYS;
  }

  /// Splits a node holding three keys. This node keeps the smallest key and the two
  /// leftmost children, the middle pair is promoted and the largest key with the two
  /// rightmost children goes to the returned sibling.
  Split splitOverflow() {
    if (!isOverflowing()) {
      throw new IllegalStateException("only an overflowing node can be split: " + this);
    }
    Node23 sibling = new Node23();
    sibling.nKeys = 1;
    sibling.keys[0] = keys[2];
    sibling.books[0] = books[2];
    sibling.children[0] = children[2];
    sibling.children[1] = children[3];

    final var split = new Split(keys[1], books[1], sibling);

    nKeys = 1;
    for (int i = 1; i < keys.length; i++) {
      keys[i] = 0;
      books[i] = 0;
    }
    children[2] = NULL_OFFSET;
    children[3] = NULL_OFFSET;
    return split;
  }

  byte[] toBytes() {
    if (nKeys < 1 || nKeys > MAX_KEYS) {
      throw new IllegalStateException("cannot write a node with " + nKeys + " keys: " + this);
    }
    ByteBuffer buffer = ByteBuffer.allocate(SIZE);
    buffer.putInt(nKeys);
    buffer.putInt(keys[0]);
    buffer.putInt(keys[1]);
    buffer.putInt(books[0]);
    buffer.putInt(books[1]);
    buffer.putInt(children[0]);
    buffer.putInt(children[1]);
    buffer.putInt(children[2]);
    return buffer.array();
  }

  /// Decodes the node stored at `offset`.
  ///
  /// @throws IllegalStateException if the slot is free or the node is malformed
  static Node23 fromBytes(byte[] bytes, int offset) {
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    final int count = buffer.getInt();
    if (FreeSlot.isFreeTag(count)) {
      throw new IllegalStateException(
          String.format("index slot %d is on the free list", offset));
    }
    if (count < 1 || count > MAX_KEYS) {
      throw new IllegalStateException(
          String.format("index slot %d has an invalid key count %d", offset, count));
    }
    Node23 node = new Node23();
    node.nKeys = count;
    node.keys[0] = buffer.getInt();
    node.keys[1] = buffer.getInt();
    node.books[0] = buffer.getInt();
    node.books[1] = buffer.getInt();
    node.children[0] = buffer.getInt();
    node.children[1] = buffer.getInt();
    node.children[2] = buffer.getInt();

    final int expectedChildren = node.isLeaf() ? 0 : count + 1;
    for (int i = 0; i <= MAX_KEYS; i++) {
      final boolean present = node.children[i] != NULL_OFFSET;
      if (present != (i < expectedChildren)) {
        throw new IllegalStateException(
            String.format("index slot %d has a malformed child list %s", offset, node));
      }
    }
    return node;
  }
}
