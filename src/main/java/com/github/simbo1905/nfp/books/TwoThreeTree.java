package com.github.simbo1905.nfp.books;

import static com.github.simbo1905.nfp.books.SlotAllocator.NULL_OFFSET;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A persistent 2-3 tree mapping a book code to the data file offset of its record.
/// Nodes live in an [IndexFile] which also holds the root pointer.
///
/// Insert and delete descend iteratively while recording the path from the root, so a
/// parent is found by popping the path rather than by searching from the root again.
/// Each operation keeps the nodes it has touched in a cache that is dropped when it
/// returns.
///
/// Write ordering: a node is written before any node or header that points at it, a key
/// leaves its old node before it is written into another, and a node is only freed once
/// nothing points at it any more. A failure part way through can lose keys but leaves a
/// valid tree.
final class TwoThreeTree {

  private static final Logger logger = Logger.getLogger(TwoThreeTree.class.getName());

  private final IndexFile indexFile;

  TwoThreeTree(IndexFile indexFile) {
    this.indexFile = indexFile;
  }

  /// Receives key and record offset pairs in ascending key order.
  @FunctionalInterface
  interface EntryVisitor {
    void visit(int key, int recordOffset);
  }

  /// Returns the offset of the node that holds `key`, or [SlotAllocator#NULL_OFFSET].
  int findNode(int key) throws IOException {
    int current = indexFile.rootAddress();
    while (current != NULL_OFFSET) {
      final var node = indexFile.load(current);
      if (node.indexOfKey(key) >= 0) {
        return current;
      }
      if (node.isLeaf()) {
        return NULL_OFFSET;
      }
      current = node.child(node.childIndexFor(key));
    }
    return NULL_OFFSET;
  }

  /// Returns the record offset paired with `key`.
  OptionalInt search(int key) throws IOException {
    final int nodeOffset = findNode(key);
    if (nodeOffset == NULL_OFFSET) {
      return OptionalInt.empty();
    }
    final var node = indexFile.load(nodeOffset);
    return OptionalInt.of(node.book(node.indexOfKey(key)));
  }

  /// Adds `key` paired with `recordOffset`.
  ///
  /// @throws IllegalArgumentException if the key is already present; nothing is written
  void insert(int key, int recordOffset) throws IOException {
    logger.log(Level.FINE, () -> String.format("insert key:%d record:%d", key, recordOffset));
    final int root = indexFile.rootAddress();
    if (root == NULL_OFFSET) {
      final int offset = indexFile.create(Node23.leaf(key, recordOffset));
      indexFile.setRootAddress(offset);
      return;
    }

    final var cache = new NodeCache();
    final Deque<Integer> path = new ArrayDeque<>();
    int current = root;
    while (true) {
      final var node = cache.load(current);
      if (node.indexOfKey(key) >= 0) {
        throw new IllegalArgumentException("Key exists: " + key);
      }
      path.push(current);
      if (node.isLeaf()) {
        break;
      }
      current = node.child(node.childIndexFor(key));
    }

    int pendingKey = key;
    int pendingRecord = recordOffset;
    int pendingChild = NULL_OFFSET;
    while (!path.isEmpty()) {
      final int offset = path.pop();
      final var node = cache.load(offset);
      node.insertPair(pendingKey, pendingRecord, pendingChild);
      if (!node.isOverflowing()) {
        cache.save(offset, node);
        return;
      }
      final var split = node.splitOverflow();
      final int siblingOffset = cache.create(split.sibling());
      cache.save(offset, node);
      logger.log(
          Level.FINER,
          () ->
              String.format(
                  "split node:%d sibling:%d promoted:%d",
                  offset, siblingOffset, split.promotedKey()));
      pendingKey = split.promotedKey();
      pendingRecord = split.promotedBook();
      pendingChild = siblingOffset;
    }

    final int newRoot = cache.create(Node23.internal(pendingKey, pendingRecord, root, pendingChild));
    indexFile.setRootAddress(newRoot);
    logger.log(Level.FINER, () -> String.format("root split new root:%d", newRoot));
  }

  /// Removes `key`.
  ///
  /// A key in an internal node is replaced by its in-order successor. The successor is
  /// taken out of its leaf first, repairing any underflow, and only then written over
  /// `key`, so a failure part way never leaves the same key in two nodes.
  ///
  /// @return false if the key was not present
  boolean delete(int key) throws IOException {
    logger.log(Level.FINE, () -> String.format("delete key:%d", key));
    final int root = indexFile.rootAddress();
    if (root == NULL_OFFSET) {
      return false;
    }

    final var cache = new NodeCache();
    final Deque<Integer> path = new ArrayDeque<>();
    int current = root;
    int keyIndex;
    while (true) {
      final var node = cache.load(current);
      path.push(current);
      keyIndex = node.indexOfKey(key);
      if (keyIndex >= 0) {
        break;
      }
      if (node.isLeaf()) {
        return false;
      }
      current = node.child(node.childIndexFor(key));
    }

    final var target = cache.load(current);
    if (target.isLeaf()) {
      target.removePairAt(keyIndex);
      removeFromLeaf(current, path, cache);
      return true;
    }

    // the in-order successor is the smallest key right of the deleted one
    int leafOffset = target.child(keyIndex + 1);
    while (true) {
      final var node = cache.load(leafOffset);
      path.push(leafOffset);
      if (node.isLeaf()) {
        break;
      }
      leafOffset = node.child(0);
    }
    final var successorLeaf = cache.load(leafOffset);
    final int successorKey = successorLeaf.key(0);
    final int successorBook = successorLeaf.book(0);
    successorLeaf.removePairAt(0);
    removeFromLeaf(leafOffset, path, cache);

    // a repair may have moved the deleted key to another node
    final int holder = cache.findNode(key);
    final var node = cache.load(holder);
    node.setPair(node.indexOfKey(key), successorKey, successorBook);
    cache.save(holder, node);
    logger.log(
        Level.FINER,
        () -> String.format("successor:%d replaced key:%d in node:%d", successorKey, key, holder));
    return true;
  }

  /// Persists a leaf that has just lost a pair. `path` ends with the leaf itself.
  private void removeFromLeaf(int leafOffset, Deque<Integer> path, NodeCache cache)
      throws IOException {
    path.pop();
    final var leaf = cache.load(leafOffset);
    if (!leaf.isEmpty()) {
      cache.save(leafOffset, leaf);
      return;
    }
    repairUnderflow(leafOffset, path, cache);
  }

  /// Fixes a node left with no keys. `path` holds its ancestors with the parent on top.
  ///
  /// Nodes are written so that a key leaves its old node before it appears in a new one.
  /// A borrow writes the donor, then the parent, then the hole. A merge stops at the
  /// first node that keeps a key or at the root; that node or the root pointer is written
  /// first and the siblings that absorbed the merges follow from the top down. Emptied
  /// nodes are freed last.
  private void repairUnderflow(int holeOffset, Deque<Integer> path, NodeCache cache)
      throws IOException {
    final Deque<Integer> absorbed = new ArrayDeque<>();
    final List<Integer> released = new ArrayList<>();
    int hole = holeOffset;
    while (true) {
      final var holeNode = cache.load(hole);
      if (path.isEmpty()) {
        // an empty root is replaced by its only child, or by nothing at the leaf level
        indexFile.setRootAddress(holeNode.child(0));
        released.add(hole);
        break;
      }

      final int parentOffset = path.pop();
      final var parent = cache.load(parentOffset);
      final int j = parent.childIndexOf(hole);
      if (j < 0) {
        throw new IllegalStateException(
            String.format("node %d is not a child of node %d %s", hole, parentOffset, parent));
      }

      if (j > 0) {
        final int leftOffset = parent.child(j - 1);
        final var left = cache.load(leftOffset);
        if (left.nKeys() == Node23.MAX_KEYS) {
          borrowFromLeft(parent, j, left, holeNode);
          cache.save(leftOffset, left);
          cache.save(parentOffset, parent);
          cache.save(hole, holeNode);
          break;
        }
      }
      if (j < parent.nKeys()) {
        final int rightOffset = parent.child(j + 1);
        final var right = cache.load(rightOffset);
        if (right.nKeys() == Node23.MAX_KEYS) {
          borrowFromRight(parent, j, right, holeNode);
          cache.save(rightOffset, right);
          cache.save(parentOffset, parent);
          cache.save(hole, holeNode);
          break;
        }
      }

      if (j > 0) {
        final int leftOffset = parent.child(j - 1);
        mergeIntoLeft(parent, j, cache.load(leftOffset), holeNode);
        absorbed.push(leftOffset);
      } else {
        final int rightOffset = parent.child(j + 1);
        mergeIntoRight(parent, j, cache.load(rightOffset), holeNode);
        absorbed.push(rightOffset);
      }
      released.add(hole);
      final int merged = hole;
      logger.log(
          Level.FINER, () -> String.format("merged node:%d into a sibling under %d", merged, parentOffset));

      if (!parent.isEmpty()) {
        cache.save(parentOffset, parent);
        break;
      }
      hole = parentOffset;
    }

    for (int offset : absorbed) {
      cache.save(offset, cache.load(offset));
    }
    for (int offset : released) {
      cache.free(offset);
    }
  }

  /// Rotates the left sibling's largest key up into the parent and the parent's
  /// separator down into the hole.
  private static void borrowFromLeft(Node23 parent, int j, Node23 left, Node23 hole) {
    hole.insertPairAt(0, parent.key(j - 1), parent.book(j - 1));
    if (!left.isLeaf()) {
      hole.insertChildAt(0, left.child(2));
      left.setChild(2, NULL_OFFSET);
    }
    parent.setPair(j - 1, left.key(1), left.book(1));
    left.removePairAt(1);
  }

  /// Rotates the right sibling's smallest key up into the parent and the parent's
  /// separator down into the hole.
  private static void borrowFromRight(Node23 parent, int j, Node23 right, Node23 hole) {
    hole.insertPairAt(0, parent.key(j), parent.book(j));
    if (!right.isLeaf()) {
      hole.setChild(1, right.child(0));
      right.removeChildAt(0);
    }
    parent.setPair(j, right.key(0), right.book(0));
    right.removePairAt(0);
  }

  /// Pulls the parent's separator down into a one-key left sibling which adopts the
  /// hole's remaining child. The parent loses a key and the pointer to the hole.
  private static void mergeIntoLeft(Node23 parent, int j, Node23 left, Node23 hole) {
    left.insertPairAt(1, parent.key(j - 1), parent.book(j - 1));
    if (!left.isLeaf()) {
      left.setChild(2, hole.child(0));
    }
    parent.removePairAt(j - 1);
    parent.removeChildAt(j);
  }

  /// As [#mergeIntoLeft] for a hole that is the leftmost child.
  private static void mergeIntoRight(Node23 parent, int j, Node23 right, Node23 hole) {
    right.insertPairAt(0, parent.key(j), parent.book(j));
    if (!right.isLeaf()) {
      right.insertChildAt(0, hole.child(0));
    }
    parent.removePairAt(j);
    parent.removeChildAt(j);
  }

  /// Visits every pair in ascending key order.
  void forEachInOrder(EntryVisitor visitor) throws IOException {
    final int root = indexFile.rootAddress();
    if (root == NULL_OFFSET) {
      return;
    }
    final Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(indexFile.load(root)));
    while (!stack.isEmpty()) {
      final var frame = stack.peek();
      final var node = frame.node;
      if (node.isLeaf()) {
        for (int i = 0; i < node.nKeys(); i++) {
          visitor.visit(node.key(i), node.book(i));
        }
        stack.pop();
        continue;
      }
      // even steps descend into child step/2, odd steps emit pair step/2
      final int step = frame.step++;
      if (step > 2 * node.nKeys()) {
        stack.pop();
      } else if (step % 2 == 0) {
        stack.push(new Frame(indexFile.load(node.child(step / 2))));
      } else {
        visitor.visit(node.key(step / 2), node.book(step / 2));
      }
    }
  }

  /// Number of keys in the tree.
  int size() throws IOException {
    final int[] count = {0};
    forEachInOrder((key, recordOffset) -> count[0]++);
    return count[0];
  }

  /// Number of levels, 0 for an empty tree.
  int height() throws IOException {
    int levels = 0;
    int current = indexFile.rootAddress();
    while (current != NULL_OFFSET) {
      levels++;
      final var node = indexFile.load(current);
      current = node.isLeaf() ? NULL_OFFSET : node.child(0);
    }
    return levels;
  }

  /// Walks the whole tree and checks that all leaves are at the same depth, that keys
  /// within a node are strictly increasing and that every key lies inside the range its
  /// parent's separators allow. Child counts are checked when each node is decoded.
  ///
  /// @throws IllegalStateException on the first violation found
  void checkInvariants() throws IOException {
    final int root = indexFile.rootAddress();
    if (root == NULL_OFFSET) {
      return;
    }
    final Set<Integer> seen = new HashSet<>();
    final Deque<Bounds> stack = new ArrayDeque<>();
    stack.push(new Bounds(root, 1, Long.MIN_VALUE, Long.MAX_VALUE));
    int leafDepth = -1;
    while (!stack.isEmpty()) {
      final var bounds = stack.pop();
      if (!seen.add(bounds.offset())) {
        throw new IllegalStateException("node " + bounds.offset() + " is reachable twice");
      }
      final var node = indexFile.load(bounds.offset());
      for (int i = 0; i < node.nKeys(); i++) {
        final int key = node.key(i);
        if (key <= bounds.low() || key >= bounds.high()) {
          throw new IllegalStateException(
              String.format(
                  "key %d in node %d is outside (%d, %d)",
                  key, bounds.offset(), bounds.low(), bounds.high()));
        }
        if (i > 0 && node.key(i - 1) >= key) {
          throw new IllegalStateException(
              String.format("keys out of order in node %d %s", bounds.offset(), node));
        }
      }
      if (node.isLeaf()) {
        if (leafDepth == -1) {
          leafDepth = bounds.depth();
        } else if (leafDepth != bounds.depth()) {
          throw new IllegalStateException(
              String.format(
                  "leaf %d at depth %d but other leaves are at depth %d",
                  bounds.offset(), bounds.depth(), leafDepth));
        }
        continue;
      }
      for (int c = 0; c <= node.nKeys(); c++) {
        final long low = c == 0 ? bounds.low() : node.key(c - 1);
        final long high = c == node.nKeys() ? bounds.high() : node.key(c);
        stack.push(new Bounds(node.child(c), bounds.depth() + 1, low, high));
      }
    }
  }

  private record Bounds(int offset, int depth, long low, long high) {}

  private static final class Frame {
    private final Node23 node;
    private int step;

    private Frame(Node23 node) {
      this.node = node;
    }
  }

  /// Nodes loaded during one insert or delete. Writes go straight through to the file.
  private final class NodeCache {
    private final Map<Integer, Node23> nodes = new HashMap<>();

    Node23 load(int offset) throws IOException {
      var node = nodes.get(offset);
      if (node == null) {
        node = indexFile.load(offset);
        nodes.put(offset, node);
      }
      return node;
    }

    void save(int offset, Node23 node) throws IOException {
      indexFile.save(offset, node);
      nodes.put(offset, node);
    }

    int create(Node23 node) throws IOException {
      final int offset = indexFile.create(node);
      nodes.put(offset, node);
      return offset;
    }

    void free(int offset) throws IOException {
      nodes.remove(offset);
      indexFile.free(offset);
    }

    /// As [TwoThreeTree#findNode] but sees the changes made so far in this operation.
    int findNode(int key) throws IOException {
      int current = indexFile.rootAddress();
      while (current != NULL_OFFSET) {
        final var node = load(current);
        if (node.indexOfKey(key) >= 0) {
          return current;
        }
        if (node.isLeaf()) {
          break;
        }
        current = node.child(node.childIndexFor(key));
      }
      throw new IllegalStateException("key " + key + " vanished during delete");
    }
  }
}
