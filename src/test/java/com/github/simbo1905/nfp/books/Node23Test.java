package com.github.simbo1905.nfp.books;

import static com.github.simbo1905.nfp.books.SlotAllocator.NULL_OFFSET;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.nio.ByteBuffer;
import org.junit.Assert;
import org.junit.Test;

public class Node23Test extends JulLoggingConfig {

  @Test
  public void leafKeepsKeysInOrder() {
    final var node = Node23.leaf(20, 200);
    node.insertPair(10, 100, NULL_OFFSET);
    assertThat(node.nKeys(), is(2));
    assertThat(node.key(0), is(10));
    assertThat(node.book(0), is(100));
    assertThat(node.key(1), is(20));
    assertThat(node.isLeaf(), is(true));
    assertThat(node.childIndexFor(5), is(0));
    assertThat(node.childIndexFor(15), is(1));
    assertThat(node.childIndexFor(25), is(2));
  }

  @Test
  public void splittingALeafPromotesTheMiddlePair() {
    final var node = Node23.leaf(10, 100);
    node.insertPair(30, 300, NULL_OFFSET);
    node.insertPair(20, 200, NULL_OFFSET);
    assertThat(node.isOverflowing(), is(true));

    final var split = node.splitOverflow();
    assertThat(split.promotedKey(), is(20));
    assertThat(split.promotedBook(), is(200));
    assertThat(node.nKeys(), is(1));
    assertThat(node.key(0), is(10));
    assertThat(split.sibling().nKeys(), is(1));
    assertThat(split.sibling().key(0), is(30));
    assertThat(split.sibling().isLeaf(), is(true));
  }

  @Test
  public void splittingAnInternalNodeSharesTheChildren() {
    final var node = Node23.internal(10, 100, 12, 44);
    node.insertPair(30, 300, 108);
    // the child at 44 split and promoted 20 with a new sibling at 76
    node.insertPair(20, 200, 76);
    assertThat(node.child(0), is(12));
    assertThat(node.child(1), is(44));
    assertThat(node.child(2), is(76));
    assertThat(node.child(3), is(108));

    final var split = node.splitOverflow();
    assertThat(split.promotedKey(), is(20));
    assertThat(node.child(0), is(12));
    assertThat(node.child(1), is(44));
    assertThat(node.child(2), is(NULL_OFFSET));
    assertThat(split.sibling().child(0), is(76));
    assertThat(split.sibling().child(1), is(108));
    assertThat(split.sibling().child(2), is(NULL_OFFSET));
  }

  @Test
  public void encodedNodeIsThirtyTwoBytes() {
    final var node = Node23.internal(10, 100, 12, 44);
    node.insertPair(30, 300, 76);
    final byte[] bytes = node.toBytes();
    assertThat(bytes.length, is(Node23.SIZE));

    final var buffer = ByteBuffer.wrap(bytes);
    assertThat(buffer.getInt(), is(2));
    assertThat(buffer.getInt(), is(10));
    assertThat(buffer.getInt(), is(30));
    assertThat(buffer.getInt(), is(100));
    assertThat(buffer.getInt(), is(300));
    assertThat(buffer.getInt(), is(12));
    assertThat(buffer.getInt(), is(44));
    assertThat(buffer.getInt(), is(76));

    assertThat(Node23.fromBytes(bytes, 12), is(node));
  }

  @Test
  public void removingPairsAndChildrenShiftsLeft() {
    final var node = Node23.internal(10, 100, 12, 44);
    node.insertPair(30, 300, 76);
    node.removePairAt(0);
    node.removeChildAt(0);
    assertThat(node.nKeys(), is(1));
    assertThat(node.key(0), is(30));
    assertThat(node.child(0), is(44));
    assertThat(node.child(1), is(76));
    assertThat(node.child(2), is(NULL_OFFSET));
    assertThat(node.childIndexOf(76), is(1));
    assertThat(node.childIndexOf(12), is(-1));
  }

  @Test
  public void emptyOrOverflowingNodesAreNeverWritten() {
    final var node = Node23.leaf(10, 100);
    node.removePairAt(0);
    Assert.assertThrows(IllegalStateException.class, node::toBytes);

    final var full = Node23.leaf(10, 100);
    full.insertPair(20, 200, NULL_OFFSET);
    full.insertPair(30, 300, NULL_OFFSET);
    Assert.assertThrows(IllegalStateException.class, full::toBytes);
  }

  @Test
  public void freeSlotIsNotANode() {
    final byte[] bytes = new FreeSlot(12, NULL_OFFSET).toBytes(Node23.SIZE);
    Assert.assertThrows(IllegalStateException.class, () -> Node23.fromBytes(bytes, 12));
  }

  @Test
  public void internalNodeNeedsOneMoreChildThanKeys() {
    final var buffer = ByteBuffer.allocate(Node23.SIZE);
    buffer.putInt(2).putInt(10).putInt(20).putInt(100).putInt(200);
    buffer.putInt(12).putInt(44).putInt(NULL_OFFSET);
    Assert.assertThrows(
        IllegalStateException.class, () -> Node23.fromBytes(buffer.array(), 76));
  }
}
