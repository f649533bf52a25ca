package com.github.simbo1905.nfp.books;

import java.io.IOException;

/// The owner of a file header that embeds a [FreeList]. The allocator never writes the
/// header itself; it asks the owner to persist the whole header with the new free-list
/// state. Implementations must write first and only adopt the new state in memory once
/// the write has succeeded.
interface FreeListOwner {

  FreeList freeList();

  void commitFreeList(FreeList updated) throws IOException;
}
