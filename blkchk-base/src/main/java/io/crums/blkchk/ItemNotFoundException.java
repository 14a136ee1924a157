/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown when an item does not exist (was never minted, or was consumed
 * in a merge).
 */
@SuppressWarnings("serial")
public class ItemNotFoundException extends BlkchkException {

  private final long itemId;

  public ItemNotFoundException(long itemId) {
    super("item [%d] does not exist".formatted(itemId));
    this.itemId = itemId;
  }

  public long itemId() {
    return itemId;
  }

}
