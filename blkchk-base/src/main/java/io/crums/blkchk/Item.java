/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Registry view of an existing item. Only the {@code rank} figures in
 * conversion; the {@code seed} is the item's (opaque) visual genome,
 * carried through merges.
 *
 * @param id      unique, positive item id
 * @param rank    &ge; 0 and &le; {@linkplain BlkchkConstants#MAX_RANK MAX_RANK}
 * @param seed    opaque visual seed
 *
 * @see ItemRegistry#getItem(long)
 */
public record Item(long id, int rank, long seed) {

  public Item {
    if (id <= 0L)
      throw new IllegalArgumentException("non-positive id: " + id);
    Ranks.checkRank(rank);
  }


  /**
   * Returns the fungible amount this item converts to.
   *
   * @see Ranks#amountFor(int)
   */
  public long amount() {
    return Ranks.amountFor(rank);
  }


  /** Returns {@code true} iff this item is at the maximal rank. */
  public boolean isMaximal() {
    return rank == BlkchkConstants.MAX_RANK;
  }


  /**
   * Returns a copy of this instance with its rank raised by one.
   */
  Item promote(long newSeed) {
    return new Item(id, rank + 1, newSeed);
  }


  Item withRank(int newRank) {
    return new Item(id, newRank, seed);
  }

}
