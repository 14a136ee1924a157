/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;


import static io.crums.blkchk.BlkchkConstants.*;

/**
 * The rank model. Maps an item's rank to its fungible conversion amount.
 *
 * <h2>Conversion Table</h2>
 * <p>
 * The amounts form a geometric progression: each rank step doubles the
 * value, starting at {@code UNIT / 4096} for rank 0. The progression is
 * broken at the top: an item at {@linkplain BlkchkConstants#MAX_RANK MAX_RANK}
 * converts to the entire {@linkplain BlkchkConstants#MAX_SUPPLY MAX_SUPPLY}
 * (the doubling would have given only 1/32 of it).
 * </p>
 * <pre>
 *    rank    amount (in UNITs)
 *    ----    -----------------
 *      0        1/4096
 *      1        2/4096
 *      ..
 *      6       64/4096
 *      7        1
 * </pre>
 */
public class Ranks {

  private Ranks() {  }


  /**
   * Returns the fungible amount an item of the given {@code rank} converts to.
   *
   * @param rank  &ge; 0 and &le; {@linkplain BlkchkConstants#MAX_RANK MAX_RANK}
   * @return {@code MAX_SUPPLY}, if {@code rank == MAX_RANK};
   *         {@code (2^rank * UNIT) / 4096}, otherwise (truncated)
   */
  public static long amountFor(int rank) {
    checkRank(rank);
    if (rank == MAX_RANK)
      return MAX_SUPPLY;
    // 2^rank * UNIT overflows a long past rank 3; UNIT is a multiple of 4096,
    // so dividing first is exact
    return (UNIT / RANK_DIVISOR) << rank;
  }


  /**
   * Tests whether the given rank is within bounds.
   */
  public static boolean isRank(int rank) {
    return rank >= 0 && rank <= MAX_RANK;
  }


  /**
   * Checks the given rank and returns it.
   *
   * @throws IllegalArgumentException if out of bounds
   */
  public static int checkRank(int rank) throws IllegalArgumentException {
    if (!isRank(rank))
      throw new IllegalArgumentException(
          "rank %d out of bounds [0, %d]".formatted(rank, MAX_RANK));
    return rank;
  }

}
