/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;


import java.lang.System.Logger;

/**
 * Library constants.
 */
public class BlkchkConstants {


  /**
   * Number of decimal places in the fungible unit (18).
   */
  public final static int DECIMALS = 18;

  /**
   * The fungible base unit: one whole token expressed in its smallest
   * denomination (10<sup><small>18</small></sup>).
   */
  public final static long UNIT = 1_000_000_000_000_000_000L;

  /**
   * The supply ceiling. Exactly one {@linkplain #UNIT}.
   */
  public final static long MAX_SUPPLY = UNIT;

  /**
   * The maximal (terminal) rank (7). An item at this rank converts to the
   * entire {@linkplain #MAX_SUPPLY}.
   */
  public final static int MAX_RANK = 7;

  /**
   * Divisor in the geometric conversion formula (4096).
   *
   * @see Ranks#amountFor(int)
   */
  public final static long RANK_DIVISOR = 4096L;

  /**
   * Rank of the items that are aggregated into a maximal-rank item
   * ({@code MAX_RANK - 1}). These are the "single" items: pairwise merges
   * stop here.
   */
  public final static int AGGREGATE_RANK = MAX_RANK - 1;

  /**
   * Number of {@linkplain #AGGREGATE_RANK}-items consumed (all but one) in
   * an aggregate merge (64).
   */
  public final static int AGGREGATE_COUNT = 1 << AGGREGATE_RANK;


  /** Fungible token name. */
  public final static String TOKEN_NAME = "Black Check";

  /** Fungible token symbol. */
  public final static String TOKEN_SYMBOL = "$BLKCHK";




  /**
   * The module's logger name.
   *
   * @see #getLogger()
   */
  public static final String LOGGER_NAME = "blkchk";


  /**
   * Returns the module logger.
   *
   * @see #LOGGER_NAME
   */
  public static Logger getLogger() {
    return System.getLogger(LOGGER_NAME);
  }



  private BlkchkConstants() {  }

}
