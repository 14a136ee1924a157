/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;

/**
 * The state of an item, from the engine's perspective.
 *
 * <pre>
 *   EXTERNAL --deposit--> IN_CUSTODY --redeem--> EXTERNAL
 *                         IN_CUSTODY --merge (burn side)--> CONSUMED
 * </pre>
 */
public enum ItemState {

  /** Held by someone other than the engine. */
  EXTERNAL,
  /** Held by the engine. */
  IN_CUSTODY,
  /** Burnt in a merge. Terminal. */
  CONSUMED;


  /** Returns {@code true} iff this is {@linkplain #IN_CUSTODY}. */
  public boolean inCustody() {
    return this == IN_CUSTODY;
  }

  /** Returns {@code true} iff this is {@linkplain #CONSUMED}. */
  public boolean isTerminal() {
    return this == CONSUMED;
  }

}
