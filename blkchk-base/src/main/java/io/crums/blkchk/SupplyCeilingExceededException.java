/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown when an issuance would push the total issued amount past
 * {@linkplain BlkchkConstants#MAX_SUPPLY MAX_SUPPLY}.
 */
@SuppressWarnings("serial")
public class SupplyCeilingExceededException extends BlkchkException {

  private final long issued;
  private final long amount;

  /**
   * @param issued    the total issued (including any amount pending in the request)
   * @param amount    the amount that was to be issued
   */
  public SupplyCeilingExceededException(long issued, long amount) {
    super(
        "issuing %d on top of %d exceeds max supply %d"
        .formatted(amount, issued, BlkchkConstants.MAX_SUPPLY));
    this.issued = issued;
    this.amount = amount;
  }

  /** Returns the total issued at the time of failure. */
  public long issued() {
    return issued;
  }

  /** Returns the rejected amount. */
  public long amount() {
    return amount;
  }

}
