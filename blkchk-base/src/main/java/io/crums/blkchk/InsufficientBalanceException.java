/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown when a debit exceeds an account's balance.
 */
@SuppressWarnings("serial")
public class InsufficientBalanceException extends BlkchkException {

  private final Address account;
  private final long available;
  private final long required;

  public InsufficientBalanceException(
      Address account, long available, long required) {
    super(
        "%s holds %d; %d required".formatted(account, available, required));
    this.account = account;
    this.available = available;
    this.required = required;
  }

  public Address account() {
    return account;
  }

  public long available() {
    return available;
  }

  public long required() {
    return required;
  }

}
