/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown when a spender moves more than its remaining allowance out of
 * another holder's account.
 */
@SuppressWarnings("serial")
public class InsufficientAllowanceException extends BlkchkException {

  private final Address owner;
  private final Address spender;
  private final long allowed;
  private final long required;

  public InsufficientAllowanceException(
      Address owner, Address spender, long allowed, long required) {
    super(
        "%s may move %d out of %s; %d required"
        .formatted(spender, allowed, owner, required));
    this.owner = owner;
    this.spender = spender;
    this.allowed = allowed;
    this.required = required;
  }

  public Address owner() {
    return owner;
  }

  public Address spender() {
    return spender;
  }

  public long allowed() {
    return allowed;
  }

  public long required() {
    return required;
  }

}
