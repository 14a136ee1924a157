/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown when an operator has no right to move an item.
 */
@SuppressWarnings("serial")
public class NotAuthorizedException extends BlkchkException {

  private final Address operator;
  private final long itemId;

  public NotAuthorizedException(Address operator, long itemId) {
    this(operator, itemId, "%s not authorized on item [%d]".formatted(operator, itemId));
  }

  public NotAuthorizedException(Address operator, long itemId, String message) {
    super(message);
    this.operator = operator;
    this.itemId = itemId;
  }

  public Address operator() {
    return operator;
  }

  public long itemId() {
    return itemId;
  }

}
