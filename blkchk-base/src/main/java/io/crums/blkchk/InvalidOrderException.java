/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown when the ids of a merge request are not in the required order.
 */
@SuppressWarnings("serial")
public class InvalidOrderException extends BlkchkException {

  public InvalidOrderException(String message) {
    super(message);
  }

}
