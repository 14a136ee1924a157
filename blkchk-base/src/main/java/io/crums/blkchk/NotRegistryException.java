/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown when an item-receipt notification does not come from the
 * engine's own registry.
 */
@SuppressWarnings("serial")
public class NotRegistryException extends BlkchkException {

  public NotRegistryException(String message) {
    super(message);
  }

}
