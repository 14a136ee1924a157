/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown by an {@linkplain ItemRegistry} when it refuses an otherwise
 * well-formed request (e.g. rank mismatch in a merge).
 */
@SuppressWarnings("serial")
public class RegistryRejectedException extends BlkchkException {

  public RegistryRejectedException(String message) {
    super(message);
  }

  public RegistryRejectedException(String message, Throwable cause) {
    super(message, cause);
  }

}
