/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;


/**
 * Base exception in the <code>blkchk</code> modules. Every failed request
 * surfaces as one of its subclasses; none are recoverable within the request
 * that raised them (the request is aborted with no state change).
 */
@SuppressWarnings("serial")
public class BlkchkException extends RuntimeException {

  public BlkchkException(String message) {
    super(message);
  }

  public BlkchkException(Throwable cause) {
    super(cause);
  }

  public BlkchkException(String message, Throwable cause) {
    super(message, cause);
  }

}
