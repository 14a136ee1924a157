/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown on every attempt to send bare value to the engine.
 */
@SuppressWarnings("serial")
public class UnsolicitedValueRejectedException extends BlkchkException {

  public UnsolicitedValueRejectedException(String message) {
    super(message);
  }

}
