/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Thrown when a request enters the engine while another of its requests
 * is still in progress.
 */
@SuppressWarnings("serial")
public class ReentrantCallException extends BlkchkException {

  public ReentrantCallException(String message) {
    super(message);
  }

}
