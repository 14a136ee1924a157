/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import io.crums.blkchk.ReentrantCallException;

/**
 * Marks an engine request as in progress. A second request entered before
 * the first exits (necessarily on the same thread, since requests are
 * serialized on the engine's lock) is refused.
 *
 * <pre>{@code
 *   try (var scope = guard.enter("redeem")) {
 *     ..
 *   }
 * }</pre>
 */
final class ReentrancyGuard {

  /** Exits the guarded request. */
  interface Scope extends AutoCloseable {
    @Override
    void close();
  }


  private String current;


  /**
   * Enters the named request.
   *
   * @throws ReentrantCallException if another request is in progress
   */
  Scope enter(String request) throws ReentrantCallException {
    if (current != null)
      throw new ReentrantCallException(
          "%s entered while %s in progress".formatted(request, current));
    current = request;
    return () -> current = null;
  }


  /** Returns {@code true} iff a request is in progress. */
  boolean entered() {
    return current != null;
  }

}
