/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;

/**
 * Receives {@linkplain LedgerEvent}s. Invoked synchronously, in order,
 * after commit; exceptions thrown here are logged and do not affect the
 * committed request.
 */
@FunctionalInterface
public interface LedgerListener {

  void onEvent(LedgerEvent event);

}
