/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Value types, the rank model, and the collaborators of the conversion
 * engine: the item registry and the fungible ledger (with in-memory
 * implementations of both).
 *
 * @see io.crums.blkchk.Ranks Ranks, the conversion table.
 */
package io.crums.blkchk;
