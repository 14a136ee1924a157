/*
 * Copyright 2025 Babak Farhang
 */
/**
 * JSON snapshots of the in-memory registry and ledger.
 */
package io.crums.blkchk.json;
