/*
 * Copyright 2025 Babak Farhang
 */
/**
 * The conversion engine: custody checks, deposits and redemptions, and
 * merges of items held in custody.
 *
 * @see io.crums.blkchk.engine.BlackCheck BlackCheck, the entry point.
 */
package io.crums.blkchk.engine;
