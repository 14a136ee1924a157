/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Properties-file configuration.
 */
package io.crums.blkchk.config;
