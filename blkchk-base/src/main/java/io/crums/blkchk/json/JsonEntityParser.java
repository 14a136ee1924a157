/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.json;

/**
 * Reads and writes entities of type {@code T}.
 */
public interface JsonEntityParser<T> extends JsonEntityWriter<T>, JsonEntityReader<T> {

}
