/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;


import java.util.Objects;

/**
 * A 20-byte account identity. Holders of items, holders of fungible
 * balances, operators, and the engine itself are all addresses.
 * The canonical string form is {@code 0x} followed by 40 lowercase
 * hex digits.
 *
 * @param hex   canonical form (normalized on construction)
 */
public record Address(String hex) implements Comparable<Address> {

  /** Number of hex digits after the {@code 0x} prefix. */
  public final static int HEX_DIGITS = 40;

  /** The all-zeroes address. Never a valid owner. */
  public final static Address ZERO = of(0L);


  /**
   * Parses and returns the given address string.
   *
   * @param hex   {@code 0x}-prefixed, 40 hex digits (any case)
   */
  public static Address of(String hex) {
    return new Address(hex);
  }


  /**
   * Returns an address whose low order bytes encode the given
   * (non-negative) number. Mostly useful for tests and fixtures.
   */
  public static Address of(long num) {
    if (num < 0L)
      throw new IllegalArgumentException("negative num: " + num);
    return new Address("0x%040x".formatted(num));
  }


  /**
   * @param hex   {@code 0x}-prefixed, 40 hex digits (any case)
   */
  public Address {
    Objects.requireNonNull(hex, "null hex");
    if (hex.length() != HEX_DIGITS + 2 ||
        !(hex.startsWith("0x") || hex.startsWith("0X")))
      throw new IllegalArgumentException("malformed address: " + hex);

    hex = "0x" + hex.substring(2).toLowerCase();
    for (int index = 2; index < hex.length(); ++index) {
      char c = hex.charAt(index);
      if (!(c >= '0' && c <= '9' || c >= 'a' && c <= 'f'))
        throw new IllegalArgumentException(
            "illegal char '%c' at index [%d]: %s".formatted(c, index, hex));
    }
  }


  /** Returns {@code true} iff this is the {@linkplain #ZERO} address. */
  public boolean isZero() {
    return equals(ZERO);
  }


  @Override
  public int compareTo(Address other) {
    return hex.compareTo(other.hex);
  }


  @Override
  public String toString() {
    return hex;
  }

}
