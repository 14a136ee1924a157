/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * The fungible-balance substrate, as seen by the engine. Accounts come into
 * being on first credit and are never removed.
 *
 * <h2>Invariant</h2>
 * <p>
 * {@linkplain #totalIssued()} equals the sum of all balances. Credits
 * increase it; debits decrease it.
 * </p>
 */
public interface FungibleLedger {

  /**
   * Returns the balance of the given account (zero, if never credited).
   */
  long balanceOf(Address account);

  /**
   * Returns the total issued: the sum of all balances.
   */
  long totalIssued();

  /**
   * Issues {@code amount} to the given account.
   *
   * @param amount  &ge; 0
   */
  void credit(Address account, long amount);

  /**
   * Retires {@code amount} from the given account.
   *
   * @param amount  &ge; 0
   * @throws InsufficientBalanceException
   *         if the account holds less than {@code amount}
   */
  void debit(Address account, long amount) throws InsufficientBalanceException;

}
