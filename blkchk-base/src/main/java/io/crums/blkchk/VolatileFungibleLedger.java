/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;


import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * In-memory {@linkplain FungibleLedger}. Besides the credit/debit interface
 * the engine uses, this also implements the usual fungible-token substrate:
 * holder-to-holder transfers, allowances, and token metadata.
 *
 * <p>
 * Instances are safe under concurrent access.
 * </p>
 */
public class VolatileFungibleLedger implements FungibleLedger {

  private final TreeMap<Address, Long> balances = new TreeMap<>();
  private final HashMap<Address, Map<Address, Long>> allowances = new HashMap<>();

  private long totalIssued;


  /** Creates an empty instance. */
  public VolatileFungibleLedger() {  }


  /**
   * Creates an instance with the given starting balances.
   *
   * @param balances  non-negative balances (zero-balances are dropped)
   *
   * @see #balances()
   */
  public VolatileFungibleLedger(Map<Address, Long> balances) {
    for (var e : balances.entrySet()) {
      Address account = checkAccount(e.getKey());
      long amount = checkAmount(e.getValue());
      if (amount == 0L)
        continue;
      this.balances.put(account, amount);
      totalIssued = Math.addExact(totalIssued, amount);
    }
  }



  /** Returns {@linkplain BlkchkConstants#TOKEN_NAME}. */
  public String name() {
    return BlkchkConstants.TOKEN_NAME;
  }

  /** Returns {@linkplain BlkchkConstants#TOKEN_SYMBOL}. */
  public String symbol() {
    return BlkchkConstants.TOKEN_SYMBOL;
  }

  /** Returns {@linkplain BlkchkConstants#DECIMALS}. */
  public int decimals() {
    return BlkchkConstants.DECIMALS;
  }



  @Override
  public synchronized long balanceOf(Address account) {
    return balances.getOrDefault(account, 0L);
  }


  @Override
  public synchronized long totalIssued() {
    return totalIssued;
  }


  @Override
  public synchronized void credit(Address account, long amount) {
    checkAccount(account);
    checkAmount(amount);
    long total = Math.addExact(totalIssued, amount);
    add(account, amount);
    totalIssued = total;
  }


  @Override
  public synchronized void debit(Address account, long amount)
      throws InsufficientBalanceException {
    checkAmount(amount);
    subtract(account, amount);
    totalIssued -= amount;
  }


  /**
   * Moves {@code amount} from one holder to another. The total issued
   * is unchanged.
   *
   * @throws InsufficientBalanceException if {@code from} holds less
   */
  public synchronized void transfer(Address from, Address to, long amount)
      throws InsufficientBalanceException {
    checkAccount(to);
    checkAmount(amount);
    subtract(from, amount);
    add(to, amount);
  }


  /**
   * Sets the amount {@code spender} may move out of {@code owner}'s account.
   *
   * @param amount  &ge; 0 (zero revokes)
   */
  public synchronized void approve(Address owner, Address spender, long amount) {
    checkAccount(owner);
    checkAccount(spender);
    checkAmount(amount);
    var granted = allowances.computeIfAbsent(owner, o -> new HashMap<>());
    if (amount == 0L)
      granted.remove(spender);
    else
      granted.put(spender, amount);
  }


  /** Returns the remaining amount {@code spender} may move out of {@code owner}'s account. */
  public synchronized long allowance(Address owner, Address spender) {
    var granted = allowances.get(owner);
    return granted == null ? 0L : granted.getOrDefault(spender, 0L);
  }


  /**
   * Moves {@code amount} out of {@code from}'s account on the authority of
   * {@code spender}'s allowance, which is reduced accordingly.
   *
   * @throws InsufficientAllowanceException
   *         if the allowance is less than {@code amount}
   * @throws InsufficientBalanceException
   *         if {@code from}'s balance is less than {@code amount}
   */
  public synchronized void transferFrom(
      Address spender, Address from, Address to, long amount)
          throws InsufficientAllowanceException, InsufficientBalanceException {

    checkAccount(to);
    checkAmount(amount);
    long allowed = allowance(from, spender);
    if (allowed < amount)
      throw new InsufficientAllowanceException(from, spender, allowed, amount);

    subtract(from, amount);
    add(to, amount);
    approve(from, spender, allowed - amount);
  }


  /**
   * Returns a snapshot of the non-zero balances, ordered by address.
   */
  public synchronized SortedMap<Address, Long> balances() {
    return Collections.unmodifiableSortedMap(new TreeMap<>(balances));
  }



  private void add(Address account, long amount) {
    if (amount == 0L)
      return;
    balances.merge(account, amount, Math::addExact);
  }


  private void subtract(Address account, long amount) {
    long balance = balances.getOrDefault(account, 0L);
    if (balance < amount)
      throw new InsufficientBalanceException(account, balance, amount);
    if (balance == amount)
      balances.remove(account);
    else
      balances.put(account, balance - amount);
  }


  private static Address checkAccount(Address account) {
    if (Objects.requireNonNull(account, "null account").isZero())
      throw new IllegalArgumentException("zero address");
    return account;
  }


  private static long checkAmount(long amount) {
    if (amount < 0L)
      throw new IllegalArgumentException("negative amount: " + amount);
    return amount;
  }

}
