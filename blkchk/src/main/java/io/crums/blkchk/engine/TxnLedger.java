/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.crums.blkchk.Address;
import io.crums.blkchk.FungibleLedger;
import io.crums.blkchk.InsufficientBalanceException;

/**
 * Single transaction view over another ledger. Used when a request makes
 * <em>multiple</em> balance changes that must land together or not at all.
 *
 * <h2>Raison D'Etre</h2>
 * <p>
 * A batch deposit credits one account per item, and each item's supply check
 * must see the credits of the items before it. Writes
 * ({@linkplain #credit(Address, long) credit}, {@linkplain #debit(Address, long)
 * debit}) go to this instance's delta buffer; reads combine the primary ledger
 * with the buffer. Nothing touches the primary until {@linkplain #commit()}.
 * Dropping the instance discards the transaction.
 * </p>
 */
final class TxnLedger implements FungibleLedger {

  private final FungibleLedger primary;
  private final long issuedSnapshot;

  private final LinkedHashMap<Address, Long> deltas = new LinkedHashMap<>();
  private long issuedDelta;

  private boolean committed;


  TxnLedger(FungibleLedger primary) {
    this.primary = Objects.requireNonNull(primary, "null primary");
    this.issuedSnapshot = primary.totalIssued();
  }



  @Override
  public long balanceOf(Address account) {
    return primary.balanceOf(account) + deltas.getOrDefault(account, 0L);
  }


  @Override
  public long totalIssued() {
    return issuedSnapshot + issuedDelta;
  }


  @Override
  public void credit(Address account, long amount) {
    checkOpen();
    checkAmount(amount);
    deltas.merge(Objects.requireNonNull(account, "null account"), amount, Math::addExact);
    issuedDelta = Math.addExact(issuedDelta, amount);
  }


  @Override
  public void debit(Address account, long amount)
      throws InsufficientBalanceException {
    checkOpen();
    checkAmount(amount);
    long balance = balanceOf(account);
    if (balance < amount)
      throw new InsufficientBalanceException(account, balance, amount);
    deltas.merge(account, -amount, Math::addExact);
    issuedDelta -= amount;
  }


  /** Returns {@code true} iff there are no pending changes. */
  public boolean isEmpty() {
    return issuedDelta == 0L && deltas.values().stream().allMatch(d -> d == 0L);
  }


  /**
   * Applies the buffered changes to the primary ledger: debits first, then
   * credits. If a debit fails, the debits already applied are restored and
   * the exception is rethrown.
   *
   * @throws ConcurrentModificationException
   *         if the primary's total changed since this instance was created
   */
  public void commit() {
    checkOpen();
    if (primary.totalIssued() != issuedSnapshot)
      throw new ConcurrentModificationException(
          "primary total issued changed from %d to %d"
          .formatted(issuedSnapshot, primary.totalIssued()));

    var debited = new ArrayList<Map.Entry<Address, Long>>();
    try {
      for (var e : deltas.entrySet()) {
        if (e.getValue() < 0L) {
          primary.debit(e.getKey(), -e.getValue());
          debited.add(e);
        }
      }
    } catch (RuntimeException rx) {
      for (int index = debited.size(); index-- > 0; ) {
        var e = debited.get(index);
        primary.credit(e.getKey(), -e.getValue());
      }
      throw rx;
    }
    for (var e : deltas.entrySet())
      if (e.getValue() > 0L)
        primary.credit(e.getKey(), e.getValue());

    committed = true;
  }


  private void checkOpen() {
    if (committed)
      throw new IllegalStateException("already committed");
  }


  private static void checkAmount(long amount) {
    if (amount < 0L)
      throw new IllegalArgumentException("negative amount: " + amount);
  }

}
