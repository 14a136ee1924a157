/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import static io.crums.blkchk.BlkchkConstants.MAX_SUPPLY;
import static io.crums.blkchk.BlkchkConstants.getLogger;

import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.blkchk.Address;
import io.crums.blkchk.FungibleLedger;
import io.crums.blkchk.InsufficientBalanceException;
import io.crums.blkchk.Item;
import io.crums.blkchk.SupplyCeilingExceededException;
import io.crums.blkchk.engine.LedgerEvent.Deposited;
import io.crums.blkchk.engine.LedgerEvent.Redeemed;
import io.crums.util.Lists;
import io.crums.util.Strings;

/**
 * Deposits (item in, fungible amount out) and redemptions (fungible amount
 * in, item out). This is the only place balances and the total issued are
 * mutated, and every issuance is checked against
 * {@linkplain io.crums.blkchk.BlkchkConstants#MAX_SUPPLY MAX_SUPPLY} in the
 * same unit of work.
 *
 * <h2>Pricing</h2>
 * <p>
 * Both directions price an item at its <em>current</em> rank. An item may be
 * merged (by anyone) while in custody, so redeeming the item one deposited
 * may cost more (or less) than it paid out.
 * </p>
 * <h2>Atomicity</h2>
 * <p>
 * A request either commits entirely or leaves balances, total issued and
 * custody as they were. Batch deposits stage their credits in a
 * {@linkplain TxnLedger} and undo their custody moves on failure (restoring
 * any per-item grants the moves cleared).
 * </p>
 * <p>
 * Instances are not thread-safe: requests are serialized by the
 * {@linkplain BlackCheck} facade.
 * </p>
 */
public class ConversionEngine {

  private final CustodyLedger custody;
  private final FungibleLedger ledger;


  public ConversionEngine(CustodyLedger custody, FungibleLedger ledger) {
    this.custody = Objects.requireNonNull(custody, "null custody");
    this.ledger = Objects.requireNonNull(ledger, "null ledger");
  }


  public FungibleLedger ledger() {
    return ledger;
  }


  /** Returns {@linkplain io.crums.blkchk.BlkchkConstants#MAX_SUPPLY MAX_SUPPLY}. */
  public long maxSupply() {
    return MAX_SUPPLY;
  }


  public long totalIssued() {
    return ledger.totalIssued();
  }



  /**
   * Deposits the given items. Each item is moved into custody and its
   * holder (not necessarily the caller) credited with the item's amount.
   * All or nothing.
   *
   * @param caller    the holder of each item, or a grantee of its holder
   * @param itemIds   non-empty, no duplicates
   *
   * @return the deposits made, in request order
   *
   * @throws SupplyCeilingExceededException
   *         if an item's amount would push the total issued past the ceiling
   */
  public List<Deposited> deposit(Address caller, List<Long> itemIds) {
    Objects.requireNonNull(caller, "null caller");
    checkBatch(itemIds);

    var txn = new TxnLedger(ledger);
    var pulled = new ArrayList<Pulled>(itemIds.size());
    try {
      for (long itemId : itemIds) {
        Address holder = custody.checkDepositable(caller, itemId);
        Item item = custody.registry().getItem(itemId);
        long amount = item.amount();
        checkCeiling(txn.totalIssued(), amount);

        var approved = custody.pullIn(caller, holder, itemId);
        pulled.add(new Pulled(
            new Deposited(caller, holder, itemId, item.rank(), amount), approved));
        txn.credit(holder, amount);
      }
      txn.commit();

    } catch (RuntimeException rx) {
      rollback(pulled, rx);
      throw rx;
    }

    getLogger().log(
        Level.DEBUG,
        () -> "%s deposited %s; total issued %d"
        .formatted(caller, Strings.nOf(pulled.size(), "item"), ledger.totalIssued()));
    return List.copyOf(Lists.map(pulled, Pulled::deposit));
  }


  /**
   * Credits the previous holder of an item that has already been moved into
   * custody (by the registry, on a safe transfer). Throwing signals the
   * registry to undo the move.
   *
   * @param operator  the party that effected the transfer
   * @param from      the previous holder (credited)
   *
   * @throws SupplyCeilingExceededException
   *         if the item's amount would push the total issued past the ceiling
   */
  public Deposited receive(Address operator, Address from, long itemId) {
    custody.checkInCustody(itemId);
    Item item = custody.registry().getItem(itemId);
    long amount = item.amount();
    checkCeiling(ledger.totalIssued(), amount);
    ledger.credit(from, amount);

    getLogger().log(
        Level.DEBUG,
        () -> "item [%d] received from %s; credited %d".formatted(itemId, from, amount));
    return new Deposited(operator, from, itemId, item.rank(), amount);
  }


  /**
   * Redeems the given item out of custody. The caller is debited the
   * item's amount at its <em>current</em> rank.
   *
   * @throws InsufficientBalanceException if the caller holds less
   */
  public Redeemed redeem(Address caller, long itemId)
      throws InsufficientBalanceException {

    Objects.requireNonNull(caller, "null caller");
    Item item = custody.custodiedItem(itemId);
    long amount = item.amount();

    ledger.debit(caller, amount);
    try {
      custody.release(caller, itemId);
    } catch (RuntimeException rx) {
      ledger.credit(caller, amount);
      throw rx;
    }

    getLogger().log(
        Level.DEBUG,
        () -> "%s redeemed item [%d] for %d".formatted(caller, itemId, amount));
    return new Redeemed(caller, itemId, item.rank(), amount);
  }



  /** An item moved into custody by an uncommitted deposit. */
  private record Pulled(Deposited deposit, Optional<Address> approved) {  }


  private void rollback(List<Pulled> pulled, RuntimeException cause) {
    for (int index = pulled.size(); index-- > 0; ) {
      var deposit = pulled.get(index).deposit();
      try {
        custody.pushBack(deposit.holder(), deposit.itemId(), pulled.get(index).approved());
      } catch (RuntimeException rx) {
        cause.addSuppressed(rx);
        getLogger().log(
            Level.WARNING,
            "failed to return item [%d] to %s on aborted deposit: %s"
            .formatted(deposit.itemId(), deposit.holder(), rx.getMessage()));
      }
    }
  }


  private static void checkCeiling(long issued, long amount)
      throws SupplyCeilingExceededException {
    if (amount > MAX_SUPPLY - issued)
      throw new SupplyCeilingExceededException(issued, amount);
  }


  private static void checkBatch(List<Long> itemIds) {
    if (Objects.requireNonNull(itemIds, "null itemIds").isEmpty())
      throw new IllegalArgumentException("empty itemIds");
    var seen = new HashSet<Long>(itemIds.size());
    for (Long itemId : itemIds) {
      if (!seen.add(Objects.requireNonNull(itemId, "null itemId")))
        throw new IllegalArgumentException("duplicate itemId: " + itemId);
    }
  }

}
