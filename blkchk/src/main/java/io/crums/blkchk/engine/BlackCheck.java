/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import static io.crums.blkchk.BlkchkConstants.getLogger;

import java.lang.System.Logger.Level;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import io.crums.blkchk.Address;
import io.crums.blkchk.BlkchkConstants;
import io.crums.blkchk.FungibleLedger;
import io.crums.blkchk.InsufficientBalanceException;
import io.crums.blkchk.InvalidOrderException;
import io.crums.blkchk.ItemNotFoundException;
import io.crums.blkchk.ItemReceiver;
import io.crums.blkchk.ItemRegistry;
import io.crums.blkchk.NotRegistryException;
import io.crums.blkchk.ReentrantCallException;
import io.crums.blkchk.SupplyCeilingExceededException;
import io.crums.blkchk.UnsolicitedValueRejectedException;
import io.crums.blkchk.VolatileFungibleLedger;
import io.crums.blkchk.VolatileItemRegistry;
import io.crums.blkchk.engine.LedgerEvent.Aggregated;
import io.crums.blkchk.engine.LedgerEvent.Deposited;
import io.crums.blkchk.engine.LedgerEvent.Merged;
import io.crums.blkchk.engine.LedgerEvent.Redeemed;

/**
 * The conversion engine's public face. Holders deposit items for
 * {@code $BLKCHK}, redeem {@code $BLKCHK} for items in custody, and anyone
 * may merge items in custody, all the way up to a single maximal-rank item
 * worth the entire supply.
 *
 * <h2>Serialization</h2>
 * <p>
 * Requests are serialized on the instance lock and each runs to commit or
 * full abort before the next begins. A request that re-enters the engine
 * while another is in progress (e.g. from a registry call-back made during a
 * custody move) fails with {@linkplain ReentrantCallException}.
 * </p>
 * <h2>Value</h2>
 * <p>
 * The engine only accepts items. Bare value sent to it is always refused
 * ({@linkplain #receiveValue(Address, long, byte[])}).
 * </p>
 *
 * @see ConversionEngine
 * @see MergeOrchestrator
 */
public class BlackCheck implements ItemReceiver {


  /**
   * Creates and returns an instance over the given in-memory registry, with
   * a new, empty in-memory fungible ledger. The instance is registered with
   * the registry as the receiver of safe transfers to {@code address}.
   *
   * @param address   the engine's address
   * @param registry  the item registry
   */
  public static BlackCheck newVolatileInstance(
      Address address, VolatileItemRegistry registry) {
    return newInstance(address, registry, new VolatileFungibleLedger());
  }


  /**
   * Creates and returns an instance over the given in-memory registry and
   * ledger. The instance is registered with the registry as the receiver of
   * safe transfers to {@code address}.
   */
  public static BlackCheck newInstance(
      Address address, VolatileItemRegistry registry, FungibleLedger ledger) {
    var engine = new BlackCheck(address, registry, ledger);
    registry.registerReceiver(address, engine);
    return engine;
  }



  private final Address address;
  private final CustodyLedger custody;
  private final ConversionEngine conversions;
  private final MergeOrchestrator merges;

  private final ReentrancyGuard guard = new ReentrancyGuard();
  private final CopyOnWriteArrayList<LedgerListener> listeners =
      new CopyOnWriteArrayList<>();


  /**
   * @param address   the engine's address (the custodian of deposited items)
   * @param registry  the item registry
   * @param ledger    the fungible ledger (exclusively mutated by this instance)
   */
  public BlackCheck(Address address, ItemRegistry registry, FungibleLedger ledger) {
    this.address = Objects.requireNonNull(address, "null address");
    this.custody = new CustodyLedger(registry, address);
    this.conversions = new ConversionEngine(custody, ledger);
    this.merges = new MergeOrchestrator(custody);
    if (address.equals(registry.address()))
      throw new IllegalArgumentException(
          "engine and registry share address " + address);
  }


  /** Returns the engine's address. */
  public Address address() {
    return address;
  }

  public ItemRegistry registry() {
    return custody.registry();
  }

  public FungibleLedger ledger() {
    return conversions.ledger();
  }


  /** Returns the fungible token's name. */
  public String name() {
    return BlkchkConstants.TOKEN_NAME;
  }

  /** Returns the fungible token's symbol. */
  public String symbol() {
    return BlkchkConstants.TOKEN_SYMBOL;
  }

  /** Returns the number of decimals in the fungible unit. */
  public int decimals() {
    return BlkchkConstants.DECIMALS;
  }



  public void addListener(LedgerListener listener) {
    listeners.add(Objects.requireNonNull(listener, "null listener"));
  }

  public boolean removeListener(LedgerListener listener) {
    return listeners.remove(listener);
  }



  /** Returns the supply ceiling. */
  public long maxSupply() {
    return conversions.maxSupply();
  }


  /** Returns the total issued. */
  public synchronized long totalIssued() {
    return conversions.totalIssued();
  }


  /** Returns the given account's balance. */
  public synchronized long balanceOf(Address account) {
    return ledger().balanceOf(account);
  }


  /**
   * Returns what the given item converts to now (at its current rank).
   *
   * @throws ItemNotFoundException if the item does not exist
   */
  public long amountFor(long itemId) throws ItemNotFoundException {
    return registry().getItem(itemId).amount();
  }


  /**
   * Returns the state of the given item.
   *
   * @throws ItemNotFoundException if the item never existed
   */
  public synchronized ItemState stateOf(long itemId) throws ItemNotFoundException {
    return custody.stateOf(itemId);
  }



  /**
   * Deposits the given items. Each item's holder is credited the item's
   * amount. All or nothing.
   *
   * @param caller    the holder of each item, or a grantee of its holder
   * @param itemIds   non-empty, no duplicates
   *
   * @throws SupplyCeilingExceededException
   *         if the deposit would push the total issued past the ceiling
   *
   * @see ConversionEngine#deposit(Address, List)
   */
  public List<Deposited> deposit(Address caller, long... itemIds) {
    return deposit(caller, Arrays.stream(itemIds).boxed().toList());
  }


  /**
   * @see #deposit(Address, long...)
   */
  public synchronized List<Deposited> deposit(Address caller, List<Long> itemIds) {
    List<Deposited> deposits;
    try (var scope = guard.enter("deposit")) {
      deposits = conversions.deposit(caller, itemIds);
    }
    deposits.forEach(this::fire);
    return deposits;
  }


  /**
   * Redeems the given item out of custody to the caller, debiting the
   * caller the item's <em>current</em> amount.
   *
   * @throws InsufficientBalanceException if the caller holds less
   *
   * @see ConversionEngine#redeem(Address, long)
   */
  public synchronized Redeemed redeem(Address caller, long itemId)
      throws InsufficientBalanceException {
    Redeemed redeemed;
    try (var scope = guard.enter("redeem")) {
      redeemed = conversions.redeem(caller, itemId);
    }
    fire(redeemed);
    return redeemed;
  }


  /**
   * Merges two items in custody. Anyone may call this.
   *
   * @throws InvalidOrderException if {@code keepId >= burnId}
   *
   * @see MergeOrchestrator#mergePair(Address, long, long)
   */
  public synchronized Merged mergePair(Address caller, long keepId, long burnId)
      throws InvalidOrderException {
    Merged merged;
    try (var scope = guard.enter("mergePair")) {
      merged = merges.mergePair(caller, keepId, burnId);
    }
    fire(merged);
    return merged;
  }


  /**
   * Aggregates items in custody into one maximal-rank item. Anyone may call
   * this.
   *
   * @throws InvalidOrderException if any id is not greater than the first
   *
   * @see MergeOrchestrator#mergeAggregate(Address, List)
   */
  public synchronized Aggregated mergeAggregate(Address caller, List<Long> itemIds)
      throws InvalidOrderException {
    Aggregated aggregated;
    try (var scope = guard.enter("mergeAggregate")) {
      aggregated = merges.mergeAggregate(caller, itemIds);
    }
    fire(aggregated);
    return aggregated;
  }


  /**
   * Receipt hook: credits {@code from} for an item safe-transferred to the
   * engine. Throwing makes the registry undo the transfer.
   *
   * @throws NotRegistryException
   *         if {@code sender} is not the engine's registry
   * @throws SupplyCeilingExceededException
   *         if the item's amount would push the total issued past the ceiling
   */
  @Override
  public synchronized void onItemReceived(
      Address sender, Address operator, Address from, long itemId) {

    if (!registry().address().equals(sender))
      throw new NotRegistryException(
          "receipt of item [%d] from %s; only %s may notify"
          .formatted(itemId, sender, registry().address()));

    Deposited deposited;
    try (var scope = guard.enter("onItemReceived")) {
      deposited = conversions.receive(operator, from, itemId);
    }
    fire(deposited);
  }


  /**
   * Refuses bare value. Always throws.
   *
   * @param from    the sender
   * @param amount  the value sent
   * @param data    accompanying call data (may be {@code null} or empty)
   *
   * @throws UnsolicitedValueRejectedException always
   */
  public void receiveValue(Address from, long amount, byte[] data)
      throws UnsolicitedValueRejectedException {
    boolean withData = data != null && data.length > 0;
    throw new UnsolicitedValueRejectedException(
        "value (%d) from %s refused%s; only items are accepted"
        .formatted(amount, from, withData ? " (with call data)" : ""));
  }



  /**
   * Checks the supply invariants: the total issued does not exceed the
   * ceiling and (where the ledger can enumerate its balances) equals
   * their sum.
   *
   * @throws IllegalStateException on violation
   */
  public synchronized void checkInvariants() throws IllegalStateException {
    long issued = totalIssued();
    if (issued < 0 || issued > maxSupply())
      throw new IllegalStateException(
          "total issued %d out of bounds [0, %d]".formatted(issued, maxSupply()));
    if (ledger() instanceof VolatileFungibleLedger volatileLedger) {
      long sum = 0;
      for (long balance : volatileLedger.balances().values())
        sum += balance;
      if (sum != issued)
        throw new IllegalStateException(
            "total issued %d != sum of balances %d".formatted(issued, sum));
    }
  }



  private void fire(LedgerEvent event) {
    for (var listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException rx) {
        getLogger().log(
            Level.WARNING,
            "listener %s failed on %s: %s".formatted(listener, event, rx), rx);
      }
    }
  }

}
