/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;


import static io.crums.blkchk.BlkchkConstants.*;

import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@linkplain ItemRegistry}.
 *
 * <h2>Storage</h2>
 * <p>
 * Items are kept in an arena keyed by id. Consumed items are never
 * reused: their ids are tomb-stoned, so a consumed id can be told apart
 * from one that was never minted.
 * </p>
 * <h2>Merge Rules</h2>
 * <ul>
 * <li>The operator must have transfer rights on every item involved.</li>
 * <li>Pairwise merges take 2 distinct items of equal rank, below
 * {@linkplain BlkchkConstants#AGGREGATE_RANK AGGREGATE_RANK}.</li>
 * <li>Aggregate merges take exactly {@linkplain BlkchkConstants#AGGREGATE_COUNT
 * AGGREGATE_COUNT} distinct items, all at {@code AGGREGATE_RANK}.</li>
 * </ul>
 * <h2>Concurrency</h2>
 * <p>
 * State is guarded by the instance lock. A safe transfer to a registered
 * receiver first takes the receiver's monitor, then this instance's lock
 * only for the move itself; the notification is made outside this
 * instance's lock. The lock order (receiver, then registry) is the same as
 * that of a receiver (the engine) calling into the registry while holding
 * its own monitor.
 * </p>
 */
public class VolatileItemRegistry implements ItemRegistry {

  private final Address address;

  private final TreeMap<Long, Item> items = new TreeMap<>();
  private final HashMap<Long, Address> owners = new HashMap<>();
  private final HashMap<Long, Address> approvals = new HashMap<>();
  private final HashMap<Address, Set<Address>> operators = new HashMap<>();
  private final TreeSet<Long> consumed = new TreeSet<>();

  private final ConcurrentHashMap<Address, ItemReceiver> receivers =
      new ConcurrentHashMap<>();


  /**
   * @param address   the registry's own address
   */
  public VolatileItemRegistry(Address address) {
    this.address = Objects.requireNonNull(address, "null address");
    if (address.isZero())
      throw new IllegalArgumentException("zero address");
  }


  @Override
  public Address address() {
    return address;
  }



  /**
   * Mints a new item with the next free id.
   *
   * @param to      the first holder
   * @param rank    the item's rank
   *
   * @return the new item
   */
  public synchronized Item mint(Address to, int rank) {
    long id = nextId();
    return mint(to, new Item(id, rank, id));
  }


  /**
   * Mints the given item.
   *
   * @param to      the first holder
   * @param item    the item (its id must be unused, past and present)
   *
   * @return {@code item}
   */
  public synchronized Item mint(Address to, Item item) {
    checkRecipient(to);
    long id = item.id();
    if (items.containsKey(id) || consumed.contains(id))
      throw new RegistryRejectedException("item [%d] already minted".formatted(id));
    items.put(id, item);
    owners.put(id, to);
    return item;
  }


  /**
   * Records the given id as consumed. Used when restoring a snapshot.
   *
   * @param id    an id that does not currently exist
   */
  public synchronized void markConsumed(long id) {
    if (id <= 0L)
      throw new IllegalArgumentException("non-positive id: " + id);
    if (items.containsKey(id))
      throw new RegistryRejectedException("item [%d] exists".formatted(id));
    consumed.add(id);
  }


  private long nextId() {
    long max = Math.max(
        items.isEmpty() ? 0L : items.lastKey(),
        consumed.isEmpty() ? 0L : consumed.last());
    return max + 1;
  }


  /**
   * Registers the given recipient hook for safe transfers to {@code holder}.
   */
  public void registerReceiver(Address holder, ItemReceiver receiver) {
    receivers.put(
        Objects.requireNonNull(holder, "null holder"),
        Objects.requireNonNull(receiver, "null receiver"));
  }


  /** Removes the recipient hook for {@code holder}, if any. */
  public void unregisterReceiver(Address holder) {
    receivers.remove(holder);
  }



  @Override
  public synchronized Item getItem(long id) throws ItemNotFoundException {
    Item item = items.get(id);
    if (item == null)
      throw new ItemNotFoundException(id);
    return item;
  }


  @Override
  public synchronized boolean exists(long id) {
    return items.containsKey(id);
  }


  @Override
  public synchronized boolean isConsumed(long id) {
    return consumed.contains(id);
  }


  @Override
  public synchronized Address ownerOf(long id) throws ItemNotFoundException {
    Address owner = owners.get(id);
    if (owner == null)
      throw new ItemNotFoundException(id);
    return owner;
  }


  /**
   * Returns the ids of the items held by the given address, in ascending order.
   */
  public synchronized SortedSet<Long> itemsOf(Address holder) {
    var ids = new TreeSet<Long>();
    for (var e : owners.entrySet())
      if (e.getValue().equals(holder))
        ids.add(e.getKey());
    return Collections.unmodifiableSortedSet(ids);
  }


  /** Returns a snapshot of all existing items, in ascending order of id. */
  public synchronized List<Item> items() {
    return List.copyOf(items.values());
  }


  /** Returns the consumed ids, in ascending order. */
  public synchronized SortedSet<Long> consumedIds() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(consumed));
  }



  /**
   * Grants {@code approved} transfer rights on the given item (per-item
   * grant). Passing {@code null} clears the grant.
   *
   * @param caller    the holder, or one of its blanket grantees
   */
  public synchronized void approve(Address caller, Address approved, long id)
      throws ItemNotFoundException, NotAuthorizedException {
    Address owner = ownerOf(id);
    if (!caller.equals(owner) && !isApprovedForAll(owner, caller))
      throw new NotAuthorizedException(caller, id);
    if (approved == null)
      approvals.remove(id);
    else
      approvals.put(id, approved);
  }


  /**
   * Grants (or revokes) {@code operator} transfer rights over all of
   * {@code owner}'s items (blanket grant).
   */
  public synchronized void setApprovalForAll(
      Address owner, Address operator, boolean approved) {
    Objects.requireNonNull(owner, "null owner");
    Objects.requireNonNull(operator, "null operator");
    if (owner.equals(operator))
      throw new IllegalArgumentException("owner approving itself: " + owner);
    if (approved)
      operators.computeIfAbsent(owner, o -> new HashSet<>()).add(operator);
    else {
      var set = operators.get(owner);
      if (set != null)
        set.remove(operator);
    }
  }


  @Override
  public synchronized Optional<Address> getApproved(long id)
      throws ItemNotFoundException {
    ownerOf(id);
    return Optional.ofNullable(approvals.get(id));
  }


  @Override
  public synchronized boolean isApprovedForAll(Address owner, Address operator) {
    var set = operators.get(owner);
    return set != null && set.contains(operator);
  }



  @Override
  public synchronized void transfer(
      Address operator, Address from, Address to, long id)
          throws ItemNotFoundException, NotAuthorizedException,
          RegistryRejectedException {

    checkRecipient(to);
    Address owner = ownerOf(id);
    if (!owner.equals(from))
      throw new RegistryRejectedException(
          "item [%d] is held by %s, not %s".formatted(id, owner, from));
    checkOperator(operator, owner, id);

    approvals.remove(id);
    owners.put(id, to);
  }


  @Override
  public synchronized void restore(
      Address holder, Address to, long id, Address approved)
          throws ItemNotFoundException, RegistryRejectedException {

    checkRecipient(to);
    Address owner = ownerOf(id);
    if (!owner.equals(holder))
      throw new RegistryRejectedException(
          "item [%d] is held by %s, not %s; not restored".formatted(id, owner, holder));
    owners.put(id, to);
    if (approved == null)
      approvals.remove(id);
    else
      approvals.put(id, approved);
  }


  /**
   * {@inheritDoc}
   *
   * <p>If {@code to} has a registered receiver, the move, the notification
   * and (on failure) the undo are made while holding the receiver's monitor.
   * </p>
   */
  @Override
  public void safeTransfer(Address operator, Address from, Address to, long id)
      throws ItemNotFoundException, NotAuthorizedException,
      RegistryRejectedException {

    ItemReceiver receiver = receivers.get(Objects.requireNonNull(to, "null recipient"));
    if (receiver == null) {
      transfer(operator, from, to, id);
      return;
    }

    synchronized (receiver) {
      Optional<Address> priorApproval;
      synchronized (this) {
        priorApproval = getApproved(id);
        transfer(operator, from, to, id);
      }

      try {
        receiver.onItemReceived(address, operator, from, id);

      } catch (RuntimeException rx) {
        try {
          restore(to, from, id, priorApproval.orElse(null));
        } catch (RuntimeException rrx) {
          rrx.addSuppressed(rx);
          getLogger().log(
              Level.WARNING,
              "item [%d] not returned to %s after failed receipt: %s"
              .formatted(id, from, rrx.getMessage()));
          throw rrx;
        }
        throw rx;
      }
    }
  }



  @Override
  public synchronized void mergePair(
      Address operator, long keepId, long burnId, boolean swap)
          throws ItemNotFoundException, NotAuthorizedException,
          RegistryRejectedException {

    if (keepId == burnId)
      throw new RegistryRejectedException(
          "cannot merge item [%d] with itself".formatted(keepId));

    Item keep = getItem(keepId);
    Item burn = getItem(burnId);
    checkOperator(operator, ownerOf(keepId), keepId);
    checkOperator(operator, ownerOf(burnId), burnId);

    if (keep.rank() != burn.rank())
      throw new RegistryRejectedException(
          "rank mismatch: item [%d] at %d, item [%d] at %d"
          .formatted(keepId, keep.rank(), burnId, burn.rank()));
    if (keep.rank() >= AGGREGATE_RANK)
      throw new RegistryRejectedException(
          "items at rank %d cannot be merged pairwise: [%d], [%d]"
          .formatted(keep.rank(), keepId, burnId));

    items.put(keepId, keep.promote(swap ? burn.seed() : keep.seed()));
    consume(burnId);
  }


  @Override
  public synchronized void mergeAggregate(Address operator, List<Long> ids)
      throws ItemNotFoundException, NotAuthorizedException,
      RegistryRejectedException {

    if (ids.size() != AGGREGATE_COUNT)
      throw new RegistryRejectedException(
          "expected %d items; actual given %d".formatted(AGGREGATE_COUNT, ids.size()));

    var distinct = new HashSet<Long>(ids);
    if (distinct.size() != ids.size())
      throw new RegistryRejectedException("duplicate ids: " + ids);

    var aggregated = new ArrayList<Item>(ids.size());
    for (long id : ids) {
      Item item = getItem(id);
      checkOperator(operator, ownerOf(id), id);
      if (item.rank() != AGGREGATE_RANK)
        throw new RegistryRejectedException(
            "item [%d] at rank %d; expected %d"
            .formatted(id, item.rank(), AGGREGATE_RANK));
      aggregated.add(item);
    }

    Item first = aggregated.get(0);
    items.put(first.id(), first.withRank(MAX_RANK));
    for (int index = 1; index < aggregated.size(); ++index)
      consume(aggregated.get(index).id());
  }



  private void consume(long id) {
    items.remove(id);
    owners.remove(id);
    approvals.remove(id);
    consumed.add(id);
  }


  private void checkOperator(Address operator, Address owner, long id)
      throws NotAuthorizedException {
    Objects.requireNonNull(operator, "null operator");
    if (operator.equals(owner) ||
        operator.equals(approvals.get(id)) ||
        isApprovedForAll(owner, operator))
      return;
    throw new NotAuthorizedException(operator, id);
  }


  private static void checkRecipient(Address to) {
    if (Objects.requireNonNull(to, "null recipient").isZero())
      throw new RegistryRejectedException("transfer to the zero address");
  }

}
