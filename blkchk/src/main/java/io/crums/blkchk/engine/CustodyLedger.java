/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import java.util.Objects;
import java.util.Optional;

import io.crums.blkchk.Address;
import io.crums.blkchk.Item;
import io.crums.blkchk.ItemNotFoundException;
import io.crums.blkchk.ItemRegistry;
import io.crums.blkchk.NotAuthorizedException;

/**
 * Tracks which items the engine (the <em>custodian</em>) holds, and
 * gate-keeps every custody move. The registry remains the sole record of
 * who holds what: this class only checks preconditions against it and then
 * asks it to make the move.
 */
public class CustodyLedger {

  private final ItemRegistry registry;
  private final Address custodian;


  /**
   * @param registry    the item registry
   * @param custodian   the engine's address
   */
  public CustodyLedger(ItemRegistry registry, Address custodian) {
    this.registry = Objects.requireNonNull(registry, "null registry");
    this.custodian = Objects.requireNonNull(custodian, "null custodian");
    if (custodian.isZero())
      throw new IllegalArgumentException("zero custodian address");
  }


  public ItemRegistry registry() {
    return registry;
  }

  /** Returns the engine's address. */
  public Address custodian() {
    return custodian;
  }



  /**
   * Checks that {@code caller} may deposit the given item and returns its
   * current holder.
   *
   * @return the holder (the party to be credited)
   *
   * @throws ItemNotFoundException if the item does not exist
   * @throws NotAuthorizedException
   *         if the item is already in custody, or if {@code caller} neither
   *         holds the item, nor has been granted rights on it
   */
  public Address checkDepositable(Address caller, long itemId)
      throws ItemNotFoundException, NotAuthorizedException {

    Objects.requireNonNull(caller, "null caller");
    Address holder = registry.ownerOf(itemId);
    if (holder.equals(custodian))
      throw new NotAuthorizedException(
          caller, itemId, "item [%d] already in custody".formatted(itemId));
    if (!TransferRight.anyGrants(registry, holder, caller, itemId))
      throw new NotAuthorizedException(caller, itemId);
    return holder;
  }


  /**
   * Checks the given item is held by the engine.
   *
   * @throws ItemNotFoundException if the item does not exist
   * @throws NotAuthorizedException if the item is held by another party
   */
  public void checkInCustody(long itemId)
      throws ItemNotFoundException, NotAuthorizedException {

    Address holder = registry.ownerOf(itemId);
    if (!holder.equals(custodian))
      throw new NotAuthorizedException(
          custodian, itemId,
          "item [%d] not in custody (held by %s)".formatted(itemId, holder));
  }


  /**
   * Returns the given item, after checking it is held by the engine.
   *
   * @see #checkInCustody(long)
   */
  public Item custodiedItem(long itemId)
      throws ItemNotFoundException, NotAuthorizedException {
    checkInCustody(itemId);
    return registry.getItem(itemId);
  }


  /**
   * Moves the item from {@code holder} into custody, on the authority of
   * {@code caller}.
   *
   * @return the per-item grant the item carried before the move, if any
   *
   * @see #checkDepositable(Address, long)
   * @see #pushBack(Address, long, Optional)
   */
  public Optional<Address> pullIn(Address caller, Address holder, long itemId) {
    Optional<Address> approved = registry.getApproved(itemId);
    registry.transfer(caller, holder, custodian, itemId);
    return approved;
  }


  /**
   * Undoes a {@linkplain #pullIn(Address, Address, long) pullIn}: returns
   * the item to {@code holder} with its prior per-item grant.
   *
   * @param approved  the grant returned by {@code pullIn}
   */
  public void pushBack(Address holder, long itemId, Optional<Address> approved) {
    registry.restore(custodian, holder, itemId, approved.orElse(null));
  }


  /**
   * Releases the item from custody to {@code to}.
   */
  public void release(Address to, long itemId) {
    registry.transfer(custodian, custodian, to, itemId);
  }


  /**
   * Returns the state of the given item.
   *
   * @throws ItemNotFoundException if the item never existed
   */
  public ItemState stateOf(long itemId) throws ItemNotFoundException {
    if (registry.isConsumed(itemId))
      return ItemState.CONSUMED;
    return
        registry.ownerOf(itemId).equals(custodian) ?
            ItemState.IN_CUSTODY : ItemState.EXTERNAL;
  }

}
