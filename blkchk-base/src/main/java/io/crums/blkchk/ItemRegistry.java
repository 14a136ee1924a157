/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;


import java.util.List;
import java.util.Optional;

/**
 * The external item registry. The registry, not the engine, owns the
 * lifecycle of items: it knows who holds what, who may move what, and how
 * items merge. The engine only ever reacts to existence and rank as
 * reported here.
 *
 * <h2>Atomicity</h2>
 * <p>
 * Every mutating method either completes entirely or throws with no
 * state change.
 * </p>
 * <h2>Errors</h2>
 * <p>
 * Missing items are reported with {@linkplain ItemNotFoundException};
 * insufficient transfer rights with {@linkplain NotAuthorizedException};
 * other refusals (wrong owner, rank mismatch, ..) with
 * {@linkplain RegistryRejectedException}.
 * </p>
 */
public interface ItemRegistry {

  /**
   * Returns the registry's own address. Receipt notifications
   * ({@linkplain ItemReceiver}) are sent from this address.
   */
  Address address();

  /**
   * Returns the item with the given id.
   *
   * @throws ItemNotFoundException if the item does not (or no longer) exist(s)
   */
  Item getItem(long id) throws ItemNotFoundException;

  /** Returns {@code true} iff the item with the given id currently exists. */
  boolean exists(long id);

  /**
   * Returns {@code true} iff the item with the given id once existed
   * but was consumed in a merge.
   */
  boolean isConsumed(long id);

  /**
   * Returns the current holder of the given item.
   *
   * @throws ItemNotFoundException if the item does not exist
   */
  Address ownerOf(long id) throws ItemNotFoundException;

  /**
   * Returns the address granted transfer rights on this one item, if any.
   * The grant is cleared whenever the item changes hands.
   *
   * @throws ItemNotFoundException if the item does not exist
   */
  Optional<Address> getApproved(long id) throws ItemNotFoundException;

  /**
   * Returns {@code true} iff {@code owner} has granted {@code operator}
   * transfer rights over all its items.
   */
  boolean isApprovedForAll(Address owner, Address operator);

  /**
   * Moves the given item from {@code from} to {@code to}.
   *
   * @param operator  the party effecting the move: the holder, or one of its
   *                  grantees
   * @param from      the current holder
   * @param to        the new holder (not the zero address)
   */
  void transfer(Address operator, Address from, Address to, long id)
      throws ItemNotFoundException, NotAuthorizedException,
      RegistryRejectedException;

  /**
   * Returns an item to a previous holder, together with the per-item grant
   * it carried there. This undoes a {@linkplain #transfer(Address, Address,
   * Address, long) transfer} made by {@code holder}'s own request.
   *
   * @param holder    the current holder (the party undoing its move)
   * @param to        the previous holder
   * @param approved  the per-item grant to restore (may be {@code null})
   *
   * @throws RegistryRejectedException if {@code holder} no longer holds the item
   */
  void restore(Address holder, Address to, long id, Address approved)
      throws ItemNotFoundException, RegistryRejectedException;

  /**
   * Moves the given item, like {@linkplain #transfer(Address, Address, Address, long)
   * transfer}, and then notifies the recipient if it is a registered
   * {@linkplain ItemReceiver}. If the recipient fails, the move is undone
   * (the per-item grant included) and the recipient's exception is rethrown.
   * The move, the notification and the undo are made while holding the
   * recipient's monitor, so no request the recipient serializes on its own
   * monitor can observe the item between the move and the notification.
   */
  void safeTransfer(Address operator, Address from, Address to, long id)
      throws ItemNotFoundException, NotAuthorizedException,
      RegistryRejectedException;

  /**
   * Merges two items of equal rank. On return {@code keepId} is one rank
   * higher and {@code burnId} is consumed.
   *
   * @param operator  must have transfer rights on both items
   * @param swap      if {@code true}, the kept item takes on the burnt
   *                  item's visual seed
   */
  void mergePair(Address operator, long keepId, long burnId, boolean swap)
      throws ItemNotFoundException, NotAuthorizedException,
      RegistryRejectedException;

  /**
   * Merges {@linkplain BlkchkConstants#AGGREGATE_COUNT AGGREGATE_COUNT}
   * distinct items of rank {@linkplain BlkchkConstants#AGGREGATE_RANK
   * AGGREGATE_RANK} into one. On return, the first item is at
   * {@linkplain BlkchkConstants#MAX_RANK MAX_RANK}; the others are consumed.
   *
   * @param operator  must have transfer rights on every item
   */
  void mergeAggregate(Address operator, List<Long> ids)
      throws ItemNotFoundException, NotAuthorizedException,
      RegistryRejectedException;

}
