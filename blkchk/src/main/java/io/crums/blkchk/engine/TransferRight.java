/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import io.crums.blkchk.Address;
import io.crums.blkchk.ItemRegistry;

/**
 * The ways an operator may come to have the right to move an item. Each
 * is queried live from the registry; nothing is cached.
 *
 * @see #anyGrants(ItemRegistry, Address, Address, long)
 */
public enum TransferRight {

  /** The operator holds the item. */
  HOLDER {
    @Override
    public boolean grants(
        ItemRegistry registry, Address holder, Address operator, long itemId) {
      return holder.equals(operator);
    }
  },

  /** The holder granted the operator rights on this one item. */
  ITEM_GRANT {
    @Override
    public boolean grants(
        ItemRegistry registry, Address holder, Address operator, long itemId) {
      return registry.getApproved(itemId).filter(operator::equals).isPresent();
    }
  },

  /** The holder granted the operator rights on all its items. */
  BLANKET_GRANT {
    @Override
    public boolean grants(
        ItemRegistry registry, Address holder, Address operator, long itemId) {
      return registry.isApprovedForAll(holder, operator);
    }
  };


  /**
   * Tests whether this mechanism grants {@code operator} the right to move
   * the given item.
   *
   * @param holder    the item's current holder
   */
  public abstract boolean grants(
      ItemRegistry registry, Address holder, Address operator, long itemId);


  /**
   * Returns {@code true} iff any mechanism grants {@code operator} the
   * right to move the given item.
   */
  public static boolean anyGrants(
      ItemRegistry registry, Address holder, Address operator, long itemId) {
    for (var right : values())
      if (right.grants(registry, holder, operator, itemId))
        return true;
    return false;
  }

}
