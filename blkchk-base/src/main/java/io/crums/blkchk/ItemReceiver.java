/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;

/**
 * Recipient-side hook for {@linkplain ItemRegistry#safeTransfer(Address,
 * Address, Address, long) safe transfers}. The item has already changed
 * hands when this is invoked; throwing undoes the transfer.
 */
@FunctionalInterface
public interface ItemReceiver {

  /**
   * Invoked by the registry after {@code itemId} is moved to this recipient.
   *
   * @param sender    the notifying registry's {@linkplain ItemRegistry#address()
   *                  address}
   * @param operator  the party that effected the transfer
   * @param from      the previous holder
   * @param itemId    the item received
   */
  void onItemReceived(Address sender, Address operator, Address from, long itemId);

}
