/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import java.util.List;

import io.crums.blkchk.Address;

/**
 * Accounting events. Emitted to {@linkplain LedgerListener}s after the
 * request that caused them commits.
 */
public sealed interface LedgerEvent {

  /**
   * An item was taken into custody and its holder credited.
   *
   * @param caller    the party that made the request
   * @param holder    the item's holder before the deposit (credited)
   * @param itemId    the item deposited
   * @param rank      the item's rank at deposit
   * @param amount    the amount credited
   */
  record Deposited(
      Address caller, Address holder, long itemId, int rank, long amount)
          implements LedgerEvent {  }

  /**
   * An item was released from custody and the redeemer debited.
   *
   * @param account   the redeemer (debited, and the item's new holder)
   * @param itemId    the item redeemed
   * @param rank      the item's rank at redemption
   * @param amount    the amount debited
   */
  record Redeemed(Address account, long itemId, int rank, long amount)
      implements LedgerEvent {  }

  /**
   * Two items in custody were merged.
   *
   * @param caller    the party that made the request
   * @param keepId    the surviving item
   * @param burnId    the consumed item
   * @param newRank   the surviving item's rank after the merge
   */
  record Merged(Address caller, long keepId, long burnId, int newRank)
      implements LedgerEvent {  }

  /**
   * Items in custody were aggregated into a maximal-rank item.
   *
   * @param caller      the party that made the request
   * @param survivorId  the surviving (now maximal-rank) item
   * @param consumedIds the items consumed
   */
  record Aggregated(Address caller, long survivorId, List<Long> consumedIds)
      implements LedgerEvent {

    public Aggregated {
      consumedIds = List.copyOf(consumedIds);
    }
  }

}
