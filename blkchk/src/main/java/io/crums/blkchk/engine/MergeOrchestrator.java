/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import static io.crums.blkchk.BlkchkConstants.AGGREGATE_COUNT;
import static io.crums.blkchk.BlkchkConstants.getLogger;

import java.lang.System.Logger.Level;
import java.util.List;
import java.util.Objects;

import io.crums.blkchk.Address;
import io.crums.blkchk.InvalidOrderException;
import io.crums.blkchk.ItemRegistry;
import io.crums.blkchk.engine.LedgerEvent.Aggregated;
import io.crums.blkchk.engine.LedgerEvent.Merged;
import io.crums.util.Lists;

/**
 * Merges items held in custody. Merging is permissionless: it only ever
 * touches items the engine holds.
 *
 * <h2>Ordering Rules</h2>
 * <p>
 * The ordering constraints are this engine's own business rules and are
 * checked here, before anything else. The structural rules (equal ranks,
 * mergeable ranks, distinct items) belong to the registry and are not
 * duplicated.
 * </p>
 * <ul>
 * <li>{@linkplain #mergePair(Address, long, long) Pairwise}: the kept id must
 * be strictly less than the burnt id.</li>
 * <li>{@linkplain #mergeAggregate(Address, List) Aggregate}: the first id,
 * which survives, must be strictly less than every other.</li>
 * </ul>
 */
public class MergeOrchestrator {

  private final CustodyLedger custody;


  public MergeOrchestrator(CustodyLedger custody) {
    this.custody = Objects.requireNonNull(custody, "null custody");
  }



  /**
   * Merges {@code burnId} into {@code keepId}. On return, {@code keepId}
   * is one rank higher and {@code burnId} no longer exists.
   *
   * @param caller  the requesting party (any)
   *
   * @throws InvalidOrderException if {@code keepId >= burnId}
   */
  public Merged mergePair(Address caller, long keepId, long burnId)
      throws InvalidOrderException {

    if (keepId >= burnId)
      throw new InvalidOrderException(
          "keep id [%d] must be less than burn id [%d]".formatted(keepId, burnId));

    custody.checkInCustody(keepId);
    custody.checkInCustody(burnId);

    ItemRegistry registry = custody.registry();
    registry.mergePair(custody.custodian(), keepId, burnId, false);
    int newRank = registry.getItem(keepId).rank();

    getLogger().log(
        Level.INFO,
        () -> "item [%d] merged into [%d] (rank %d) by %s"
        .formatted(burnId, keepId, newRank, caller));
    return new Merged(caller, keepId, burnId, newRank);
  }


  /**
   * Aggregates {@linkplain io.crums.blkchk.BlkchkConstants#AGGREGATE_COUNT
   * AGGREGATE_COUNT} items into one maximal-rank item. The first item
   * survives; the rest are consumed. Irreversible.
   *
   * @param caller  the requesting party (any)
   * @param itemIds exactly {@code AGGREGATE_COUNT} ids, the first being the least
   *
   * @throws InvalidOrderException if any id is not greater than the first
   */
  public Aggregated mergeAggregate(Address caller, List<Long> itemIds)
      throws InvalidOrderException {

    Objects.requireNonNull(itemIds, "null itemIds");
    if (itemIds.size() != AGGREGATE_COUNT)
      throw new IllegalArgumentException(
          "expected %d item ids; actual given %d"
          .formatted(AGGREGATE_COUNT, itemIds.size()));

    final long first = itemIds.get(0);
    for (int index = 1; index < itemIds.size(); ++index) {
      long id = itemIds.get(index);
      if (id <= first)
        throw new InvalidOrderException(
            "item [%d] at index %d is not greater than first item [%d]"
            .formatted(id, index, first));
    }

    for (long id : itemIds)
      custody.checkInCustody(id);

    custody.registry().mergeAggregate(custody.custodian(), List.copyOf(itemIds));

    var consumed = Lists.readOnlyCopy(itemIds.subList(1, itemIds.size()));
    getLogger().log(
        Level.INFO,
        () -> "item [%d] aggregated to maximal rank by %s".formatted(first, caller));
    return new Aggregated(caller, first, consumed);
  }

}
