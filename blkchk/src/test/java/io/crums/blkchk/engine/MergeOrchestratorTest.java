/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import static io.crums.blkchk.BlkchkConstants.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.blkchk.Address;
import io.crums.blkchk.InsufficientBalanceException;
import io.crums.blkchk.InvalidOrderException;
import io.crums.blkchk.NotAuthorizedException;
import io.crums.blkchk.Ranks;
import io.crums.blkchk.RegistryRejectedException;
import io.crums.blkchk.engine.LedgerEvent.Aggregated;
import io.crums.blkchk.engine.LedgerEvent.Merged;

/**
 * 
 */
public class MergeOrchestratorTest extends EngineTestCase {


  @Test
  public void testMergePair() {
    var engine = newEngine();
    long a = mint(ALICE, 2);
    long b = mint(BOB, 2);
    engine.deposit(ALICE, a);
    engine.deposit(BOB, b);

    Merged merged = engine.mergePair(CAROL, a, b);
    assertEquals(new Merged(CAROL, a, b, 3), merged);
    assertEquals(3, registry.getItem(a).rank());
    assertEquals(a, registry.getItem(a).seed());
    assertTrue(registry.isConsumed(b));
    assertEquals(ItemState.CONSUMED, engine.stateOf(b));
    // merging moves no fungible value
    assertEquals(Ranks.amountFor(3), engine.totalIssued());
    engine.checkInvariants();
  }


  @Test
  public void testPairOrderCheckedFirst() {
    var counting = new ForwardingRegistry(registry);
    var engine = new BlackCheck(ENGINE, counting, ledger);
    try {
      engine.mergePair(CAROL, 5, 3);
      fail();
    } catch (InvalidOrderException expected) {  }
    try {
      engine.mergePair(CAROL, 3, 3);
      fail();
    } catch (InvalidOrderException expected) {  }
    assertEquals(0, counting.calls);
  }


  @Test
  public void testPairNotInCustody() {
    var engine = newEngine();
    long a = mint(ALICE, 0);
    long b = mint(ALICE, 0);
    engine.deposit(ALICE, a);
    try {
      engine.mergePair(ALICE, a, b);
      fail();
    } catch (NotAuthorizedException expected) {  }
    assertEquals(0, registry.getItem(a).rank());
    assertTrue(registry.exists(b));
  }


  @Test
  public void testPairRankRules() {
    var engine = newEngine();
    long a = mint(ALICE, 0);
    long b = mint(ALICE, 1);
    long c = mint(ALICE, AGGREGATE_RANK);
    long d = mint(ALICE, AGGREGATE_RANK);
    engine.deposit(ALICE, a, b, c, d);
    try {
      engine.mergePair(ALICE, a, b);
      fail();
    } catch (RegistryRejectedException expected) {  }
    try {
      engine.mergePair(ALICE, c, d);
      fail();
    } catch (RegistryRejectedException expected) {  }
    assertEquals(4, registry.items().size());
  }


  @Test
  public void testAggregateOrderCheckedFirst() {
    var counting = new ForwardingRegistry(registry);
    var engine = new BlackCheck(ENGINE, counting, ledger);
    var ids = new ArrayList<Long>();
    for (long id = AGGREGATE_COUNT; id > 0; --id)
      ids.add(id);
    try {
      engine.mergeAggregate(CAROL, ids);
      fail();
    } catch (InvalidOrderException expected) {  }
    assertEquals(0, counting.calls);

    try {
      engine.mergeAggregate(CAROL, Collections.nCopies(AGGREGATE_COUNT, 1L));
      fail();
    } catch (InvalidOrderException expected) {  }
    assertEquals(0, counting.calls);

    try {
      engine.mergeAggregate(CAROL, ids.subList(1, ids.size()));
      fail();
    } catch (IllegalArgumentException expected) {  }
    assertEquals(0, counting.calls);
  }


  @Test
  public void testAggregateNonMinimalFirst() {
    var engine = newEngine();
    var ids = mintSingles();
    for (int index = 0; index < ids.size(); ++index)
      engine.deposit(holder(index), ids.get(index));

    var shuffled = new ArrayList<Long>(ids);
    shuffled.set(0, ids.get(1));
    shuffled.set(1, ids.get(0));
    try {
      engine.mergeAggregate(CAROL, shuffled);
      fail();
    } catch (InvalidOrderException expected) {  }
    assertEquals(AGGREGATE_COUNT, registry.items().size());
    assertTrue(registry.consumedIds().isEmpty());
  }


  @Test
  public void testAggregateNeedsCustody() {
    var engine = newEngine();
    var ids = mintSingles();
    for (int index = 1; index < ids.size(); ++index)
      engine.deposit(holder(index), ids.get(index));
    try {
      engine.mergeAggregate(CAROL, ids);
      fail();
    } catch (NotAuthorizedException expected) {  }
    assertEquals(AGGREGATE_COUNT, registry.items().size());
  }


  @Test
  public void testFullAggregation() {
    var engine = newEngine();
    var events = new ArrayList<LedgerEvent>();
    engine.addListener(events::add);

    List<Long> ids = mintSingles();
    for (int index = 0; index < ids.size(); ++index)
      engine.deposit(holder(index), ids.get(index));

    assertEquals(MAX_SUPPLY, engine.totalIssued());
    assertEquals(MAX_SUPPLY / AGGREGATE_COUNT, engine.balanceOf(holder(0)));
    engine.checkInvariants();

    Aggregated aggregated = engine.mergeAggregate(CAROL, ids);
    long survivor = ids.get(0);
    assertEquals(survivor, aggregated.survivorId());
    assertEquals(ids.subList(1, ids.size()), aggregated.consumedIds());
    assertEquals(aggregated, events.get(events.size() - 1));

    assertEquals(MAX_RANK, registry.getItem(survivor).rank());
    assertTrue(registry.getItem(survivor).isMaximal());
    assertEquals(AGGREGATE_COUNT - 1, registry.consumedIds().size());
    assertEquals(List.of(registry.getItem(survivor)), registry.items());
    assertEquals(MAX_SUPPLY, engine.amountFor(survivor));
    assertEquals(MAX_SUPPLY, engine.totalIssued());

    // no single depositor can redeem the survivor
    for (int index = 0; index < AGGREGATE_COUNT; ++index) {
      try {
        engine.redeem(holder(index), survivor);
        fail();
      } catch (InsufficientBalanceException expected) {  }
    }

    Address gatherer = Address.of(0xfeedL);
    for (int index = 0; index < AGGREGATE_COUNT; ++index)
      ledger.transfer(holder(index), gatherer, ledger.balanceOf(holder(index)));
    assertEquals(MAX_SUPPLY, engine.balanceOf(gatherer));

    engine.redeem(gatherer, survivor);
    assertEquals(gatherer, registry.ownerOf(survivor));
    assertEquals(0L, engine.totalIssued());
    assertEquals(0L, sumOfBalances());
    engine.checkInvariants();
  }

}
