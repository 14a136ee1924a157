/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.blkchk.ItemNotFoundException;
import io.crums.blkchk.NotAuthorizedException;

/**
 * 
 */
public class CustodyLedgerTest extends EngineTestCase {

  private final CustodyLedger custody = new CustodyLedger(registry, ENGINE);


  @Test
  public void testDepositableByHolder() {
    long id = mint(ALICE, 0);
    assertEquals(ALICE, custody.checkDepositable(ALICE, id));
    assertTrue(TransferRight.HOLDER.grants(registry, ALICE, ALICE, id));
    assertFalse(TransferRight.ITEM_GRANT.grants(registry, ALICE, ALICE, id));
    assertFalse(TransferRight.BLANKET_GRANT.grants(registry, ALICE, ALICE, id));
  }


  @Test
  public void testDepositableByItemGrantee() {
    long id = mint(ALICE, 0);
    long other = mint(ALICE, 0);
    registry.approve(ALICE, BOB, id);

    assertEquals(ALICE, custody.checkDepositable(BOB, id));
    assertTrue(TransferRight.ITEM_GRANT.grants(registry, ALICE, BOB, id));
    try {
      custody.checkDepositable(BOB, other);
      fail();
    } catch (NotAuthorizedException expected) {
      assertEquals(BOB, expected.operator());
      assertEquals(other, expected.itemId());
    }
  }


  @Test
  public void testDepositableByBlanketGrantee() {
    long id = mint(ALICE, 0);
    long other = mint(ALICE, 2);
    registry.setApprovalForAll(ALICE, CAROL, true);

    assertEquals(ALICE, custody.checkDepositable(CAROL, id));
    assertEquals(ALICE, custody.checkDepositable(CAROL, other));
    assertTrue(TransferRight.BLANKET_GRANT.grants(registry, ALICE, CAROL, id));
    assertFalse(TransferRight.ITEM_GRANT.grants(registry, ALICE, CAROL, id));

    registry.setApprovalForAll(ALICE, CAROL, false);
    assertFalse(TransferRight.anyGrants(registry, ALICE, CAROL, id));
  }


  @Test
  public void testNotDepositableByStranger() {
    long id = mint(ALICE, 0);
    try {
      custody.checkDepositable(BOB, id);
      fail();
    } catch (NotAuthorizedException expected) {  }
    try {
      custody.checkDepositable(BOB, id + 1);
      fail();
    } catch (ItemNotFoundException expected) {  }
  }


  @Test
  public void testPullInAndRelease() {
    long id = mint(ALICE, 1);
    registry.approve(ALICE, BOB, id);
    assertEquals(ItemState.EXTERNAL, custody.stateOf(id));
    try {
      custody.checkInCustody(id);
      fail();
    } catch (NotAuthorizedException expected) {  }

    custody.pullIn(BOB, ALICE, id);
    assertEquals(ItemState.IN_CUSTODY, custody.stateOf(id));
    assertTrue(custody.stateOf(id).inCustody());
    assertEquals(1, custody.custodiedItem(id).rank());
    // the per-item grant does not survive the move
    assertTrue(registry.getApproved(id).isEmpty());

    custody.release(CAROL, id);
    assertEquals(CAROL, registry.ownerOf(id));
    assertEquals(ItemState.EXTERNAL, custody.stateOf(id));
  }


  @Test
  public void testConsumedState() {
    long a = mint(ALICE, 0);
    long b = mint(ALICE, 0);
    custody.pullIn(ALICE, ALICE, a);
    custody.pullIn(ALICE, ALICE, b);
    registry.mergePair(ENGINE, a, b, false);

    assertEquals(ItemState.CONSUMED, custody.stateOf(b));
    assertTrue(custody.stateOf(b).isTerminal());
    assertFalse(custody.stateOf(a).isTerminal());
    try {
      custody.stateOf(b + 1);
      fail();
    } catch (ItemNotFoundException expected) {  }
  }



  @Test
  public void testNotDepositableInCustody() {
    long id = mint(ALICE, 0);
    custody.pullIn(ALICE, ALICE, id);
    for (var caller : List.of(ENGINE, ALICE)) {
      try {
        custody.checkDepositable(caller, id);
        fail();
      } catch (NotAuthorizedException expected) {
        assertEquals(id, expected.itemId());
      }
    }
  }


  @Test
  public void testPushBackRestoresGrant() {
    long id = mint(ALICE, 0);
    registry.approve(ALICE, BOB, id);

    var approved = custody.pullIn(BOB, ALICE, id);
    assertEquals(BOB, approved.orElseThrow());
    assertTrue(registry.getApproved(id).isEmpty());

    custody.pushBack(ALICE, id, approved);
    assertEquals(ALICE, registry.ownerOf(id));
    assertEquals(BOB, registry.getApproved(id).orElseThrow());
    assertEquals(ItemState.EXTERNAL, custody.stateOf(id));
  }

}
