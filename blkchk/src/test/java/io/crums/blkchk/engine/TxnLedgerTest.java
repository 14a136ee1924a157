/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.engine;


import static org.junit.jupiter.api.Assertions.*;

import java.util.ConcurrentModificationException;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.crums.blkchk.Address;
import io.crums.blkchk.InsufficientBalanceException;
import io.crums.blkchk.VolatileFungibleLedger;

/**
 * 
 */
public class TxnLedgerTest {

  private final static Address ALICE = Address.of(0xa1L);
  private final static Address BOB = Address.of(0xb0L);
  private final static Address CAROL = Address.of(0xc0L);


  @Test
  public void testStagedReads() {
    var primary = new VolatileFungibleLedger(Map.of(ALICE, 10L));
    var txn = new TxnLedger(primary);
    assertTrue(txn.isEmpty());

    txn.credit(ALICE, 5);
    txn.credit(BOB, 7);
    assertFalse(txn.isEmpty());
    assertEquals(15L, txn.balanceOf(ALICE));
    assertEquals(7L, txn.balanceOf(BOB));
    assertEquals(22L, txn.totalIssued());

    // nothing written through
    assertEquals(10L, primary.balanceOf(ALICE));
    assertEquals(0L, primary.balanceOf(BOB));
    assertEquals(10L, primary.totalIssued());
  }


  @Test
  public void testCommit() {
    var primary = new VolatileFungibleLedger(Map.of(ALICE, 10L));
    var txn = new TxnLedger(primary);
    txn.debit(ALICE, 4);
    txn.credit(BOB, 9);
    txn.commit();

    assertEquals(6L, primary.balanceOf(ALICE));
    assertEquals(9L, primary.balanceOf(BOB));
    assertEquals(15L, primary.totalIssued());
    try {
      txn.credit(BOB, 1);
      fail();
    } catch (IllegalStateException expected) {  }
    try {
      txn.commit();
      fail();
    } catch (IllegalStateException expected) {  }
  }


  @Test
  public void testStagedDebitSeesStagedCredit() {
    var primary = new VolatileFungibleLedger();
    var txn = new TxnLedger(primary);
    try {
      txn.debit(ALICE, 1);
      fail();
    } catch (InsufficientBalanceException expected) {  }
    txn.credit(ALICE, 3);
    txn.debit(ALICE, 3);
    assertTrue(txn.isEmpty());
    txn.commit();
    assertEquals(0L, primary.totalIssued());
  }


  @Test
  public void testConcurrentModification() {
    var primary = new VolatileFungibleLedger();
    var txn = new TxnLedger(primary);
    txn.credit(ALICE, 1);
    primary.credit(BOB, 1);
    try {
      txn.commit();
      fail();
    } catch (ConcurrentModificationException expected) {  }
    assertEquals(0L, primary.balanceOf(ALICE));
    assertEquals(1L, primary.totalIssued());
  }


  @Test
  public void testFailedCommitRestoresDebits() {
    var primary = new VolatileFungibleLedger(Map.of(ALICE, 10L, BOB, 10L));
    var txn = new TxnLedger(primary);
    txn.debit(BOB, 5);
    txn.debit(ALICE, 5);
    txn.credit(CAROL, 1);

    // same total, different balances
    primary.transfer(ALICE, CAROL, 10);

    try {
      txn.commit();
      fail();
    } catch (InsufficientBalanceException expected) {  }
    assertEquals(10L, primary.balanceOf(BOB));
    assertEquals(0L, primary.balanceOf(ALICE));
    assertEquals(10L, primary.balanceOf(CAROL));
    assertEquals(20L, primary.totalIssued());
  }

}
