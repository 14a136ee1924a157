/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class AddressTest {


  @Test
  public void testNormalized() {
    var upper = Address.of("0X036721E5A769CC48B3189EFBB9CCE4471E8A48B1");
    var lower = Address.of("0x036721e5a769cc48b3189efbb9cce4471e8a48b1");
    assertEquals(lower, upper);
    assertEquals("0x036721e5a769cc48b3189efbb9cce4471e8a48b1", upper.toString());
  }


  @Test
  public void testFromNumber() {
    var address = Address.of(255L);
    assertEquals("0x" + "0".repeat(38) + "ff", address.hex());
    assertTrue(Address.of(0L).isZero());
    assertFalse(address.isZero());
    assertTrue(Address.of(1L).compareTo(Address.of(2L)) < 0);
  }


  @Test
  public void testMalformed() {
    String[] bad = {
        "036721e5a769cc48b3189efbb9cce4471e8a48b1",
        "0x036721e5a769cc48b3189efbb9cce4471e8a48b",
        "0x036721e5a769cc48b3189efbb9cce4471e8a48bg",
    };
    for (var hex : bad) {
      try {
        Address.of(hex);
        fail(hex);
      } catch (IllegalArgumentException expected) {  }
    }
  }

}
