/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.config;


import static io.crums.blkchk.BlkchkConstants.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.blkchk.Address;
import io.crums.blkchk.VolatileFungibleLedger;
import io.crums.blkchk.VolatileItemRegistry;
import io.crums.blkchk.engine.ItemState;
import io.crums.blkchk.json.LedgerParser;
import io.crums.blkchk.json.RegistryParser;

/**
 * 
 */
public class EngineConfigTest {

  private final static Address REGISTRY = Address.of(0xc4ecL);
  private final static Address ENGINE = Address.of(0xb1ac4L);
  private final static Address ALICE = Address.of(0xa1L);

  private final static String RESOURCE = "engine.properties";


  @Test
  public void testResource() throws IOException {
    var props = new Properties();
    try (InputStream in = getClass().getResourceAsStream(RESOURCE)) {
      props.load(in);
    }
    var config = new EngineConfig(props);
    assertEquals(ENGINE, config.engineAddress());
    assertEquals(REGISTRY, config.registryAddress().orElseThrow());
    assertTrue(config.registrySnapshot().isEmpty());
    assertTrue(config.baseDir().isEmpty());

    var engine = config.newEngine();
    assertEquals(ENGINE, engine.address());
    assertEquals(REGISTRY, engine.registry().address());
    assertEquals(0L, engine.totalIssued());
  }


  @Test
  public void testMissingEngineAddress() {
    var props = new Properties();
    props.setProperty(EngineConfig.REGISTRY_ADDRESS, REGISTRY.toString());
    try {
      new EngineConfig(props);
      fail();
    } catch (IllegalArgumentException expected) {  }
  }


  @Test
  public void testMissingRegistry() {
    var props = new Properties();
    props.setProperty(EngineConfig.ENGINE_ADDRESS, ENGINE.toString());
    try {
      new EngineConfig(props);
      fail();
    } catch (IllegalArgumentException expected) {  }
  }


  @Test
  public void testSharedAddress() {
    var props = new Properties();
    props.setProperty(EngineConfig.ENGINE_ADDRESS, ENGINE.toString());
    props.setProperty(EngineConfig.REGISTRY_ADDRESS, ENGINE.toString());
    try {
      new EngineConfig(props);
      fail();
    } catch (IllegalArgumentException expected) {  }
  }


  @Test
  public void testBadAddress() {
    var props = new Properties();
    props.setProperty(EngineConfig.ENGINE_ADDRESS, "0xnothex");
    props.setProperty(EngineConfig.REGISTRY_ADDRESS, REGISTRY.toString());
    try {
      new EngineConfig(props);
      fail();
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().startsWith(EngineConfig.ENGINE_ADDRESS));
    }
  }


  @Test
  public void testSnapshots(@TempDir Path dir) throws IOException {
    var registry = new VolatileItemRegistry(REGISTRY);
    long held = registry.mint(ALICE, 3).id();
    long custodied = registry.mint(ENGINE, 3).id();
    var ledger = new VolatileFungibleLedger(Map.of(ALICE, UNIT / 4096 * 8));

    Path snapshots = Files.createDirectory(dir.resolve("snapshots"));
    Files.writeString(
        snapshots.resolve("registry.json"),
        RegistryParser.INSTANCE.toJsonObject(registry).toJSONString());
    Files.writeString(
        snapshots.resolve("ledger.json"),
        LedgerParser.INSTANCE.toJsonObject(ledger).toJSONString());

    File propsFile = dir.resolve("blkchk.properties").toFile();
    Files.writeString(
        propsFile.toPath(),
        EngineConfig.ENGINE_ADDRESS + "=" + ENGINE + "\n" +
        EngineConfig.REGISTRY_SNAPSHOT + "=snapshots/registry.json\n" +
        EngineConfig.LEDGER_SNAPSHOT + "=snapshots/ledger.json\n");

    var config = new EngineConfig(propsFile);
    assertTrue(config.registryAddress().isEmpty());
    assertEquals(
        snapshots.resolve("registry.json").toFile().getAbsoluteFile(),
        config.registrySnapshot().orElseThrow().getAbsoluteFile());

    var engine = config.newEngine();
    assertEquals(REGISTRY, engine.registry().address());
    assertEquals(ItemState.EXTERNAL, engine.stateOf(held));
    assertEquals(ItemState.IN_CUSTODY, engine.stateOf(custodied));
    assertEquals(UNIT / 4096 * 8, engine.balanceOf(ALICE));
    engine.checkInvariants();

    engine.redeem(ALICE, custodied);
    assertEquals(ALICE, engine.registry().ownerOf(custodied));
    assertEquals(0L, engine.totalIssued());

    // the loaded engine receives safe transfers
    engine.registry().safeTransfer(ALICE, ALICE, ENGINE, held);
    assertEquals(UNIT / 4096 * 8, engine.balanceOf(ALICE));
  }


  @Test
  public void testRegistryAddressMismatch(@TempDir Path dir) throws IOException {
    var registry = new VolatileItemRegistry(REGISTRY);
    Path snapshot = dir.resolve("registry.json");
    Files.writeString(
        snapshot, RegistryParser.INSTANCE.toJsonObject(registry).toJSONString());

    var props = new Properties();
    props.setProperty(EngineConfig.ENGINE_ADDRESS, ENGINE.toString());
    props.setProperty(EngineConfig.REGISTRY_ADDRESS, Address.of(0xdeadL).toString());
    props.setProperty(EngineConfig.REGISTRY_SNAPSHOT, snapshot.toString());
    var config = new EngineConfig(props);
    try {
      config.newRegistry();
      fail();
    } catch (IllegalArgumentException expected) {  }
  }


  @Test
  public void testMissingPropertiesFile(@TempDir Path dir) {
    try {
      new EngineConfig(dir.resolve("nope.properties").toFile());
      fail();
    } catch (IllegalArgumentException expected) {  }
  }

}
