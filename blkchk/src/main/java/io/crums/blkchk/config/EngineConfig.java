/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.config;


import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import io.crums.blkchk.Address;
import io.crums.blkchk.BlkchkConstants;
import io.crums.blkchk.VolatileFungibleLedger;
import io.crums.blkchk.VolatileItemRegistry;
import io.crums.blkchk.engine.BlackCheck;
import io.crums.blkchk.json.LedgerParser;
import io.crums.blkchk.json.RegistryParser;
import io.crums.util.Lists;

/**
 * Engine configuration.
 *
 * <h2>Quirks and Features</h2>
 * <p>
 * A simple properties file is used to store configuration. The engine's
 * starting state (its registry and its balances) may be loaded from JSON
 * snapshots; absent these, the engine starts empty.
 * </p>
 * <h3>Relative Paths</h3>
 * <p>
 * Snapshot paths may be specified in either absolute or relative form. For
 * relative paths, <em>paths are resolved relative to the location of the
 * configuration file.</em>
 * </p>
 *
 * @see RegistryParser
 * @see LedgerParser
 */
public class EngineConfig {

  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "blkchk.";

  /**
   * The name of the base directory path. <em>This value should not be set in
   * the properties file.</em> It is set dynamically to the parent directory of
   * the configuration file.
   */
  public final static String BASE_DIR = ROOT + "base.dir";

  /** The name of the engine's address. Required property. */
  public final static String ENGINE_ADDRESS = ROOT + "engine.address";

  /**
   * The name of the registry's address. Required, unless a
   * {@linkplain #REGISTRY_SNAPSHOT} is given (which carries its own address).
   */
  public final static String REGISTRY_ADDRESS = ROOT + "registry.address";

  /** The name of the path to the registry's JSON snapshot. Optional. */
  public final static String REGISTRY_SNAPSHOT = ROOT + "registry.snapshot";

  /** The name of the path to the fungible ledger's JSON snapshot. Optional. */
  public final static String LEDGER_SNAPSHOT = ROOT + "ledger.snapshot";


  /** List of property names. */
  public final static List<String> PROP_NAMES = Lists.asReadOnlyList(
    new String[] {
        BASE_DIR,
        ENGINE_ADDRESS,
        REGISTRY_ADDRESS,
        REGISTRY_SNAPSHOT,
        LEDGER_SNAPSHOT,
    });


  private static Properties loadProperties(File propertiesFile) {
    Properties props = new Properties();
    try (var in = new FileInputStream(propertiesFile)) {
      props.load(in);
    } catch (FileNotFoundException fnfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    File baseDir = propertiesFile.getAbsoluteFile().getParentFile();
    props.put(BASE_DIR, baseDir.getAbsolutePath());
    return props;
  }



  private final File baseDir;
  private final Address engineAddress;
  private final Address registryAddress;
  private final File registrySnapshot;
  private final File ledgerSnapshot;


  /**
   * Loads the configuration from the given properties file.
   */
  public EngineConfig(File propertiesFile) {
    this(loadProperties(propertiesFile));
  }


  public EngineConfig(Properties props) {
    String base = props.getProperty(BASE_DIR);
    this.baseDir = base == null ? null : new File(base);

    this.engineAddress = getAddress(props, ENGINE_ADDRESS, true);
    this.registrySnapshot = getFile(props, REGISTRY_SNAPSHOT);
    this.registryAddress = getAddress(props, REGISTRY_ADDRESS, registrySnapshot == null);
    this.ledgerSnapshot = getFile(props, LEDGER_SNAPSHOT);

    if (engineAddress.equals(registryAddress))
      throw new IllegalArgumentException(
          "%s and %s must differ: %s".formatted(ENGINE_ADDRESS, REGISTRY_ADDRESS, engineAddress));
  }


  private static Address getAddress(Properties props, String name, boolean required) {
    String value = props.getProperty(name);
    if (value == null || value.isBlank()) {
      if (required)
        throw new IllegalArgumentException("missing required property " + name);
      return null;
    }
    try {
      return Address.of(value.trim());
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException(name + ": " + iax.getMessage(), iax);
    }
  }


  private File getFile(Properties props, String name) {
    String path = props.getProperty(name);
    if (path == null || path.isBlank())
      return null;
    File file = new File(path.trim());
    if (!file.isAbsolute() && baseDir != null)
      file = new File(baseDir, path.trim());
    return file;
  }



  /** Returns the engine's address. */
  public Address engineAddress() {
    return engineAddress;
  }


  /**
   * Returns the configured registry address, if set. (If not set, the
   * address comes from the registry snapshot.)
   */
  public Optional<Address> registryAddress() {
    return Optional.ofNullable(registryAddress);
  }


  public Optional<File> registrySnapshot() {
    return Optional.ofNullable(registrySnapshot);
  }


  public Optional<File> ledgerSnapshot() {
    return Optional.ofNullable(ledgerSnapshot);
  }


  /**
   * Returns the base directory relative paths are resolved against, if any.
   */
  public Optional<File> baseDir() {
    return Optional.ofNullable(baseDir);
  }



  /**
   * Creates and returns the configured registry: loaded from its snapshot,
   * if any; empty, otherwise.
   *
   * @throws IllegalArgumentException
   *         if the snapshot's address disagrees with {@linkplain #REGISTRY_ADDRESS}
   */
  public VolatileItemRegistry newRegistry() {
    if (registrySnapshot == null)
      return new VolatileItemRegistry(registryAddress);

    var registry = RegistryParser.INSTANCE.toEntity(registrySnapshot);
    if (registryAddress != null && !registryAddress.equals(registry.address()))
      throw new IllegalArgumentException(
          "%s (%s) disagrees with snapshot %s (%s)".formatted(
              REGISTRY_ADDRESS, registryAddress, registrySnapshot, registry.address()));
    return registry;
  }


  /**
   * Creates and returns the configured fungible ledger: loaded from its
   * snapshot, if any; empty, otherwise.
   *
   * @throws IllegalArgumentException
   *         if the snapshot's total exceeds {@linkplain BlkchkConstants#MAX_SUPPLY}
   */
  public VolatileFungibleLedger newLedger() {
    if (ledgerSnapshot == null)
      return new VolatileFungibleLedger();

    var ledger = LedgerParser.INSTANCE.toEntity(ledgerSnapshot);
    if (ledger.totalIssued() > BlkchkConstants.MAX_SUPPLY)
      throw new IllegalArgumentException(
          "snapshot %s total issued %d exceeds max supply"
          .formatted(ledgerSnapshot, ledger.totalIssued()));
    return ledger;
  }


  /**
   * Creates and returns a new engine over the configured registry and ledger.
   */
  public BlackCheck newEngine() {
    return BlackCheck.newInstance(engineAddress, newRegistry(), newLedger());
  }

}
