package com.codeheadsystems.keymanager.dropwizard;

import com.codeheadsystems.keymanager.crypto.KeyEncryptionUnit;
import com.codeheadsystems.keymanager.crypto.KeyMaterialFactory;
import com.codeheadsystems.keymanager.crypto.MasterKey;
import com.codeheadsystems.keymanager.crypto.RandomProvider;
import com.codeheadsystems.keymanager.dropwizard.health.KeyManagerHealthCheck;
import com.codeheadsystems.keymanager.dropwizard.lifecycle.ManagedKeyRotation;
import com.codeheadsystems.keymanager.server.config.KeyManagerConfig;
import com.codeheadsystems.keymanager.server.manager.KeyManager;
import com.codeheadsystems.keymanager.server.resource.KeyBundleResource;
import com.codeheadsystems.keymanager.server.scheduler.KeyRotationScheduler;
import com.codeheadsystems.keymanager.server.store.AccountKeyStore;
import com.codeheadsystems.keymanager.server.store.InMemoryAccountKeyStore;
import com.codeheadsystems.keymanager.server.store.TimeBoundedAccountKeyStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the key manager into an existing Dropwizard application.
 * <p>
 * Registers the key publication resource, the {@code key-manager} health check and a managed
 * lifecycle that runs the rotation scheduler. Requires a {@link KeyManagerConfiguration} block
 * in the application's YAML config.
 * <p>
 * Embed with the in-memory store (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new KeyManagerBundle<>());
 * }</pre>
 * <p>
 * Or supply a persistent store:
 * <pre>{@code
 *   bootstrap.addBundle(new KeyManagerBundle<>(myAccountKeyStore));
 * }</pre>
 */
public class KeyManagerBundle<C extends KeyManagerConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(KeyManagerBundle.class);

  private final AccountKeyStore accountKeyStore;
  private KeyManager keyManager;

  /**
   * Creates a bundle backed by the in-memory store. All keys are lost on restart.
   */
  public KeyManagerBundle() {
    this(new InMemoryAccountKeyStore());
    log.warn("""
        #################################################################
        # WARNING: Using the in-memory key store. All identity keys,    #
        # signed pre-keys and one-time pre-keys are lost on restart.    #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied store.
   *
   * @param accountKeyStore the store
   */
  public KeyManagerBundle(AccountKeyStore accountKeyStore) {
    this.accountKeyStore = accountKeyStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    KeyManagerConfig config = configuration.toKeyManagerConfig();
    RandomProvider randomProvider = new RandomProvider();
    KeyMaterialFactory keyMaterialFactory = new KeyMaterialFactory(randomProvider);
    KeyEncryptionUnit encryptionUnit = new KeyEncryptionUnit(buildMasterKey(configuration, randomProvider), randomProvider);
    TimeBoundedAccountKeyStore store = new TimeBoundedAccountKeyStore(accountKeyStore, config.storageTimeout());

    keyManager = new KeyManager(store, keyMaterialFactory, encryptionUnit, config, randomProvider);
    KeyRotationScheduler scheduler = new KeyRotationScheduler(
        keyManager, configuration.getRotationCheckInterval().toJavaDuration());

    environment.jersey().register(new KeyBundleResource(keyManager));
    environment.healthChecks().register("key-manager",
        new KeyManagerHealthCheck(encryptionUnit, keyMaterialFactory, randomProvider));
    environment.lifecycle().manage(
        new ManagedKeyRotation(keyManager, scheduler, store, configuration.getBootstrapAccounts()));
  }

  /**
   * The key manager built by {@link #run}, for applications that hand keys to their session layer.
   *
   * @return the key manager
   * @throws IllegalStateException before the bundle has run
   */
  public KeyManager getKeyManager() {
    if (keyManager == null) {
      throw new IllegalStateException("KeyManagerBundle has not run yet");
    }
    return keyManager;
  }

  static MasterKey buildMasterKey(KeyManagerConfiguration configuration, RandomProvider randomProvider) {
    String masterKeyHex = configuration.getMasterKeyHex();
    if (masterKeyHex != null && !masterKeyHex.isEmpty()) {
      return MasterKey.fromHex(masterKeyHex);
    }
    if (!configuration.isAllowEphemeralMasterKey()) {
      throw new IllegalStateException(
          "masterKeyHex must be configured for the key manager. "
              + "Generate a value with: openssl rand -hex 32. "
              + "Set allowEphemeralMasterKey: true to start with a random key (dev/test only).");
    }
    return MasterKey.ephemeral(randomProvider);
  }
}
