package com.codeheadsystems.keymanager.dropwizard.lifecycle;

import com.codeheadsystems.keymanager.server.manager.KeyManager;
import com.codeheadsystems.keymanager.server.scheduler.KeyRotationScheduler;
import com.codeheadsystems.keymanager.server.store.TimeBoundedAccountKeyStore;
import io.dropwizard.lifecycle.Managed;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ties the key manager to the application lifecycle: initializes the configured accounts and
 * starts the rotation scheduler on start; stops the scheduler, releases the store threads and
 * zeroizes cached keys on stop.
 */
public class ManagedKeyRotation implements Managed {

  private static final Logger log = LoggerFactory.getLogger(ManagedKeyRotation.class);

  private final KeyManager keyManager;
  private final KeyRotationScheduler scheduler;
  private final TimeBoundedAccountKeyStore store;
  private final List<String> bootstrapAccounts;

  public ManagedKeyRotation(KeyManager keyManager,
                            KeyRotationScheduler scheduler,
                            TimeBoundedAccountKeyStore store,
                            List<String> bootstrapAccounts) {
    this.keyManager = keyManager;
    this.scheduler = scheduler;
    this.store = store;
    this.bootstrapAccounts = List.copyOf(bootstrapAccounts);
  }

  @Override
  public void start() {
    for (String accountId : bootstrapAccounts) {
      keyManager.initialize(accountId);
    }
    log.info("Initialized {} bootstrap account(s)", bootstrapAccounts.size());
    scheduler.start();
  }

  @Override
  public void stop() {
    scheduler.shutdown();
    store.close();
    keyManager.clearSensitiveData();
  }
}
