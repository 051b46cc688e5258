package com.codeheadsystems.keymanager.client.manager;

import com.codeheadsystems.keymanager.client.accessor.KeyBundleAccessor;
import com.codeheadsystems.keymanager.client.model.VerifiedKeyBundle;
import com.codeheadsystems.keymanager.client.verifier.KeyBundleVerifier;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches a counterpart's key bundle and verifies it in one step.
 */
@Singleton
public class KeyBundleClientManager {
  private static final Logger log = LoggerFactory.getLogger(KeyBundleClientManager.class);

  private final KeyBundleAccessor accessor;
  private final KeyBundleVerifier verifier;

  @Inject
  public KeyBundleClientManager(final KeyBundleAccessor accessor, final KeyBundleVerifier verifier) {
    log.info("KeyBundleClientManager({}, {})", accessor, verifier);
    this.accessor = accessor;
    this.verifier = verifier;
  }

  /**
   * Fetches and verifies the bundle of an account.
   *
   * @param accountId the account
   * @return the verified bundle, or empty if the server has none
   * @throws com.codeheadsystems.keymanager.client.exceptions.KeyBundleVerificationException if the
   *     bundle fails verification
   */
  public Optional<VerifiedKeyBundle> fetchVerified(final String accountId) {
    return accessor.fetch(accountId).map(verifier::verify);
  }
}
