package com.codeheadsystems.keymanager.server.manager;

import com.codeheadsystems.keymanager.crypto.ByteUtils;
import com.codeheadsystems.keymanager.crypto.KeyEncryptionUnit;
import com.codeheadsystems.keymanager.crypto.KeyMaterialFactory;
import com.codeheadsystems.keymanager.crypto.RandomProvider;
import com.codeheadsystems.keymanager.crypto.exceptions.KeyAuthenticationException;
import com.codeheadsystems.keymanager.crypto.model.IdentityKeyPair;
import com.codeheadsystems.keymanager.crypto.model.IdentityPrivateKey;
import com.codeheadsystems.keymanager.crypto.model.IdentityPublicKey;
import com.codeheadsystems.keymanager.crypto.model.PreKeyPair;
import com.codeheadsystems.keymanager.crypto.model.PreKeyPrivateKey;
import com.codeheadsystems.keymanager.crypto.model.PreKeyPublicKey;
import com.codeheadsystems.keymanager.server.config.KeyManagerConfig;
import com.codeheadsystems.keymanager.server.exceptions.KeyNotInitializedException;
import com.codeheadsystems.keymanager.server.exceptions.PreKeyUnavailableException;
import com.codeheadsystems.keymanager.server.model.AccountKeyStatus;
import com.codeheadsystems.keymanager.server.model.AccountState;
import com.codeheadsystems.keymanager.server.model.ConsumedPreKey;
import com.codeheadsystems.keymanager.server.model.KeyBundle;
import com.codeheadsystems.keymanager.server.model.KeyManagerStatistics;
import com.codeheadsystems.keymanager.server.model.OneTimePreKeyPublic;
import com.codeheadsystems.keymanager.server.model.PoolHealth;
import com.codeheadsystems.keymanager.server.model.RotationCheckResult;
import com.codeheadsystems.keymanager.server.model.SignedPreKeyFreshness;
import com.codeheadsystems.keymanager.server.model.SignedPreKeyPublic;
import com.codeheadsystems.keymanager.server.store.AccountKeyStore;
import com.codeheadsystems.keymanager.server.store.IdentityRecord;
import com.codeheadsystems.keymanager.server.store.OneTimePreKeyRecord;
import com.codeheadsystems.keymanager.server.store.SignedPreKeyRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic owner of every account's X3DH key material.
 * <p>
 * Bootstraps identities, keeps the one-time pre-key pool topped up, rotates signed pre-keys and
 * hands out decrypted private keys to the session layer. Private keys are sealed with the
 * {@link KeyEncryptionUnit} before they reach the {@link AccountKeyStore}; decrypted keys live
 * only in this process's caches or in the objects returned to callers.
 * <p>
 * Bootstrap, rotation and replenishment of one account are serialized by a per-account lock.
 * Consumption is not locked: the store's conditional used-flag update decides the winner.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link IllegalArgumentException} for a null or blank account id</li>
 *   <li>{@link KeyNotInitializedException} when an accessor runs before {@link #initialize}</li>
 *   <li>{@link PreKeyUnavailableException} for an unknown, used or expired pre-key</li>
 *   <li>{@link KeyAuthenticationException} when stored key material fails to decrypt</li>
 *   <li>{@code KeyStorageException} when the store fails or times out</li>
 * </ul>
 */
@Singleton
public class KeyManager {

  private static final Logger log = LoggerFactory.getLogger(KeyManager.class);

  /**
   * Registration ids are drawn from [1, 16380].
   */
  public static final int REGISTRATION_ID_MIN = 1;
  public static final int REGISTRATION_ID_MAX = 16380;

  private static final int CONSUME_CANDIDATE_PAGE = 8;

  private final AccountKeyStore store;
  private final KeyMaterialFactory keyMaterialFactory;
  private final KeyEncryptionUnit encryptionUnit;
  private final KeyManagerConfig config;
  private final RandomProvider randomProvider;
  private final Clock clock;

  private final ConcurrentHashMap<String, AccountState> lifecycle = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, CachedIdentity> identities = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, CachedSignedPreKey> signedPreKeys = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();

  private final AtomicLong identityKeysGenerated = new AtomicLong();
  private final AtomicLong preKeysGenerated = new AtomicLong();
  private final AtomicLong preKeysUsed = new AtomicLong();
  private final AtomicLong signedPreKeysRotated = new AtomicLong();

  public KeyManager(final AccountKeyStore store,
                    final KeyMaterialFactory keyMaterialFactory,
                    final KeyEncryptionUnit encryptionUnit,
                    final KeyManagerConfig config,
                    final RandomProvider randomProvider) {
    this(store, keyMaterialFactory, encryptionUnit, config, randomProvider, Clock.systemUTC());
  }

  @Inject
  public KeyManager(final AccountKeyStore store,
                    final KeyMaterialFactory keyMaterialFactory,
                    final KeyEncryptionUnit encryptionUnit,
                    final KeyManagerConfig config,
                    final RandomProvider randomProvider,
                    final Clock clock) {
    this.store = store;
    this.keyMaterialFactory = keyMaterialFactory;
    this.encryptionUnit = encryptionUnit;
    this.config = config;
    this.randomProvider = randomProvider;
    this.clock = clock;
  }

  // ── Lifecycle ────────────────────────────────────────────────────────────

  /**
   * Brings an account to READY: loads or creates its identity, fills the one-time pre-key pool
   * and makes sure an unexpired signed pre-key is active. Idempotent.
   *
   * @param accountId the account
   */
  public void initialize(String accountId) {
    requireAccountId(accountId);
    ReentrantLock lock = lockFor(accountId);
    lock.lock();
    AccountState previous = null;
    try {
      log.info("initialize(accountId={})", accountId);
      previous = lifecycle.put(accountId, AccountState.BOOTSTRAPPING);
      IdentityKeyPair identity = loadOrCreateIdentity(accountId);
      replenishLocked(accountId);
      ensureSignedPreKey(accountId, identity);
      lifecycle.put(accountId, AccountState.READY);
    } catch (RuntimeException e) {
      if (previous == AccountState.READY) {
        lifecycle.put(accountId, AccountState.READY);
      } else {
        lifecycle.remove(accountId);
      }
      log.error("Failed to initialize keys for account {}: {}", accountId, e.getMessage());
      throw e;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Accounts this instance has brought to READY.
   *
   * @return snapshot of managed account ids
   */
  public Set<String> managedAccounts() {
    return lifecycle.entrySet().stream()
        .filter(e -> e.getValue() == AccountState.READY)
        .map(Map.Entry::getKey)
        .collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Accounts the rotation sweep maintains: those this instance brought to READY plus every
   * account with an identity in the store.
   *
   * @return snapshot of account ids in ascending order
   */
  public Set<String> accountsForMaintenance() {
    Set<String> accounts = new TreeSet<>(managedAccounts());
    accounts.addAll(store.listAccounts());
    return Collections.unmodifiableSet(accounts);
  }

  /**
   * Drops and zeroizes the cached private keys of one account. Copies already handed to callers
   * are unaffected. The account stays managed; the next access reloads from the store.
   *
   * @param accountId the account
   */
  public void evict(String accountId) {
    requireAccountId(accountId);
    CachedIdentity identity = identities.remove(accountId);
    if (identity != null) {
      identity.keyPair().destroy();
    }
    CachedSignedPreKey signedPreKey = signedPreKeys.remove(accountId);
    if (signedPreKey != null) {
      signedPreKey.keyPair().destroy();
    }
    log.debug("Evicted cached keys for account {}", accountId);
  }

  /**
   * Zeroizes every cached private key and the master key. The manager is unusable afterwards.
   */
  public void clearSensitiveData() {
    identities.values().forEach(c -> c.keyPair().destroy());
    identities.clear();
    signedPreKeys.values().forEach(c -> c.keyPair().destroy());
    signedPreKeys.clear();
    lifecycle.clear();
    encryptionUnit.destroy();
    log.info("Cleared all cached key material");
  }

  // ── Accessors ────────────────────────────────────────────────────────────

  /**
   * The account's identity key pair. The caller owns the returned copy and may destroy it.
   *
   * @param accountId the account
   * @return a copy of the identity key pair
   * @throws KeyNotInitializedException if the account has no identity
   */
  public IdentityKeyPair getIdentityKeyPair(String accountId) {
    return copyOf(identity(accountId).keyPair());
  }

  /**
   * The account's registration id.
   *
   * @param accountId the account
   * @return the registration id
   * @throws KeyNotInitializedException if the account has no identity
   */
  public int getRegistrationId(String accountId) {
    return identity(accountId).registrationId();
  }

  /**
   * The account's active signed pre-key pair. A cached key is trusted for the configured cache
   * TTL and never past its rotation deadline; after that it is re-checked against the store, so
   * a rotation done by another instance is picked up.
   *
   * @param accountId the account
   * @return a copy of the active signed pre-key pair, owned by the caller
   * @throws KeyNotInitializedException if the account has no active signed pre-key
   */
  public PreKeyPair getSignedPreKeyPair(String accountId) {
    requireAccountId(accountId);
    Instant now = clock.instant();
    CachedSignedPreKey cached = signedPreKeys.get(accountId);
    if (cached != null && cached.isFresh(now, config.cacheTtl())) {
      return copyOf(cached.keyPair());
    }
    SignedPreKeyRecord active = store.loadActiveSignedPreKey(accountId)
        .orElseThrow(() -> new KeyNotInitializedException(
            "No active signed pre-key for account " + accountId + "; call initialize() first"));
    if (cached != null && cached.keyId() == active.keyId()) {
      signedPreKeys.put(accountId, cached.verifiedAt(now));
      return copyOf(cached.keyPair());
    }
    return copyOf(cacheSignedPreKey(accountId, active).keyPair());
  }

  /**
   * A signed pre-key by id: the active one, or a superseded one still inside its grace period.
   * Used to answer handshakes that were started against an older bundle.
   *
   * @param accountId the account
   * @param keyId     the signed pre-key id
   * @return the key pair
   * @throws PreKeyUnavailableException if the id is unknown or its grace period has passed
   */
  public PreKeyPair getSignedPreKey(String accountId, int keyId) {
    requireAccountId(accountId);
    CachedSignedPreKey cached = signedPreKeys.get(accountId);
    if (cached != null && cached.keyId() == keyId) {
      return copyOf(cached.keyPair());
    }
    SignedPreKeyRecord record = store.loadSignedPreKey(accountId, keyId)
        .orElseThrow(() -> new PreKeyUnavailableException(
            "Signed pre-key " + keyId + " not found for account " + accountId));
    if (!record.active() && record.deactivatedAt() != null
        && !clock.instant().isBefore(record.deactivatedAt().plus(config.signedPreKeyGracePeriod()))) {
      throw new PreKeyUnavailableException(
          "Signed pre-key " + keyId + " for account " + accountId + " is past its grace period");
    }
    return decryptPreKeyPair(record.publicKey(), record.encryptedPrivateKey());
  }

  /**
   * Public bundle for publication: identity key, registration id, active signed pre-key and up to
   * the configured number of unused one-time pre-keys. Pre-keys are not reserved by publication.
   *
   * @param accountId the account
   * @return the bundle, or empty if the account is not initialized or its signed pre-key does not
   *     verify under its identity key
   */
  public Optional<KeyBundle> getPublicBundleForPublishing(String accountId) {
    requireAccountId(accountId);
    Optional<IdentityRecord> identity = store.loadIdentityBundle(accountId);
    if (identity.isEmpty()) {
      log.debug("No identity for account {}, nothing to publish", accountId);
      return Optional.empty();
    }
    Optional<SignedPreKeyRecord> signedPreKey = store.loadActiveSignedPreKey(accountId);
    if (signedPreKey.isEmpty()) {
      log.debug("No active signed pre-key for account {}, nothing to publish", accountId);
      return Optional.empty();
    }
    if (signedPreKey.get().isDueForRotation(clock.instant())) {
      log.warn("Signed pre-key {} of account {} is past its rotation deadline; rotating before publishing",
          signedPreKey.get().keyId(), accountId);
      signedPreKey = rotateIfDue(accountId);
    }
    IdentityPublicKey identityKey = new IdentityPublicKey(identity.get().identityPublicKey().clone());
    SignedPreKeyRecord spk = signedPreKey.get();
    if (!keyMaterialFactory.verify(spk.publicKey(), spk.signature(), identityKey)) {
      log.warn("Signed pre-key {} of account {} does not verify under its identity key; not publishing",
          spk.keyId(), accountId);
      return Optional.empty();
    }
    List<OneTimePreKeyPublic> oneTimePreKeys = store
        .loadUnusedPreKeys(accountId, config.publicationBatchSize()).stream()
        .map(r -> new OneTimePreKeyPublic(r.keyId(), new PreKeyPublicKey(r.publicKey())))
        .toList();
    return Optional.of(new KeyBundle(
        identityKey,
        identity.get().registrationId(),
        new SignedPreKeyPublic(spk.keyId(), new PreKeyPublicKey(spk.publicKey()), spk.signature()),
        oneTimePreKeys));
  }

  // ── Consumption ──────────────────────────────────────────────────────────

  /**
   * Takes a specific one-time pre-key out of the pool and returns its decrypted key pair.
   * The key is decrypted before it is marked used, so a decryption failure leaves it unused.
   *
   * @param accountId the account
   * @param keyId     the pre-key id named by the initiator
   * @return the key pair
   * @throws PreKeyUnavailableException if the key is unknown or already used, including when a
   *                                    concurrent caller won the race for it
   */
  public PreKeyPair consumePreKey(String accountId, int keyId) {
    requireAccountId(accountId);
    OneTimePreKeyRecord record = store.loadPreKey(accountId, keyId)
        .filter(r -> !r.used())
        .orElseThrow(() -> new PreKeyUnavailableException(
            "One-time pre-key " + keyId + " is unknown or already used for account " + accountId));
    PreKeyPair keyPair = decryptPreKeyPair(record.publicKey(), record.encryptedPrivateKey());
    if (!store.markPreKeyUsed(accountId, keyId)) {
      keyPair.destroy();
      throw new PreKeyUnavailableException(
          "One-time pre-key " + keyId + " was consumed concurrently for account " + accountId);
    }
    preKeysUsed.incrementAndGet();
    log.debug("Consumed one-time pre-key {} for account {}", keyId, accountId);
    return keyPair;
  }

  /**
   * Takes the lowest-numbered unused one-time pre-key.
   *
   * @param accountId the account
   * @return the consumed key, or empty if the pool is exhausted
   */
  public Optional<ConsumedPreKey> consumeNextPreKey(String accountId) {
    requireAccountId(accountId);
    List<OneTimePreKeyRecord> candidates = store.loadUnusedPreKeys(accountId, CONSUME_CANDIDATE_PAGE);
    while (!candidates.isEmpty()) {
      for (OneTimePreKeyRecord candidate : candidates) {
        PreKeyPair keyPair = decryptPreKeyPair(candidate.publicKey(), candidate.encryptedPrivateKey());
        if (store.markPreKeyUsed(accountId, candidate.keyId())) {
          preKeysUsed.incrementAndGet();
          log.debug("Consumed one-time pre-key {} for account {}", candidate.keyId(), accountId);
          return Optional.of(new ConsumedPreKey(candidate.keyId(), keyPair));
        }
        keyPair.destroy();
      }
      candidates = store.loadUnusedPreKeys(accountId, CONSUME_CANDIDATE_PAGE);
    }
    log.warn("One-time pre-key pool exhausted for account {}", accountId);
    return Optional.empty();
  }

  // ── Maintenance ──────────────────────────────────────────────────────────

  /**
   * Installs a new signed pre-key, signed by the account's identity key. The previous key stays
   * readable through {@link #getSignedPreKey} for the grace period.
   *
   * @param accountId the account
   * @return id of the new signed pre-key
   * @throws KeyNotInitializedException if the account has no identity
   */
  public int rotateSignedPreKey(String accountId) {
    requireAccountId(accountId);
    ReentrantLock lock = lockFor(accountId);
    lock.lock();
    try {
      return rotateLocked(accountId, identity(accountId).keyPair());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Tops the one-time pre-key pool up to the target size when it has fallen below the low-water
   * mark.
   *
   * @param accountId the account
   * @return number of keys generated, 0 if the pool was healthy
   */
  public int replenishPreKeysIfNeeded(String accountId) {
    requireAccountId(accountId);
    ReentrantLock lock = lockFor(accountId);
    lock.lock();
    try {
      return replenishLocked(accountId);
    } finally {
      lock.unlock();
    }
  }

  /**
   * One maintenance pass: rotates the signed pre-key if due, replenishes the pool if low and prunes
   * superseded signed pre-keys past their grace period.
   *
   * @param accountId the account
   * @return what the pass did
   * @throws KeyNotInitializedException if the account has no identity
   */
  public RotationCheckResult performKeyRotationCheck(String accountId) {
    requireAccountId(accountId);
    ReentrantLock lock = lockFor(accountId);
    lock.lock();
    try {
      IdentityKeyPair identity = identity(accountId).keyPair();
      Instant now = clock.instant();
      Optional<SignedPreKeyRecord> active = store.loadActiveSignedPreKey(accountId);
      boolean rotated = false;
      if (active.isEmpty() || active.get().isDueForRotation(now)) {
        rotateLocked(accountId, identity);
        rotated = true;
      }
      int generated = replenishLocked(accountId);
      int pruned = store.pruneInactiveSignedPreKeys(accountId, now.minus(config.signedPreKeyGracePeriod()));
      int unused = store.countUnusedPreKeys(accountId);
      if (rotated || generated > 0 || pruned > 0) {
        log.info("Rotation check for account {}: rotated={}, generated={}, pruned={}, unused={}",
            accountId, rotated, generated, pruned, unused);
      }
      return new RotationCheckResult(rotated, generated, unused, pruned);
    } finally {
      lock.unlock();
    }
  }

  // ── Reporting ────────────────────────────────────────────────────────────

  public KeyManagerStatistics getStatistics() {
    return new KeyManagerStatistics(
        identityKeysGenerated.get(),
        preKeysGenerated.get(),
        preKeysUsed.get(),
        signedPreKeysRotated.get(),
        encryptionUnit.operationCount());
  }

  /**
   * Health of one account. Reads only public metadata from the store.
   *
   * @param accountId the account
   * @return the status
   */
  public AccountKeyStatus getAccountStatus(String accountId) {
    requireAccountId(accountId);
    Instant now = clock.instant();
    int unused = store.countUnusedPreKeys(accountId);
    Optional<SignedPreKeyRecord> active = store.loadActiveSignedPreKey(accountId);
    AccountState state = lifecycle.get(accountId);
    if (state == null) {
      state = active.isPresent() && store.loadIdentityBundle(accountId).isPresent()
          ? AccountState.READY
          : AccountState.UNINITIALIZED;
    }
    return new AccountKeyStatus(
        accountId,
        state,
        unused,
        unused < config.lowWaterMark() ? PoolHealth.LOW : PoolHealth.HEALTHY,
        active.map(SignedPreKeyRecord::keyId).orElse(-1),
        active.isEmpty() || active.get().isDueForRotation(now)
            ? SignedPreKeyFreshness.DUE_FOR_ROTATION
            : SignedPreKeyFreshness.CURRENT,
        active.map(SignedPreKeyRecord::nextRotationAt).orElse(null));
  }

  // ── Internals ────────────────────────────────────────────────────────────

  private CachedIdentity identity(String accountId) {
    requireAccountId(accountId);
    CachedIdentity cached = identities.get(accountId);
    if (cached != null) {
      return cached;
    }
    IdentityRecord record = store.loadIdentityBundle(accountId)
        .orElseThrow(() -> new KeyNotInitializedException(
            "No identity for account " + accountId + "; call initialize() first"));
    return cacheIdentity(accountId, record);
  }

  private Optional<SignedPreKeyRecord> rotateIfDue(String accountId) {
    ReentrantLock lock = lockFor(accountId);
    lock.lock();
    try {
      Optional<SignedPreKeyRecord> active = store.loadActiveSignedPreKey(accountId);
      if (active.isEmpty() || active.get().isDueForRotation(clock.instant())) {
        rotateLocked(accountId, identity(accountId).keyPair());
        return store.loadActiveSignedPreKey(accountId);
      }
      return active;
    } finally {
      lock.unlock();
    }
  }

  private IdentityKeyPair loadOrCreateIdentity(String accountId) {
    Optional<IdentityRecord> existing = store.loadIdentityBundle(accountId);
    if (existing.isPresent()) {
      return cacheIdentity(accountId, existing.get()).keyPair();
    }
    log.info("Generating identity for account {}", accountId);
    IdentityKeyPair keyPair = keyMaterialFactory.generateIdentityKeyPair();
    int registrationId = randomProvider.randomInt(REGISTRATION_ID_MIN, REGISTRATION_ID_MAX + 1);
    IdentityRecord record = new IdentityRecord(
        keyPair.publicKey().bytes().clone(),
        encryptionUnit.encrypt(keyPair.privateKey().bytes()),
        registrationId,
        clock.instant());
    store.upsertIdentityBundle(accountId, record);
    identityKeysGenerated.incrementAndGet();
    identities.put(accountId, new CachedIdentity(keyPair, registrationId));
    return keyPair;
  }

  private CachedIdentity cacheIdentity(String accountId, IdentityRecord record) {
    byte[] privateKey = decryptMatching(record.identityPublicKey(), record.encryptedIdentityPrivateKey());
    CachedIdentity cached = new CachedIdentity(
        new IdentityKeyPair(new IdentityPublicKey(record.identityPublicKey().clone()), new IdentityPrivateKey(privateKey)),
        record.registrationId());
    identities.put(accountId, cached);
    return cached;
  }

  private void ensureSignedPreKey(String accountId, IdentityKeyPair identity) {
    Optional<SignedPreKeyRecord> active = store.loadActiveSignedPreKey(accountId);
    if (active.isEmpty()) {
      rotateLocked(accountId, identity);
    } else if (active.get().isDueForRotation(clock.instant())) {
      log.info("Signed pre-key {} of account {} is past its rotation deadline", active.get().keyId(), accountId);
      rotateLocked(accountId, identity);
    } else if (!keyMaterialFactory.verify(active.get().publicKey(), active.get().signature(), identity.publicKey())) {
      log.warn("Signed pre-key {} of account {} does not verify under the current identity; replacing",
          active.get().keyId(), accountId);
      rotateLocked(accountId, identity);
    } else {
      cacheSignedPreKey(accountId, active.get());
    }
  }

  private int rotateLocked(String accountId, IdentityKeyPair identity) {
    PreKeyPair keyPair = keyMaterialFactory.generatePreKeyPair();
    byte[] signature = keyMaterialFactory.sign(keyPair.publicKey().bytes(), identity.privateKey());
    int keyId = store.reserveSignedPreKeyId(accountId);
    Instant now = clock.instant();
    Duration interval = config.rotationSchedule().interval();
    SignedPreKeyRecord record = new SignedPreKeyRecord(
        keyId,
        keyPair.publicKey().bytes().clone(),
        encryptionUnit.encrypt(keyPair.privateKey().bytes()),
        signature,
        now,
        interval,
        now.plus(interval),
        true,
        null);
    store.storeSignedPreKey(accountId, record);
    signedPreKeysRotated.incrementAndGet();
    // Superseded pairs are not zeroized here; a concurrent handshake may still hold them.
    signedPreKeys.put(accountId, new CachedSignedPreKey(keyId, keyPair, record.nextRotationAt(), now));
    log.info("Installed signed pre-key {} for account {}, next rotation at {}", keyId, accountId,
        record.nextRotationAt());
    return keyId;
  }

  private CachedSignedPreKey cacheSignedPreKey(String accountId, SignedPreKeyRecord record) {
    CachedSignedPreKey cached = new CachedSignedPreKey(
        record.keyId(),
        decryptPreKeyPair(record.publicKey(), record.encryptedPrivateKey()),
        record.nextRotationAt(),
        clock.instant());
    signedPreKeys.put(accountId, cached);
    return cached;
  }

  private int replenishLocked(String accountId) {
    int current = store.countUnusedPreKeys(accountId);
    if (current >= config.lowWaterMark()) {
      log.debug("Pre-key pool of account {} is healthy ({} unused)", accountId, current);
      return 0;
    }
    int shortfall = config.targetPoolSize() - current;
    List<PreKeyPair> batch = keyMaterialFactory.generateBatch(shortfall);
    int firstId = store.reservePreKeyIds(accountId, shortfall);
    Instant now = clock.instant();
    List<OneTimePreKeyRecord> records = new ArrayList<>(shortfall);
    for (int i = 0; i < shortfall; i++) {
      PreKeyPair keyPair = batch.get(i);
      records.add(new OneTimePreKeyRecord(
          firstId + i,
          keyPair.publicKey().bytes(),
          encryptionUnit.encrypt(keyPair.privateKey().bytes()),
          false,
          now));
      keyPair.destroy();
    }
    store.storePreKeyBatch(accountId, records);
    preKeysGenerated.addAndGet(shortfall);
    log.info("Replenished {} one-time pre-keys for account {} ({} -> {})",
        shortfall, accountId, current, current + shortfall);
    return shortfall;
  }

  private PreKeyPair decryptPreKeyPair(byte[] publicKey, byte[] encryptedPrivateKey) {
    byte[] privateKey = decryptMatching(publicKey, encryptedPrivateKey);
    return new PreKeyPair(new PreKeyPublicKey(publicKey.clone()), new PreKeyPrivateKey(privateKey));
  }

  /**
   * Opens a sealed private key and checks it belongs to the stored public key.
   */
  private byte[] decryptMatching(byte[] publicKey, byte[] encryptedPrivateKey) {
    byte[] privateKey = encryptionUnit.decrypt(encryptedPrivateKey);
    if (!Arrays.equals(publicKey, keyMaterialFactory.derivePublicKey(privateKey))) {
      ByteUtils.zeroize(privateKey);
      throw new KeyAuthenticationException("Stored private key does not match its public key");
    }
    return privateKey;
  }

  private static IdentityKeyPair copyOf(IdentityKeyPair keyPair) {
    return new IdentityKeyPair(
        new IdentityPublicKey(keyPair.publicKey().bytes().clone()),
        new IdentityPrivateKey(keyPair.privateKey().bytes().clone()));
  }

  private static PreKeyPair copyOf(PreKeyPair keyPair) {
    return new PreKeyPair(
        new PreKeyPublicKey(keyPair.publicKey().bytes().clone()),
        new PreKeyPrivateKey(keyPair.privateKey().bytes().clone()));
  }

  private ReentrantLock lockFor(String accountId) {
    return accountLocks.computeIfAbsent(accountId, id -> new ReentrantLock());
  }

  private static void requireAccountId(String accountId) {
    if (accountId == null || accountId.isBlank()) {
      throw new IllegalArgumentException("accountId must not be blank");
    }
  }

  private record CachedIdentity(IdentityKeyPair keyPair, int registrationId) {
  }

  private record CachedSignedPreKey(int keyId, PreKeyPair keyPair, Instant nextRotationAt, Instant verifiedAt) {

    boolean isFresh(Instant now, Duration ttl) {
      return now.isBefore(verifiedAt.plus(ttl)) && now.isBefore(nextRotationAt);
    }

    CachedSignedPreKey verifiedAt(Instant now) {
      return new CachedSignedPreKey(keyId, keyPair, nextRotationAt, now);
    }
  }
}
