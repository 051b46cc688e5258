package com.codeheadsystems.keymanager.server.store;

import com.codeheadsystems.keymanager.server.exceptions.KeyStorageException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable, per-account storage of encrypted key material.
 * <p>
 * Implementations must be thread-safe and the authoritative source of key ids and of the
 * used flag on one-time pre-keys. Private keys arrive here already sealed; the store never sees
 * plaintext key material.
 * <p>
 * Every method may throw {@link KeyStorageException} when the backing store fails.
 */
public interface AccountKeyStore {

  /**
   * Load the identity of an account.
   *
   * @param accountId the account
   * @return the identity, or empty if the account was never initialized
   */
  Optional<IdentityRecord> loadIdentityBundle(String accountId);

  /**
   * Create or replace the identity of an account.
   *
   * @param accountId the account
   * @param record    the identity
   */
  void upsertIdentityBundle(String accountId, IdentityRecord record);

  /**
   * List every account that has a stored identity, in ascending order. The rotation sweep walks
   * this list, so accounts initialized by another instance or before a restart are maintained too.
   *
   * @return account ids, possibly empty
   */
  List<String> listAccounts();

  /**
   * Load the account's active signed pre-key.
   *
   * @param accountId the account
   * @return the active key, or empty if none
   */
  Optional<SignedPreKeyRecord> loadActiveSignedPreKey(String accountId);

  /**
   * Load a signed pre-key by id, active or superseded.
   *
   * @param accountId the account
   * @param keyId     the key id
   * @return the key, or empty if unknown or already pruned
   */
  Optional<SignedPreKeyRecord> loadSignedPreKey(String accountId, int keyId);

  /**
   * Store a new active signed pre-key. The previously active key, if any, is marked inactive
   * with the current time as its deactivation time, atomically with the insert.
   *
   * @param accountId the account
   * @param record    the new active key
   */
  void storeSignedPreKey(String accountId, SignedPreKeyRecord record);

  /**
   * Delete inactive signed pre-keys deactivated before the cutoff.
   *
   * @param accountId the account
   * @param cutoff    deactivation time before which keys are deleted
   * @return number of keys deleted
   */
  int pruneInactiveSignedPreKeys(String accountId, Instant cutoff);

  /**
   * Count the unused one-time pre-keys of an account.
   *
   * @param accountId the account
   * @return unused count
   */
  int countUnusedPreKeys(String accountId);

  /**
   * Store a batch of one-time pre-keys. Ids must come from {@link #reservePreKeyIds}.
   *
   * @param accountId the account
   * @param records   the keys
   */
  void storePreKeyBatch(String accountId, List<OneTimePreKeyRecord> records);

  /**
   * Load unused one-time pre-keys in ascending id order.
   *
   * @param accountId the account
   * @param limit     maximum number of keys returned
   * @return unused keys, possibly empty
   */
  List<OneTimePreKeyRecord> loadUnusedPreKeys(String accountId, int limit);

  /**
   * Load a one-time pre-key by id, used or not.
   *
   * @param accountId the account
   * @param keyId     the key id
   * @return the key, or empty if unknown
   */
  Optional<OneTimePreKeyRecord> loadPreKey(String accountId, int keyId);

  /**
   * Conditionally flip a one-time pre-key from unused to used.
   * <p>
   * Of any number of concurrent calls for the same key, exactly one returns true.
   *
   * @param accountId the account
   * @param keyId     the key id
   * @return true if this call performed the transition, false if the key was unknown or already used
   */
  boolean markPreKeyUsed(String accountId, int keyId);

  /**
   * Reserve a contiguous range of one-time pre-key ids. Reserved ids are never handed out again.
   *
   * @param accountId the account
   * @param count     how many ids
   * @return the first id of the range
   */
  int reservePreKeyIds(String accountId, int count);

  /**
   * Reserve the next signed pre-key id.
   *
   * @param accountId the account
   * @return the id
   */
  int reserveSignedPreKeyId(String accountId);
}
