package com.codeheadsystems.keymanager.server.store;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AccountKeyStore}.
 * <p>
 * Each account's data is guarded by its own monitor, so the signed pre-key swap and the
 * used-flag transition are atomic. All keys are lost on restart. Suitable for development and
 * integration testing only.
 */
public class InMemoryAccountKeyStore implements AccountKeyStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAccountKeyStore.class);

  private final ConcurrentHashMap<String, AccountData> accounts = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryAccountKeyStore() {
    this(Clock.systemUTC());
  }

  public InMemoryAccountKeyStore(final Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryAccountKeyStore: key material will NOT survive restarts. "
        + "Replace with a persistent AccountKeyStore for production.");
  }

  @Override
  public Optional<IdentityRecord> loadIdentityBundle(String accountId) {
    AccountData data = accounts.get(accountId);
    if (data == null) {
      return Optional.empty();
    }
    synchronized (data) {
      return Optional.ofNullable(data.identity);
    }
  }

  @Override
  public void upsertIdentityBundle(String accountId, IdentityRecord record) {
    AccountData data = account(accountId);
    synchronized (data) {
      data.identity = record;
    }
    log.debug("Stored identity for account {}", accountId);
  }

  @Override
  public List<String> listAccounts() {
    List<String> result = new ArrayList<>();
    accounts.forEach((accountId, data) -> {
      synchronized (data) {
        if (data.identity != null) {
          result.add(accountId);
        }
      }
    });
    Collections.sort(result);
    return result;
  }

  @Override
  public Optional<SignedPreKeyRecord> loadActiveSignedPreKey(String accountId) {
    AccountData data = accounts.get(accountId);
    if (data == null) {
      return Optional.empty();
    }
    synchronized (data) {
      return data.activeSignedPreKeyId == null
          ? Optional.empty()
          : Optional.ofNullable(data.signedPreKeys.get(data.activeSignedPreKeyId));
    }
  }

  @Override
  public Optional<SignedPreKeyRecord> loadSignedPreKey(String accountId, int keyId) {
    AccountData data = accounts.get(accountId);
    if (data == null) {
      return Optional.empty();
    }
    synchronized (data) {
      return Optional.ofNullable(data.signedPreKeys.get(keyId));
    }
  }

  @Override
  public void storeSignedPreKey(String accountId, SignedPreKeyRecord record) {
    if (!record.active()) {
      throw new IllegalArgumentException("Only an active signed pre-key can be stored");
    }
    AccountData data = account(accountId);
    synchronized (data) {
      if (data.activeSignedPreKeyId != null && data.activeSignedPreKeyId != record.keyId()) {
        SignedPreKeyRecord previous = data.signedPreKeys.get(data.activeSignedPreKeyId);
        if (previous != null) {
          data.signedPreKeys.put(previous.keyId(), previous.deactivate(clock.instant()));
        }
      }
      data.signedPreKeys.put(record.keyId(), record);
      data.activeSignedPreKeyId = record.keyId();
    }
    log.debug("Stored active signed pre-key {} for account {}", record.keyId(), accountId);
  }

  @Override
  public int pruneInactiveSignedPreKeys(String accountId, Instant cutoff) {
    AccountData data = accounts.get(accountId);
    if (data == null) {
      return 0;
    }
    int pruned = 0;
    synchronized (data) {
      Iterator<SignedPreKeyRecord> it = data.signedPreKeys.values().iterator();
      while (it.hasNext()) {
        SignedPreKeyRecord record = it.next();
        if (!record.active() && record.deactivatedAt() != null && record.deactivatedAt().isBefore(cutoff)) {
          it.remove();
          pruned++;
        }
      }
    }
    return pruned;
  }

  @Override
  public int countUnusedPreKeys(String accountId) {
    AccountData data = accounts.get(accountId);
    if (data == null) {
      return 0;
    }
    synchronized (data) {
      return (int) data.preKeys.values().stream().filter(r -> !r.used()).count();
    }
  }

  @Override
  public void storePreKeyBatch(String accountId, List<OneTimePreKeyRecord> records) {
    AccountData data = account(accountId);
    synchronized (data) {
      for (OneTimePreKeyRecord record : records) {
        if (data.preKeys.containsKey(record.keyId())) {
          throw new IllegalArgumentException("Pre-key id " + record.keyId() + " already exists");
        }
      }
      records.forEach(r -> data.preKeys.put(r.keyId(), r));
    }
    log.debug("Stored {} one-time pre-keys for account {}", records.size(), accountId);
  }

  @Override
  public List<OneTimePreKeyRecord> loadUnusedPreKeys(String accountId, int limit) {
    AccountData data = accounts.get(accountId);
    if (data == null || limit <= 0) {
      return List.of();
    }
    List<OneTimePreKeyRecord> result = new ArrayList<>();
    synchronized (data) {
      for (OneTimePreKeyRecord record : data.preKeys.values()) {
        if (result.size() >= limit) {
          break;
        }
        if (!record.used()) {
          result.add(record);
        }
      }
    }
    return result;
  }

  @Override
  public Optional<OneTimePreKeyRecord> loadPreKey(String accountId, int keyId) {
    AccountData data = accounts.get(accountId);
    if (data == null) {
      return Optional.empty();
    }
    synchronized (data) {
      return Optional.ofNullable(data.preKeys.get(keyId));
    }
  }

  @Override
  public boolean markPreKeyUsed(String accountId, int keyId) {
    AccountData data = accounts.get(accountId);
    if (data == null) {
      return false;
    }
    synchronized (data) {
      OneTimePreKeyRecord record = data.preKeys.get(keyId);
      if (record == null || record.used()) {
        return false;
      }
      data.preKeys.put(keyId, record.markUsed());
      return true;
    }
  }

  @Override
  public int reservePreKeyIds(String accountId, int count) {
    if (count < 1) {
      throw new IllegalArgumentException("count must be positive: " + count);
    }
    AccountData data = account(accountId);
    synchronized (data) {
      int first = data.nextPreKeyId;
      data.nextPreKeyId += count;
      return first;
    }
  }

  @Override
  public int reserveSignedPreKeyId(String accountId) {
    AccountData data = account(accountId);
    synchronized (data) {
      return data.nextSignedPreKeyId++;
    }
  }

  private AccountData account(String accountId) {
    return accounts.computeIfAbsent(accountId, id -> new AccountData());
  }

  private static final class AccountData {
    private IdentityRecord identity;
    private Integer activeSignedPreKeyId;
    private int nextPreKeyId = 1;
    private int nextSignedPreKeyId = 1;
    private final Map<Integer, SignedPreKeyRecord> signedPreKeys = new TreeMap<>();
    private final Map<Integer, OneTimePreKeyRecord> preKeys = new TreeMap<>();
  }
}
