package com.codeheadsystems.keymanager.server.store;

import com.codeheadsystems.keymanager.server.exceptions.KeyStorageException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AccountKeyStore} decorator that bounds every call with a timeout.
 * <p>
 * A call that does not finish in time is cancelled and surfaces as {@link KeyStorageException}.
 * A timed-out {@link #markPreKeyUsed} may still have been applied by the backing store; that key
 * is then lost to the pool, never handed out twice.
 */
public class TimeBoundedAccountKeyStore implements AccountKeyStore, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TimeBoundedAccountKeyStore.class);

  private final AccountKeyStore delegate;
  private final Duration timeout;
  private final ExecutorService executor;

  public TimeBoundedAccountKeyStore(final AccountKeyStore delegate, final Duration timeout) {
    this.delegate = delegate;
    this.timeout = timeout;
    AtomicInteger threadCount = new AtomicInteger();
    this.executor = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "key-store-io-" + threadCount.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public Optional<IdentityRecord> loadIdentityBundle(String accountId) {
    return call("loadIdentityBundle", () -> delegate.loadIdentityBundle(accountId));
  }

  @Override
  public void upsertIdentityBundle(String accountId, IdentityRecord record) {
    run("upsertIdentityBundle", () -> delegate.upsertIdentityBundle(accountId, record));
  }

  @Override
  public List<String> listAccounts() {
    return call("listAccounts", delegate::listAccounts);
  }

  @Override
  public Optional<SignedPreKeyRecord> loadActiveSignedPreKey(String accountId) {
    return call("loadActiveSignedPreKey", () -> delegate.loadActiveSignedPreKey(accountId));
  }

  @Override
  public Optional<SignedPreKeyRecord> loadSignedPreKey(String accountId, int keyId) {
    return call("loadSignedPreKey", () -> delegate.loadSignedPreKey(accountId, keyId));
  }

  @Override
  public void storeSignedPreKey(String accountId, SignedPreKeyRecord record) {
    run("storeSignedPreKey", () -> delegate.storeSignedPreKey(accountId, record));
  }

  @Override
  public int pruneInactiveSignedPreKeys(String accountId, Instant cutoff) {
    return call("pruneInactiveSignedPreKeys", () -> delegate.pruneInactiveSignedPreKeys(accountId, cutoff));
  }

  @Override
  public int countUnusedPreKeys(String accountId) {
    return call("countUnusedPreKeys", () -> delegate.countUnusedPreKeys(accountId));
  }

  @Override
  public void storePreKeyBatch(String accountId, List<OneTimePreKeyRecord> records) {
    run("storePreKeyBatch", () -> delegate.storePreKeyBatch(accountId, records));
  }

  @Override
  public List<OneTimePreKeyRecord> loadUnusedPreKeys(String accountId, int limit) {
    return call("loadUnusedPreKeys", () -> delegate.loadUnusedPreKeys(accountId, limit));
  }

  @Override
  public Optional<OneTimePreKeyRecord> loadPreKey(String accountId, int keyId) {
    return call("loadPreKey", () -> delegate.loadPreKey(accountId, keyId));
  }

  @Override
  public boolean markPreKeyUsed(String accountId, int keyId) {
    return call("markPreKeyUsed", () -> delegate.markPreKeyUsed(accountId, keyId));
  }

  @Override
  public int reservePreKeyIds(String accountId, int count) {
    return call("reservePreKeyIds", () -> delegate.reservePreKeyIds(accountId, count));
  }

  @Override
  public int reserveSignedPreKeyId(String accountId) {
    return call("reserveSignedPreKeyId", () -> delegate.reserveSignedPreKeyId(accountId));
  }

  /**
   * Stops the worker threads. Calls in flight are interrupted.
   */
  @Override
  public void close() {
    executor.shutdownNow();
  }

  private void run(String operation, Runnable runnable) {
    call(operation, () -> {
      runnable.run();
      return null;
    });
  }

  private <T> T call(String operation, Callable<T> callable) {
    Future<T> future = executor.submit(callable);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Key store operation {} timed out after {}", operation, timeout);
      throw new KeyStorageException("Key store operation " + operation + " timed out after " + timeout, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new KeyStorageException("Interrupted during key store operation " + operation, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new KeyStorageException("Key store operation " + operation + " failed", cause);
    }
  }
}
