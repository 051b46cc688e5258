package com.codeheadsystems.keymanager.server.scheduler;

import com.codeheadsystems.keymanager.server.manager.KeyManager;
import com.codeheadsystems.keymanager.server.model.RotationCheckResult;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically runs {@link KeyManager#performKeyRotationCheck} for every managed account.
 * <p>
 * A failure on one account is logged and the sweep moves on; the account is retried on the next
 * tick. {@link #shutdown()} must be called on application shutdown to release the thread.
 */
public class KeyRotationScheduler {

  private static final Logger log = LoggerFactory.getLogger(KeyRotationScheduler.class);

  public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);

  private final KeyManager keyManager;
  private final Duration interval;
  private final AtomicBoolean started = new AtomicBoolean();
  private final ScheduledExecutorService executor =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "key-rotation-scheduler");
        t.setDaemon(true);
        return t;
      });

  public KeyRotationScheduler(final KeyManager keyManager) {
    this(keyManager, DEFAULT_INTERVAL);
  }

  public KeyRotationScheduler(final KeyManager keyManager, final Duration interval) {
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.keyManager = keyManager;
    this.interval = interval;
  }

  /**
   * Starts the periodic sweep. The first sweep runs one interval after start.
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Scheduler already started");
    }
    executor.scheduleWithFixedDelay(this::runOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    log.info("Key rotation scheduler started, interval {}", interval);
  }

  /**
   * Sweeps every stored or managed account once on the calling thread.
   *
   * @return what the sweep did
   */
  public SweepSummary runOnce() {
    int checked = 0;
    int rotated = 0;
    int replenished = 0;
    int failed = 0;
    for (String accountId : keyManager.accountsForMaintenance()) {
      checked++;
      try {
        RotationCheckResult result = keyManager.performKeyRotationCheck(accountId);
        if (result.signedPreKeyRotated()) {
          rotated++;
        }
        if (result.preKeysGenerated() > 0) {
          replenished++;
        }
      } catch (RuntimeException e) {
        failed++;
        log.error("Rotation check failed for account {}: {}", accountId, e.getMessage(), e);
      }
    }
    SweepSummary summary = new SweepSummary(checked, rotated, replenished, failed);
    log.debug("Rotation sweep finished: {}", summary);
    return summary;
  }

  /**
   * Shuts down the scheduler thread.
   */
  public void shutdown() {
    executor.shutdown();
    log.info("Key rotation scheduler stopped");
  }

  /**
   * Result of one sweep.
   *
   * @param accountsChecked     accounts visited
   * @param signedPreKeysRotated accounts whose signed pre-key was rotated
   * @param poolsReplenished    accounts whose pool was topped up
   * @param failures            accounts whose check threw
   */
  public record SweepSummary(int accountsChecked, int signedPreKeysRotated, int poolsReplenished, int failures) {
  }
}
