package com.codeheadsystems.keymanager.server.config;

import java.time.Duration;

/**
 * How often the active signed pre-key is replaced.
 */
public enum RotationSchedule {
  WEEKLY(Duration.ofDays(7)),
  MONTHLY(Duration.ofDays(30));

  private final Duration interval;

  RotationSchedule(Duration interval) {
    this.interval = interval;
  }

  /**
   * Lifetime of a signed pre-key under this schedule.
   *
   * @return the interval
   */
  public Duration interval() {
    return interval;
  }
}
