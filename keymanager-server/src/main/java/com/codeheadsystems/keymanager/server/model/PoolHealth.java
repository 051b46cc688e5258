package com.codeheadsystems.keymanager.server.model;

/**
 * Whether the one-time pre-key pool is at or above its low-water mark.
 */
public enum PoolHealth {
  HEALTHY,
  LOW
}
