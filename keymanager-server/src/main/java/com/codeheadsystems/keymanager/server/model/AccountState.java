package com.codeheadsystems.keymanager.server.model;

/**
 * Lifecycle of an account's key material.
 */
public enum AccountState {
  UNINITIALIZED,
  BOOTSTRAPPING,
  READY
}
