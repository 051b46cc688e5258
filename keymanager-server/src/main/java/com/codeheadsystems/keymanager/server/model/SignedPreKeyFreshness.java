package com.codeheadsystems.keymanager.server.model;

public enum SignedPreKeyFreshness {
  CURRENT,
  DUE_FOR_ROTATION
}
