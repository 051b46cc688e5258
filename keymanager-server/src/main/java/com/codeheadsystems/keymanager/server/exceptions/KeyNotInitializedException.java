package com.codeheadsystems.keymanager.server.exceptions;

/**
 * The account has no identity key or no active signed pre-key yet.
 * <p>
 * Recoverable: the caller must run {@code KeyManager.initialize} first. Accessors never
 * bootstrap on their own.
 */
public class KeyNotInitializedException extends RuntimeException {

  /**
   * Instantiates a new Key not initialized exception.
   *
   * @param message the message
   */
  public KeyNotInitializedException(final String message) {
    super(message);
  }
}
