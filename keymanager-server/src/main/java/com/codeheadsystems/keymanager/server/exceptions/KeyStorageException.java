package com.codeheadsystems.keymanager.server.exceptions;

/**
 * A key store operation failed or timed out.
 * <p>
 * Recoverable: callers may retry with backoff.
 */
public class KeyStorageException extends RuntimeException {

  /**
   * Instantiates a new Key storage exception.
   *
   * @param message the message
   */
  public KeyStorageException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Key storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyStorageException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
