package com.codeheadsystems.keymanager.client.exceptions;

/**
 * The type Key bundle accessor exception.
 */
public class KeyBundleAccessorException extends RuntimeException {
  /**
   * Instantiates a new Key bundle accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyBundleAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
