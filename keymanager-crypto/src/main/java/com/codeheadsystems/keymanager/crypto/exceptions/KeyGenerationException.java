package com.codeheadsystems.keymanager.crypto.exceptions;

/**
 * Key material could not be produced, typically because the secure random source failed.
 * <p>
 * Fatal: retrying without a working entropy source cannot succeed.
 */
public class KeyGenerationException extends RuntimeException {

  /**
   * Instantiates a new Key generation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyGenerationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
