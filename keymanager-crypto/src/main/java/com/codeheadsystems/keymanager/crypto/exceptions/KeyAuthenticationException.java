package com.codeheadsystems.keymanager.crypto.exceptions;

/**
 * An encrypted key blob failed authentication on decrypt.
 * <p>
 * Indicates tampering or corruption of the stored record. Fatal for that record: the bytes must
 * never be used as key material.
 */
public class KeyAuthenticationException extends RuntimeException {

  /**
   * Instantiates a new Key authentication exception.
   *
   * @param message the message
   */
  public KeyAuthenticationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Key authentication exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyAuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
