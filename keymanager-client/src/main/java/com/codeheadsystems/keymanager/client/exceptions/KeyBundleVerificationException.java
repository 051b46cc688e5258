package com.codeheadsystems.keymanager.client.exceptions;

/**
 * A fetched key bundle is malformed or its signed pre-key does not verify. The bundle must not be
 * used.
 */
public class KeyBundleVerificationException extends RuntimeException {

  public KeyBundleVerificationException(final String message) {
    super(message);
  }

  public KeyBundleVerificationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
