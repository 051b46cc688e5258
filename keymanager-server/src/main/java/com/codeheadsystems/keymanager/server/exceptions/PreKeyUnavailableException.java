package com.codeheadsystems.keymanager.server.exceptions;

/**
 * The requested pre-key is unknown, already used, or past its grace period.
 * <p>
 * Recoverable: the initiator should request another pre-key or fall back to a handshake
 * without a one-time pre-key.
 */
public class PreKeyUnavailableException extends RuntimeException {

  /**
   * Instantiates a new Pre key unavailable exception.
   *
   * @param message the message
   */
  public PreKeyUnavailableException(final String message) {
    super(message);
  }
}
