package com.codeheadsystems.keymaster.common;

import com.codeheadsystems.keymaster.model.KeymasterError;

/**
 * Raised by keyed-hash engines and the dispatcher when a failure has to leave the current call.
 * Operations translate it back into the carried {@link KeymasterError}.
 */
public class KeymasterException extends RuntimeException {

  private final KeymasterError error;

  /**
   * Instantiates a new Keymaster exception.
   *
   * @param error   the error
   * @param message the message
   */
  public KeymasterException(final KeymasterError error, final String message) {
    super(message);
    this.error = error;
  }

  /**
   * Instantiates a new Keymaster exception.
   *
   * @param error   the error
   * @param message the message
   * @param cause   the cause
   */
  public KeymasterException(final KeymasterError error, final String message, final Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  /**
   * The error code to report to the caller.
   *
   * @return the keymaster error
   */
  public KeymasterError error() {
    return error;
  }
}
