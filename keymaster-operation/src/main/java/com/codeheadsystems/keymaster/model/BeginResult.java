package com.codeheadsystems.keymaster.model;

/**
 * Outcome of starting an operation through the dispatcher.
 *
 * @param error  the result code
 * @param handle the operation handle, zero unless {@code error} is {@link KeymasterError#OK}
 */
public record BeginResult(KeymasterError error, long handle) {

  /**
   * A failed begin with no handle.
   *
   * @param error the error
   * @return the begin result
   */
  public static BeginResult failure(KeymasterError error) {
    return new BeginResult(error, 0L);
  }
}
