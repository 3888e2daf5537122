package com.codeheadsystems.keymaster.model;

/**
 * Outcome of an update call.
 *
 * @param error         the result code
 * @param inputConsumed how many bytes of the input were consumed
 */
public record UpdateResult(KeymasterError error, int inputConsumed) {

  /**
   * A failed update that consumed nothing.
   *
   * @param error the error
   * @return the update result
   */
  public static UpdateResult failure(KeymasterError error) {
    return new UpdateResult(error, 0);
  }
}
