package com.codeheadsystems.keymaster.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of finishing an operation through the dispatcher.
 *
 * @param error  the result code
 * @param output bytes produced by the finish call (the tag when signing), never null
 */
public record FinishResult(KeymasterError error, byte[] output) {

  private static final byte[] EMPTY = new byte[0];

  /**
   * A failed finish with no output.
   *
   * @param error the error
   * @return the finish result
   */
  public static FinishResult failure(KeymasterError error) {
    return new FinishResult(error, EMPTY);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FinishResult other
        && error == other.error
        && Arrays.equals(output, other.output);
  }

  @Override
  public int hashCode() {
    return Objects.hash(error, Arrays.hashCode(output));
  }

  @Override
  public String toString() {
    return "FinishResult[error=" + error + ", output=<" + output.length + " bytes>]";
  }
}
