package com.codeheadsystems.keymaster.operation;

import com.codeheadsystems.keymaster.common.KeymasterBuffer;
import com.codeheadsystems.keymaster.model.KeymasterError;
import com.codeheadsystems.keymaster.model.KeymasterPurpose;
import com.codeheadsystems.keymaster.model.UpdateResult;
import java.util.Objects;

/**
 * Lifecycle shared by every keymaster operation.
 * <p>
 * The dispatcher calls {@link #begin()} once, {@link #update} zero or more times, then exactly one of
 * {@link #finish} or {@link #abort()}, and finally {@link #close()}. Implementations are driven by one
 * caller at a time and do no locking of their own.
 */
public abstract class Operation implements AutoCloseable {

  private final KeymasterPurpose purpose;

  /**
   * Instantiates a new Operation.
   *
   * @param purpose the purpose
   */
  protected Operation(final KeymasterPurpose purpose) {
    this.purpose = Objects.requireNonNull(purpose, "purpose");
  }

  /**
   * Purpose keymaster purpose.
   *
   * @return the keymaster purpose
   */
  public KeymasterPurpose purpose() {
    return purpose;
  }

  /**
   * Reports whether the operation can run. Errors found while constructing the operation surface here.
   *
   * @return the keymaster error
   */
  public abstract KeymasterError begin();

  /**
   * Feeds input into the operation.
   *
   * @param input  the readable input, its read cursor is left for the caller to advance
   * @param output receives any output produced along the way
   * @return the update result
   */
  public abstract UpdateResult update(KeymasterBuffer input, KeymasterBuffer output);

  /**
   * Completes the operation. Terminal.
   *
   * @param signature the signature to check, when verifying
   * @param output    receives the final output
   * @return the keymaster error
   */
  public abstract KeymasterError finish(KeymasterBuffer signature, KeymasterBuffer output);

  /**
   * Abandons the operation. Terminal.
   *
   * @return the keymaster error
   */
  public abstract KeymasterError abort();

  /**
   * Releases everything the operation holds, whatever state it is in.
   */
  @Override
  public abstract void close();
}
