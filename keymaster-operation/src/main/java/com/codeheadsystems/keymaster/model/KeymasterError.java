package com.codeheadsystems.keymaster.model;

/**
 * Result codes returned by keymaster operations. Values match the keymaster wire codes.
 */
public enum KeymasterError {

  /**
   * Success.
   */
  OK(0),
  /**
   * The purpose is not one the operation can serve.
   */
  UNSUPPORTED_PURPOSE(-2),
  /**
   * The requested tag length exceeds the digest's native output size.
   */
  UNSUPPORTED_MAC_LENGTH(-9),
  /**
   * The digest is not supported by the keyed-hash engine.
   */
  UNSUPPORTED_DIGEST(-12),
  /**
   * A supplied signature has the wrong length.
   */
  INVALID_INPUT_LENGTH(-21),
  /**
   * No operation is registered under the handle.
   */
  INVALID_OPERATION_HANDLE(-28),
  /**
   * The computed tag does not match the supplied signature.
   */
  VERIFICATION_FAILED(-30),
  /**
   * The operation table is full.
   */
  TOO_MANY_OPERATIONS(-31),
  /**
   * The underlying primitive failed.
   */
  UNKNOWN_ERROR(-1000);

  private final int code;

  KeymasterError(final int code) {
    this.code = code;
  }

  /**
   * Keymaster wire code.
   *
   * @return the int
   */
  public int code() {
    return code;
  }

  /**
   * Is ok boolean.
   *
   * @return the boolean
   */
  public boolean isOk() {
    return this == OK;
  }
}
