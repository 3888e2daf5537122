package com.codeheadsystems.keymaster.model;

/**
 * What an operation is started for. HMAC operations only serve {@link #SIGN} and {@link #VERIFY}.
 */
public enum KeymasterPurpose {

  /**
   * Encrypt keymaster purpose.
   */
  ENCRYPT(0),
  /**
   * Decrypt keymaster purpose.
   */
  DECRYPT(1),
  /**
   * Sign keymaster purpose.
   */
  SIGN(2),
  /**
   * Verify keymaster purpose.
   */
  VERIFY(3);

  private final int value;

  KeymasterPurpose(final int value) {
    this.value = value;
  }

  /**
   * Keymaster wire value.
   *
   * @return the int
   */
  public int value() {
    return value;
  }

  /**
   * Returns the purpose for the given wire value.
   *
   * @param value the value
   * @return the keymaster purpose
   * @throws IllegalArgumentException for unknown values
   */
  public static KeymasterPurpose fromValue(final int value) {
    for (KeymasterPurpose purpose : values()) {
      if (purpose.value == value) {
        return purpose;
      }
    }
    throw new IllegalArgumentException("Unknown keymaster purpose: " + value);
  }
}
