package com.codeheadsystems.keymaster.model;

/**
 * Digest selectors as carried in key authorizations. Only the SHA-2 family can back an HMAC key;
 * the rest are recognised on the wire but rejected by the keyed-hash engines.
 */
public enum KeymasterDigest {

  /**
   * None keymaster digest.
   */
  NONE(0),
  /**
   * Md 5 keymaster digest.
   */
  MD5(1),
  /**
   * Sha 1 keymaster digest.
   */
  SHA1(2),
  /**
   * Sha 2 224 keymaster digest.
   */
  SHA_2_224(3),
  /**
   * Sha 2 256 keymaster digest.
   */
  SHA_2_256(4),
  /**
   * Sha 2 384 keymaster digest.
   */
  SHA_2_384(5),
  /**
   * Sha 2 512 keymaster digest.
   */
  SHA_2_512(6);

  private final int value;

  KeymasterDigest(final int value) {
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
   * Returns the digest for the given wire value.
   *
   * @param value the value
   * @return the keymaster digest
   * @throws IllegalArgumentException for unknown values
   */
  public static KeymasterDigest fromValue(final int value) {
    for (KeymasterDigest digest : values()) {
      if (digest.value == value) {
        return digest;
      }
    }
    throw new IllegalArgumentException("Unknown keymaster digest: " + value);
  }
}
