package com.codeheadsystems.keymaster.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * An authorized HMAC key: the raw secret plus the digest and tag length it was authorized for.
 * <p>
 * The key material is copied on the way in and on the way out, so callers may wipe their own arrays.
 *
 * @param keyMaterial the raw secret
 * @param digest      the digest the key is bound to
 * @param macLength   the tag length in bytes
 */
public record HmacKey(byte[] keyMaterial, KeymasterDigest digest, int macLength) {

  /**
   * Instantiates a new Hmac key.
   *
   * @param keyMaterial the key material
   * @param digest      the digest
   * @param macLength   the mac length
   */
  public HmacKey {
    Objects.requireNonNull(keyMaterial, "keyMaterial");
    keyMaterial = keyMaterial.clone();
  }

  @Override
  public byte[] keyMaterial() {
    return keyMaterial.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof HmacKey other
        && Arrays.equals(keyMaterial, other.keyMaterial)
        && digest == other.digest
        && macLength == other.macLength;
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(keyMaterial), digest, macLength);
  }

  // Never print the secret.
  @Override
  public String toString() {
    return "HmacKey[keyMaterial=<" + keyMaterial.length + " bytes>, digest=" + digest
        + ", macLength=" + macLength + "]";
  }
}
