package com.codeheadsystems.keymaster.engine;

import com.codeheadsystems.keymaster.common.KeymasterException;
import com.codeheadsystems.keymaster.model.KeymasterDigest;
import com.codeheadsystems.keymaster.model.KeymasterError;
import java.util.EnumSet;
import java.util.Set;

/**
 * Keyed-hash primitive used by HMAC operations.
 * <p>
 * Supported digests are the SHA-2 family:
 * <ul>
 *   <li>SHA_2_224 — 28 byte output</li>
 *   <li>SHA_2_256 — 32 byte output</li>
 *   <li>SHA_2_384 — 48 byte output</li>
 *   <li>SHA_2_512 — 64 byte output</li>
 * </ul>
 * Implementations report primitive failures as {@link KeymasterException} carrying
 * {@link KeymasterError#UNKNOWN_ERROR}.
 */
public interface HmacEngine {

  /**
   * Largest native output size of any supported digest, in bytes.
   */
  int MAX_DIGEST_SIZE = 64;

  /**
   * Whether the digest can back an HMAC computation.
   *
   * @param digest the digest, may be null
   * @return the boolean
   */
  default boolean supports(KeymasterDigest digest) {
    if (digest == null) {
      return false;
    }
    return switch (digest) {
      case SHA_2_224, SHA_2_256, SHA_2_384, SHA_2_512 -> true;
      default -> false;
    };
  }

  /**
   * The digests this engine supports.
   *
   * @return the set
   */
  default Set<KeymasterDigest> supportedDigests() {
    EnumSet<KeymasterDigest> supported = EnumSet.noneOf(KeymasterDigest.class);
    for (KeymasterDigest digest : KeymasterDigest.values()) {
      if (supports(digest)) {
        supported.add(digest);
      }
    }
    return supported;
  }

  /**
   * Native (untruncated) output size of the digest in bytes.
   *
   * @param digest the digest
   * @return the int
   * @throws KeymasterException with {@link KeymasterError#UNSUPPORTED_DIGEST} for unsupported digests
   */
  default int outputSize(KeymasterDigest digest) {
    if (!supports(digest)) {
      throw new KeymasterException(KeymasterError.UNSUPPORTED_DIGEST, "Unsupported HMAC digest: " + digest);
    }
    return switch (digest) {
      case SHA_2_224 -> 28;
      case SHA_2_256 -> 32;
      case SHA_2_384 -> 48;
      case SHA_2_512 -> 64;
      default -> throw new KeymasterException(KeymasterError.UNSUPPORTED_DIGEST, "No output size for " + digest);
    };
  }

  /**
   * Starts a keyed-hash computation. Implementations must not retain the caller's key array.
   *
   * @param digest the digest, must be supported
   * @param key    the raw key
   * @return an exclusively owned context
   */
  HmacContext init(KeymasterDigest digest, byte[] key);
}
