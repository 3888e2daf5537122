package com.codeheadsystems.keymaster.engine;

import com.codeheadsystems.keymaster.common.KeymasterException;
import com.codeheadsystems.keymaster.model.KeymasterDigest;
import com.codeheadsystems.keymaster.model.KeymasterError;
import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import javax.crypto.Mac;
import javax.crypto.SecretKey;

/**
 * {@link HmacEngine} over the installed JCA providers ({@code javax.crypto.Mac}).
 */
public class JcaHmacEngine implements HmacEngine {

  @Override
  public HmacContext init(final KeymasterDigest digest, final byte[] key) {
    String algorithm = macAlgorithm(digest);
    RawHmacKey secretKey = new RawHmacKey(algorithm, key);
    try {
      Mac mac = Mac.getInstance(algorithm);
      mac.init(secretKey);
      return new JcaHmacContext(mac);
    } catch (GeneralSecurityException e) {
      throw new KeymasterException(KeymasterError.UNKNOWN_ERROR, algorithm + " not available", e);
    } finally {
      secretKey.destroy();
    }
  }

  @Override
  public int outputSize(final KeymasterDigest digest) {
    String algorithm = macAlgorithm(digest);
    try {
      return Mac.getInstance(algorithm).getMacLength();
    } catch (NoSuchAlgorithmException e) {
      throw new KeymasterException(KeymasterError.UNKNOWN_ERROR, algorithm + " not available", e);
    }
  }

  /**
   * JCA algorithm name for the digest, e.g. {@code HmacSHA256}.
   *
   * @param digest the digest
   * @return the string
   */
  String macAlgorithm(final KeymasterDigest digest) {
    if (!supports(digest)) {
      throw new KeymasterException(KeymasterError.UNSUPPORTED_DIGEST, "Unsupported HMAC digest: " + digest);
    }
    return switch (digest) {
      case SHA_2_224 -> "HmacSHA224";
      case SHA_2_256 -> "HmacSHA256";
      case SHA_2_384 -> "HmacSHA384";
      case SHA_2_512 -> "HmacSHA512";
      default -> throw new KeymasterException(KeymasterError.UNSUPPORTED_DIGEST, "Unsupported HMAC digest: " + digest);
    };
  }

  /**
   * Raw key bytes for {@link Mac#init}. Unlike {@code SecretKeySpec} this accepts an empty key. The
   * provider copies the encoding during init, so the bytes are zeroed right after.
   */
  private static final class RawHmacKey implements SecretKey {

    private static final long serialVersionUID = 1L;

    private final String algorithm;
    private final byte[] key;
    private boolean destroyed;

    private RawHmacKey(final String algorithm, final byte[] key) {
      this.algorithm = algorithm;
      this.key = key.clone();
    }

    @Override
    public String getAlgorithm() {
      return algorithm;
    }

    @Override
    public String getFormat() {
      return "RAW";
    }

    @Override
    public byte[] getEncoded() {
      if (destroyed) {
        throw new IllegalStateException("Key already destroyed");
      }
      return key.clone();
    }

    @Override
    public void destroy() {
      Arrays.fill(key, (byte) 0);
      destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
      return destroyed;
    }
  }

  private static final class JcaHmacContext implements HmacContext {

    private Mac mac;

    private JcaHmacContext(final Mac mac) {
      this.mac = mac;
    }

    @Override
    public void update(final byte[] input, final int offset, final int length) {
      try {
        live().update(input, offset, length);
      } catch (RuntimeException e) {
        throw new KeymasterException(KeymasterError.UNKNOWN_ERROR, "HMAC update failed", e);
      }
    }

    @Override
    public byte[] doFinal() {
      try {
        return live().doFinal();
      } catch (RuntimeException e) {
        throw new KeymasterException(KeymasterError.UNKNOWN_ERROR, "HMAC finalize failed", e);
      }
    }

    @Override
    public void close() {
      if (mac != null) {
        mac.reset();
        mac = null;
      }
    }

    private Mac live() {
      if (mac == null) {
        throw new IllegalStateException("HMAC context already released");
      }
      return mac;
    }
  }
}
