package com.codeheadsystems.keymaster.engine;

import com.codeheadsystems.keymaster.common.KeymasterException;
import com.codeheadsystems.keymaster.model.KeymasterDigest;
import com.codeheadsystems.keymaster.model.KeymasterError;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA224Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA384Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Default {@link HmacEngine}, backed by the BouncyCastle lightweight {@link HMac}.
 */
public class BouncyCastleHmacEngine implements HmacEngine {

  @Override
  public HmacContext init(final KeymasterDigest digest, final byte[] key) {
    if (!supports(digest)) {
      throw new KeymasterException(KeymasterError.UNSUPPORTED_DIGEST, "Unsupported HMAC digest: " + digest);
    }
    try {
      HMac hmac = new HMac(newDigest(digest));
      hmac.init(new KeyParameter(key));
      return new BouncyCastleHmacContext(hmac);
    } catch (RuntimeException e) {
      throw new KeymasterException(KeymasterError.UNKNOWN_ERROR, "HMAC init failed for " + digest, e);
    }
  }

  @Override
  public int outputSize(final KeymasterDigest digest) {
    if (!supports(digest)) {
      throw new KeymasterException(KeymasterError.UNSUPPORTED_DIGEST, "Unsupported HMAC digest: " + digest);
    }
    return newDigest(digest).getDigestSize();
  }

  private static Digest newDigest(final KeymasterDigest digest) {
    return switch (digest) {
      case SHA_2_224 -> new SHA224Digest();
      case SHA_2_256 -> new SHA256Digest();
      case SHA_2_384 -> new SHA384Digest();
      case SHA_2_512 -> new SHA512Digest();
      default -> throw new KeymasterException(KeymasterError.UNSUPPORTED_DIGEST, "Unsupported HMAC digest: " + digest);
    };
  }

  private static final class BouncyCastleHmacContext implements HmacContext {

    private HMac hmac;

    private BouncyCastleHmacContext(final HMac hmac) {
      this.hmac = hmac;
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
        HMac live = live();
        byte[] out = new byte[live.getMacSize()];
        live.doFinal(out, 0);
        return out;
      } catch (RuntimeException e) {
        throw new KeymasterException(KeymasterError.UNKNOWN_ERROR, "HMAC finalize failed", e);
      }
    }

    @Override
    public void close() {
      if (hmac != null) {
        hmac.reset();
        hmac = null;
      }
    }

    private HMac live() {
      if (hmac == null) {
        throw new IllegalStateException("HMAC context already released");
      }
      return hmac;
    }
  }
}
