package com.codeheadsystems.keymaster.operation;

import com.codeheadsystems.keymaster.common.KeymasterException;
import com.codeheadsystems.keymaster.engine.BouncyCastleHmacEngine;
import com.codeheadsystems.keymaster.engine.HmacEngine;
import com.codeheadsystems.keymaster.model.HmacKey;
import com.codeheadsystems.keymaster.model.KeymasterDigest;
import com.codeheadsystems.keymaster.model.KeymasterError;
import com.codeheadsystems.keymaster.model.KeymasterPurpose;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link HmacOperation}s for authorized HMAC keys.
 * <p>
 * Only the purpose is checked here. Digest and tag length problems are left to the operation, which
 * reports them from {@link Operation#begin()}.
 */
public class HmacOperationFactory {

  private static final Logger log = LoggerFactory.getLogger(HmacOperationFactory.class);

  private static final Set<KeymasterPurpose> SUPPORTED_PURPOSES =
      EnumSet.of(KeymasterPurpose.SIGN, KeymasterPurpose.VERIFY);

  private final HmacEngine engine;

  /**
   * Instantiates a new Hmac operation factory on the BouncyCastle engine.
   */
  public HmacOperationFactory() {
    this(new BouncyCastleHmacEngine());
  }

  /**
   * Instantiates a new Hmac operation factory.
   *
   * @param engine the engine
   */
  public HmacOperationFactory(final HmacEngine engine) {
    log.info("HmacOperationFactory({})", engine.getClass().getSimpleName());
    this.engine = engine;
  }

  /**
   * Purposes an HMAC operation can serve.
   *
   * @return the set
   */
  public Set<KeymasterPurpose> supportedPurposes() {
    return EnumSet.copyOf(SUPPORTED_PURPOSES);
  }

  /**
   * Digests the engine can back.
   *
   * @return the set
   */
  public Set<KeymasterDigest> supportedDigests() {
    return engine.supportedDigests();
  }

  /**
   * Creates an operation for the key. The caller owns the result and must close it.
   *
   * @param purpose the purpose
   * @param key     the key
   * @return the operation
   * @throws KeymasterException with {@link KeymasterError#UNSUPPORTED_PURPOSE} for purposes other than
   *                            sign and verify
   */
  public Operation createOperation(final KeymasterPurpose purpose, final HmacKey key) {
    if (!SUPPORTED_PURPOSES.contains(purpose)) {
      throw new KeymasterException(KeymasterError.UNSUPPORTED_PURPOSE, "HMAC keys cannot " + purpose);
    }
    log.trace("createOperation(purpose={}, digest={}, macLength={})", purpose, key.digest(), key.macLength());
    byte[] keyMaterial = key.keyMaterial();
    try {
      return new HmacOperation(purpose, keyMaterial, key.digest(), key.macLength(), engine);
    } finally {
      Arrays.fill(keyMaterial, (byte) 0);
    }
  }
}
