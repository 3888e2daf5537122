package com.codeheadsystems.keymaster.operation;

import com.codeheadsystems.keymaster.common.KeymasterBuffer;
import com.codeheadsystems.keymaster.common.KeymasterException;
import com.codeheadsystems.keymaster.engine.HmacContext;
import com.codeheadsystems.keymaster.engine.HmacEngine;
import com.codeheadsystems.keymaster.model.KeymasterDigest;
import com.codeheadsystems.keymaster.model.KeymasterError;
import com.codeheadsystems.keymaster.model.KeymasterPurpose;
import com.codeheadsystems.keymaster.model.UpdateResult;
import java.util.Arrays;
import java.util.Objects;

/**
 * Streaming HMAC sign or verify over a single key and digest.
 * <p>
 * Invalid digests and tag lengths do not fail construction. They are recorded and returned by
 * {@link #begin()}, and the instance stays safe to {@link #close()}. Signing emits the first
 * {@code tagLength} bytes of the HMAC; verifying compares that prefix against the supplied signature
 * in constant time.
 * <p>
 * Each instance serves exactly one pass. After {@link #finish} or {@link #abort()} the keyed context is
 * gone and further updates or finishes fail.
 */
public class HmacOperation extends Operation {

  private final int tagLength;
  private final KeymasterError error;
  private HmacContext context;

  /**
   * Instantiates a new Hmac operation.
   *
   * @param purpose   the purpose
   * @param key       the raw key, only read during construction
   * @param digest    the digest
   * @param tagLength the tag length in bytes
   * @param engine    the keyed-hash engine
   */
  public HmacOperation(final KeymasterPurpose purpose,
                       final byte[] key,
                       final KeymasterDigest digest,
                       final int tagLength,
                       final HmacEngine engine) {
    super(purpose);
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(engine, "engine");
    this.tagLength = tagLength;
    this.error = initialize(key, digest, engine);
  }

  private KeymasterError initialize(final byte[] key, final KeymasterDigest digest, final HmacEngine engine) {
    if (!engine.supports(digest)) {
      return KeymasterError.UNSUPPORTED_DIGEST;
    }
    if (tagLength < 0 || tagLength > engine.outputSize(digest)) {
      return KeymasterError.UNSUPPORTED_MAC_LENGTH;
    }
    try {
      context = engine.init(digest, key);
    } catch (KeymasterException e) {
      return e.error();
    }
    return KeymasterError.OK;
  }

  /**
   * Tag length in bytes.
   *
   * @return the int
   */
  public int tagLength() {
    return tagLength;
  }

  @Override
  public KeymasterError begin() {
    return error;
  }

  @Override
  public UpdateResult update(final KeymasterBuffer input, final KeymasterBuffer output) {
    if (context == null) {
      return UpdateResult.failure(unusable());
    }
    int available = input.availableRead();
    try {
      context.update(input.array(), input.readPosition(), available);
    } catch (KeymasterException e) {
      return UpdateResult.failure(KeymasterError.UNKNOWN_ERROR);
    }
    return new UpdateResult(KeymasterError.OK, available);
  }

  @Override
  public KeymasterError finish(final KeymasterBuffer signature, final KeymasterBuffer output) {
    if (context == null) {
      return unusable();
    }
    byte[] digest;
    try {
      digest = context.doFinal();
    } catch (KeymasterException e) {
      return KeymasterError.UNKNOWN_ERROR;
    } finally {
      release();
    }
    try {
      return switch (purpose()) {
        case SIGN -> sign(digest, output);
        case VERIFY -> verify(digest, signature);
        default -> KeymasterError.UNSUPPORTED_PURPOSE;
      };
    } finally {
      Arrays.fill(digest, (byte) 0);
    }
  }

  private KeymasterError sign(final byte[] digest, final KeymasterBuffer output) {
    output.reserve(tagLength);
    output.write(digest, 0, tagLength);
    return KeymasterError.OK;
  }

  private KeymasterError verify(final byte[] digest, final KeymasterBuffer signature) {
    if (signature.availableRead() != tagLength) {
      return KeymasterError.INVALID_INPUT_LENGTH;
    }
    byte[] expected = Arrays.copyOf(digest, tagLength);
    byte[] candidate = signature.peekRead();
    try {
      return org.bouncycastle.util.Arrays.constantTimeAreEqual(expected, candidate)
          ? KeymasterError.OK
          : KeymasterError.VERIFICATION_FAILED;
    } finally {
      Arrays.fill(expected, (byte) 0);
    }
  }

  @Override
  public KeymasterError abort() {
    release();
    return KeymasterError.OK;
  }

  @Override
  public void close() {
    release();
  }

  private void release() {
    if (context != null) {
      context.close();
      context = null;
    }
  }

  // No context means construction failed or the pass is over.
  private KeymasterError unusable() {
    return error.isOk() ? KeymasterError.UNKNOWN_ERROR : error;
  }
}
