package com.codeheadsystems.keymaster.manager;

import com.codeheadsystems.keymaster.common.KeymasterBuffer;
import com.codeheadsystems.keymaster.common.KeymasterException;
import com.codeheadsystems.keymaster.config.OperationConfig;
import com.codeheadsystems.keymaster.model.BeginResult;
import com.codeheadsystems.keymaster.model.FinishResult;
import com.codeheadsystems.keymaster.model.HmacKey;
import com.codeheadsystems.keymaster.model.KeymasterError;
import com.codeheadsystems.keymaster.model.KeymasterPurpose;
import com.codeheadsystems.keymaster.model.UpdateResult;
import com.codeheadsystems.keymaster.operation.HmacOperationFactory;
import com.codeheadsystems.keymaster.operation.Operation;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives HMAC operations by handle: begin registers an operation, update feeds it, and finish or abort
 * retire it.
 * <p>
 * Any failed update or finish retires the operation as well, so a handle never outlives an error. A
 * single handle must be driven by one caller at a time; different handles may be used concurrently.
 */
public class OperationManager {

  private static final Logger log = LoggerFactory.getLogger(OperationManager.class);
  private static final byte[] NO_SIGNATURE = new byte[0];

  private final HmacOperationFactory factory;
  private final OperationTable table;

  /**
   * Instantiates a new Operation manager on the BouncyCastle engine.
   *
   * @param config the config
   */
  public OperationManager(final OperationConfig config) {
    this(new HmacOperationFactory(), new OperationTable(config));
  }

  /**
   * Instantiates a new Operation manager.
   *
   * @param factory the factory
   * @param table   the table
   */
  public OperationManager(final HmacOperationFactory factory, final OperationTable table) {
    this.factory = factory;
    this.table = table;
  }

  /**
   * Starts an operation. Nothing is registered unless the result is {@link KeymasterError#OK}.
   *
   * @param purpose the purpose
   * @param key     the key
   * @return the begin result carrying the new handle
   */
  public BeginResult begin(final KeymasterPurpose purpose, final HmacKey key) {
    Objects.requireNonNull(key, "key");
    log.trace("begin(purpose={}, key={})", purpose, key);
    final Operation operation;
    try {
      operation = factory.createOperation(purpose, key);
    } catch (KeymasterException e) {
      log.warn("begin rejected: {}", e.getMessage());
      return BeginResult.failure(e.error());
    }
    KeymasterError error = operation.begin();
    if (!error.isOk()) {
      operation.close();
      log.warn("begin failed: {} for {}", error, key);
      return BeginResult.failure(error);
    }
    try {
      return new BeginResult(KeymasterError.OK, table.add(operation));
    } catch (KeymasterException e) {
      operation.close();
      log.warn("begin rejected: {}", e.getMessage());
      return BeginResult.failure(e.error());
    }
  }

  /**
   * Feeds input to an operation.
   *
   * @param handle the handle
   * @param input  the input
   * @return the update result
   */
  public UpdateResult update(final long handle, final byte[] input) {
    Objects.requireNonNull(input, "input");
    Optional<Operation> operation = table.find(handle);
    if (operation.isEmpty()) {
      return UpdateResult.failure(KeymasterError.INVALID_OPERATION_HANDLE);
    }
    log.trace("update(handle={}, {} bytes)", Long.toHexString(handle), input.length);
    UpdateResult result = operation.get().update(new KeymasterBuffer(input), new KeymasterBuffer());
    if (!result.error().isOk()) {
      log.warn("update failed: {} for handle={}", result.error(), Long.toHexString(handle));
      table.delete(handle);
    }
    return result;
  }

  /**
   * Completes an operation and retires its handle.
   *
   * @param handle    the handle
   * @param signature the signature to verify, or null when signing
   * @return the finish result, with the tag as output when signing
   */
  public FinishResult finish(final long handle, final byte[] signature) {
    Optional<Operation> operation = table.find(handle);
    if (operation.isEmpty()) {
      return FinishResult.failure(KeymasterError.INVALID_OPERATION_HANDLE);
    }
    log.trace("finish(handle={})", Long.toHexString(handle));
    KeymasterBuffer output = new KeymasterBuffer();
    try {
      KeymasterError error = operation.get().finish(
          new KeymasterBuffer(signature == null ? NO_SIGNATURE : signature), output);
      if (!error.isOk()) {
        log.warn("finish failed: {} for handle={}", error, Long.toHexString(handle));
        return FinishResult.failure(error);
      }
      return new FinishResult(KeymasterError.OK, output.toByteArray());
    } finally {
      output.clear();
      table.delete(handle);
    }
  }

  /**
   * Abandons an operation and retires its handle.
   *
   * @param handle the handle
   * @return the keymaster error
   */
  public KeymasterError abort(final long handle) {
    Optional<Operation> operation = table.find(handle);
    if (operation.isEmpty()) {
      return KeymasterError.INVALID_OPERATION_HANDLE;
    }
    log.debug("abort(handle={})", Long.toHexString(handle));
    try {
      return operation.get().abort();
    } finally {
      table.delete(handle);
    }
  }

  /**
   * Number of operations in flight.
   *
   * @return the int
   */
  public int inFlight() {
    return table.size();
  }

  /**
   * Closes every operation still in flight.
   */
  public void shutdown() {
    log.info("shutdown() closing {} operation(s)", table.size());
    table.clear();
  }
}
