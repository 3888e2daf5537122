package com.codeheadsystems.keymaster.manager;

import com.codeheadsystems.keymaster.common.KeymasterException;
import com.codeheadsystems.keymaster.config.OperationConfig;
import com.codeheadsystems.keymaster.model.KeymasterError;
import com.codeheadsystems.keymaster.operation.Operation;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-flight operations keyed by random 64-bit handles, backed by a {@link ConcurrentHashMap}.
 * <p>
 * The table owns the operations it holds: {@link #delete} and {@link #clear} close them.
 */
public class OperationTable {

  private static final Logger log = LoggerFactory.getLogger(OperationTable.class);

  private final ConcurrentHashMap<Long, Operation> operations = new ConcurrentHashMap<>();
  private final SecureRandom random;
  private final int maxOperations;

  /**
   * Instantiates a new Operation table.
   *
   * @param config the config
   */
  public OperationTable(final OperationConfig config) {
    this(config, new SecureRandom());
  }

  /**
   * Instantiates a new Operation table.
   *
   * @param config the config
   * @param random source of handles
   */
  public OperationTable(final OperationConfig config, final SecureRandom random) {
    this.maxOperations = config.maxOperations();
    this.random = random;
  }

  /**
   * Registers an operation.
   *
   * @param operation the operation
   * @return a non-zero handle unique within the table
   * @throws KeymasterException with {@link KeymasterError#TOO_MANY_OPERATIONS} when the table is full
   */
  public synchronized long add(final Operation operation) {
    if (operations.size() >= maxOperations) {
      throw new KeymasterException(KeymasterError.TOO_MANY_OPERATIONS,
          "Operation table full (" + maxOperations + ")");
    }
    long handle;
    do {
      handle = random.nextLong();
    } while (handle == 0L || operations.containsKey(handle));
    operations.put(handle, operation);
    log.debug("Added operation handle={} ({} in flight)", Long.toHexString(handle), operations.size());
    return handle;
  }

  /**
   * Looks up an operation.
   *
   * @param handle the handle
   * @return the operation, or empty if the handle is unknown
   */
  public Optional<Operation> find(final long handle) {
    return Optional.ofNullable(operations.get(handle));
  }

  /**
   * Removes and closes an operation.
   *
   * @param handle the handle
   * @return false if the handle was unknown
   */
  public boolean delete(final long handle) {
    Operation operation = operations.remove(handle);
    if (operation == null) {
      return false;
    }
    operation.close();
    log.debug("Deleted operation handle={}", Long.toHexString(handle));
    return true;
  }

  /**
   * Number of operations in flight.
   *
   * @return the int
   */
  public int size() {
    return operations.size();
  }

  /**
   * Removes and closes every operation.
   */
  public void clear() {
    List<Long> handles = new ArrayList<>(operations.keySet());
    for (Long handle : handles) {
      delete(handle);
    }
  }
}
