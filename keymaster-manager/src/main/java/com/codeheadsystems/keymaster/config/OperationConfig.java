package com.codeheadsystems.keymaster.config;

/**
 * Configuration for the operation dispatcher.
 *
 * @param maxOperations how many operations may be in flight at once
 */
public record OperationConfig(int maxOperations) {

  /**
   * Default configuration: sixteen concurrent operations, the usual keymaster table size.
   */
  public static final OperationConfig DEFAULT = new OperationConfig(16);

  /**
   * Instantiates a new Operation config.
   *
   * @param maxOperations the max operations
   */
  public OperationConfig {
    if (maxOperations <= 0) {
      throw new IllegalArgumentException("maxOperations must be positive: " + maxOperations);
    }
  }

  /**
   * Creates a test configuration with a small table.
   *
   * @param maxOperations the max operations
   * @return the operation config
   */
  public static OperationConfig forTesting(int maxOperations) {
    return new OperationConfig(maxOperations);
  }
}
