package com.codeheadsystems.keymaster.engine;

/**
 * A running keyed-hash computation. Owned by exactly one operation.
 */
public interface HmacContext extends AutoCloseable {

  /**
   * Feeds bytes into the computation.
   *
   * @param input  the input
   * @param offset the offset
   * @param length the length
   */
  void update(byte[] input, int offset, int length);

  /**
   * Completes the computation.
   *
   * @return the native-length digest
   */
  byte[] doFinal();

  /**
   * Releases the keyed state. Safe to call more than once.
   */
  @Override
  void close();
}
