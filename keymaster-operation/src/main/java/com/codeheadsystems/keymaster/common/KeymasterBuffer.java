package com.codeheadsystems.keymaster.common;

import java.util.Arrays;

/**
 * Byte buffer with independent read and write cursors, used to pass data into and out of operations.
 * <p>
 * Bytes between {@link #readPosition()} and the write position are readable. Writes append at the
 * write position and fail rather than grow unless space was made with {@link #reserve(int)}.
 * Instances are not thread-safe.
 */
public class KeymasterBuffer {

  private static final byte[] EMPTY = new byte[0];

  private byte[] buffer;
  private int readPosition;
  private int writePosition;

  /**
   * Instantiates an empty buffer with no capacity.
   */
  public KeymasterBuffer() {
    this.buffer = EMPTY;
  }

  /**
   * Instantiates an empty buffer with the given capacity.
   *
   * @param capacity the capacity
   */
  public KeymasterBuffer(final int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("Negative capacity: " + capacity);
    }
    this.buffer = new byte[capacity];
  }

  /**
   * Instantiates a buffer holding a copy of the data, all of it readable.
   *
   * @param data the data
   */
  public KeymasterBuffer(final byte[] data) {
    this(data, 0, data.length);
  }

  /**
   * Instantiates a buffer holding a copy of a slice of the data, all of it readable.
   *
   * @param data   the data
   * @param offset the offset
   * @param length the length
   */
  public KeymasterBuffer(final byte[] data, final int offset, final int length) {
    this.buffer = Arrays.copyOfRange(data, offset, offset + length);
    this.writePosition = length;
  }

  /**
   * Number of bytes that can still be read.
   *
   * @return the int
   */
  public int availableRead() {
    return writePosition - readPosition;
  }

  /**
   * Number of bytes that can be written without a reserve.
   *
   * @return the int
   */
  public int availableWrite() {
    return buffer.length - writePosition;
  }

  /**
   * The backing array. Readable bytes start at {@link #readPosition()}.
   *
   * @return the byte [ ]
   */
  public byte[] array() {
    return buffer;
  }

  /**
   * Offset of the first readable byte in {@link #array()}.
   *
   * @return the int
   */
  public int readPosition() {
    return readPosition;
  }

  /**
   * Copy of the readable span, leaving the read cursor where it is.
   *
   * @return the byte [ ]
   */
  public byte[] peekRead() {
    return Arrays.copyOfRange(buffer, readPosition, writePosition);
  }

  /**
   * Moves the read cursor forward.
   *
   * @param count the count
   * @return false if fewer than {@code count} bytes were readable; the cursor is then unchanged
   */
  public boolean advanceRead(final int count) {
    if (count < 0 || count > availableRead()) {
      return false;
    }
    readPosition += count;
    return true;
  }

  /**
   * Ensures at least {@code size} bytes can be written. Unread data is compacted to the front.
   *
   * @param size the size
   */
  public void reserve(final int size) {
    if (size < 0) {
      throw new IllegalArgumentException("Negative reservation: " + size);
    }
    if (availableWrite() >= size) {
      return;
    }
    int readable = availableRead();
    byte[] grown = new byte[readable + size];
    System.arraycopy(buffer, readPosition, grown, 0, readable);
    Arrays.fill(buffer, (byte) 0);
    buffer = grown;
    readPosition = 0;
    writePosition = readable;
  }

  /**
   * Appends bytes at the write cursor.
   *
   * @param data   the data
   * @param offset the offset
   * @param length the length
   * @return false if there is not enough room; nothing is written then
   */
  public boolean write(final byte[] data, final int offset, final int length) {
    if (length < 0 || length > availableWrite()) {
      return false;
    }
    System.arraycopy(data, offset, buffer, writePosition, length);
    writePosition += length;
    return true;
  }

  /**
   * Appends all of the given bytes.
   *
   * @param data the data
   * @return false if there is not enough room
   */
  public boolean write(final byte[] data) {
    return write(data, 0, data.length);
  }

  /**
   * Same as {@link #peekRead()}.
   *
   * @return the byte [ ]
   */
  public byte[] toByteArray() {
    return peekRead();
  }

  /**
   * Zeroes the contents and resets both cursors.
   */
  public void clear() {
    Arrays.fill(buffer, (byte) 0);
    readPosition = 0;
    writePosition = 0;
  }
}
