package org.digitalresearch.calmlake;

/**
 * Thrown by CalmLake.send when the buffer already holds maxBufferSize items.
 * The item was not buffered; what to do with it is up to the caller.
 *
 * @author calm-lake developers
 */
public class BufferOverflowException extends RuntimeException {

  // Static fields.

  private static final long serialVersionUID = 1L;

  // Instance fields.

  private final int maxBufferSize;

  // Implementation.

  public BufferOverflowException(int maxBufferSize) {
    super("BufferOverflow");
    this.maxBufferSize = maxBufferSize;
  }

  public int getMaxBufferSize() {
    return maxBufferSize;
  }
}
