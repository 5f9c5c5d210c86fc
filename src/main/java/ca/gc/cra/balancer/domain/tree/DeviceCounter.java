package ca.gc.cra.balancer.domain.tree;

/**
 * Strictly increasing device numbering shared by splitters and mergers within one design call.
 *
 * <p>Not thread-safe. Each design owns its own instance, so concurrent designs never observe
 * each other's numbering.</p>
 *
 * @since 0.1.0
 */
public final class DeviceCounter {
  private int next;

  /** Creates a counter starting at zero. */
  public DeviceCounter() {
    this(0);
  }

  /**
   * Creates a counter starting at {@code start}.
   *
   * @param start first number handed out; must be non-negative
   */
  public DeviceCounter(int start) {
    if (start < 0) {
      throw new IllegalArgumentException("start must be non-negative (was " + start + ")");
    }
    this.next = start;
  }

  /**
   * Returns the next device number and advances the counter.
   *
   * @return next number
   * @throws IllegalStateException if the counter would overflow
   */
  public int next() {
    if (next == Integer.MAX_VALUE) {
      throw new IllegalStateException("device counter exhausted");
    }
    return next++;
  }

  /**
   * Number that the next call to {@link #next()} will return.
   *
   * @return peeked value
   */
  public int peek() {
    return next;
  }
}
