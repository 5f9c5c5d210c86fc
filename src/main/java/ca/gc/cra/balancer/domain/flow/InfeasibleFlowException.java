package ca.gc.cra.balancer.domain.flow;

/**
 * Raised when the requested inputs cannot be redistributed into the requested outputs because
 * the two totals differ.
 *
 * <p>Thrown before any graph node is created; callers never observe a partial network.</p>
 *
 * @since 0.1.0
 */
public final class InfeasibleFlowException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final long inputTotal;
  private final long outputTotal;

  /**
   * Creates an exception describing the mismatched totals.
   *
   * @param inputTotal sum of all input magnitudes
   * @param outputTotal sum of all output magnitudes
   */
  public InfeasibleFlowException(long inputTotal, long outputTotal) {
    super("Total input flow " + inputTotal + " must equal total output flow " + outputTotal);
    this.inputTotal = inputTotal;
    this.outputTotal = outputTotal;
  }

  /**
   * Returns the sum of the requested inputs.
   *
   * @return input total
   */
  public long inputTotal() {
    return inputTotal;
  }

  /**
   * Returns the sum of the requested outputs.
   *
   * @return output total
   */
  public long outputTotal() {
    return outputTotal;
  }
}
