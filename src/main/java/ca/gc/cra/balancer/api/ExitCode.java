package ca.gc.cra.balancer.api;

/**
 * <strong>What:</strong> Exit codes returned by the balancer command-line tools.
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points so scripts can react to
 * each outcome.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while reading configuration or writing the graph. */
  IO_ERROR(3),
  /** Total input flow differs from total output flow. */
  INFEASIBLE(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
