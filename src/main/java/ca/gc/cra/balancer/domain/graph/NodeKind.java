package ca.gc.cra.balancer.domain.graph;

/**
 * Kinds of node that appear in a balancer graph, with their id prefix and rendering hints.
 *
 * @since 0.1.0
 */
public enum NodeKind {
  /** Caller-supplied input; rendered as a green box. */
  INPUT('I', "box", "lightgreen"),
  /** Caller-requested output; rendered as a blue box. */
  OUTPUT('O', "box", "lightblue"),
  /** One-in, up-to-three-out device; rendered as a yellow diamond. */
  SPLITTER('S', "diamond", "lightyellow"),
  /** Up-to-three-in, one-out device; rendered as a coral diamond. */
  MERGER('M', "diamond", "lightcoral");

  private final char idPrefix;
  private final String shape;
  private final String fillColor;

  NodeKind(char idPrefix, String shape, String fillColor) {
    this.idPrefix = idPrefix;
    this.shape = shape;
    this.fillColor = fillColor;
  }

  /**
   * Prefix used when forming node ids ({@code I0}, {@code S3}, ...).
   *
   * @return single-character prefix
   */
  public char idPrefix() {
    return idPrefix;
  }

  /**
   * Graphviz shape name.
   *
   * @return shape hint
   */
  public String shape() {
    return shape;
  }

  /**
   * Graphviz fill colour name.
   *
   * @return colour hint
   */
  public String fillColor() {
    return fillColor;
  }

  /**
   * Whether the node is a splitter or merger rather than an endpoint.
   *
   * @return {@code true} for devices
   */
  public boolean isDevice() {
    return this == SPLITTER || this == MERGER;
  }
}
