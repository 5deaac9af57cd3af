package iocextract;

/**
 * Lifecycle of a single extraction run.
 *
 * <pre>
 * IDLE -&gt; READING -&gt; NORMALIZING -&gt; WRITING -&gt; DONE
 *            |                            |
 *            +----------&gt; FAILED &lt;-------+
 * </pre>
 */
public enum RunState {
  IDLE,
  READING,
  NORMALIZING,
  WRITING,
  DONE,
  FAILED;

  /**
   * Returns whether this is a state a run ends in.
   */
  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
