package til;

/**
 * Signals that a CFG under construction or normalization violates one of its structural
 * invariants. These are never recovered from: the input graph is malformed or an earlier stage has
 * a bug.
 */
public class InternalConsistencyError extends TilError {

  public InternalConsistencyError(String message) {
    super(message);
  }

  public static InternalConsistencyError format(String template, Object... args) {
    return new InternalConsistencyError(String.format(template, args));
  }
}
