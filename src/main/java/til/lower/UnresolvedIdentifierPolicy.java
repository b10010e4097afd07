package til.lower;

/** What to do about identifiers that are not bound in the current scope. */
public enum UnresolvedIdentifierPolicy {
  /** Keep the identifier as is and log a warning. */
  PASS_THROUGH,
  /** Throw an {@link UnresolvedIdentifierError}. */
  FAIL
}
