package til.lower;

import til.TilError;

public class UnresolvedIdentifierError extends TilError {

  public final String name;

  public UnresolvedIdentifierError(String name) {
    super("Identifier " + name + " is not in scope");
    this.name = name;
  }
}
