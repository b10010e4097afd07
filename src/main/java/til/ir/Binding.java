package til.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A name bound in a scope. Let bindings carry the (already reduced) expression they stand for.
 * Function parameters carry nothing when they belong to the CFG's own parameters, and the phi of
 * the local function's block otherwise.
 *
 * <p>A letrec binding is pushed before its definition is reduced, so its definition is tied exactly
 * once afterwards. Every other binding is immutable.
 */
public final class Binding {

  public enum Kind {
    LET,
    LETREC,
    FUN_PARAM
  }

  public final String name;
  public final Kind kind;
  @Nullable private Expression definition;

  private Binding(String name, Kind kind, @Nullable Expression definition) {
    this.name = name;
    this.kind = kind;
    this.definition = definition;
  }

  public static Binding let(String name, @NotNull Expression definition) {
    return new Binding(name, Kind.LET, definition);
  }

  /** The definition has to be supplied later on with {@link #define(Expression)}. */
  public static Binding letrec(String name) {
    return new Binding(name, Kind.LETREC, null);
  }

  public static Binding parameter(String name) {
    return new Binding(name, Kind.FUN_PARAM, null);
  }

  public static Binding parameter(String name, @NotNull Expression.Phi phi) {
    return new Binding(name, Kind.FUN_PARAM, phi);
  }

  /** Ties the knot of a letrec binding. */
  public void define(@NotNull Expression definition) {
    checkArgument(kind == Kind.LETREC, "Only letrec bindings are defined after the fact: %s", this);
    checkState(this.definition == null, "Binding %s was already defined", name);
    this.definition = definition;
  }

  public Optional<Expression> definition() {
    return Optional.ofNullable(definition);
  }

  public boolean isNamed() {
    return !name.isEmpty();
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase() + " " + name;
  }
}
