package til.lower;

import static com.google.common.base.Preconditions.checkState;

import java.util.Optional;
import org.pcollections.ConsPStack;
import org.pcollections.PStack;
import til.InternalConsistencyError;
import til.ir.Binding;

/**
 * The bindings visible at the current point of lowering, innermost first.
 *
 * <p>Backed by a persistent cons list, so {@link #fork()} is O(1) and pushes onto a fork never
 * show up in the original (and vice versa).
 */
public final class ScopeStack {
  private PStack<Binding> bindings;

  public ScopeStack() {
    this(ConsPStack.empty());
  }

  private ScopeStack(PStack<Binding> bindings) {
    this.bindings = bindings;
  }

  /** Bindings without a name are never pushed, so that they are not visible to any lookup. */
  public void push(Binding binding) {
    if (binding.isNamed()) {
      bindings = bindings.plus(binding);
    }
  }

  /**
   * Leaves the scope of {@code binding}, which has to be the innermost one.
   *
   * @throws IllegalStateException if there is nothing to pop
   * @throws InternalConsistencyError if the innermost binding is a different one
   */
  public void pop(Binding binding) {
    if (!binding.isNamed()) {
      return;
    }
    checkState(!bindings.isEmpty(), "Can't leave the scope of %s, the stack is empty", binding);
    Binding top = bindings.get(0);
    if (top != binding) {
      throw InternalConsistencyError.format(
          "Leaving the scope of %s, but the innermost binding is %s", binding, top);
    }
    bindings = bindings.minus(0);
  }

  /**
   * Lookup {@code name} and return the binding pushed most recently, or {@link Optional#empty()}
   * if {@code name} is not bound.
   */
  public Optional<Binding> lookup(String name) {
    for (Binding binding : bindings) {
      if (binding.name.equals(name)) {
        return Optional.of(binding);
      }
    }
    return Optional.empty();
  }

  public Optional<Binding> peek() {
    if (bindings.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(bindings.get(0));
  }

  /** An independent copy of the current scope. */
  public ScopeStack fork() {
    return new ScopeStack(bindings);
  }

  public int size() {
    return bindings.size();
  }

  public boolean isEmpty() {
    return bindings.isEmpty();
  }
}
