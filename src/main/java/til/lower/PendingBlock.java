package til.lower;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import til.cfg.BasicBlock;
import til.ir.Expression;

/**
 * A local function whose body has not been lowered yet, together with everything needed to lower
 * it later: the block it goes into, the scope it was defined in (with its parameters bound to the
 * block's phis) and the block it continues with once some call has told us.
 *
 * <p>Only {@link PendingBlocks} moves an entry along its {@link State}s.
 */
public final class PendingBlock {

  public enum State {
    /** Defined, but not known to be called. */
    DEFERRED,
    /** Called at least once, waiting to be lowered. */
    QUEUED,
    /** Lowered into its block. */
    PROCESSED
  }

  /** Position in definition order, for diagnostics. */
  public final int index;

  public final Expression.Code code;
  public final BasicBlock block;
  final ScopeStack scope;
  @Nullable BasicBlock continuation;
  State state = State.DEFERRED;

  PendingBlock(int index, Expression.Code code, BasicBlock block, ScopeStack scope) {
    this.index = index;
    this.code = code;
    this.block = block;
    this.scope = scope;
  }

  public Optional<BasicBlock> continuation() {
    return Optional.ofNullable(continuation);
  }

  public State state() {
    return state;
  }

  @Override
  public String toString() {
    return "#" + index + " (" + block + ", " + state + ")";
  }
}
