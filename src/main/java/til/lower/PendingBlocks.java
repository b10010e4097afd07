package til.lower;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import til.InternalConsistencyError;
import til.cfg.BasicBlock;
import til.ir.Expression;

/**
 * Table of all local functions met during lowering, keyed by the identity of their {@link
 * Expression.Code}, plus a FIFO work list of those that have to be lowered.
 *
 * <p>Entries enter the work list at most once: enqueueing an entry that is already queued or
 * processed does nothing. Entries nobody ever called are dropped from the table by {@link
 * #drain(Consumer)}.
 */
public class PendingBlocks {

  private static final Logger LOGGER = LoggerFactory.getLogger("PendingBlocks");

  /** Expressions don't override equals, so this is an identity map. */
  private final Map<Expression.Code, PendingBlock> table = new LinkedHashMap<>();

  private final Deque<PendingBlock> queue = new ArrayDeque<>();
  private int nextIndex = 0;

  public PendingBlock defer(Expression.Code code, BasicBlock block, ScopeStack scope) {
    checkArgument(!table.containsKey(code), "Local function was already deferred");
    PendingBlock entry = new PendingBlock(nextIndex++, code, block, scope);
    table.put(code, entry);
    return entry;
  }

  public Optional<PendingBlock> lookup(Expression.Code code) {
    return Optional.ofNullable(table.get(code));
  }

  /**
   * Records where {@code entry} continues. Every call of a local function has to agree on that.
   *
   * @throws InternalConsistencyError if a different continuation was recorded before
   */
  public void bindContinuation(PendingBlock entry, BasicBlock continuation) {
    if (entry.continuation == null) {
      entry.continuation = continuation;
    } else if (entry.continuation != continuation) {
      throw InternalConsistencyError.format(
          "Local function #%d in %s is continued by both %s and %s",
          entry.index, entry.block, entry.continuation, continuation);
    }
  }

  public void enqueue(PendingBlock entry) {
    if (entry.state != PendingBlock.State.DEFERRED) {
      LOGGER.debug("Not enqueueing {}", entry);
      return;
    }
    entry.state = PendingBlock.State.QUEUED;
    queue.addLast(entry);
    LOGGER.debug("Enqueued {}", entry);
  }

  /**
   * Hands every queued entry to {@code lower} in FIFO order, including those enqueued while
   * draining. Entries without a continuation are dropped instead, just like those never enqueued.
   */
  public void drain(Consumer<PendingBlock> lower) {
    while (!queue.isEmpty()) {
      PendingBlock entry = queue.removeFirst();
      if (entry.continuation == null) {
        LOGGER.debug("Dropping {}, it has no continuation", entry);
        table.remove(entry.code);
        continue;
      }
      lower.accept(entry);
      entry.state = PendingBlock.State.PROCESSED;
    }
    Iterator<PendingBlock> it = table.values().iterator();
    while (it.hasNext()) {
      PendingBlock entry = it.next();
      if (entry.state == PendingBlock.State.DEFERRED) {
        LOGGER.debug("Dropping unreachable {}", entry);
        it.remove();
      }
    }
  }

  public Collection<PendingBlock> entries() {
    return Collections.unmodifiableCollection(table.values());
  }
}
