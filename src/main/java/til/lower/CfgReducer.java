package til.lower;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import til.InternalConsistencyError;
import til.cfg.BasicBlock;
import til.cfg.CfgArena;
import til.cfg.CfgNormalizer;
import til.cfg.CfgPrinter;
import til.cfg.CfgVerifier;
import til.cfg.Scfg;
import til.ir.Binding;
import til.ir.Expression;
import til.ir.Instruction;
import til.ir.Terminator;

/**
 * Lowers a tree-shaped function into a normalized {@link Scfg}.
 *
 * <p>Exactly one block is open at any time. Visiting an expression appends its instructions to
 * that block and returns its value, or null if the value already went into the active
 * continuation (which then also closed the block). The continuation is only active for expressions
 * in tail position.
 *
 * <p>Local functions ({@link Expression.Code}, possibly under a chain of {@link
 * Expression.Function}s naming its parameters) are not lowered where they are defined. They get a
 * block right away and are registered in the {@link PendingBlocks}; a call of a local function
 * becomes a jump to that block, and only functions that are called at least once are lowered
 * afterwards. Consequently, every call of a local function has to return to the same place.
 *
 * <p>A reducer lowers a single CFG; all its blocks come from the same arena.
 */
public class CfgReducer implements Expression.Visitor<Expression> {

  private static final Logger LOGGER = LoggerFactory.getLogger("CfgReducer");

  private final CfgArena arena;
  private final LoweringOptions options;
  private final PendingBlocks pendingBlocks = new PendingBlocks();
  /** Arguments of (partial) applications of local functions, consumed by the next call. */
  private final List<Expression> pendingArgs = new ArrayList<>();

  private ScopeStack scope = new ScopeStack();
  private Scfg cfg;
  @Nullable private BasicBlock currentBlock;
  private List<Instruction> currentInstructions = new ArrayList<>();
  @Nullable private BasicBlock continuation;

  public CfgReducer(LoweringOptions options) {
    this(new CfgArena(), options);
  }

  public CfgReducer(CfgArena arena, LoweringOptions options) {
    this.arena = arena;
    this.options = options;
  }

  public static Scfg lower(Expression function, LoweringOptions options) {
    return new CfgReducer(options).lower(function);
  }

  /**
   * Lowers {@code function}, which is either a body, a {@link Expression.Code} or a chain of
   * lambdas around a {@link Expression.Code}. The lambdas' parameters become the parameters of the
   * CFG.
   */
  public Scfg lower(Expression function) {
    checkState(cfg == null, "This reducer already lowered a CFG");
    List<Binding> parameters = new ArrayList<>();
    Expression body = function;
    while (body instanceof Expression.Function) {
      Expression.Function lambda = (Expression.Function) body;
      parameters.add(Binding.parameter(lambda.parameter));
      body = lambda.body;
    }
    if (body instanceof Expression.Code) {
      body = ((Expression.Code) body).body;
    }

    cfg = Scfg.create(arena, parameters);
    LOGGER.debug("Lowering a CFG with parameters {}", parameters);
    parameters.forEach(scope::push);
    startBlock(cfg.entry);
    continuation = cfg.exit;
    reduceTail(body);
    Lists.reverse(parameters).forEach(scope::pop);
    continuation = null;

    pendingBlocks.drain(this::lowerPending);

    startBlock(cfg.exit);
    finishBlock(arena.newReturn(cfg.exit.argument(0)));

    CfgNormalizer.computeNormalForm(cfg);
    if (options.verify) {
      CfgVerifier.verify(cfg);
    }
    if (options.dumpCfg) {
      LOGGER.info("Normalized CFG:{}{}", System.lineSeparator(), new CfgPrinter().print(cfg));
    }
    if (options.ssaPass().isPresent()) {
      return options.ssaPass().get().transform(cfg, arena);
    }
    return cfg;
  }

  public PendingBlocks pendingBlocks() {
    return pendingBlocks;
  }

  public CfgArena arena() {
    return arena;
  }

  private void lowerPending(PendingBlock entry) {
    LOGGER.debug("Lowering local function {}", entry);
    ScopeStack savedScope = scope;
    scope = entry.scope;
    continuation = entry.continuation;
    startBlock(entry.block);
    reduceTail(entry.code.body);
    continuation = null;
    scope = savedScope;
  }

  // Block management

  private void startBlock(BasicBlock block) {
    if (currentBlock != null) {
      throw InternalConsistencyError.format(
          "Can't open block %s while block %s is still open", block, currentBlock);
    }
    if (block.isFinished()) {
      throw InternalConsistencyError.format("Can't reopen finished block %s", block);
    }
    currentBlock = block;
    cfg.addBlock(block);
  }

  private BasicBlock openBlock() {
    if (currentBlock == null) {
      throw new InternalConsistencyError("No block is open");
    }
    return currentBlock;
  }

  private void finishBlock(Terminator terminator) {
    openBlock().finish(currentInstructions, terminator);
    currentBlock = null;
    currentInstructions = new ArrayList<>();
  }

  private <T extends Instruction> T place(T instruction) {
    instruction.setBlock(openBlock());
    currentInstructions.add(instruction);
    return instruction;
  }

  private void jump(BasicBlock target, List<Expression> arguments) {
    finishBlock(arena.newGoto(openBlock(), target, arguments));
  }

  // Reduction contexts

  /** Reduces {@code expr} in value position, i.e. without a continuation. */
  private Expression reduceValue(Expression expr) {
    BasicBlock saved = continuation;
    continuation = null;
    Expression value = expr.acceptVisitor(this);
    continuation = saved;
    if (value == null) {
      throw InternalConsistencyError.format("%s yields no value", expr);
    }
    return value;
  }

  /** Reduces {@code expr} in tail position, passing its value on to the active continuation. */
  private void reduceTail(Expression expr) {
    checkState(continuation != null, "Tail position without a continuation");
    Expression value = expr.acceptVisitor(this);
    if (value != null) {
      jump(continuation, ImmutableList.of(value));
    }
    if (currentBlock != null) {
      throw InternalConsistencyError.format(
          "Block %s is still open in tail position", currentBlock);
    }
  }

  // Local functions

  private Optional<PendingBlock> localFunction(Expression expr) {
    while (expr instanceof Expression.Function) {
      expr = ((Expression.Function) expr).body;
    }
    if (expr instanceof Expression.Code) {
      return pendingBlocks.lookup((Expression.Code) expr);
    }
    return Optional.empty();
  }

  private void deferLocalFunction(Expression.Code code, List<String> parameters) {
    if (pendingBlocks.lookup(code).isPresent()) {
      return;
    }
    BasicBlock block = arena.newBlock(parameters.size());
    ScopeStack snapshot = scope.fork();
    for (int i = 0; i < parameters.size(); i++) {
      Expression.Phi phi = block.argument(i);
      phi.setName(parameters.get(i));
      snapshot.push(Binding.parameter(parameters.get(i), phi));
    }
    PendingBlock entry = pendingBlocks.defer(code, block, snapshot);
    LOGGER.debug("Deferred local function {} taking {} arguments", entry, parameters.size());
  }

  /**
   * Jumps to {@code callee}, passing all arguments pushed since {@code base}. The jump returns to
   * the active continuation, or to a fresh one if there is none.
   */
  @Nullable
  private Expression jumpTo(PendingBlock callee, int base) {
    List<Expression> pushed = pendingArgs.subList(base, pendingArgs.size());
    List<Expression> arguments = new ArrayList<>(pushed);
    pushed.clear();
    BasicBlock returnTo = continuation;
    boolean synthesized = returnTo == null;
    if (synthesized) {
      returnTo = arena.newBlock(1);
    }
    pendingBlocks.bindContinuation(callee, returnTo);
    jump(callee.block, arguments);
    pendingBlocks.enqueue(callee);
    if (!synthesized) {
      return null;
    }
    startBlock(returnTo);
    return returnTo.argument(0);
  }

  // Visitor

  @Override
  public Expression visitLiteral(Expression.Literal that) {
    return that;
  }

  @Override
  public Expression visitVariable(Expression.Variable that) {
    return that;
  }

  @Override
  public Expression visitIdentifier(Expression.Identifier that) {
    Optional<Binding> found = scope.lookup(that.name);
    if (!found.isPresent()) {
      if (options.unresolvedIdentifiers == UnresolvedIdentifierPolicy.FAIL) {
        throw new UnresolvedIdentifierError(that.name);
      }
      LOGGER.warn("Identifier {} is not in scope, passing it through", that.name);
      return new Expression.Identifier(that.name);
    }
    Binding binding = found.get();
    switch (binding.kind) {
      case LET:
        return binding.definition().get();
      case LETREC:
        return binding
            .definition()
            .orElseThrow(
                () ->
                    InternalConsistencyError.format(
                        "%s is used before its definition was reduced", binding));
      case FUN_PARAM:
        return binding.definition().orElseGet(() -> new Expression.Variable(binding));
      default:
        throw new UnsupportedOperationException("Unhandled binding kind " + binding.kind);
    }
  }

  @Override
  public Expression visitFunction(Expression.Function that) {
    List<String> parameters = new ArrayList<>();
    Expression body = that;
    while (body instanceof Expression.Function) {
      parameters.add(((Expression.Function) body).parameter);
      body = ((Expression.Function) body).body;
    }
    if (body instanceof Expression.Code) {
      deferLocalFunction((Expression.Code) body, parameters);
    }
    // Other lambdas are opaque values.
    return that;
  }

  @Override
  public Expression visitApply(Expression.Apply that) {
    Expression function = reduceValue(that.function);
    if (!localFunction(function).isPresent()) {
      return new Expression.Apply(function, reduceValue(that.argument));
    }
    pendingArgs.add(reduceValue(that.argument));
    if (function instanceof Expression.Function) {
      return ((Expression.Function) function).body;
    }
    // More arguments than parameters, the jump will complain
    return function;
  }

  @Override
  public Expression visitCode(Expression.Code that) {
    deferLocalFunction(that, ImmutableList.of());
    return that;
  }

  @Override
  public Expression visitLet(Expression.Let that) {
    Binding binding;
    int argsBefore = pendingArgs.size();
    if (that.kind == Binding.Kind.LETREC) {
      binding = Binding.letrec(that.name);
      scope.push(binding);
      Expression definition = reduceValue(that.definition);
      binding.define(definition);
      nameAfter(definition, that.name);
    } else {
      Expression definition = reduceValue(that.definition);
      binding = Binding.let(that.name, definition);
      nameAfter(definition, that.name);
      scope.push(binding);
    }
    if (pendingArgs.size() != argsBefore) {
      throw InternalConsistencyError.format(
          "Partial application bound to %s is never called", that.name);
    }
    Expression result = that.body.acceptVisitor(this);
    scope.pop(binding);
    return result;
  }

  private static void nameAfter(Expression definition, String name) {
    if (definition instanceof Instruction) {
      Instruction instruction = (Instruction) definition;
      if (instruction.name().isEmpty()) {
        instruction.setName(name);
      }
    }
  }

  @Override
  public Expression visitIfThenElse(Expression.IfThenElse that) {
    Expression condition = reduceValue(that.condition);
    BasicBlock thenBlock = arena.newBlock(0);
    BasicBlock elseBlock = arena.newBlock(0);
    finishBlock(arena.newBranch(openBlock(), condition, thenBlock, elseBlock));

    BasicBlock saved = continuation;
    boolean synthesized = saved == null;
    if (synthesized) {
      continuation = arena.newBlock(1);
    }
    ScopeStack savedScope = scope;
    scope = savedScope.fork();
    startBlock(thenBlock);
    reduceTail(that.thenExpr);
    scope = savedScope.fork();
    startBlock(elseBlock);
    reduceTail(that.elseExpr);
    scope = savedScope;

    BasicBlock join = continuation;
    continuation = saved;
    if (!synthesized) {
      return null;
    }
    startBlock(join);
    return join.argument(0);
  }

  @Override
  public Expression visitCall(Expression.Call that) {
    int base = pendingArgs.size();
    Expression target = reduceValue(that.target);
    Optional<PendingBlock> callee = localFunction(target);
    if (callee.isPresent()) {
      return jumpTo(callee.get(), base);
    }
    if (pendingArgs.size() != base) {
      throw InternalConsistencyError.format(
          "Call of %s leaves arguments of a local function behind", target);
    }
    return place(new Expression.Call(target));
  }

  @Override
  public Expression visitBinaryOp(Expression.BinaryOp that) {
    Expression left = reduceValue(that.left);
    Expression right = reduceValue(that.right);
    return place(new Expression.BinaryOp(that.op, left, right));
  }

  @Override
  public Expression visitUnaryOp(Expression.UnaryOp that) {
    return place(new Expression.UnaryOp(that.op, reduceValue(that.operand)));
  }

  @Override
  public Expression visitPhi(Expression.Phi that) {
    throw cfgOnly("phi");
  }

  @Override
  public Expression visitGoto(Expression.Goto that) {
    throw cfgOnly("goto");
  }

  @Override
  public Expression visitBranch(Expression.Branch that) {
    throw cfgOnly("branch");
  }

  @Override
  public Expression visitReturn(Expression.Return that) {
    throw cfgOnly("return");
  }

  private static InternalConsistencyError cfgOnly(String what) {
    return InternalConsistencyError.format("A %s can't occur in a tree to be lowered", what);
  }
}
