package til.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import til.cfg.BasicBlock;
import til.cfg.CfgArena;

/**
 * The closed family of TIL expressions. Tree-shaped input uses the variants up to {@link
 * IfThenElse}; {@link Phi}, {@link Goto}, {@link Branch} and {@link Return} only ever appear in a
 * lowered CFG.
 */
public abstract class Expression {

  Expression() {}

  public abstract <T> T acceptVisitor(Visitor<T> visitor);

  @Override
  public String toString() {
    return acceptVisitor(new ExpressionPrinter()).toString();
  }

  public static class Literal extends Expression {

    public final Object value;

    public Literal(Object value) {
      this.value = value;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  /** A reference to a function parameter that is not represented by a phi. */
  public static class Variable extends Expression {

    public final Binding binding;

    public Variable(Binding binding) {
      this.binding = binding;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitVariable(this);
    }
  }

  /** A name that still has to be resolved against the scope. */
  public static class Identifier extends Expression {

    public final String name;

    public Identifier(String name) {
      this.name = name;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitIdentifier(this);
    }
  }

  /** A lambda of a single parameter. */
  public static class Function extends Expression {

    public final String parameter;
    public final Expression body;

    public Function(String parameter, Expression body) {
      this.parameter = parameter;
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitFunction(this);
    }
  }

  /** Applies a function to a single argument, without calling it. */
  public static class Apply extends Expression {

    public final Expression function;
    public final Expression argument;

    public Apply(Expression function, Expression argument) {
      this.function = function;
      this.argument = argument;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitApply(this);
    }
  }

  /**
   * The body of a function. Nested inside of a CFG, every code expression becomes a basic block
   * whose phis are the parameters of the lambdas directly around it.
   */
  public static class Code extends Expression {

    public final Expression body;

    public Code(Expression body) {
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitCode(this);
    }
  }

  public static class Let extends Expression {

    public final Binding.Kind kind;
    public final String name;
    public final Expression definition;
    public final Expression body;

    public Let(Binding.Kind kind, String name, Expression definition, Expression body) {
      checkArgument(kind != Binding.Kind.FUN_PARAM, "Parameters are bound by lambdas, not lets");
      this.kind = kind;
      this.name = name;
      this.definition = definition;
      this.body = body;
    }

    public static Let let(String name, Expression definition, Expression body) {
      return new Let(Binding.Kind.LET, name, definition, body);
    }

    public static Let letrec(String name, Expression definition, Expression body) {
      return new Let(Binding.Kind.LETREC, name, definition, body);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitLet(this);
    }
  }

  public static class IfThenElse extends Expression {

    public final Expression condition;
    public final Expression thenExpr;
    public final Expression elseExpr;

    public IfThenElse(Expression condition, Expression thenExpr, Expression elseExpr) {
      this.condition = condition;
      this.thenExpr = thenExpr;
      this.elseExpr = elseExpr;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitIfThenElse(this);
    }
  }

  /** Calls a function whose arguments were supplied by (possibly nested) {@link Apply}s. */
  public static class Call extends Instruction {

    public final Expression target;

    public Call(Expression target) {
      this.target = target;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  public static class BinaryOp extends Instruction {

    public final BinOp op;
    public final Expression left;
    public final Expression right;

    public BinaryOp(BinOp op, Expression left, Expression right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitBinaryOp(this);
    }
  }

  public static class UnaryOp extends Instruction {

    public final UnOp op;
    public final Expression operand;

    public UnaryOp(UnOp op, Expression operand) {
      this.op = op;
      this.operand = operand;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitUnaryOp(this);
    }
  }

  /**
   * A block argument. Slot {@code j} holds the value flowing in from the {@code j}th predecessor of
   * the owning block; a slot is null until the corresponding goto has been emitted.
   */
  public static class Phi extends Instruction {

    private final List<Expression> values = new ArrayList<>();

    public Phi(BasicBlock block) {
      setBlock(block);
    }

    /** Appends an empty slot for a newly added predecessor. */
    public void addSlot() {
      values.add(null);
    }

    public void setValue(int slot, Expression value) {
      checkElementIndex(slot, values.size(), "phi slot");
      values.set(slot, value);
    }

    public List<Expression> values() {
      return Collections.unmodifiableList(values);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitPhi(this);
    }
  }

  /** Jumps to a block, having written its arguments into the phi slots at {@link #slot}. */
  public static class Goto extends Terminator {

    private final CfgArena arena;
    public final int targetHandle;
    /** Index of the jumping block in the target's predecessor list. */
    public final int slot;

    public Goto(CfgArena arena, int targetHandle, int slot) {
      this.arena = arena;
      this.targetHandle = targetHandle;
      this.slot = slot;
    }

    public BasicBlock target() {
      return arena.block(targetHandle);
    }

    @Override
    public List<Integer> successorHandles() {
      return ImmutableList.of(targetHandle);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitGoto(this);
    }
  }

  public static class Branch extends Terminator {

    private final CfgArena arena;
    public final Expression condition;
    public final int thenHandle;
    public final int elseHandle;

    public Branch(CfgArena arena, Expression condition, int thenHandle, int elseHandle) {
      this.arena = arena;
      this.condition = condition;
      this.thenHandle = thenHandle;
      this.elseHandle = elseHandle;
    }

    public BasicBlock thenBlock() {
      return arena.block(thenHandle);
    }

    public BasicBlock elseBlock() {
      return arena.block(elseHandle);
    }

    @Override
    public List<Integer> successorHandles() {
      return ImmutableList.of(thenHandle, elseHandle);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitBranch(this);
    }
  }

  /** Terminates the exit block. */
  public static class Return extends Terminator {

    @Nullable public final Expression value;

    public Return(@Nullable Expression value) {
      this.value = value;
    }

    @Override
    public List<Integer> successorHandles() {
      return ImmutableList.of();
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  public interface Visitor<T> {

    T visitLiteral(Literal that);

    T visitVariable(Variable that);

    T visitIdentifier(Identifier that);

    T visitFunction(Function that);

    T visitApply(Apply that);

    T visitCode(Code that);

    T visitLet(Let that);

    T visitIfThenElse(IfThenElse that);

    T visitCall(Call that);

    T visitBinaryOp(BinaryOp that);

    T visitUnaryOp(UnaryOp that);

    T visitPhi(Phi that);

    T visitGoto(Goto that);

    T visitBranch(Branch that);

    T visitReturn(Return that);
  }
}
