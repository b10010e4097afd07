package til.ir;

import com.google.common.base.Strings;
import java.util.List;
import java.util.stream.Collectors;
import til.cfg.BasicBlock;

/**
 * Renders expressions in a compact, lisp-ish notation.
 *
 * <p>Instructions that are already placed in a block are rendered as references ({@code %3} after
 * renumbering, {@code %name} before) whenever they occur as an operand. That keeps the output
 * finite for phis that feed back into themselves.
 *
 * <p>Instances of this class <em>are</em> stateful (nesting depth). It is very cheap to create new
 * instances of this class and therefore it is generally not advisable to reuse instances.
 */
public class ExpressionPrinter implements Expression.Visitor<CharSequence> {

  private int depth = 0;

  public static String reference(Instruction instruction) {
    if (instruction.instrId() != Instruction.UNNUMBERED) {
      return "%" + instruction.instrId();
    }
    return "%" + (instruction.name().isEmpty() ? "_" : instruction.name());
  }

  private CharSequence operand(Expression e) {
    if (depth > 0 && e instanceof Instruction && ((Instruction) e).isPlaced()) {
      return reference((Instruction) e);
    }
    depth++;
    CharSequence ret = e.acceptVisitor(this);
    depth--;
    return ret;
  }

  private CharSequence nullableOperand(Expression e) {
    return e == null ? "<unset>" : operand(e);
  }

  @Override
  public CharSequence visitLiteral(Expression.Literal that) {
    if (that.value instanceof String) {
      return "\"" + that.value + "\"";
    }
    return String.valueOf(that.value);
  }

  @Override
  public CharSequence visitVariable(Expression.Variable that) {
    return "$" + that.binding.name;
  }

  @Override
  public CharSequence visitIdentifier(Expression.Identifier that) {
    return that.name;
  }

  @Override
  public CharSequence visitFunction(Expression.Function that) {
    return new StringBuilder("(\\")
        .append(that.parameter)
        .append(" -> ")
        .append(operand(that.body))
        .append(")");
  }

  @Override
  public CharSequence visitApply(Expression.Apply that) {
    return new StringBuilder("(")
        .append(operand(that.function))
        .append(" ")
        .append(operand(that.argument))
        .append(")");
  }

  @Override
  public CharSequence visitCode(Expression.Code that) {
    return new StringBuilder("code { ").append(operand(that.body)).append(" }");
  }

  @Override
  public CharSequence visitLet(Expression.Let that) {
    return new StringBuilder("(")
        .append(that.kind == Binding.Kind.LETREC ? "letrec " : "let ")
        .append(that.name)
        .append(" = ")
        .append(operand(that.definition))
        .append(" in ")
        .append(operand(that.body))
        .append(")");
  }

  @Override
  public CharSequence visitIfThenElse(Expression.IfThenElse that) {
    return new StringBuilder("(if ")
        .append(operand(that.condition))
        .append(" then ")
        .append(operand(that.thenExpr))
        .append(" else ")
        .append(operand(that.elseExpr))
        .append(")");
  }

  @Override
  public CharSequence visitCall(Expression.Call that) {
    return new StringBuilder("call ").append(operand(that.target));
  }

  @Override
  public CharSequence visitBinaryOp(Expression.BinaryOp that) {
    return new StringBuilder("(")
        .append(operand(that.left))
        .append(" ")
        .append(that.op.string)
        .append(" ")
        .append(operand(that.right))
        .append(")");
  }

  @Override
  public CharSequence visitUnaryOp(Expression.UnaryOp that) {
    return new StringBuilder("(").append(that.op.string).append(operand(that.operand)).append(")");
  }

  @Override
  public CharSequence visitPhi(Expression.Phi that) {
    return that.values()
        .stream()
        .map(this::nullableOperand)
        .collect(Collectors.joining(", ", "phi [", "]"));
  }

  @Override
  public CharSequence visitGoto(Expression.Goto that) {
    BasicBlock target = that.target();
    List<Expression.Phi> phis = target.phis();
    return phis.stream()
        .map(phi -> nullableOperand(phi.values().get(that.slot)))
        .collect(Collectors.joining(", ", "goto " + target + "(", ")"));
  }

  @Override
  public CharSequence visitBranch(Expression.Branch that) {
    return new StringBuilder("branch ")
        .append(operand(that.condition))
        .append(" ? ")
        .append(that.thenBlock())
        .append(" : ")
        .append(that.elseBlock());
  }

  @Override
  public CharSequence visitReturn(Expression.Return that) {
    if (that.value == null) {
      return "return";
    }
    return new StringBuilder("return ").append(operand(that.value));
  }

  /** Indentation helper shared with the CFG printer. */
  public static String indent(int level) {
    return Strings.repeat("  ", level);
  }
}
