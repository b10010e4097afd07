package til.ir;

public enum BinOp {
  MUL("*"),
  DIV("/"),
  REM("%"),
  ADD("+"),
  SUB("-"),
  SHL("<<"),
  SHR(">>"),
  BIT_AND("&"),
  BIT_XOR("^"),
  BIT_OR("|"),
  EQ("=="),
  NEQ("!="),
  LT("<"),
  LEQ("<="),
  LOGIC_AND("&&"),
  LOGIC_OR("||");

  public final String string;

  BinOp(String string) {
    this.string = string;
  }
}
