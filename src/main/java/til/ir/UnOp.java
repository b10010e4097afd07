package til.ir;

public enum UnOp {
  MINUS("-"),
  BIT_NOT("~"),
  LOGIC_NOT("!");

  public final String string;

  UnOp(String string) {
    this.string = string;
  }
}
