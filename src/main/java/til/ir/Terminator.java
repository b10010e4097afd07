package til.ir;

import java.util.List;

/** The last instruction of a basic block. Successors are arena handles of the target blocks. */
public abstract class Terminator extends Instruction {

  Terminator() {}

  public abstract List<Integer> successorHandles();
}
