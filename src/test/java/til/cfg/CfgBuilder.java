package til.cfg;

import com.google.common.collect.ImmutableList;
import java.util.List;
import til.ir.Expression;

/**
 * Builds raw CFGs directly through the block API. Jumps to blocks expecting an argument (i.e. the
 * exit) pass a literal.
 */
public class CfgBuilder {
  public final CfgArena arena = new CfgArena();
  public final Scfg cfg = Scfg.create(arena);

  private CfgBuilder() {
    cfg.addBlock(cfg.entry);
  }

  public static CfgBuilder newCfg() {
    return new CfgBuilder();
  }

  public BasicBlock newBlock() {
    BasicBlock block = arena.newBlock(0);
    cfg.addBlock(block);
    return block;
  }

  /** A block that is allocated from the arena, but not listed in the CFG. */
  public BasicBlock newUnlistedBlock() {
    return arena.newBlock(0);
  }

  public CfgBuilder jump(BasicBlock from, BasicBlock to) {
    List<Expression> arguments =
        to.arity() == 0
            ? ImmutableList.of()
            : ImmutableList.of(new Expression.Literal(from.handle));
    from.finish(ImmutableList.of(), arena.newGoto(from, to, arguments));
    return this;
  }

  public CfgBuilder branch(BasicBlock from, BasicBlock thenBlock, BasicBlock elseBlock) {
    from.finish(
        ImmutableList.of(),
        arena.newBranch(from, new Expression.Literal(true), thenBlock, elseBlock));
    return this;
  }

  public Scfg build() {
    cfg.addBlock(cfg.exit);
    cfg.exit.finish(ImmutableList.of(), arena.newReturn(cfg.exit.argument(0)));
    return cfg;
  }

  public Scfg normalized() {
    Scfg built = build();
    CfgNormalizer.computeNormalForm(built);
    return built;
  }
}
