package til.lower;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;
import static org.junit.Assert.assertThat;
import static til.ir.Trees.app;
import static til.ir.Trees.bin;
import static til.ir.Trees.call;
import static til.ir.Trees.code;
import static til.ir.Trees.id;
import static til.ir.Trees.ite;
import static til.ir.Trees.lam;
import static til.ir.Trees.let;
import static til.ir.Trees.letrec;
import static til.ir.Trees.lit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jooq.lambda.Seq;
import org.junit.Test;
import til.InternalConsistencyError;
import til.cfg.BasicBlock;
import til.cfg.CfgArena;
import til.cfg.CfgNormalizer;
import til.cfg.Scfg;
import til.ir.BinOp;
import til.ir.Binding;
import til.ir.Expression;
import til.ir.Instruction;

public class CfgReducerTest {

  private static Scfg lower(Expression program) {
    return CfgReducer.lower(program, LoweringOptions.DEFAULT);
  }

  private static List<Instruction> allInstructions(Scfg cfg) {
    List<Instruction> ret = new ArrayList<>();
    for (BasicBlock block : cfg.blocks()) {
      ret.addAll(block.phis());
      ret.addAll(block.instructions());
      ret.add(block.terminator().get());
    }
    return ret;
  }

  private static BasicBlock onlyPredecessor(BasicBlock block) {
    assertThat(block + " predecessors", block.predecessors().size(), is(1));
    return block.predecessors().get(0);
  }

  private static Expression ifCallsOneOfTwoLocalFunctions(Expression join) {
    return lam(
        "c",
        code(
            let(
                "f",
                lam("y", code(id("y"))),
                let(
                    "g",
                    lam("z", code(id("z"))),
                    let(
                        "x",
                        lit(1),
                        join)))));
  }

  @Test
  public void branchToLocalFunctions_synthesizesContinuation() throws Exception {
    Expression conditional =
        ite(id("c"), call(id("f"), id("x")), call(id("g"), id("x")));
    Scfg cfg = lower(ifCallsOneOfTwoLocalFunctions(let("r", conditional, id("r"))));

    assertThat(cfg.blocks().size(), is(7));
    assertThat(cfg.entry.terminator().get(), instanceOf(Expression.Branch.class));

    BasicBlock continuation = onlyPredecessor(cfg.exit);
    assertThat(continuation.arity(), is(1));
    assertThat(continuation.predecessors().size(), is(2));
    assertThat(continuation.argument(0).values().size(), is(2));
    assertThat(continuation.argument(0).name(), is("r"));

    List<Expression> results = new ArrayList<>();
    for (BasicBlock function : continuation.predecessors()) {
      assertThat(function.arity(), is(1));
      BasicBlock arm = onlyPredecessor(function);
      assertThat(onlyPredecessor(arm), is(cfg.entry));
      results.add(function.argument(0));
    }
    assertThat(
        continuation.argument(0).values(), containsInAnyOrder(results.get(0), results.get(1)));

    assertThat(continuation.immediateDominator(), is(Optional.of(cfg.entry)));
    assertThat(cfg.entry.immediatePostDominator(), is(Optional.of(continuation)));
  }

  @Test
  public void branchToLocalFunctionsInTailPosition_jumpsToExit() throws Exception {
    Expression conditional =
        ite(id("c"), call(id("f"), id("x")), call(id("g"), id("x")));
    Scfg cfg = lower(ifCallsOneOfTwoLocalFunctions(conditional));

    assertThat(cfg.blocks().size(), is(6));
    assertThat(cfg.exit.predecessors().size(), is(2));
    assertThat(cfg.exit.argument(0).values().size(), is(2));
    assertThat(cfg.exit.immediateDominator(), is(Optional.of(cfg.entry)));
    assertThat(cfg.entry.immediatePostDominator(), is(Optional.of(cfg.exit)));
  }

  @Test
  public void instructionIds_areSequentialFromOne() throws Exception {
    Expression conditional =
        ite(id("c"), call(id("f"), id("x")), call(id("g"), id("x")));
    Scfg cfg = lower(ifCallsOneOfTwoLocalFunctions(let("r", conditional, id("r"))));

    List<Integer> ids = Seq.seq(allInstructions(cfg)).map(Instruction::instrId).toList();
    assertThat(ids, is(Seq.range(1, cfg.numInstructions()).toList()));
  }

  @Test
  public void tailCalls_collapseIntoJumps() throws Exception {
    Expression program =
        lam(
            "n",
            code(
                let(
                    "g",
                    lam("y", code(bin(BinOp.ADD, id("y"), id("n")))),
                    let(
                        "f",
                        lam("x", code(call(id("g"), id("x")))),
                        call(id("f"), id("n"))))));
    Scfg cfg = lower(program);

    assertThat(cfg.blocks().size(), is(4));
    for (Instruction instruction : allInstructions(cfg)) {
      assertThat(instruction instanceof Expression.Call, is(false));
    }
    for (BasicBlock block : cfg.blocks()) {
      for (Expression.Phi phi : block.phis()) {
        assertThat(phi.values().size(), is(block.predecessors().size()));
      }
      if (block != cfg.exit) {
        assertThat(block.terminator().get(), instanceOf(Expression.Goto.class));
      }
    }
    BasicBlock g = onlyPredecessor(cfg.exit);
    Expression.BinaryOp sum = (Expression.BinaryOp) g.instructions().get(0);
    assertThat(sum.right, instanceOf(Expression.Variable.class));
    assertThat(((Expression.Variable) sum.right).binding, is(cfg.parameters().get(0)));
  }

  @Test
  public void callInArgumentPosition_returnsToFreshContinuation() throws Exception {
    Expression program =
        let(
            "f",
            lam("x", code(id("x"))),
            let("g", lam("y", code(id("y"))), call(id("f"), call(id("g"), lit(1)))));
    Scfg cfg = lower(program);

    assertThat(cfg.blocks().size(), is(5));
    BasicBlock f = onlyPredecessor(cfg.exit);
    BasicBlock continuation = onlyPredecessor(f);
    assertThat(f.argument(0).values(), contains((Expression) continuation.argument(0)));
    BasicBlock g = onlyPredecessor(continuation);
    assertThat(onlyPredecessor(g), is(cfg.entry));
  }

  @Test
  public void unusedLocalFunction_contributesNothing() throws Exception {
    CfgReducer reducer = new CfgReducer(LoweringOptions.DEFAULT);
    Scfg withDeadCode =
        reducer.lower(
            lam(
                "a",
                code(let("f", lam("x", code(bin(BinOp.ADD, id("x"), lit(1)))), id("a")))));
    Scfg without = lower(lam("a", code(id("a"))));

    assertThat(withDeadCode.blocks().size(), is(2));
    assertThat(withDeadCode.numInstructions(), is(without.numInstructions()));
    assertThat(reducer.pendingBlocks().entries(), is(empty()));
  }

  @Test
  public void letrec_lowersToLoop() throws Exception {
    Expression body =
        ite(
            bin(BinOp.LT, id("i"), id("n")),
            call(id("loop"), bin(BinOp.ADD, id("i"), lit(1))),
            id("i"));
    Expression program =
        lam("n", code(letrec("loop", lam("i", code(body)), call(id("loop"), lit(0)))));
    Scfg cfg = lower(program);

    assertThat(cfg.blocks().size(), is(5));
    BasicBlock header = cfg.blocks().get(1);
    assertThat(header.predecessors().size(), is(2));
    assertThat(header.immediateDominator(), is(Optional.of(cfg.entry)));

    Expression.Phi i = header.argument(0);
    assertThat(i.name(), is("i"));
    assertThat(((Expression.Literal) i.values().get(0)).value, is(0));
    Expression.BinaryOp increment = (Expression.BinaryOp) i.values().get(1);
    BasicBlock latch = increment.block();
    assertThat(latch.successors(), contains(header));
    assertThat(header.dominates(latch), is(true));
    assertThat(header.postDominates(latch), is(true));
    assertThat(latch.dominates(header), is(false));
  }

  @Test
  public void loopWithEarlyReturn_postDominatorsSeeBothExits() throws Exception {
    Expression body =
        ite(
            bin(BinOp.LT, id("i"), id("n")),
            ite(
                bin(BinOp.EQ, id("i"), lit(5)),
                id("i"),
                call(id("loop"), bin(BinOp.ADD, id("i"), lit(1)))),
            id("i"));
    Expression program =
        lam("n", code(letrec("loop", lam("i", code(body)), call(id("loop"), lit(0)))));
    Scfg cfg = lower(program);

    assertThat(cfg.blocks().size(), is(7));
    BasicBlock header = cfg.blocks().get(1);
    BasicBlock inLoop = header.successors().get(0);
    BasicBlock earlyReturn = inLoop.successors().get(0);
    BasicBlock latch = inLoop.successors().get(1);
    assertThat(latch.successors(), contains(header));

    assertThat(earlyReturn.postDominates(inLoop), is(false));
    assertThat(inLoop.immediatePostDominator(), is(Optional.of(cfg.exit)));
    assertThat(header.immediatePostDominator(), is(Optional.of(cfg.exit)));
    assertThat(latch.immediatePostDominator(), is(Optional.of(header)));
    assertThat(header.dominates(latch), is(true));

    String before = cfg.toString();
    CfgNormalizer.computeNormalForm(cfg);
    assertThat(cfg.toString(), is(before));
  }

  @Test
  public void zeroArityLocalFunction_isCalledWithoutArguments() throws Exception {
    Scfg cfg = lower(let("k", code(lit(7)), call(id("k"))));

    assertThat(cfg.blocks().size(), is(3));
    Expression.Phi result = cfg.exit.argument(0);
    assertThat(((Expression.Literal) result.values().get(0)).value, is(7));
  }

  @Test
  public void branchArms_shadowIndependently() throws Exception {
    Expression program =
        lam(
            "c",
            code(let("x", lit(2), ite(id("c"), let("x", lit(1), id("x")), id("x")))));
    Scfg cfg = lower(program);

    List<Integer> results =
        Seq.seq(cfg.exit.argument(0).values())
            .map(v -> (Integer) ((Expression.Literal) v).value)
            .toList();
    assertThat(results, containsInAnyOrder(1, 2));
  }

  @Test
  public void letBoundInstructions_areNamedAfterTheBinding() throws Exception {
    Scfg cfg = lower(lam("a", code(let("sum", bin(BinOp.ADD, id("a"), lit(1)), id("sum")))));

    Instruction sum = cfg.entry.instructions().get(0);
    assertThat(sum.name(), is("sum"));
    assertThat(sum.instrId(), is(1));
    assertThat(cfg.numInstructions(), is(5));
  }

  @Test
  public void parameters_areRecorded() throws Exception {
    Scfg cfg = lower(lam("a", "b", code(id("b"))));

    assertThat(Seq.seq(cfg.parameters()).map(b -> b.name).toList(), contains("a", "b"));
    assertThat(cfg.parameters().get(1).kind, is(Binding.Kind.FUN_PARAM));
  }

  @Test
  public void unresolvedIdentifier_passesThroughByDefault() throws Exception {
    Scfg cfg = lower(call(id("mystery")));

    Expression.Call call = (Expression.Call) cfg.entry.instructions().get(0);
    assertThat(call.target, instanceOf(Expression.Identifier.class));
    assertThat(((Expression.Identifier) call.target).name, is("mystery"));
  }

  @Test(expected = UnresolvedIdentifierError.class)
  public void unresolvedIdentifier_failPolicy_throws() throws Exception {
    LoweringOptions options =
        LoweringOptions.builder().unresolvedIdentifiers(UnresolvedIdentifierPolicy.FAIL).build();
    CfgReducer.lower(id("mystery"), options);
  }

  @Test(expected = InternalConsistencyError.class)
  public void conflictingContinuations_throws() throws Exception {
    lower(
        let(
            "f",
            lam("x", code(id("x"))),
            let(
                "a",
                call(id("f"), lit(1)),
                let("b", call(id("f"), lit(2)), bin(BinOp.ADD, id("a"), id("b"))))));
  }

  @Test(expected = InternalConsistencyError.class)
  public void tooFewArguments_throws() throws Exception {
    lower(let("f", lam("x", "y", code(id("x"))), call(id("f"), lit(1))));
  }

  @Test(expected = InternalConsistencyError.class)
  public void tooManyArguments_throws() throws Exception {
    lower(let("k", code(lit(1)), call(id("k"), lit(2))));
  }

  @Test(expected = InternalConsistencyError.class)
  public void partialApplicationNeverCalled_throws() throws Exception {
    lower(let("f", lam("x", "y", code(id("x"))), let("p", app(id("f"), lit(1)), lit(0))));
  }

  @Test(expected = InternalConsistencyError.class)
  public void letrecUsedInItsOwnDefinition_throws() throws Exception {
    lower(letrec("x", bin(BinOp.ADD, id("x"), lit(1)), id("x")));
  }

  @Test(expected = InternalConsistencyError.class)
  public void cfgNodesInInput_throw() throws Exception {
    lower(new Expression.Return(lit(1)));
  }

  @Test
  public void ssaPass_receivesNormalizedCfgAndArena() throws Exception {
    List<CfgArena> arenas = new ArrayList<>();
    LoweringOptions options =
        LoweringOptions.builder()
            .dumpCfg(true)
            .ssaPass(
                (cfg, arena) -> {
                  assertThat(cfg.blocks().get(0), is(cfg.entry));
                  arenas.add(arena);
                  return cfg;
                })
            .build();
    CfgReducer reducer = new CfgReducer(options);
    reducer.lower(lit(42));

    assertThat(arenas, contains(reducer.arena()));
  }

  @Test
  public void defaults_passThroughAndVerify() throws Exception {
    assertThat(
        LoweringOptions.DEFAULT.unresolvedIdentifiers, is(UnresolvedIdentifierPolicy.PASS_THROUGH));
    assertThat(LoweringOptions.DEFAULT.verify, is(true));
    assertThat(LoweringOptions.DEFAULT.ssaPass(), isEmpty());
  }
}
