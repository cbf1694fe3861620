package exm.lowc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.lowc.ast.SourceTree;
import exm.lowc.ast.SourceTree.Conditional;
import exm.lowc.ast.SourceTree.FunctionDef;
import exm.lowc.ast.SourceTree.Loop;
import exm.lowc.ast.SourceTree.MultiAssign;
import exm.lowc.ast.SourceTree.Nop;
import exm.lowc.ast.SourceTree.Return;
import exm.lowc.ast.SourceTree.ScopedBinding;
import exm.lowc.ast.SourceTree.Statement;
import exm.lowc.common.Logging;
import exm.lowc.common.NameGenerator;
import exm.lowc.common.Settings;
import exm.lowc.common.exceptions.ArityMismatchException;
import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.common.exceptions.UndefinedFunctionException;
import exm.lowc.common.exceptions.UndefinedVariableException;
import exm.lowc.common.exceptions.UserException;
import exm.lowc.common.lang.BoolExpr;
import exm.lowc.common.lang.Builtins;
import exm.lowc.common.lang.Expr;
import exm.lowc.common.lang.Operators.ArithOp;
import exm.lowc.common.lang.Operators.RelOp;
import exm.lowc.common.util.Pair;
import exm.lowc.frontend.ASTWalker.LoweredProgram;
import exm.lowc.ic.opt.Flattener;
import exm.lowc.ic.tree.ICTree;
import exm.lowc.ic.tree.ICTree.Instruction;
import exm.lowc.ic.tree.ICTree.Untagged;

public class ASTWalkerTest {

  private static final List<String> NO_PARAMS = Collections.emptyList();

  private static Logger logger;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("target/ASTWalkerTest.lowc.log", true);
  }

  @After
  public void resetSettings() {
    Settings.reset(Settings.OPT_MUL_UNROLL_LIMIT);
  }

  private static LoweredProgram lowerProgram(Statement program,
                      Builtins builtins) throws UserException {
    ASTWalker walker = new ASTWalker(logger, new NameGenerator());
    return walker.lower(Normaliser.precompile(program), builtins);
  }

  private static Instruction<Untagged> lower(Statement program,
                      Builtins builtins) throws UserException {
    return Flattener.flatten(lowerProgram(program, builtins).code);
  }

  private static Instruction<Untagged> lower(Statement program)
                                              throws UserException {
    return lower(program, Builtins.empty());
  }

  private static Statement bind(String name, Expr init, Statement rest) {
    return new ScopedBinding(name, init, rest);
  }

  private static Statement set(String name, Expr value) {
    return new MultiAssign(name, value);
  }

  private static Expr id(String name) {
    return Expr.ident(name);
  }

  private static Expr lit(long val) {
    return Expr.intLit(val);
  }

  private static Expr mul(Expr lhs, Expr rhs) {
    return Expr.binaryOp(lhs, ArithOp.MUL, rhs);
  }

  private static Statement function(String name, List<String> params,
                                    Statement body, Statement rest) {
    return new FunctionDef(name, params, body, rest);
  }

  @Test
  public void testBindingsKeepSourceNames() throws UserException {
    Statement program = bind("x", lit(5),
                          bind("y", mul(id("x"), lit(3)),
                            new Return(id("y"))));
    LoweredProgram lowered = lowerProgram(program, Builtins.empty());

    assertEquals(ICTree.seq(
          ICTree.assign("x", lit(5)),
          ICTree.assign("y", Expr.add(id("x"),
                                      Expr.add(id("x"), id("x"))))),
        Flattener.flatten(lowered.code));
    assertEquals(new HashSet<String>(Arrays.asList("x", "y")),
                 lowered.outputs);
  }

  @Test
  public void testConstantOnLeftOfMultiply() throws UserException {
    Statement program = bind("x", lit(2),
                          bind("y", mul(lit(3), id("x")), Nop.NOP));
    assertEquals(ICTree.seq(
          ICTree.assign("x", lit(2)),
          ICTree.assign("y", Expr.add(id("x"),
                                      Expr.add(id("x"), id("x"))))),
        lower(program));
  }

  @Test
  public void testMultiplyByZeroOrOne() throws UserException {
    Statement program = bind("x", lit(7),
                          bind("y", mul(id("x"), lit(0)),
                            bind("z", mul(lit(1), id("x")), Nop.NOP)));
    assertEquals(ICTree.seq(
          ICTree.assign("x", lit(7)),
          ICTree.assign("y", lit(0)),
          ICTree.assign("z", id("x"))),
        lower(program));
  }

  @Test
  public void testMultiplyByZeroStillChecksOperand() throws UserException {
    exception.expect(UndefinedVariableException.class);
    lower(bind("y", mul(id("missing"), lit(0)), Nop.NOP));
  }

  @Test
  public void testLargeMultiplierUsesBuiltin() throws UserException {
    Settings.set(Settings.OPT_MUL_UNROLL_LIMIT, "2");
    Builtins builtins = Builtins.empty().define("*", Arrays.asList("m", "n"),
                                                new Return(id("m")));
    Statement program = bind("x", lit(2),
                          bind("y", mul(id("x"), lit(3)), Nop.NOP));
    assertEquals(ICTree.seq(
          ICTree.assign("x", lit(2)),
          ICTree.assign("_2", id("x")),
          ICTree.assign("_3", lit(3)),
          ICTree.assign("_1", lit(0)),
          ICTree.assign("_1", id("_2")),
          ICTree.assign("y", id("_1"))),
        lower(program, builtins));
  }

  @Test
  public void testNegativeMultiplierNeedsBuiltin() throws UserException {
    Statement program = bind("x", lit(2),
                          bind("y", mul(id("x"), lit(-2)), Nop.NOP));
    try {
      lower(program);
      fail("Expected undefined function");
    } catch (UndefinedFunctionException e) {
      assertEquals("*", e.getFunction());
    }
  }

  @Test
  public void testDivisionNeedsBuiltin() throws UserException {
    Statement program = bind("x", lit(2),
        bind("y", Expr.binaryOp(id("x"), ArithOp.DIV, lit(2)), Nop.NOP));
    try {
      lower(program);
      fail("Expected undefined function");
    } catch (UndefinedFunctionException e) {
      assertEquals("/", e.getFunction());
    }
  }

  @Test
  public void testAssignToUndeclared() throws UserException {
    try {
      lower(set("x", lit(1)));
      fail("Expected undefined variable");
    } catch (UndefinedVariableException e) {
      assertEquals("x", e.getVarName());
    }
  }

  @Test
  public void testCallUndefinedFunction() throws UserException {
    Statement program = bind("r", lit(0),
                          set("r", Expr.call("g", lit(1))));
    try {
      lower(program);
      fail("Expected undefined function");
    } catch (UndefinedFunctionException e) {
      assertEquals("g", e.getFunction());
    }
  }

  @Test
  public void testWrongArgumentCount() throws UserException {
    Statement program = function("f", Arrays.asList("a"),
        new Return(id("a")),
        bind("r", lit(0), set("r", Expr.call("f", lit(1), lit(2)))));
    try {
      lower(program);
      fail("Expected arity mismatch");
    } catch (ArityMismatchException e) {
      assertEquals("f", e.getFunction());
    }
  }

  @Test
  public void testTooManyResultsForCall() throws UserException {
    exception.expect(ArityMismatchException.class);
    Statement program = function("f", NO_PARAMS, new Return(lit(1)),
        bind("a", lit(0), bind("b", lit(0),
            new MultiAssign(Arrays.asList("a", "b"), Expr.call("f")))));
    lower(program);
  }

  @Test
  public void testTooManyTargetsForPlainValue() throws UserException {
    exception.expect(ArityMismatchException.class);
    Statement program = bind("a", lit(0), bind("b", lit(0),
            new MultiAssign(Arrays.asList("a", "b"), lit(1))));
    lower(program);
  }

  @Test
  public void testRepeatedCallsDontCapture() throws UserException {
    Statement f = bind("t", Expr.add(id("a"), lit(1)), new Return(id("t")));
    Statement program = function("f", Arrays.asList("a"), f,
        bind("a", lit(10), bind("t", lit(20),
          bind("r1", lit(0), bind("r2", lit(0), SourceTree.seq(
            set("r1", Expr.call("f", id("t"))),
            set("r2", Expr.call("f", id("a")))))))));

    assertEquals(ICTree.seq(
          ICTree.assign("a", lit(10)),
          ICTree.assign("t", lit(20)),
          ICTree.assign("r1", lit(0)),
          ICTree.assign("r2", lit(0)),
          ICTree.assign("_1", id("t")),
          ICTree.assign("r1", lit(0)),
          ICTree.assign("_2", Expr.add(id("_1"), lit(1))),
          ICTree.assign("r1", id("_2")),
          ICTree.assign("_3", id("a")),
          ICTree.assign("r2", lit(0)),
          ICTree.assign("_4", Expr.add(id("_3"), lit(1))),
          ICTree.assign("r2", id("_4"))),
        lower(program));
  }

  @Test
  public void testCallsInsideExpression() throws UserException {
    Statement program = function("f", Arrays.asList("a"),
        new Return(id("a")),
        bind("y", Expr.add(Expr.call("f", lit(1)), Expr.call("f", lit(2))),
             Nop.NOP));

    assertEquals(ICTree.seq(
          ICTree.assign("_2", lit(1)),
          ICTree.assign("_1", lit(0)),
          ICTree.assign("_1", id("_2")),
          ICTree.assign("_4", lit(2)),
          ICTree.assign("_3", lit(0)),
          ICTree.assign("_3", id("_4")),
          ICTree.assign("y", Expr.add(id("_1"), id("_3")))),
        lower(program));
  }

  @Test
  public void testExtraReturnValuesDiscarded() throws UserException {
    Statement program = function("f", NO_PARAMS,
        new Return(lit(1), lit(2)),
        bind("x", lit(0), set("x", Expr.call("f"))));

    assertEquals(ICTree.seq(
          ICTree.assign("x", lit(0)),
          ICTree.assign("x", lit(0)),
          ICTree.assign("x", lit(1))),
        lower(program));
  }

  @Test
  public void testResultDefinedWhenNoReturn() throws UserException {
    BoolExpr negative = BoolExpr.compare(id("a"), RelOp.LT, lit(0));
    Statement program = function("f", Arrays.asList("a"),
        new Conditional(negative, new Return(lit(1)), Nop.NOP),
        bind("x", lit(5), set("x", Expr.call("f", id("x")))));

    assertEquals(ICTree.seq(
          ICTree.assign("x", lit(5)),
          ICTree.assign("_1", id("x")),
          ICTree.assign("x", lit(0)),
          ICTree.assign("_2", id("_1")),
          ICTree.assign("_3", lit(0)),
          ICTree.compare("_2", "_3"),
          ICTree.conditional(BoolExpr.flag("_3"),
                             ICTree.assign("x", lit(1)),
                             ICTree.<Untagged>seq())),
        lower(program));
  }

  @Test
  public void testLaterDefinitionShadows() throws UserException {
    Statement program = function("f", NO_PARAMS, new Return(lit(1)),
        function("f", NO_PARAMS, new Return(lit(2)),
          bind("x", lit(0), set("x", Expr.call("f")))));

    assertEquals(ICTree.seq(
          ICTree.assign("x", lit(0)),
          ICTree.assign("x", lit(0)),
          ICTree.assign("x", lit(2))),
        lower(program));
  }

  @Test
  public void testFunctionCantCallItself() throws UserException {
    Statement body = bind("r", lit(0),
        SourceTree.seq(set("r", Expr.call("f")), new Return(id("r"))));
    Statement program = function("f", NO_PARAMS, body,
        bind("x", lit(0), set("x", Expr.call("f"))));
    try {
      lower(program);
      fail("Expected undefined function");
    } catch (UndefinedFunctionException e) {
      assertEquals("f", e.getFunction());
    }
  }

  @Test
  public void testFunctionCantCallLaterFunction() throws UserException {
    Statement program = function("g", NO_PARAMS,
        new Return(Expr.call("h")),
        function("h", NO_PARAMS, new Return(lit(1)),
          bind("x", lit(0), set("x", Expr.call("g")))));
    try {
      lower(program);
      fail("Expected undefined function");
    } catch (UndefinedFunctionException e) {
      assertEquals("h", e.getFunction());
    }
  }

  @Test
  public void testBuiltinsCallEarlierBuiltins() throws UserException {
    Statement quadBody = bind("d", lit(0), SourceTree.seq(
        set("d", Expr.call("double", id("n"))),
        new Return(Expr.add(id("d"), id("d")))));
    Builtins builtins = Builtins.empty()
        .define("double", Arrays.asList("n"),
                new Return(Expr.add(id("n"), id("n"))))
        .define("quad", Arrays.asList("n"), quadBody);

    LoweredProgram lowered = lowerProgram(
        bind("x", Expr.call("quad", lit(3)), Nop.NOP), builtins);
    assertEquals(Collections.singleton("x"), lowered.outputs);

    Builtins reversed = Builtins.empty()
        .define("quad", Arrays.asList("n"), quadBody)
        .define("double", Arrays.asList("n"),
                new Return(Expr.add(id("n"), id("n"))));
    try {
      lowerProgram(bind("x", Expr.call("quad", lit(3)), Nop.NOP), reversed);
      fail("Expected undefined function");
    } catch (UndefinedFunctionException e) {
      assertEquals("double", e.getFunction());
    }
  }

  @Test
  public void testShadowingBindingRenamed() throws UserException {
    Statement program = bind("x", lit(1),
                          bind("x", Expr.add(id("x"), lit(1)),
                            bind("y", id("x"), Nop.NOP)));
    LoweredProgram lowered = lowerProgram(program, Builtins.empty());

    assertEquals(ICTree.seq(
          ICTree.assign("x", lit(1)),
          ICTree.assign("_1", Expr.add(id("x"), lit(1))),
          ICTree.assign("y", id("_1"))),
        Flattener.flatten(lowered.code));
    assertEquals(new HashSet<String>(Arrays.asList("x", "_1", "y")),
                 lowered.outputs);
  }

  @Test
  public void testFunctionLocalsAreNotOutputs() throws UserException {
    Statement program = function("f", NO_PARAMS,
        bind("t", lit(1), new Return(id("t"))),
        bind("r", lit(0), set("r", Expr.call("f"))));
    assertEquals(Collections.singleton("r"),
                 lowerProgram(program, Builtins.empty()).outputs);
  }

  @Test
  public void testOutputsInsideTopLevelConditional() throws UserException {
    BoolExpr cond = BoolExpr.compare(id("x"), RelOp.LT, lit(1));
    Statement program = bind("x", lit(0),
        new Conditional(cond, bind("a", lit(1), Nop.NOP),
                              bind("b", lit(2), Nop.NOP)));
    assertEquals(new HashSet<String>(Arrays.asList("x", "a", "b")),
                 lowerProgram(program, Builtins.empty()).outputs);
  }

  @Test
  public void testTopLevelReturnDropped() throws UserException {
    assertEquals(ICTree.<Untagged>seq(), lower(new Return(lit(1))));
  }

  @Test
  public void testDiscardedReturnValueChecked() throws UserException {
    try {
      lower(new Return(id("nosuch")));
      fail("Expected undefined variable");
    } catch (UndefinedVariableException e) {
      assertEquals("nosuch", e.getVarName());
    }
  }

  @Test
  public void testDiscardedReturnNeedsBuiltin() throws UserException {
    Statement program = bind("x", lit(1), bind("y", lit(2),
                          new Return(mul(id("x"), id("y")))));
    try {
      lower(program);
      fail("Expected undefined function");
    } catch (UndefinedFunctionException e) {
      assertEquals("*", e.getFunction());
    }
  }

  @Test
  public void testUnassignedReturnSlotChecked() throws UserException {
    Statement program = function("f", NO_PARAMS,
        new Return(lit(1), id("nosuch")),
        bind("a", lit(0), set("a", Expr.call("f"))));
    try {
      lower(program);
      fail("Expected undefined variable");
    } catch (UndefinedVariableException e) {
      assertEquals("nosuch", e.getVarName());
    }
  }

  @Test
  public void testLoopConditionRecomputed() throws UserException {
    BoolExpr cond = BoolExpr.compare(id("i"), RelOp.LT, lit(3));
    Statement program = bind("i", lit(0),
        new Loop(cond, set("i", Expr.add(id("i"), lit(1)))));

    assertEquals(ICTree.seq(
          ICTree.assign("i", lit(0)),
          ICTree.assign("_1", id("i")),
          ICTree.assign("_2", lit(3)),
          ICTree.compare("_1", "_2"),
          ICTree.loop(BoolExpr.flag("_2"), ICTree.seq(
              ICTree.assign("i", Expr.add(id("i"), lit(1))),
              ICTree.assign("_1", id("i")),
              ICTree.assign("_2", lit(3)),
              ICTree.compare("_1", "_2")))),
        lower(program));
  }

  @Test
  public void testRelationalFormulas() throws UserException {
    for (RelOp op: RelOp.values()) {
      NameGenerator names = new NameGenerator();
      ExprWalker exprWalker = new ExprWalker(logger,
                                  new ASTWalker(logger, names), names);
      Context context = Context.createRoot(Builtins.empty())
                               .bindVar("x", "x").bindVar("y", "y");
      Pair<List<Instruction<Untagged>>, BoolExpr> lowered =
          exprWalker.lowerBool(context,
                               BoolExpr.compare(id("x"), op, id("y")));

      assertEquals(Arrays.asList(
            ICTree.assign("_1", id("x")),
            ICTree.assign("_2", id("y")),
            ICTree.compare("_1", "_2")),
          lowered.val1);
      assertEquals("Formula for " + op,
                   ExprWalker.relFormula(op, "_1", "_2"), lowered.val2);
    }
  }

  @Test
  public void testRelFormulaFlags() {
    BoolExpr greater = BoolExpr.flag("a");
    BoolExpr less = BoolExpr.flag("b");
    assertEquals(less, ExprWalker.relFormula(RelOp.LT, "a", "b"));
    assertEquals(greater, ExprWalker.relFormula(RelOp.GT, "a", "b"));
    assertEquals(BoolExpr.not(greater),
                 ExprWalker.relFormula(RelOp.LTE, "a", "b"));
    assertEquals(BoolExpr.not(less),
                 ExprWalker.relFormula(RelOp.GTE, "a", "b"));
    assertEquals(BoolExpr.or(greater, less),
                 ExprWalker.relFormula(RelOp.NEQ, "a", "b"));
    assertEquals(BoolExpr.and(BoolExpr.not(greater), BoolExpr.not(less)),
                 ExprWalker.relFormula(RelOp.EQ, "a", "b"));
  }

  @Test
  public void testCompoundCondition() throws UserException {
    BoolExpr cond = BoolExpr.and(
        BoolExpr.compare(id("x"), RelOp.LT, id("y")),
        BoolExpr.not(BoolExpr.compare(id("x"), RelOp.EQ, id("y"))));
    Statement program = bind("x", lit(1), bind("y", lit(2),
        new Conditional(cond, set("x", lit(3)), Nop.NOP)));

    BoolExpr expectedCond = BoolExpr.and(BoolExpr.flag("_2"),
        BoolExpr.not(BoolExpr.and(BoolExpr.not(BoolExpr.flag("_3")),
                                  BoolExpr.not(BoolExpr.flag("_4")))));
    assertEquals(ICTree.seq(
          ICTree.assign("x", lit(1)),
          ICTree.assign("y", lit(2)),
          ICTree.assign("_1", id("x")),
          ICTree.assign("_2", id("y")),
          ICTree.compare("_1", "_2"),
          ICTree.assign("_3", id("x")),
          ICTree.assign("_4", id("y")),
          ICTree.compare("_3", "_4"),
          ICTree.conditional(expectedCond, ICTree.assign("x", lit(3)),
                             ICTree.<Untagged>seq())),
        lower(program));
  }

  @Test
  public void testFlagInSourceRejected() throws UserException {
    exception.expect(LowcRuntimeError.class);
    lower(new Conditional(BoolExpr.flag("x"), Nop.NOP, Nop.NOP));
  }
}
