package exm.lowc.ic.opt;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import exm.lowc.common.lang.BoolExpr;
import exm.lowc.common.lang.Expr;
import exm.lowc.ic.tree.ICTree;
import exm.lowc.ic.tree.ICTree.Instruction;
import exm.lowc.ic.tree.ICTree.Parallel;
import exm.lowc.ic.tree.ICTree.Untagged;

public class FlattenerTest {

  private static Instruction<Untagged> set(String var, long val) {
    return ICTree.assign(var, Expr.intLit(val));
  }

  @Test
  public void testNestedSequencesSpliced() {
    Instruction<Untagged> in = ICTree.seq(
        ICTree.seq(set("a", 1), ICTree.seq(set("b", 2))),
        ICTree.<Untagged>seq(),
        set("c", 3),
        ICTree.seq(ICTree.seq(ICTree.seq(set("d", 4)))));
    assertEquals(ICTree.seq(set("a", 1), set("b", 2), set("c", 3),
                            set("d", 4)),
                 Flattener.flatten(in));
  }

  @Test
  public void testSingletonUnwrapped() {
    assertEquals(set("a", 1),
        Flattener.flatten(ICTree.seq(ICTree.seq(set("a", 1)))));
  }

  @Test
  public void testEmpty() {
    assertEquals(ICTree.<Untagged>seq(),
        Flattener.flatten(ICTree.seq(ICTree.<Untagged>seq(),
                                     ICTree.<Untagged>seq())));
  }

  @Test
  public void testBlocksFlattened() {
    BoolExpr flag = BoolExpr.flag("f");
    Instruction<Untagged> in = ICTree.seq(
        ICTree.conditional(flag,
            ICTree.seq(ICTree.seq(set("a", 1)), set("b", 2)),
            ICTree.seq(ICTree.<Untagged>seq())),
        ICTree.loop(flag, ICTree.seq(ICTree.seq(set("c", 3)))));

    Instruction<Untagged> expected = ICTree.seq(
        ICTree.conditional(flag, ICTree.seq(set("a", 1), set("b", 2)),
                           ICTree.<Untagged>seq()),
        ICTree.loop(flag, set("c", 3)));
    assertEquals(expected, Flattener.flatten(in));
  }

  @Test
  public void testParallelKeptSeparate() {
    Instruction<Untagged> in = ICTree.seq(set("a", 1),
        new Parallel<Untagged>(Arrays.asList(
            ICTree.seq(ICTree.seq(set("b", 2)), set("c", 3)),
            ICTree.seq(set("d", 4)))));

    Instruction<Untagged> expected = ICTree.seq(set("a", 1),
        new Parallel<Untagged>(Arrays.asList(
            ICTree.seq(set("b", 2), set("c", 3)),
            set("d", 4))));
    assertEquals(expected, Flattener.flatten(in));
  }

  @Test
  public void testFlattenIdempotent() {
    Instruction<Untagged> in = ICTree.seq(ICTree.seq(set("a", 1)),
        ICTree.loop(BoolExpr.flag("f"),
                    ICTree.seq(set("b", 2), ICTree.seq(set("c", 3)))));
    Instruction<Untagged> once = Flattener.flatten(in);
    assertEquals(once, Flattener.flatten(once));
  }
}
