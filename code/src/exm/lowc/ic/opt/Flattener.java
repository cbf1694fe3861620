package exm.lowc.ic.opt;

import java.util.ArrayList;
import java.util.List;

import exm.lowc.common.exceptions.LowcRuntimeError;
import exm.lowc.ic.tree.ICTree.Conditional;
import exm.lowc.ic.tree.ICTree.Instruction;
import exm.lowc.ic.tree.ICTree.Loop;
import exm.lowc.ic.tree.ICTree.Parallel;
import exm.lowc.ic.tree.ICTree.Sequence;

public class Flattener {

  /**
   * Splice nested sequences into the enclosing block, recursively
   * flattening the blocks of conditionals, loops and parallel branches.
   * @param in
   * @return a single instruction if the block has exactly one, otherwise a
   *        sequence none of whose elements are sequences
   */
  public static <T> Instruction<T> flatten(Instruction<T> in) {
    List<Instruction<T>> flat = new ArrayList<Instruction<T>>();
    flattenInto(in, flat);
    if (flat.size() == 1) {
      return flat.get(0);
    }
    return new Sequence<T>(flat);
  }

  private static <T> void flattenInto(Instruction<T> inst,
                                      List<Instruction<T>> out) {
    switch (inst.type()) {
      case SEQUENCE:
        for (Instruction<T> nested: ((Sequence<T>)inst).instructions()) {
          flattenInto(nested, out);
        }
        break;
      case CONDITIONAL: {
        Conditional<T> cond = (Conditional<T>)inst;
        out.add(new Conditional<T>(cond.condition(),
                flatten(cond.thenBlock()), flatten(cond.elseBlock()),
                cond.tag()));
        break;
      }
      case LOOP: {
        Loop<T> loop = (Loop<T>)inst;
        out.add(new Loop<T>(loop.condition(), flatten(loop.body()),
                            loop.tag()));
        break;
      }
      case PARALLEL: {
        List<Instruction<T>> branches = new ArrayList<Instruction<T>>();
        for (Instruction<T> branch: ((Parallel<T>)inst).branches()) {
          branches.add(flatten(branch));
        }
        out.add(new Parallel<T>(branches));
        break;
      }
      case ASSIGN:
      case COMPARE:
        out.add(inst);
        break;
      default:
        throw new LowcRuntimeError("Unknown instruction type " + inst.type());
    }
  }
}
