package asyncdep.transforms;

import asyncdep.exec.Driver;
import asyncdep.hir.Function;
import asyncdep.hir.PrintTools;
import asyncdep.hir.Program;

import java.util.Set;

/**
 * A transform pass applied to every function of the program except those
 * named by the skip-functions option.
 */
public abstract class FunctionTransformPass extends TransformPass
{
  protected FunctionTransformPass(Program program)
  {
    super(program);
  }

  public abstract void transformFunction(Function f);

  public void start()
  {
    Set<String> skip_set = Driver.getSkipFunctionSet();

    for (Function f : program.getFunctions()) {
      if (skip_set.contains(f.getName())) {
        PrintTools.printlnStatus(1, getPassName(), "skipping function",
            f.getName());
        continue;
      }
      PrintTools.printlnStatus(1, getPassName(), "examining function",
          f.getName());
      transformFunction(f);
    }
  }
}
