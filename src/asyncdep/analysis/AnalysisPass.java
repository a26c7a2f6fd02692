package asyncdep.analysis;

import asyncdep.hir.IRTools;
import asyncdep.hir.PrintTools;
import asyncdep.hir.Program;
import asyncdep.hir.Tools;

/**
 * Base class of the passes that inspect the program without changing its
 * dependency lists.
 */
public abstract class AnalysisPass
{
  protected Program program;

  protected AnalysisPass(Program program)
  {
    this.program = program;
  }

  public abstract String getPassName();

  public static void run(AnalysisPass pass)
  {
    double timer = Tools.getTime();
    PrintTools.println(pass.getPassName() + " begin", 0);
    pass.start();
    PrintTools.println(pass.getPassName() + " end in " +
      String.format("%.2f seconds", Tools.getTime(timer)), 0);
    if (!IRTools.checkConsistency(pass.program))
      throw new InternalError("Inconsistent IR after " + pass.getPassName());
  }

  public abstract void start();
}
