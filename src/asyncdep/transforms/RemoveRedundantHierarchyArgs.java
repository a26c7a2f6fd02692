package asyncdep.transforms;

import asyncdep.hir.*;

/**
 * Erases the kernel operands of hierarchy events whose argument is not used
 * in the body.
 */
public class RemoveRedundantHierarchyArgs extends FunctionTransformPass
{
  private static final String pass_name = "[RemoveRedundantHierarchyArgs]";

  public RemoveRedundantHierarchyArgs(Program program)
  {
    super(program);
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void transformFunction(Function f)
  {
    for (HierarchyEvent h : IRTools.getEvents(f, HierarchyEvent.class)) {
      for (int i = h.getNumKernelOperands() - 1; i >= 0; i--) {
        Value arg = h.getKernelArguments().get(i);
        if (IRTools.getUses(h.getBody(), arg).isEmpty()) {
          PrintTools.printlnStatus(2, pass_name, "erased argument", arg,
              "of", h.getName());
          h.eraseKernelOperand(i);
        }
      }
    }
  }
}
