package asyncdep.transforms;

import asyncdep.analysis.AccessSummary;
import asyncdep.analysis.DependencyTracer;
import asyncdep.analysis.PartialRegion;
import asyncdep.hir.*;

import java.util.List;

/**
 * Adds to every async event the dependencies implied by the buffers and
 * index values it accesses: reads wait for earlier writers, writes wait for
 * any earlier access, and index values wait for the execute events
 * computing them. Events are visited in program order.
 */
public class TraceDependencies extends FunctionTransformPass
{
  private static final String pass_name = "[TraceDependencies]";

  public TraceDependencies(Program program)
  {
    super(program);
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void transformFunction(Function f)
  {
    List<AsyncEvent> events = IRTools.getEvents(f, AsyncEvent.class);
    for (AsyncEvent e : events) {
      if (e instanceof WaitAllEvent)
        continue;
      int before = e.getAsyncDependencies().size();
      AccessSummary summary = getAccesses(e);
      DependencyTracer.traceDependencyFromOp(summary.getReads(), e, "RAW");
      DependencyTracer.traceDependencyFromOp(summary.getWrites(), e, "WAW/WAR");
      DependencyTracer.traceTileIndices(summary, e);
      PrintTools.printlnStatus(2, pass_name, e.getName(), "gained",
          e.getAsyncDependencies().size() - before, "dependencies");
    }
  }

  // Kernel operands of a hierarchy event are read or written according to
  // the uses of their arguments in the body.
  private static AccessSummary getAccesses(AsyncEvent e)
  {
    if (!(e instanceof HierarchyEvent))
      return DependencyTracer.getPartialRegions(e);

    HierarchyEvent h = (HierarchyEvent)e;
    AccessSummary ret = new AccessSummary();
    List<Value> operands = h.getKernelOperands();
    for (int i = 0; i < operands.size(); i++) {
      Value v = operands.get(i);
      if (v.isIndex()) {
        ret.getScalarIns().add(v);
        continue;
      }
      if (!v.isBuffer())
        continue;
      char rw = DependencyTracer.checkOperandReadOrWrite(
          h.getKernelArguments().get(i));
      if (rw == 'r')
        ret.getReads().add(PartialRegion.whole(v));
      else
        ret.getWrites().add(PartialRegion.whole(v));
    }
    return ret;
  }
}
