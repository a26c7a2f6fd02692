package asyncdep.transforms;

import asyncdep.analysis.DependencyTracer;
import asyncdep.hir.*;
import asyncdep.utils.DependencyUtils;

import java.util.*;

/**
 * Restricts the dependency lists of partition and herd events to control
 * tokens: for loop iteration arguments, parallel loop initial values and
 * wait-all tokens. The control tokens the event is ordered by through its
 * other dependencies are added first; every other token is then erased and
 * reported. Launch events are left alone.
 */
public class CanonicalizeHierarchyDependency extends FunctionTransformPass
{
  private static final String pass_name = "[CanonicalizeHierarchyDependency]";

  private final Map<HierarchyEvent, List<Value>> dropped;

  public CanonicalizeHierarchyDependency(Program program)
  {
    super(program);
    dropped = new LinkedHashMap<HierarchyEvent, List<Value>>();
  }

  public String getPassName()
  {
    return pass_name;
  }

  /**
   * Returns the tokens erased from the dependency list of each hierarchy
   * event.
   */
  public Map<HierarchyEvent, List<Value>> getDroppedDependencies()
  {
    return dropped;
  }

  public void transformFunction(Function f)
  {
    for (HierarchyEvent h : IRTools.getEvents(f, HierarchyEvent.class)) {
      if (h.getLevel() == HierarchyLevel.LAUNCH)
        continue;

      for (Value token : DependencyTracer.traceDependentControlToken(h))
        h.addAsyncDependencyIfNew(token);

      List<Value> deps = h.getAsyncDependencies();
      for (int i = deps.size() - 1; i >= 0; i--) {
        Value token = deps.get(i);
        if (isControlToken(h, token))
          continue;
        h.eraseAsyncDependency(i);
        List<Value> list = dropped.get(h);
        if (list == null) {
          list = new ArrayList<Value>();
          dropped.put(h, list);
        }
        list.add(0, token);
        PrintTools.printlnWarning(pass_name + " " + h.getName()
            + " no longer waits on " + token + " produced by "
            + token.getDefiningEvent().getName(), 1);
      }
    }
  }

  private static boolean isControlToken(HierarchyEvent h, Value token)
  {
    if (DependencyUtils.getForIterArgOwner(token) != null)
      return true;
    if (DependencyUtils.getParallelInitValOwner(h, token) != null)
      return true;
    Event def = token.getDefiningEvent();
    return def == null || def instanceof WaitAllEvent;
  }
}
