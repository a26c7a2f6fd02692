package asyncdep.transforms;

import asyncdep.hir.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Removes repeated tokens from dependency lists, keeping the first
 * occurrence of each.
 */
public class RemoveDepListRepetition extends FunctionTransformPass
{
  private static final String pass_name = "[RemoveDepListRepetition]";

  public RemoveDepListRepetition(Program program)
  {
    super(program);
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void transformFunction(Function f)
  {
    for (AsyncEvent e : IRTools.getEvents(f, AsyncEvent.class)) {
      List<Value> deps = e.getAsyncDependencies();
      List<Value> unique = new ArrayList<Value>(new LinkedHashSet<Value>(deps));
      if (unique.size() == deps.size())
        continue;
      deps.clear();
      deps.addAll(unique);
    }
  }
}
