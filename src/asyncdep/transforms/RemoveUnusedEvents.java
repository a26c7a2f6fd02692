package asyncdep.transforms;

import asyncdep.hir.*;

import java.util.List;

/**
 * Deletes execute events whose yielded values are all unused and wait-all
 * events whose token is unused. The token of a deleted execute event is
 * first removed from the dependency lists waiting on it. Wait-all events are
 * visited last to first, so a chain of joins feeding only each other goes
 * in one run.
 */
public class RemoveUnusedEvents extends FunctionTransformPass
{
  private static final String pass_name = "[RemoveUnusedEvents]";

  public RemoveUnusedEvents(Program program)
  {
    super(program);
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void transformFunction(Function f)
  {
    for (ExecuteEvent e : IRTools.getEvents(f, ExecuteEvent.class)) {
      if (e.getResults().size() < 2)
        continue;
      boolean unused = true;
      for (Value v : e.getResults().subList(1, e.getResults().size())) {
        if (IRTools.hasUses(v))
          unused = false;
      }
      if (!unused)
        continue;

      Value token = e.getAsyncToken();
      List<Event> users = IRTools.getUses(f, token);
      boolean erasable = true;
      for (Event user : users) {
        if (!(user instanceof AsyncEvent))
          erasable = false;
      }
      // The token still orders a terminator.
      if (!erasable)
        continue;

      for (Event user : users)
        ((AsyncEvent)user).removeAsyncDependency(token);
      e.detach();
      PrintTools.printlnStatus(2, pass_name, "removed unused execute", token);
    }

    List<WaitAllEvent> joins = IRTools.getEvents(f, WaitAllEvent.class);
    for (int i = joins.size() - 1; i >= 0; i--) {
      WaitAllEvent w = joins.get(i);
      if (IRTools.getUses(f, w.getAsyncToken()).isEmpty()) {
        w.detach();
        PrintTools.printlnStatus(2, pass_name, "removed unused wait_all",
            w.getAsyncToken());
      }
    }
  }
}
