package asyncdep.transforms;

import asyncdep.hir.*;

/**
 * Replaces every wait-all event with a single dependency by that dependency
 * and clears the ids of the remaining wait-all events.
 */
public class RemoveRedundantWaitAlls extends FunctionTransformPass
{
  private static final String pass_name = "[RemoveRedundantWaitAlls]";

  public RemoveRedundantWaitAlls(Program program)
  {
    super(program);
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void transformFunction(Function f)
  {
    for (WaitAllEvent w : IRTools.getEvents(f, WaitAllEvent.class)) {
      if (w.getAsyncDependencies().size() != 1) {
        w.removeId();
        continue;
      }
      Value input = w.getAsyncDependencies().get(0);
      Value token = w.getAsyncToken();
      for (Event user : IRTools.getUses(f, token)) {
        if (user instanceof AsyncEvent
            && ((AsyncEvent)user).getAsyncDependencies().contains(input))
          ((AsyncEvent)user).removeAsyncDependency(token);
        else
          user.replaceUsesOfWith(token, input);
      }
      w.detach();
      PrintTools.printlnStatus(2, pass_name, "replaced", token, "by", input);
    }
  }
}
