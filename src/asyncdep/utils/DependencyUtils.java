package asyncdep.utils;

import asyncdep.hir.*;

import java.util.*;

/**
 * Helpers shared by the dependency analysis and the dependency rewriting
 * passes: loop-carried token lookups, channel pairing and the dependency
 * list of each event kind.
 */
public class DependencyUtils
{
  private DependencyUtils()
  {
  }

  /**
   * Returns the for loop whose region iteration argument is the given value,
   * or null if the value is not one.
   */
  public static ForLoopEvent getForIterArgOwner(Value v)
  {
    if (v == null || !(v.getOwner() instanceof ForLoopEvent))
      return null;
    ForLoopEvent loop = (ForLoopEvent)v.getOwner();
    if (loop.getRegionIterArgs().contains(v))
      return loop;
    return null;
  }

  /**
   * Returns the closest parallel loop enclosing <var>consumer</var> whose
   * initial values contain <var>token</var>, or null.
   */
  public static ParallelLoopEvent getParallelInitValOwner(Event consumer,
      Value token)
  {
    ParallelLoopEvent loop = consumer.getParentOfType(ParallelLoopEvent.class);
    while (loop != null) {
      if (loop.getInitVals().contains(token))
        return loop;
      loop = loop.getParentOfType(ParallelLoopEvent.class);
    }
    return null;
  }

  /**
   * Returns the live list of tokens the event waits on: the dependency list
   * of an async event, the iteration operands of a for loop, the initial
   * values of a parallel loop and the operands of a loop or branch
   * terminator. Other events return null.
   */
  public static List<Value> getDependencyList(Event e)
  {
    if (e instanceof AsyncEvent)
      return ((AsyncEvent)e).getAsyncDependencies();
    if (e instanceof ForLoopEvent)
      return ((ForLoopEvent)e).getIterOperands();
    if (e instanceof ParallelLoopEvent)
      return ((ParallelLoopEvent)e).getInitVals();
    if (e instanceof YieldEvent)
      return ((YieldEvent)e).getYieldedValues();
    if (e instanceof ReduceEvent)
      return ((ReduceEvent)e).getReducedValues();
    return null;
  }

  /**
   * Returns the channel events on the other side of the given one: the gets
   * of a put, the puts of a get, matched by channel name over the whole
   * program.
   *
   * @throws InternalError if the channel has no counterpart.
   */
  public static List<ChannelEvent> getTheOtherChannelEvents(ChannelEvent e)
  {
    Traversable root = e.getFunction();
    if (root != null && ((Function)root).getProgram() != null)
      root = ((Function)root).getProgram();
    if (root == null)
      throw new InternalError("detached channel event " + e);

    Class<? extends ChannelEvent> other = (e instanceof ChannelPutEvent) ?
        ChannelGetEvent.class : ChannelPutEvent.class;
    List<ChannelEvent> ret = new ArrayList<ChannelEvent>();
    for (ChannelEvent c : IRTools.getEvents(root, other)) {
      if (c.getChannelName().equals(e.getChannelName()))
        ret.add(c);
    }
    if (ret.isEmpty())
      throw new InternalError("channel @" + e.getChannelName()
          + " has no matching " + (e instanceof ChannelPutEvent ? "get" : "put"));
    return ret;
  }

  /**
   * Returns the name of the memory space of a buffer. Buffers without an
   * explicit space live in L3.
   */
  public static String getMemorySpaceAsString(Value buffer)
  {
    MemorySpace space = buffer.getMemorySpace();
    return (space == null) ? MemorySpace.L3.name() : space.name();
  }
}
