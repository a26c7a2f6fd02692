package asyncdep.transforms;

import asyncdep.analysis.GraphVertex;
import asyncdep.analysis.ScopeGraph;
import asyncdep.analysis.VertexMapTree;
import asyncdep.analysis.VertexType;
import asyncdep.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the dependency lists of the async events to the in-edges of
 * their vertices in the reduced graphs. All lists are cleared before any of
 * them is refilled, so a token may be re-added to a list it was removed
 * from.
 */
public class DependencyListRewriter
{
  private static final String pass_name = "[DependencyListRewriter]";

  private DependencyListRewriter()
  {
  }

  /**
   * Rewrites the dependency lists from every reduced graph of the tree and
   * clears the ids except those of DMA, channel and hierarchy events.
   */
  public static void updateDepList(VertexMapTree tree)
  {
    List<ScopeGraph> graphs = new ArrayList<ScopeGraph>();
    collectReducedGraphs(tree, graphs);

    for (ScopeGraph g : graphs) {
      for (GraphVertex v : g.getVertices()) {
        if (v.getEvent() instanceof AsyncEvent)
          ((AsyncEvent)v.getEvent()).clearAsyncDependencies();
      }
    }

    for (ScopeGraph g : graphs) {
      for (GraphVertex v : g.getVertices()) {
        if (!(v.getEvent() instanceof AsyncEvent))
          continue;
        AsyncEvent sink = (AsyncEvent)v.getEvent();
        for (GraphVertex pred : v.getPreds()) {
          if (pred.getType() == VertexType.START || pred.getEvent() == sink)
            continue;
          Value token = getSourceToken(pred, sink);
          if (token == null) {
            PrintTools.printlnStatus(2, pass_name, "no token for edge",
                pred, "->", v);
            continue;
          }
          sink.addAsyncDependencyIfNew(token);
        }
      }
    }

    for (ScopeGraph g : graphs) {
      for (GraphVertex v : g.getVertices()) {
        switch (v.getType()) {
          case START:
          case DMA:
          case CHANNEL:
          case HIERARCHY:
            break;
          default:
            v.getOp().removeId();
        }
      }
    }
  }

  private static void collectReducedGraphs(VertexMapTree tree,
      List<ScopeGraph> graphs)
  {
    graphs.add(tree.getReduced());
    for (VertexMapTree child : tree.getChildren())
      collectReducedGraphs(child, graphs);
  }

  /**
   * Returns the token a sink waits on for an edge leaving the given vertex:
   * the carried token inside a loop body, the loop result after a loop
   * terminator, and otherwise the token of the source event, or of the
   * outermost conditional enclosing it that does not also enclose the sink.
   */
  static Value getSourceToken(GraphVertex src, Event sink)
  {
    Event e = src.getEvent();
    switch (src.getType()) {
      case FOR_LOOP: {
        List<Value> args = ((ForLoopEvent)e).getRegionIterArgs();
        return args.isEmpty() ? null : args.get(0);
      }
      case PARALLEL_LOOP: {
        List<Value> inits = ((ParallelLoopEvent)e).getInitVals();
        return inits.isEmpty() ? null : inits.get(0);
      }
      case TERMINATOR: {
        Event loop = e.getParentEvent();
        return (loop == null || loop.getResults().isEmpty()) ?
          null : loop.getResult(0);
      }
      default:
        if (!(e instanceof AsyncEvent))
          return null;
        while (e.getParentEvent() instanceof ConditionalEvent
            && !e.getParentEvent().isProperAncestor(sink))
          e = e.getParentEvent();
        return e.getResults().isEmpty() ? null : e.getResult(0);
    }
  }
}
