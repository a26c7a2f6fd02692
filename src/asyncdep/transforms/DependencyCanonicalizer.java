package asyncdep.transforms;

import asyncdep.analysis.DependencyContext;
import asyncdep.analysis.DependencyGraphAnalysis;
import asyncdep.analysis.VertexMapTree;
import asyncdep.hir.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites every dependency list to the transitive reduction of the
 * dependency graph and cleans up the result. For each function the graphs
 * are built, optionally dumped, reduced and written back to the dependency
 * lists; the cleanup passes then run over the whole program.
 */
public class DependencyCanonicalizer extends FunctionTransformPass
{
  private static final String pass_name = "[DependencyCanonicalizer]";

  private final Map<Function, VertexMapTree> graphs;

  private Map<HierarchyEvent, List<Value>> dropped;

  public DependencyCanonicalizer(Program program)
  {
    super(program);
    graphs = new LinkedHashMap<Function, VertexMapTree>();
    dropped = new LinkedHashMap<HierarchyEvent, List<Value>>();
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void start()
  {
    super.start();

    TransformPass.run(new RemoveDepListRepetition(program));
    TransformPass.run(new RemoveUnusedEvents(program));
    TransformPass.run(new RemoveRedundantWaitAlls(program));
    CanonicalizeHierarchyDependency hierarchy_pass =
      new CanonicalizeHierarchyDependency(program);
    TransformPass.run(hierarchy_pass);
    dropped = hierarchy_pass.getDroppedDependencies();
    TransformPass.run(new RemoveRedundantHierarchyArgs(program));
  }

  public void transformFunction(Function f)
  {
    VertexMapTree tree =
      DependencyGraphAnalysis.buildAndReduce(f, new DependencyContext());
    DependencyListRewriter.updateDepList(tree);
    graphs.put(f, tree);
  }

  /**
   * Returns the last built and reduced graph trees of each function. The
   * ids on the vertices match the events only until the next pass rewrites
   * them.
   */
  public Map<Function, VertexMapTree> getGraphs()
  {
    return graphs;
  }

  /** Returns the tokens erased from hierarchy dependency lists. */
  public Map<HierarchyEvent, List<Value>> getDroppedDependencies()
  {
    return dropped;
  }
}
