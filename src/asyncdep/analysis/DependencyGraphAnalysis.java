package asyncdep.analysis;

import asyncdep.exec.Driver;
import asyncdep.hir.Function;
import asyncdep.hir.PrintTools;
import asyncdep.hir.Program;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds and reduces the dependency graphs of every function and writes
 * them out as requested by the dump-graphs and dump-flat-graph options.
 * The dependency lists of the program are left as they are; only the ids of
 * the represented events are rewritten.
 */
public class DependencyGraphAnalysis extends AnalysisPass
{
  private static final String pass_name = "[DependencyGraphAnalysis]";

  private final Map<Function, VertexMapTree> graphs;

  public DependencyGraphAnalysis(Program program)
  {
    super(program);
    graphs = new LinkedHashMap<Function, VertexMapTree>();
  }

  public String getPassName()
  {
    return pass_name;
  }

  public void start()
  {
    Set<String> skip_set = Driver.getSkipFunctionSet();
    for (Function f : program.getFunctions()) {
      if (skip_set.contains(f.getName())) {
        PrintTools.printlnStatus(1, pass_name, "skipping function", f.getName());
        continue;
      }
      PrintTools.printlnStatus(1, pass_name, "examining function", f.getName());
      graphs.put(f, buildAndReduce(f, new DependencyContext()));
    }
  }

  /** Returns the graph trees computed for each function. */
  public Map<Function, VertexMapTree> getGraphs()
  {
    return graphs;
  }

  /**
   * Builds the graph tree of the function and its transitive reduction,
   * dumping both when the dump options are set. The files of a function go
   * to a directory named after it under the output directory.
   *
   * @param f the function.
   * @param context the per-run graph state.
   * @return the tree pairing the built and the reduced graphs.
   */
  public static VertexMapTree buildAndReduce(Function f,
      DependencyContext context)
  {
    ScopeGraph host = new GraphBuilder(context).build(f);
    String outdir = Driver.getOptionValue("outdir");
    String dir = (outdir == null || outdir.length() == 0) ?
      f.getName() : outdir + PrintTools.file_sep + f.getName();
    if (Driver.isEnabled("dump-graphs"))
      DotGraphWriter.dumpGraphs(host, dir, "built_");

    VertexMapTree tree = TransitiveReduction.canonicalizeGraphs(host);
    PrintTools.printlnStatus(2, pass_name, f.getName() + ":",
        host.getEdgeCount(), "edges before reduction,",
        tree.getReduced().getEdgeCount(), "after");

    if (Driver.isEnabled("dump-graphs"))
      DotGraphWriter.dumpGraphs(tree.getReduced(), dir, "");
    if (Driver.isEnabled("dump-flat-graph"))
      DotGraphWriter.dumpFlatGraph(tree.getReduced(), dir);
    return tree;
  }
}
