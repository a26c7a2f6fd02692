package asyncdep.analysis;

import asyncdep.hir.PrintTools;

import java.util.*;

/**
* Computes transitive reductions of dependency graphs. The reduced graph has
* the vertices of the original and keeps an edge u -> v only if v cannot be
* reached from u through another path; reachability between all vertex pairs
* is unchanged.
*/
public final class TransitiveReduction {

    private static final String pass_name = "[TransitiveReduction]";

    private TransitiveReduction() {
    }

    /**
    * Fills the empty graph <var>reduced</var> with the transitive reduction
    * of <var>graph</var> and records the vertex correspondence in the map.
    * Vertex attributes and the terminator pointer are copied; graph pointers
    * of the vertices are left to the caller.
    *
    * @throws InternalError if the graph has a cycle.
    * @throws IllegalArgumentException if the reduced graph is not empty.
    */
    public static void reduce(ScopeGraph graph, ScopeGraph reduced,
            VertexMap map) {
        if (reduced.size() != 1) {
            throw new IllegalArgumentException("reduced graph is not empty");
        }
        List<GraphVertex> order = graph.topologicalSort();
        if (order == null) {
            throw new InternalError("dependency graph of "
                    + graph.getLevelName() + " has a cycle");
        }
        for (GraphVertex v : graph.getVertices()) {
            GraphVertex copy = reduced.copyVertex(v);
            map.put(v, copy);
            if (v == graph.getTerminator()) {
                reduced.setTerminator(copy);
            }
        }

        // Reverse topological order: every successor is done before its
        // predecessors.
        BitSet[] reach = new BitSet[order.size()];
        for (int i = order.size() - 1; i >= 0; i--) {
            GraphVertex u = order.get(i);
            List<GraphVertex> succs = new ArrayList<GraphVertex>(u.getSuccs());
            Collections.sort(succs, new Comparator<GraphVertex>() {
                public int compare(GraphVertex a, GraphVertex b) {
                    return getOrder(a) - getOrder(b);
                }
            });
            BitSet r = new BitSet(order.size());
            for (GraphVertex s : succs) {
                int j = getOrder(s);
                if (!r.get(j)) {
                    reduced.addEdge(map.getReduced(u), map.getReduced(s));
                    r.or(reach[j]);
                    r.set(j);
                } else {
                    PrintTools.printlnStatus(3, pass_name, "redundant edge",
                            u, "->", s);
                }
            }
            reach[i] = r;
        }
        for (GraphVertex v : order) {
            v.removeData("top-order");
        }
    }

    private static int getOrder(GraphVertex v) {
        Integer order = v.getData("top-order");
        return order.intValue();
    }

    /**
    * Reduces every graph of the tree rooted at <var>global</var>. The
    * reduced tree is created under <var>reduced</var> unless the caller
    * already shaped it.
    *
    * @param global the root of the built graph tree.
    * @param reduced an empty graph of the same level receiving the reduction.
    * @return the tree of vertex maps.
    * @throws InternalError if the two trees differ in shape.
    */
    public static VertexMapTree canonicalizeGraphs(ScopeGraph global,
            ScopeGraph reduced) {
        if (reduced.getSubgraphs().isEmpty()) {
            for (ScopeGraph child : global.getSubgraphs()) {
                reduced.addSubgraph(new ScopeGraph(child.getHierarchy()));
            }
        }
        if (reduced.getSubgraphs().size() != global.getSubgraphs().size()
                || reduced.getHierarchy() != global.getHierarchy()) {
            throw new InternalError("graph tree size mismatch");
        }
        VertexMap map = new VertexMap();
        reduce(global, reduced, map);
        VertexMapTree ret = new VertexMapTree(global, reduced, map);
        List<ScopeGraph> children = global.getSubgraphs();
        for (int i = 0; i < children.size(); i++) {
            ret.addChild(canonicalizeGraphs(children.get(i),
                    reduced.getSubgraphs().get(i)));
        }
        for (GraphVertex v : global.getVertices()) {
            ScopeGraph next = v.getNextGraph();
            if (next == null) {
                continue;
            }
            if (v.getType() == VertexType.HIERARCHY) {
                int i = children.indexOf(next);
                if (i < 0) {
                    throw new InternalError("graph tree size mismatch");
                }
                map.getReduced(v).setNextGraph(reduced.getSubgraphs().get(i));
            } else {
                map.getReduced(v).setNextGraph(reduced.getParent());
            }
        }
        return ret;
    }

    /** Reduces the tree rooted at <var>global</var> into a new tree. */
    public static VertexMapTree canonicalizeGraphs(ScopeGraph global) {
        return canonicalizeGraphs(global,
                new ScopeGraph(global.getHierarchy()));
    }

}
