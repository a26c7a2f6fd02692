package asyncdep.analysis;

import asyncdep.hir.Event;
import asyncdep.hir.HierarchyEvent;
import asyncdep.hir.PrintTools;

import java.util.*;

/**
* Class ScopeGraph is the dependency graph of one hierarchy level: the host
* level of a function, or the body of one launch, partition or herd event.
* Every graph starts with a START vertex; the graph of a hierarchy event also
* gets a terminator vertex once its body terminator is added. The graphs of a
* function form a tree following the nesting of hierarchy events.
*/
public class ScopeGraph implements Iterable<GraphVertex> {

    // The list of vertices in insertion order
    private final ArrayList<GraphVertex> nodes;

    // The hierarchy event whose body this graph represents; null for host
    private final HierarchyEvent hierarchy;

    private final GraphVertex start;

    private GraphVertex terminator;

    private ScopeGraph parent;

    private final List<ScopeGraph> subgraphs;

    /**
    * Constructs a graph with a single start vertex.
    *
    * @param hierarchy the hierarchy event of the level, null for host.
    */
    public ScopeGraph(HierarchyEvent hierarchy) {
        this.hierarchy = hierarchy;
        nodes = new ArrayList<GraphVertex>();
        subgraphs = new ArrayList<ScopeGraph>();
        parent = null;
        terminator = null;
        start = addVertex(VertexType.START, "start", "yellow", "box", 0,
                null, null);
    }

    /**
    * Creates a vertex in this graph.
    *
    * @return the new vertex.
    */
    public GraphVertex addVertex(VertexType type, String label, String color,
            String shape, int id, Event event, Event op) {
        GraphVertex v = new GraphVertex(this, type, label, color, shape, id,
                event, op);
        nodes.add(v);
        return v;
    }

    /**
    * Creates a copy of the specified vertex of another graph in this graph,
    * without edges and graph pointers.
    */
    public GraphVertex copyVertex(GraphVertex v) {
        if (v.getType() == VertexType.START) {
            return start;
        }
        return addVertex(v.getType(), v.getLabel(), v.getColor(),
                v.getShape(), v.getId(), v.getEvent(), v.getOp());
    }

    /**
    * Adds a directed edge between two vertices of this graph unless it
    * exists.
    *
    * @return true if the edge was added.
    * @throws IllegalArgumentException if a vertex belongs to another graph.
    */
    public boolean addEdge(GraphVertex from, GraphVertex to) {
        if (from.getGraph() != this || to.getGraph() != this) {
            throw new IllegalArgumentException("edge " + from + " -> " + to
                    + " crosses graphs");
        }
        if (from.getSuccs().contains(to)) {
            return false;
        }
        from.addSucc(to);
        to.addPred(from);
        PrintTools.printlnStatus(3, "edge", from, "->", to);
        return true;
    }

    public boolean hasEdge(GraphVertex from, GraphVertex to) {
        return from.getSuccs().contains(to);
    }

    public void removeEdge(GraphVertex from, GraphVertex to) {
        from.removeSucc(to);
        to.removePred(from);
    }

    /** Returns the vertices in insertion order; the list is not modifiable. */
    public List<GraphVertex> getVertices() {
        return Collections.unmodifiableList(nodes);
    }

    public Iterator<GraphVertex> iterator() {
        return getVertices().iterator();
    }

    public int size() {
        return nodes.size();
    }

    /** Returns the number of edges of this graph. */
    public int getEdgeCount() {
        int ret = 0;
        for (GraphVertex v : nodes) {
            ret += v.getOutDegree();
        }
        return ret;
    }

    public GraphVertex getStart() {
        return start;
    }

    /**
    * Returns the terminator vertex.
    *
    * @return the vertex, or null for the host graph or an unterminated body.
    */
    public GraphVertex getTerminator() {
        return terminator;
    }

    public void setTerminator(GraphVertex terminator) {
        this.terminator = terminator;
    }

    /**
    * Returns the hierarchy event of this level.
    *
    * @return the event, or null for the host graph.
    */
    public HierarchyEvent getHierarchy() {
        return hierarchy;
    }

    /** Returns the level name: "host", "launch", "partition" or "herd". */
    public String getLevelName() {
        if (hierarchy == null || hierarchy.getLevel() == null) {
            return "host";
        }
        return hierarchy.getLevel().getName();
    }

    public ScopeGraph getParent() {
        return parent;
    }

    /** Returns the child graphs in creation order. */
    public List<ScopeGraph> getSubgraphs() {
        return Collections.unmodifiableList(subgraphs);
    }

    /** Appends a child graph and makes this graph its parent. */
    public ScopeGraph addSubgraph(ScopeGraph child) {
        if (child.parent != null) {
            throw new IllegalArgumentException("graph already has a parent");
        }
        subgraphs.add(child);
        child.parent = this;
        return child;
    }

    /**
    * Returns the list of the vertices that have no predecessors.
    */
    public List<GraphVertex> getEntryNodes() {
        List<GraphVertex> ret = new ArrayList<GraphVertex>();
        for (GraphVertex v : nodes) {
            if (v.getInDegree() == 0) {
                ret.add(v);
            }
        }
        return ret;
    }

    /**
    * Returns the list of the vertices that have no successors.
    */
    public List<GraphVertex> getExitNodes() {
        List<GraphVertex> ret = new ArrayList<GraphVertex>();
        for (GraphVertex v : nodes) {
            if (v.getOutDegree() == 0) {
                ret.add(v);
            }
        }
        return ret;
    }

    /**
    * Computes a topological order of the vertices by repeatedly removing
    * vertices without remaining predecessors. The position of each vertex is
    * mapped by the key "top-order".
    *
    * @return the ordered vertices, or null if the graph has a cycle.
    */
    public List<GraphVertex> topologicalSort() {
        Map<GraphVertex, Integer> in_degree =
                new HashMap<GraphVertex, Integer>(nodes.size() * 2);
        LinkedList<GraphVertex> work_list = new LinkedList<GraphVertex>();
        for (GraphVertex v : nodes) {
            in_degree.put(v, v.getInDegree());
            if (v.getInDegree() == 0) {
                work_list.add(v);
            }
        }
        List<GraphVertex> ret = new ArrayList<GraphVertex>(nodes.size());
        while (!work_list.isEmpty()) {
            GraphVertex v = work_list.removeFirst();
            v.putData("top-order", ret.size());
            ret.add(v);
            for (GraphVertex succ : v.getSuccs()) {
                int degree = in_degree.get(succ) - 1;
                in_degree.put(succ, degree);
                if (degree == 0) {
                    work_list.add(succ);
                }
            }
        }
        if (ret.size() != nodes.size()) {
            for (GraphVertex v : nodes) {
                v.removeData("top-order");
            }
            return null;
        }
        return ret;
    }

    /**
    * Checks if the "to" vertex is reachable from the "from" vertex through at
    * least one edge.
    */
    public boolean isReachable(GraphVertex from, GraphVertex to) {
        Set<GraphVertex> visited = new HashSet<GraphVertex>();
        LinkedList<GraphVertex> work_list =
                new LinkedList<GraphVertex>(from.getSuccs());
        while (!work_list.isEmpty()) {
            GraphVertex v = work_list.removeFirst();
            if (v == to) {
                return true;
            }
            if (visited.add(v)) {
                work_list.addAll(v.getSuccs());
            }
        }
        return false;
    }

    /**
    * Converts the graph to a string in dot format.
    *
    * @param name the graph name.
    * @return the result string.
    */
    public String toDot(String name) {
        StringBuilder str = new StringBuilder();
        String sep = PrintTools.line_sep;
        str.append("digraph ").append(name).append(" {").append(sep);
        for (int i = 0; i < nodes.size(); i++) {
            str.append("  ").append(nodes.get(i).toDot("node" + i));
            str.append(";").append(sep);
        }
        for (int i = 0; i < nodes.size(); i++) {
            for (GraphVertex succ : nodes.get(i).getSuccs()) {
                str.append("  node").append(i).append(" -> node");
                str.append(nodes.indexOf(succ)).append(";").append(sep);
            }
        }
        str.append("}").append(sep);
        return str.toString();
    }

    @Override
    public String toString() {
        return "<ScopeGraph " + getLevelName() + ">" + nodes + "</ScopeGraph>";
    }

}
