package asyncdep.analysis;

import asyncdep.hir.Event;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
* Class GraphVertex represents one node of a {@link ScopeGraph}. Besides the
* edge sets, a vertex carries its export attributes, the id shared with the
* represented event, the event owning the dependency list and the event the
* vertex stands for. The two events differ only for the vertices of an
* execute event, which all point to the execute event as dependency list
* owner. The "data" map holds satellite contents mapped by string keys.
*/
public class GraphVertex {

    private final ScopeGraph graph;

    private final VertexType type;

    private final String label;

    private final String color;

    private final String shape;

    private final int id;

    // Owner of the dependency list
    private final Event event;

    // Represented operation
    private final Event op;

    // Child graph of a hierarchy vertex, parent graph of a terminator
    private ScopeGraph next_graph;

    // Container for satellite objects
    private final Map<String, Object> data;

    private final Set<GraphVertex> preds;

    private final Set<GraphVertex> succs;

    GraphVertex(ScopeGraph graph, VertexType type, String label, String color,
            String shape, int id, Event event, Event op) {
        this.graph = graph;
        this.type = type;
        this.label = label;
        this.color = color;
        this.shape = shape;
        this.id = id;
        this.event = event;
        this.op = op;
        next_graph = null;
        data = new HashMap<String, Object>(1);
        preds = new LinkedHashSet<GraphVertex>(2);
        succs = new LinkedHashSet<GraphVertex>(2);
    }

    /** Returns the graph containing this vertex. */
    public ScopeGraph getGraph() {
        return graph;
    }

    public VertexType getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    public String getColor() {
        return color;
    }

    public String getShape() {
        return shape;
    }

    /** Returns the id of this vertex, 0 for a start vertex. */
    public int getId() {
        return id;
    }

    /**
    * Returns the event owning the dependency list this vertex stands for.
    *
    * @return the event, or null for a start vertex.
    */
    public Event getEvent() {
        return event;
    }

    /**
    * Returns the operation represented by this vertex; for the vertices of an
    * execute event this is the primitive or the terminator.
    */
    public Event getOp() {
        return op;
    }

    /**
    * Returns the graph this vertex points to: the child graph for a hierarchy
    * vertex, the parent graph for a hierarchy terminator.
    *
    * @return the graph, or null if the vertex points nowhere.
    */
    public ScopeGraph getNextGraph() {
        return next_graph;
    }

    public void setNextGraph(ScopeGraph next_graph) {
        this.next_graph = next_graph;
    }

    /**
    * Returns the data in the vertex mapped by the key. The warnings are
    * suppressed since it is the callers' responsibility to use putData and
    * getData consistently.
    *
    * @param key a string key.
    * @return the object mapped by the key. null if the key does not exist.
    */
    @SuppressWarnings("unchecked")
    public <T> T getData(String key) {
        return (T)data.get(key);
    }

    public void putData(String key, Object value) {
        data.put(key, value);
    }

    public void removeData(String key) {
        data.remove(key);
    }

    /**
    * Returns the set of successor vertices; the set is not modifiable.
    */
    public Set<GraphVertex> getSuccs() {
        return Collections.unmodifiableSet(succs);
    }

    /**
    * Returns the set of predecessor vertices; the set is not modifiable.
    */
    public Set<GraphVertex> getPreds() {
        return Collections.unmodifiableSet(preds);
    }

    public int getInDegree() {
        return preds.size();
    }

    public int getOutDegree() {
        return succs.size();
    }

    void addPred(GraphVertex pred) {
        preds.add(pred);
    }

    void addSucc(GraphVertex succ) {
        succs.add(succ);
    }

    void removePred(GraphVertex pred) {
        preds.remove(pred);
    }

    void removeSucc(GraphVertex succ) {
        succs.remove(succ);
    }

    /**
    * Returns the dot node statement of this vertex using the given node name.
    */
    public String toDot(String node_name) {
        return node_name + " [label=\"" + escape(label) + "\", color=\""
                + color + "\", shape=\"" + shape + "\", style=\"filled\"]";
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"")
                .replace("\n", "\\n");
    }

    @Override
    public String toString() {
        return type + "_" + id + "(" + label + ")";
    }

}
