package asyncdep.analysis;

import asyncdep.hir.Event;
import asyncdep.hir.ExecuteEvent;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
* Per-run state of the dependency graph construction: the id counters and
* the map from (vertex type, id) to the vertex. Ids are assigned by
* pre-incrementing the counter of the type's id category, so the first id of
* every category is 1.
*/
public class DependencyContext {

    private final Map<String, Integer> counters;

    private final Map<VertexType, Map<Integer, GraphVertex>> vertices;

    public DependencyContext() {
        counters = new HashMap<String, Integer>();
        vertices = new EnumMap<VertexType, Map<Integer, GraphVertex>>(
                VertexType.class);
    }

    /** Returns the next id for a vertex of the specified type. */
    public int nextId(VertexType type) {
        String category = type.getIdCategory();
        if (category == null) {
            throw new InternalError("no id category for " + type);
        }
        Integer last = counters.get(category);
        int id = (last == null) ? 1 : last + 1;
        counters.put(category, id);
        return id;
    }

    /** Records the vertex under its type and id. */
    public void register(GraphVertex v) {
        Map<Integer, GraphVertex> by_id = vertices.get(v.getType());
        if (by_id == null) {
            by_id = new HashMap<Integer, GraphVertex>();
            vertices.put(v.getType(), by_id);
        }
        if (by_id.put(v.getId(), v) != null) {
            throw new InternalError("duplicate vertex " + v);
        }
    }

    /**
    * Returns the vertex with the specified type and id.
    *
    * @return the vertex, or null if there is none.
    */
    public GraphVertex getVertex(VertexType type, int id) {
        Map<Integer, GraphVertex> by_id = vertices.get(type);
        return (by_id == null) ? null : by_id.get(id);
    }

    /**
    * Returns the graph containing the vertex with the specified type and id.
    *
    * @return the graph, or null if there is no such vertex.
    */
    public ScopeGraph getGraph(VertexType type, int id) {
        GraphVertex v = getVertex(type, id);
        return (v == null) ? null : v.getGraph();
    }

    /**
    * Returns the vertex representing the event. An execute event is
    * represented by a chain of vertices: <var>front</var> selects the first
    * vertex of the chain, the dependency sink, otherwise the terminator
    * vertex, the dependency source, is returned.
    *
    * @param e the event.
    * @param front true for the front of an execute chain.
    * @return the vertex, or null if the event has none.
    */
    public GraphVertex getVertex(Event e, boolean front) {
        if (e instanceof ExecuteEvent) {
            ExecuteEvent execute = (ExecuteEvent)e;
            if (execute.getBody().isEmpty()) {
                return null;
            }
            e = front ? execute.getBody().getEvents().get(0)
                    : execute.getBody().getLast();
        }
        VertexType type = VertexType.forEvent(e);
        if (type == null || !e.hasId()) {
            return null;
        }
        GraphVertex v = getVertex(type, e.getId());
        if (v == null || v.getOp() != e) {
            return null;
        }
        return v;
    }

}
