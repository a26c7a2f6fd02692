package asyncdep.analysis;

import java.util.HashMap;
import java.util.Map;

/**
* Maps the vertices of a graph to the vertices of its reduced copy and back.
*/
public class VertexMap {

    private final Map<GraphVertex, GraphVertex> a_to_b;

    private final Map<GraphVertex, GraphVertex> b_to_a;

    public VertexMap() {
        a_to_b = new HashMap<GraphVertex, GraphVertex>();
        b_to_a = new HashMap<GraphVertex, GraphVertex>();
    }

    public void put(GraphVertex a, GraphVertex b) {
        a_to_b.put(a, b);
        b_to_a.put(b, a);
    }

    /** Returns the copy of an original vertex, or null. */
    public GraphVertex getReduced(GraphVertex a) {
        return a_to_b.get(a);
    }

    /** Returns the original of a copied vertex, or null. */
    public GraphVertex getOriginal(GraphVertex b) {
        return b_to_a.get(b);
    }

    public int size() {
        return a_to_b.size();
    }

}
