package asyncdep.analysis;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeGraphTest {

    private static GraphVertex vertex(ScopeGraph g, int id) {
        return g.addVertex(VertexType.WAIT_ALL, "WaitAllOp", "crimson", "oval",
                id, null, null);
    }

    @Test
    public void ordersVerticesTopologically() {
        ScopeGraph g = new ScopeGraph(null);
        GraphVertex a = vertex(g, 1);
        GraphVertex b = vertex(g, 2);
        GraphVertex c = vertex(g, 3);
        g.addEdge(g.getStart(), a);
        g.addEdge(a, c);
        g.addEdge(g.getStart(), b);
        g.addEdge(b, c);

        assertFalse(g.addEdge(a, c));
        assertEquals(4, g.getEdgeCount());
        List<GraphVertex> order = g.topologicalSort();
        assertEquals(Arrays.asList(g.getStart(), a, b, c), order);
        assertEquals(Integer.valueOf(3), c.<Integer>getData("top-order"));
        assertEquals(Arrays.asList(c), g.getExitNodes());
        assertTrue(g.isReachable(g.getStart(), c));
        assertFalse(g.isReachable(c, c));
        assertFalse(g.isReachable(a, b));
    }

    @Test
    public void detectsCycles() {
        ScopeGraph g = new ScopeGraph(null);
        GraphVertex a = vertex(g, 1);
        GraphVertex b = vertex(g, 2);
        g.addEdge(a, b);
        g.addEdge(b, a);

        assertNull(g.topologicalSort());
        assertNull(a.getData("top-order"));
        assertTrue(g.isReachable(a, a));

        g.removeEdge(b, a);
        assertFalse(g.hasEdge(b, a));
        assertEquals(0, a.getInDegree());
        assertNotNull(g.topologicalSort());
    }

    @Test
    public void rejectsEdgesAcrossGraphs() {
        ScopeGraph host = new ScopeGraph(null);
        ScopeGraph child = host.addSubgraph(new ScopeGraph(null));
        GraphVertex inner = vertex(child, 1);

        assertSame(host, child.getParent());
        assertThrows(IllegalArgumentException.class, () ->
                host.addEdge(host.getStart(), inner));
        assertSame(child.getStart(), child.copyVertex(host.getStart()));
        GraphVertex copy = host.copyVertex(inner);
        assertSame(host, copy.getGraph());
        assertEquals("wait_all_1(WaitAllOp)", copy.toString());
    }

}
