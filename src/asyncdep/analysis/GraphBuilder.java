package asyncdep.analysis;

import asyncdep.hir.*;
import asyncdep.utils.DependencyUtils;

import java.util.*;

/**
* GraphBuilder builds the dependency graphs of a function: one
* {@link ScopeGraph} for the host level and one for the body of every
* launch, partition and herd event, nested the way the events are nested.
* Each vertex stands for one event; an edge u -> v means that the event of v
* waits on a token produced by the event of u.
* <p>
* Building the graphs writes a fresh id on every represented event. The
* vertices are recorded in the {@link DependencyContext} under their type and
* id.
*/
public class GraphBuilder {

    private static final String pass_name = "[GraphBuilder]";

    private final DependencyContext context;

    public GraphBuilder(DependencyContext context) {
        this.context = context;
    }

    /**
    * Builds the graph tree of the function.
    *
    * @return the host graph.
    */
    public ScopeGraph build(Function f) {
        ScopeGraph host = new ScopeGraph(null);
        addVerticesInBlock(f.getBody(), host);
        parseEdges(host);
        connectGraphs(host);
        PrintTools.printlnStatus(2, pass_name, "built graphs of", f.getName());
        return host;
    }

    private void addVerticesInBlock(Block block, ScopeGraph g) {
        for (Event e : block.getEvents()) {
            GraphVertex v = addVertexFromEvent(e, g);
            if (e instanceof HierarchyEvent) {
                ScopeGraph child = g.addSubgraph(
                        new ScopeGraph((HierarchyEvent)e));
                v.setNextGraph(child);
                addVerticesInBlock(((HierarchyEvent)e).getBody(), child);
            } else if (!(e instanceof ExecuteEvent)) {
                for (Block region : e.getRegions()) {
                    addVerticesInBlock(region, g);
                }
            }
        }
    }

    /**
    * Adds the vertices representing the event to the graph.
    *
    * @return the vertex standing for the event, the front of the chain for an
    *   execute event, or null if the event has no vertex.
    * @throws InternalError for an event outside any vertex rule.
    */
    private GraphVertex addVertexFromEvent(Event e, ScopeGraph g) {
        switch (e.getKind()) {
        case DMA:
            return addVertex(e, e, VertexType.DMA, "DmaMemcpyNdOp", "cyan",
                    "oval", g);
        case CHANNEL_PUT:
        case CHANNEL_GET:
            return addVertex(e, e, VertexType.CHANNEL,
                    getChannelLabel((ChannelEvent)e), "cyan", "oval", g);
        case EXECUTE:
            return addVerticesFromExecute((ExecuteEvent)e, g);
        case WAIT_ALL:
            return addVertex(e, e, VertexType.WAIT_ALL, "WaitAllOp", "crimson",
                    "oval", g);
        case FOR_LOOP:
            return addVertex(e, e, VertexType.FOR_LOOP, "ScfForOp", "crimson",
                    "box", g);
        case PARALLEL_LOOP:
            return addVertex(e, e, VertexType.PARALLEL_LOOP, "ScfParallelOp",
                    "crimson", "box", g);
        case HIERARCHY:
            return addVertex(e, e, VertexType.HIERARCHY,
                    getHierarchyLabel((HierarchyEvent)e, "Op"), "yellow", "box",
                    g);
        case HIERARCHY_TERMINATOR: {
            HierarchyEvent h = (HierarchyEvent)e.getParentEvent();
            GraphVertex v = addVertex(e, e, VertexType.HIERARCHY_TERMINATOR,
                    getHierarchyLabel(h, "Terminator"), "yellow", "box", g);
            g.setTerminator(v);
            return v;
        }
        case YIELD:
            if (e.getParentEvent() instanceof ForLoopEvent) {
                return addVertex(e, e, VertexType.TERMINATOR, "ScfForYieldOp",
                        "crimson", "box", g);
            }
            // Yields of parallel loops and conditionals join nothing.
            return null;
        case REDUCE:
            return addVertex(e, e, VertexType.TERMINATOR, "ScfReduceOp",
                    "crimson", "box", g);
        case CONDITIONAL:
        case SCALAR:
            return null;
        case PRIMITIVE:
        case EXECUTE_TERMINATOR:
            throw new InternalError(e.getName() + " outside of an execute");
        default:
            throw new InternalError("no vertex rule for " + e.getKind());
        }
    }

    private GraphVertex addVertex(Event event, Event op, VertexType type,
            String label, String color, String shape, ScopeGraph g) {
        int id = context.nextId(type);
        op.setId(id);
        GraphVertex v = g.addVertex(type, label, color, shape, id, event, op);
        context.register(v);
        return v;
    }

    // One vertex per body event, chained in body order.
    private GraphVertex addVerticesFromExecute(ExecuteEvent execute,
            ScopeGraph g) {
        if (execute.getTerminator() == null) {
            throw new InternalError("execute without terminator");
        }
        GraphVertex front = null;
        GraphVertex prev = null;
        for (Event e : execute.getBody().getEvents()) {
            GraphVertex v = addVertex(execute, e, VertexType.EXECUTE,
                    getExecuteLabel(e), "chartreuse", "oval", g);
            if (prev == null) {
                front = v;
            } else {
                g.addEdge(prev, v);
            }
            prev = v;
        }
        return front;
    }

    private static String getExecuteLabel(Event e) {
        if (e instanceof ExecuteTerminator) {
            return "ExecuteTerminatorOp";
        }
        if (!(e instanceof PrimitiveEvent)) {
            throw new InternalError("unexpected " + e.getName()
                    + " in execute body");
        }
        switch (((PrimitiveEvent)e).getPrimitiveKind()) {
        case LINALG:
            return "LinalgOp";
        case ALLOC:
            return "AllocOp";
        case DEALLOC:
            return "DeallocOp";
        case COPY:
            return "CopyOp";
        case AFFINE_APPLY:
            return "AffineApplyOp";
        case MULI:
            return "MuliOp";
        default:
            return "AddIOp";
        }
    }

    private static String getHierarchyLabel(HierarchyEvent h, String suffix) {
        if (h == null || h.getLevel() == null) {
            return "Hierarchy" + suffix;
        }
        String name = h.getLevel().getName();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1)
                + suffix;
    }

    /**
    * Returns the label of a channel vertex, naming the memory spaces on both
    * sides of the channel and the broadcast shape if there is one.
    *
    * @throws InternalError if the channel has no counterpart.
    */
    private static String getChannelLabel(ChannelEvent e) {
        ChannelEvent other = DependencyUtils.getTheOtherChannelEvents(e).get(0);
        StringBuilder sb = new StringBuilder();
        if (e instanceof ChannelPutEvent) {
            sb.append("ChannelPutOp@").append(e.getChannelName()).append("(");
            sb.append(DependencyUtils.getMemorySpaceAsString(e.getMemref()));
            sb.append("-->");
            sb.append(DependencyUtils.getMemorySpaceAsString(other.getMemref()));
        } else {
            sb.append("ChannelGetOp@").append(e.getChannelName()).append("(");
            sb.append(DependencyUtils.getMemorySpaceAsString(e.getMemref()));
            sb.append("<--");
            sb.append(DependencyUtils.getMemorySpaceAsString(other.getMemref()));
        }
        sb.append(")");
        Function f = e.getFunction();
        ChannelDeclaration decl = (f == null || f.getProgram() == null) ?
                null : f.getProgram().getChannel(e.getChannelName());
        if (decl != null && decl.isBroadcast()) {
            sb.append("\n(broadcast");
            sb.append(decl.getSize()).append("-->");
            sb.append(decl.getBroadcastShape()).append(")");
        }
        return sb.toString();
    }

    // Edges of every graph from the dependency lists, outer graphs first.
    private void parseEdges(ScopeGraph g) {
        Set<Event> visited = new HashSet<Event>();
        for (GraphVertex v : g.getVertices()) {
            Event event = v.getEvent();
            if (event == null || !visited.add(event)) {
                continue;
            }
            List<Value> deps = DependencyUtils.getDependencyList(event);
            if (deps == null) {
                continue;
            }
            GraphVertex sink = context.getVertex(event, true);
            for (Value token : deps) {
                if (!token.isToken()) {
                    continue;
                }
                for (Event producer
                        : DependencyTracer.traceOpsFromToken(event, token)) {
                    GraphVertex src = context.getVertex(producer, false);
                    if (src == null || src.getGraph() != g) {
                        PrintTools.printlnStatus(3, pass_name, "token", token,
                                "of", event.getName(),
                                "has no producer in the", g.getLevelName(),
                                "graph");
                        continue;
                    }
                    if (src != sink) {
                        g.addEdge(src, sink);
                    }
                }
            }
        }
        for (ScopeGraph child : g.getSubgraphs()) {
            parseEdges(child);
        }
    }

    private void connectGraphs(ScopeGraph g) {
        int hierarchy_vertices = 0;
        for (GraphVertex v : g.getVertices()) {
            if (v.getType() == VertexType.HIERARCHY) {
                hierarchy_vertices++;
                if (v.getNextGraph() == null
                        || v.getNextGraph().getParent() != g) {
                    throw new InternalError(
                            "mismatch between # graphs and hierarchy ops");
                }
            }
        }
        if (hierarchy_vertices != g.getSubgraphs().size()) {
            throw new InternalError(
                    "mismatch between # graphs and hierarchy ops");
        }
        if (g.getHierarchy() != null) {
            connectTerminatorInGraph(g);
        }
        connectStartNode(g);
        if (g.getTerminator() != null) {
            g.getTerminator().setNextGraph(g.getParent());
        }
        for (ScopeGraph child : g.getSubgraphs()) {
            connectGraphs(child);
        }
    }

    private static void connectTerminatorInGraph(ScopeGraph g) {
        GraphVertex terminator = g.getTerminator();
        if (terminator == null) {
            return;
        }
        for (GraphVertex v : g.getVertices()) {
            if (v != terminator && v != g.getStart()
                    && v.getOutDegree() == 0) {
                g.addEdge(v, terminator);
            }
        }
    }

    private static void connectStartNode(ScopeGraph g) {
        GraphVertex start = g.getStart();
        for (GraphVertex v : g.getVertices()) {
            if (v != start && v.getInDegree() == 0) {
                g.addEdge(start, v);
            }
        }
    }

}
