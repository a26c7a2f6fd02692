package asyncdep.analysis;

import asyncdep.hir.*;
import asyncdep.utils.DependencyUtils;

import java.util.*;

/**
* DependencyTracer infers the dependencies of async events from the buffer
* regions and index values they access, and resolves dependency tokens back
* to the events producing them.
* <p>
* A dependency found between events of different blocks is elevated: the
* first ancestor of the source that is an async event located before the sink
* in the sink's block supplies the token. If there is no such ancestor, for
* example because the source sits in a non-async loop, the dependency is
* dropped and a message is printed at verbosity 2.
*/
public final class DependencyTracer {

    private static final String pass_name = "[DependencyTracer]";

    private DependencyTracer() {
    }

    /**
    * Returns the events producing the specified token as seen from the
    * consumer: the enclosing parallel loop for one of its initial values,
    * the for loop for one of its iteration arguments, the async event
    * producing it, the yield of a for loop or the reduce of a parallel loop
    * producing it, and the producers of the values yielded by the branches of
    * a conditional producing it.
    *
    * @param consumer the event using the token.
    * @param token the token.
    * @return the producing events, empty if there are none.
    */
    public static List<Event> traceOpsFromToken(Event consumer, Value token) {
        Set<Event> ret = new LinkedHashSet<Event>();
        traceOpsFromToken(consumer, token, ret);
        return new ArrayList<Event>(ret);
    }

    private static void traceOpsFromToken(Event consumer, Value token,
            Set<Event> ret) {
        ParallelLoopEvent parallel =
                DependencyUtils.getParallelInitValOwner(consumer, token);
        if (parallel != null) {
            ret.add(parallel);
            return;
        }
        ForLoopEvent loop = DependencyUtils.getForIterArgOwner(token);
        if (loop != null) {
            ret.add(loop);
            return;
        }
        Event def = token.getDefiningEvent();
        if (def instanceof AsyncEvent) {
            ret.add(def);
        } else if (def instanceof ForLoopEvent) {
            YieldEvent yield = ((ForLoopEvent)def).getYield();
            if (yield != null) {
                ret.add(yield);
            }
        } else if (def instanceof ParallelLoopEvent) {
            ReduceEvent reduce = ((ParallelLoopEvent)def).getReduce();
            if (reduce != null) {
                ret.add(reduce);
            }
        } else if (def instanceof ConditionalEvent) {
            ConditionalEvent cond = (ConditionalEvent)def;
            int i = token.getResultNumber();
            for (YieldEvent branch : Arrays.asList(cond.getThenYield(),
                    cond.getElseYield())) {
                if (branch != null && i < branch.getYieldedValues().size()) {
                    traceOpsFromToken(branch,
                            branch.getYieldedValues().get(i), ret);
                }
            }
        }
    }

    /**
    * Returns the buffer regions read and written by the event and the index
    * values it consumes and produces. The summary of an execute event is the
    * union of the summaries of its primitives.
    */
    public static AccessSummary getPartialRegions(Event e) {
        AccessSummary ret = new AccessSummary();
        if (e instanceof ExecuteEvent) {
            for (PrimitiveEvent p : ((ExecuteEvent)e).getPrimitives()) {
                ret.addAll(getPartialRegions(p));
            }
            return ret;
        }
        switch (e.getKind()) {
        case PRIMITIVE:
            addPrimitiveRegions((PrimitiveEvent)e, ret);
            break;
        case DMA: {
            DmaMemcpyEvent dma = (DmaMemcpyEvent)e;
            ret.getScalarOuts().addAll(dma.getDstOffsets());
            ret.getScalarOuts().addAll(dma.getDstSizes());
            ret.getScalarOuts().addAll(dma.getDstStrides());
            ret.getScalarIns().addAll(dma.getSrcOffsets());
            ret.getScalarIns().addAll(dma.getSrcSizes());
            ret.getScalarIns().addAll(dma.getSrcStrides());
            ret.getReads().add(new PartialRegion(dma.getSrcMemref(),
                    dma.getSrcOffsets()));
            ret.getWrites().add(new PartialRegion(dma.getDstMemref(),
                    dma.getDstOffsets()));
            break;
        }
        case CHANNEL_PUT: {
            ChannelEvent put = (ChannelEvent)e;
            ret.getScalarIns().addAll(put.getOffsets());
            ret.getScalarIns().addAll(put.getSizes());
            ret.getScalarIns().addAll(put.getStrides());
            ret.getReads().add(new PartialRegion(put.getMemref(),
                    put.getOffsets()));
            break;
        }
        case CHANNEL_GET: {
            ChannelEvent get = (ChannelEvent)e;
            ret.getScalarOuts().addAll(get.getOffsets());
            ret.getScalarOuts().addAll(get.getSizes());
            ret.getScalarOuts().addAll(get.getStrides());
            ret.getWrites().add(new PartialRegion(get.getMemref(),
                    get.getOffsets()));
            break;
        }
        case SCALAR:
            ret.getScalarIns().addAll(e.getOperands());
            ret.getScalarOuts().addAll(e.getResults());
            break;
        default:
            addGenericRegions(e, ret);
        }
        return ret;
    }

    private static void addPrimitiveRegions(PrimitiveEvent p,
            AccessSummary ret) {
        switch (p.getPrimitiveKind()) {
        case LINALG:
            for (Value v : p.getInputs()) {
                if (v.isBuffer()) {
                    ret.getReads().add(PartialRegion.whole(v));
                } else if (v.isIndex()) {
                    ret.getScalarIns().add(v);
                }
            }
            for (Value v : p.getOutputs()) {
                if (v.isBuffer()) {
                    ret.getReads().add(PartialRegion.whole(v));
                    ret.getWrites().add(PartialRegion.whole(v));
                } else if (v.isIndex()) {
                    ret.getScalarIns().add(v);
                    ret.getScalarOuts().add(v);
                }
            }
            break;
        case DEALLOC:
            for (Value v : p.getInputs()) {
                ret.getReads().add(PartialRegion.whole(v));
                ret.getWrites().add(PartialRegion.whole(v));
            }
            break;
        case COPY:
            for (Value v : p.getInputs()) {
                ret.getReads().add(PartialRegion.whole(v));
            }
            for (Value v : p.getOutputs()) {
                ret.getReads().add(PartialRegion.whole(v));
                ret.getWrites().add(PartialRegion.whole(v));
            }
            break;
        case AFFINE_APPLY:
        case MULI:
        case ADDI:
            ret.getScalarIns().addAll(p.getInputs());
            ret.getScalarOuts().addAll(p.getResults());
            break;
        default:
            addGenericRegions(p, ret);
        }
    }

    // Every buffer operand is read and written, every index operand is
    // consumed and produced.
    private static void addGenericRegions(Event e, AccessSummary ret) {
        for (Value v : e.getOperands()) {
            if (v.isBuffer()) {
                ret.getReads().add(PartialRegion.whole(v));
                ret.getWrites().add(PartialRegion.whole(v));
            } else if (v.isIndex()) {
                ret.getScalarIns().add(v);
                ret.getScalarOuts().add(v);
            }
        }
        for (Value v : e.getResults()) {
            if (v.isBuffer()) {
                ret.getWrites().add(PartialRegion.whole(v));
            } else if (v.isIndex()) {
                ret.getScalarOuts().add(v);
            }
        }
    }

    /**
    * Adds to the sink the dependencies on earlier events accessing the
    * specified regions.
    *
    * @param regions the regions accessed by the sink.
    * @param sink the event receiving the dependencies.
    * @param mode "RAW" to look for writers, "WAW/WAR" for any access.
    * @throws InternalError if the mode is unknown.
    */
    public static void traceDependencyFromOp(List<PartialRegion> regions,
            AsyncEvent sink, String mode) {
        traceDependencyFromOp(regions, sink, TracingMode.fromString(mode));
    }

    public static void traceDependencyFromOp(List<PartialRegion> regions,
            AsyncEvent sink, TracingMode mode) {
        for (PartialRegion region : regions) {
            traceDefiningEventAsDep(region.getBuffer(), sink);
            pushDepsAtCurrentScope(region.getBuffer(), sink, mode, region);
        }
    }

    // A buffer allocated by an execute event is ready once the event is done.
    private static void traceDefiningEventAsDep(Value v, AsyncEvent sink) {
        Event def = v.getDefiningEvent();
        if (def instanceof ExecuteEvent && def != sink) {
            if (sink.addAsyncDependencyIfNew(((ExecuteEvent)def)
                    .getAsyncToken())) {
                PrintTools.printlnStatus(3, pass_name, sink.getName(),
                        "depends on the producer of", v);
            }
        }
    }

    private static void pushDepsAtCurrentScope(Value buffer, AsyncEvent sink,
            TracingMode mode, PartialRegion tile) {
        Traversable scope = IRTools.getScope(buffer);
        if (scope == null) {
            return;
        }
        for (Event user : IRTools.getUses(scope, buffer)) {
            if (user == sink || sink.isProperAncestor(user)) {
                continue;
            }
            switch (user.getKind()) {
            case DMA: {
                DmaMemcpyEvent dma = (DmaMemcpyEvent)user;
                boolean link = false;
                if (mode != TracingMode.READ && dma.getDstMemref() == buffer) {
                    link |= tile.mayOverlap(new PartialRegion(buffer,
                            dma.getDstOffsets()));
                }
                if (mode != TracingMode.RAW && dma.getSrcMemref() == buffer) {
                    link |= tile.mayOverlap(new PartialRegion(buffer,
                            dma.getSrcOffsets()));
                }
                if (link) {
                    addDependencyBetweenOps(dma, sink);
                }
                break;
            }
            case CHANNEL_PUT: {
                ChannelEvent put = (ChannelEvent)user;
                if (mode != TracingMode.RAW && put.getMemref() == buffer
                        && tile.mayOverlap(new PartialRegion(buffer,
                                put.getOffsets()))) {
                    addDependencyBetweenOps(put, sink);
                }
                break;
            }
            case CHANNEL_GET: {
                ChannelEvent get = (ChannelEvent)user;
                if (mode != TracingMode.READ && get.getMemref() == buffer
                        && tile.mayOverlap(new PartialRegion(buffer,
                                get.getOffsets()))) {
                    addDependencyBetweenOps(get, sink);
                }
                break;
            }
            case PRIMITIVE: {
                PrimitiveEvent p = (PrimitiveEvent)user;
                ExecuteEvent execute = p.getExecute();
                if (execute == null) {
                    break;
                }
                if (p.getPrimitiveKind() != PrimitiveEvent.PrimitiveKind.LINALG
                        || mode != TracingMode.RAW
                        || p.getOutputs().contains(buffer)) {
                    addDependencyBetweenOps(execute, sink);
                }
                break;
            }
            case HIERARCHY: {
                HierarchyEvent h = (HierarchyEvent)user;
                List<Value> operands = h.getKernelOperands();
                for (int i = 0; i < operands.size(); i++) {
                    if (operands.get(i) != buffer) {
                        continue;
                    }
                    char rw = checkOperandReadOrWrite(
                            h.getKernelArguments().get(i));
                    if (mode == TracingMode.WAW_WAR || rw == mode.getCode()) {
                        addDependencyBetweenOps(h, sink);
                        break;
                    }
                }
                break;
            }
            default: {
                Event parent = user.getParentEvent();
                if (parent instanceof ExecuteEvent && parent != sink) {
                    addDependencyBetweenOps(parent, sink);
                }
            }
            }
        }
    }

    /**
    * Classifies the accesses to a hierarchy kernel argument inside the
    * hierarchy body.
    *
    * @return 'w' if any use writes, otherwise 'r' if any use reads, and 'w'
    *   for an unused argument.
    */
    public static char checkOperandReadOrWrite(Value arg) {
        if (!(arg.getOwner() instanceof HierarchyEvent)) {
            throw new IllegalArgumentException(arg
                    + " is not a hierarchy argument");
        }
        boolean read = false;
        boolean write = false;
        for (Event user : IRTools.getUses(arg.getOwner(), arg)) {
            switch (user.getKind()) {
            case DMA: {
                DmaMemcpyEvent dma = (DmaMemcpyEvent)user;
                read |= dma.getSrcMemref() == arg;
                write |= dma.getDstMemref() == arg;
                break;
            }
            case CHANNEL_PUT:
                read = true;
                break;
            case CHANNEL_GET:
                write = true;
                break;
            case PRIMITIVE: {
                PrimitiveEvent p = (PrimitiveEvent)user;
                switch (p.getPrimitiveKind()) {
                case LINALG:
                case COPY:
                    read |= p.getInputs().contains(arg);
                    write |= p.getOutputs().contains(arg);
                    break;
                default:
                    write = true;
                }
                break;
            }
            case HIERARCHY: {
                HierarchyEvent h = (HierarchyEvent)user;
                List<Value> operands = h.getKernelOperands();
                for (int i = 0; i < operands.size(); i++) {
                    if (operands.get(i) == arg) {
                        char rw = checkOperandReadOrWrite(
                                h.getKernelArguments().get(i));
                        read |= rw == 'r';
                        write |= rw == 'w';
                    }
                }
                break;
            }
            default:
                write = true;
            }
        }
        if (write) {
            return 'w';
        }
        return read ? 'r' : 'w';
    }

    /**
    * Makes the sink depend on the source, elevating the source to its first
    * async ancestor in the sink's block when the two are in different
    * blocks.
    *
    * @return true if a dependency is in place, false if none could be
    *   placed.
    * @throws InternalError if the sink is not an async event.
    */
    public static boolean addDependencyBetweenOps(Event source, Event sink) {
        if (!(sink instanceof AsyncEvent)) {
            throw new InternalError(sink.getName()
                    + " has no dependency list");
        }
        if (source == sink) {
            return false;
        }
        AsyncEvent async_sink = (AsyncEvent)sink;
        for (Event e = source; e != null; e = e.getParentEvent()) {
            if (e.getBlock() != null && e.getBlock() == sink.getBlock()
                    && e.isBeforeInBlock(sink) && e instanceof AsyncEvent) {
                if (async_sink.addAsyncDependencyIfNew(
                        ((AsyncEvent)e).getAsyncToken())) {
                    PrintTools.printlnStatus(3, pass_name, sink.getName(),
                            "depends on", e.getName());
                }
                return true;
            }
        }
        PrintTools.printlnStatus(2, pass_name, "no async ancestor of",
                source.getName(), "precedes", sink.getName(),
                "in its block; dependency dropped");
        return false;
    }

    /**
    * Makes the sink depend on the execute events producing the index values
    * it uses as region indices or scalar operands.
    */
    public static void traceTileIndices(AccessSummary summary,
            AsyncEvent sink) {
        List<Value> indices = new ArrayList<Value>();
        for (PartialRegion r : summary.getReads()) {
            indices.addAll(r.getIndices());
        }
        for (PartialRegion r : summary.getWrites()) {
            indices.addAll(r.getIndices());
        }
        indices.addAll(summary.getScalarIns());
        indices.addAll(summary.getScalarOuts());
        for (Value v : indices) {
            if (v != null) {
                pushTileIndexAsDep(v, sink);
            }
        }
    }

    private static void pushTileIndexAsDep(Value v, AsyncEvent sink) {
        Event def = v.getDefiningEvent();
        if (def instanceof ExecuteEvent && def != sink) {
            sink.addAsyncDependencyIfNew(((ExecuteEvent)def).getAsyncToken());
        }
    }

    /**
    * Traces the index operands of the event back to the loop induction
    * variables, for loop iteration arguments and hierarchy ids they are
    * computed from. Index values produced by execute events and scalar
    * arithmetic are followed through their operands.
    */
    public static InductionTrace traceDependentInductionVar(Event e) {
        List<Value> sources = new ArrayList<Value>();
        List<Event> history = new ArrayList<Event>();
        traceDependentInductionVar(e, sources, history);
        return new InductionTrace(sources, history);
    }

    private static void traceDependentInductionVar(Event e,
            List<Value> sources, List<Event> history) {
        List<Value> operands = new ArrayList<Value>();
        if (e instanceof ExecuteEvent) {
            for (PrimitiveEvent p : ((ExecuteEvent)e).getPrimitives()) {
                operands.addAll(p.getOperands());
            }
        } else {
            operands.addAll(e.getOperands());
        }
        for (Value v : operands) {
            if (!v.isIndex()) {
                continue;
            }
            if (isInductionSource(v)) {
                if (!sources.contains(v)) {
                    sources.add(v);
                }
                continue;
            }
            Event def = v.getDefiningEvent();
            if ((def instanceof ExecuteEvent || def instanceof ScalarEvent
                    || def instanceof PrimitiveEvent)
                    && !history.contains(def)) {
                history.add(def);
                traceDependentInductionVar(def, sources, history);
            }
        }
    }

    private static boolean isInductionSource(Value v) {
        Traversable owner = v.getOwner();
        if (owner instanceof ForLoopEvent || owner instanceof ParallelLoopEvent) {
            return true;
        }
        if (owner instanceof HierarchyEvent) {
            return ((HierarchyEvent)owner).getIds().contains(v);
        }
        return false;
    }

    /**
    * Finds the control tokens the event is ordered by: a for loop iteration
    * argument, a parallel loop initial value or a wait-all token among its
    * dependencies, or else among the dependencies of the async events it
    * depends on, searched recursively.
    *
    * @return the tokens found, empty if there are none.
    */
    public static List<Value> traceDependentControlToken(AsyncEvent e) {
        List<Value> ret = new ArrayList<Value>();
        traceDependentControlToken(e, ret, new HashSet<Event>());
        return ret;
    }

    private static void traceDependentControlToken(AsyncEvent e,
            List<Value> ret, Set<Event> visited) {
        for (Value token : e.getAsyncDependencies()) {
            if (DependencyUtils.getForIterArgOwner(token) != null
                    || DependencyUtils.getParallelInitValOwner(e, token)
                            != null
                    || token.getDefiningEvent() instanceof WaitAllEvent) {
                if (!ret.contains(token)) {
                    ret.add(token);
                }
                return;
            }
        }
        for (Value token : e.getAsyncDependencies()) {
            Event def = token.getDefiningEvent();
            if (def instanceof AsyncEvent && visited.add(def)) {
                traceDependentControlToken((AsyncEvent)def, ret, visited);
            }
        }
    }

    /**
    * Threads the loop-carried tokens of the loops enclosing the event
    * through it: the event depends on the token entering each iteration and
    * the wait-all joined by the loop terminator depends on the event.
    * Enclosing loops are handled from the inside out.
    *
    * @throws InternalError if the loop tokens are not produced as expected.
    */
    public static void reconnectLoopCarriedDependencyFromOp(Event op) {
        AsyncEvent async_op = getAsyncEventOf(op);
        Event parent = op.getParentEvent();
        if (parent instanceof ParallelLoopEvent) {
            ParallelLoopEvent loop = (ParallelLoopEvent)parent;
            if (loop.getInitVals().isEmpty() || loop.getReduce() == null) {
                throw new InternalError("parallel loop carries no token");
            }
            async_op.addAsyncDependencyIfNew(loop.getInitVals().get(0));
            getJoin(loop.getReduce().getReducedValues())
                    .addAsyncDependencyIfNew(op.getResult(0));
            reconnectLoopCarriedDependencyFromOp(loop);
        } else if (parent instanceof ForLoopEvent) {
            ForLoopEvent loop = (ForLoopEvent)parent;
            if (loop.getRegionIterArgs().isEmpty() || loop.getYield() == null) {
                throw new InternalError("for loop carries no token");
            }
            async_op.addAsyncDependencyIfNew(loop.getRegionIterArgs().get(0));
            getJoin(loop.getYield().getYieldedValues())
                    .addAsyncDependencyIfNew(op.getResult(0));
            reconnectLoopCarriedDependencyFromOp(loop);
        }
    }

    // The async event whose dependency list receives the loop token.
    private static AsyncEvent getAsyncEventOf(Event op) {
        Value token = null;
        if (op instanceof AsyncEvent) {
            return (AsyncEvent)op;
        } else if (op instanceof ParallelLoopEvent
                && !((ParallelLoopEvent)op).getInitVals().isEmpty()) {
            token = ((ParallelLoopEvent)op).getInitVals().get(0);
        } else if (op instanceof ForLoopEvent
                && !((ForLoopEvent)op).getIterOperands().isEmpty()) {
            token = ((ForLoopEvent)op).getIterOperands().get(0);
        }
        if (token == null || !(token.getDefiningEvent() instanceof AsyncEvent)) {
            throw new InternalError("no async event carries the token of "
                    + op.getName());
        }
        return (AsyncEvent)token.getDefiningEvent();
    }

    private static WaitAllEvent getJoin(List<Value> terminator_operands) {
        Event def = terminator_operands.isEmpty() ?
                null : terminator_operands.get(0).getDefiningEvent();
        if (!(def instanceof WaitAllEvent)) {
            throw new InternalError("loop terminator is not fed by a wait_all");
        }
        return (WaitAllEvent)def;
    }

}
