package asyncdep.analysis;

import asyncdep.hir.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static asyncdep.ProgramFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class DependencyTracerTest {

    private static void trace(AsyncEvent e) {
        AccessSummary summary = DependencyTracer.getPartialRegions(e);
        DependencyTracer.traceDependencyFromOp(summary.getReads(), e, "RAW");
        DependencyTracer.traceDependencyFromOp(summary.getWrites(), e,
                "WAW/WAR");
    }

    @Test
    public void readAfterTwoWritesDependsOnBoth() {
        Function f = function("abc");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Value src = f.addBufferArgument(1, MemorySpace.L3);
        Value dst = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dma(body, buf, src);
        DmaMemcpyEvent b = dma(body, buf, src);
        DmaMemcpyEvent c = dma(body, dst, buf);

        trace(a);
        trace(b);
        trace(c);

        assertTrue(a.getAsyncDependencies().isEmpty());
        assertEquals(deps(a.getAsyncToken()), b.getAsyncDependencies());
        assertEquals(deps(a.getAsyncToken(), b.getAsyncToken()),
                c.getAsyncDependencies());
    }

    @Test
    public void disjointConstantIndicesDoNotConflict() {
        Function f = function("disjoint");
        Value buf = f.addBufferArgument(1, MemorySpace.L2);
        Value src = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dmaAt(body, buf, constant(body, 0), src);
        DmaMemcpyEvent b = dmaAt(body, buf, constant(body, 1), src);

        trace(a);
        trace(b);

        assertTrue(b.getAsyncDependencies().isEmpty());
    }

    @Test
    public void equalConstantsAndUnconstrainedDimensionsConflict() {
        Function f = function("overlap");
        Value buf = f.addBufferArgument(1, MemorySpace.L2);
        Value src = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dmaAt(body, buf, constant(body, 3), src);
        DmaMemcpyEvent b = dmaAt(body, buf, constant(body, 3), src);
        DmaMemcpyEvent c = dma(body, buf, src);

        trace(b);
        trace(c);

        assertEquals(deps(a.getAsyncToken()), b.getAsyncDependencies());
        assertEquals(deps(a.getAsyncToken(), b.getAsyncToken()),
                c.getAsyncDependencies());
    }

    @Test
    public void regionsOfDifferentRankDoNotOverlap() {
        Value buf = Value.buffer(2, MemorySpace.L1);
        Value i = Value.index();
        PartialRegion whole = PartialRegion.whole(buf);
        PartialRegion row = new PartialRegion(buf, Arrays.asList(i));

        assertEquals(2, whole.getRank());
        assertNull(whole.getIndices().get(0));
        assertFalse(whole.mayOverlap(row));
        assertTrue(whole.mayOverlap(PartialRegion.whole(buf)));
        assertTrue(PartialRegion.mayBeEqual(i, i));
        assertFalse(PartialRegion.mayBeEqual(i, Value.index()));
    }

    @Test
    public void unknownModeIsFatal() {
        Function f = function("mode");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        DmaMemcpyEvent a = dma(f.getBody(), buf, buf);
        List<PartialRegion> regions =
                Collections.singletonList(PartialRegion.whole(buf));

        assertThrows(InternalError.class, () ->
                DependencyTracer.traceDependencyFromOp(regions, a, "WAR"));
    }

    @Test
    public void classifiesHierarchyArgumentsByTheirUses() {
        Function f = function("herd");
        Value in = f.addBufferArgument(1, MemorySpace.L3);
        Value out = f.addBufferArgument(1, MemorySpace.L3);
        Value unused = f.addBufferArgument(1, MemorySpace.L3);
        HierarchyEvent herd = hierarchy(f.getBody(), HierarchyLevel.HERD,
                deps(), in, out, unused);
        Block hb = herd.getBody();
        ExecuteEvent local = alloc(hb, 1, MemorySpace.L1);
        dma(hb, allocated(local), herd.getKernelArguments().get(0));
        ExecuteEvent compute = hb.add(new ExecuteEvent(deps()));
        compute.add(PrimitiveEvent.linalg("fill", deps(),
                deps(herd.getKernelArguments().get(1))));
        compute.terminate();
        herd.terminate();

        assertEquals('r', DependencyTracer.checkOperandReadOrWrite(
                herd.getKernelArguments().get(0)));
        assertEquals('w', DependencyTracer.checkOperandReadOrWrite(
                herd.getKernelArguments().get(1)));
        assertEquals('w', DependencyTracer.checkOperandReadOrWrite(
                herd.getKernelArguments().get(2)));
    }

    @Test
    public void hierarchyOperandsConflictByClassification() {
        Function f = function("host");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Value src = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent w = dma(body, buf, src);
        HierarchyEvent herd = hierarchy(body, HierarchyLevel.HERD, deps(),
                buf);
        ExecuteEvent local = alloc(herd.getBody(), 1, MemorySpace.L1);
        dma(herd.getBody(), allocated(local), herd.getKernelArguments().get(0));
        herd.terminate();
        DmaMemcpyEvent reader = dma(body, src, buf);
        DmaMemcpyEvent writer = dma(body, buf, src);

        DependencyTracer.traceDependencyFromOp(
                Collections.singletonList(PartialRegion.whole(buf)), herd,
                TracingMode.RAW);
        trace(reader);
        trace(writer);

        assertEquals(deps(w.getAsyncToken()), herd.getAsyncDependencies());
        // a read-only herd does not order a later reader
        assertFalse(reader.getAsyncDependencies().contains(
                herd.getAsyncToken()));
        assertTrue(writer.getAsyncDependencies().contains(
                herd.getAsyncToken()));
    }

    @Test
    public void elevatesSourceToAsyncAncestor() {
        Function f = function("elevate");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        HierarchyEvent launch = hierarchy(body, HierarchyLevel.LAUNCH, deps(),
                buf);
        DmaMemcpyEvent inner = dma(launch.getBody(),
                launch.getKernelArguments().get(0),
                launch.getKernelArguments().get(0));
        launch.terminate();
        WaitAllEvent sink = body.add(new WaitAllEvent(deps()));

        assertTrue(DependencyTracer.addDependencyBetweenOps(inner, sink));
        assertEquals(deps(launch.getAsyncToken()), sink.getAsyncDependencies());
    }

    @Test
    public void dropsDependencyWithoutAsyncAncestor() {
        Function f = function("loop");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        WaitAllEvent init = body.add(new WaitAllEvent(deps()));
        ForLoopEvent loop = body.add(new ForLoopEvent(constant(body, 0),
                constant(body, 4), constant(body, 1),
                deps(init.getAsyncToken())));
        DmaMemcpyEvent inner = dma(loop.getBody(), buf, buf,
                loop.getRegionIterArgs().get(0));
        loop.terminate(inner.getAsyncToken());
        WaitAllEvent sink = body.add(new WaitAllEvent(deps()));

        assertFalse(DependencyTracer.addDependencyBetweenOps(inner, sink));
        assertTrue(sink.getAsyncDependencies().isEmpty());
        assertThrows(InternalError.class, () ->
                DependencyTracer.addDependencyBetweenOps(inner, loop));
    }

    @Test
    public void resolvesTokensThroughLoopsAndConditionals() {
        Function f = function("tokens");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        WaitAllEvent init = body.add(new WaitAllEvent(deps()));
        ForLoopEvent loop = body.add(new ForLoopEvent(constant(body, 0),
                constant(body, 4), constant(body, 1),
                deps(init.getAsyncToken())));
        Value iter_arg = loop.getRegionIterArgs().get(0);
        DmaMemcpyEvent inner = dma(loop.getBody(), buf, buf, iter_arg);
        YieldEvent yield = loop.terminate(inner.getAsyncToken());

        ConditionalEvent cond = body.add(new ConditionalEvent(
                constant(body, 1), 1));
        DmaMemcpyEvent then_dma = dma(cond.getThenBlock(), buf, buf);
        cond.terminateThen(then_dma.getAsyncToken());
        DmaMemcpyEvent else_dma = dma(cond.getElseBlock(), buf, buf);
        cond.terminateElse(else_dma.getAsyncToken());
        WaitAllEvent join = body.add(new WaitAllEvent(
                deps(loop.getResult(0), cond.getResult(0))));

        assertEquals(Arrays.<Event>asList(loop),
                DependencyTracer.traceOpsFromToken(inner, iter_arg));
        assertEquals(Arrays.<Event>asList(init),
                DependencyTracer.traceOpsFromToken(loop,
                        init.getAsyncToken()));
        assertEquals(Arrays.<Event>asList(yield),
                DependencyTracer.traceOpsFromToken(join, loop.getResult(0)));
        assertEquals(Arrays.<Event>asList(then_dma, else_dma),
                DependencyTracer.traceOpsFromToken(join, cond.getResult(0)));
    }

    @Test
    public void resolvesParallelInitValues() {
        Function f = function("parallel");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        WaitAllEvent init = body.add(new WaitAllEvent(deps()));
        ParallelLoopEvent loop = body.add(new ParallelLoopEvent(
                deps(constant(body, 0)), deps(constant(body, 2)),
                deps(constant(body, 1)), deps(init.getAsyncToken())));
        DmaMemcpyEvent inner = dma(loop.getBody(), buf, buf,
                init.getAsyncToken());
        ReduceEvent reduce = loop.terminate(inner.getAsyncToken());

        assertEquals(Arrays.<Event>asList(loop),
                DependencyTracer.traceOpsFromToken(inner,
                        init.getAsyncToken()));
        assertEquals(Arrays.<Event>asList(reduce),
                DependencyTracer.traceOpsFromToken(init, loop.getResult(0)));
    }

    @Test
    public void tracesInductionVariablesAndTileIndices() {
        Function f = function("tiles");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Value src = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        ForLoopEvent loop = body.add(new ForLoopEvent(constant(body, 0),
                constant(body, 4), constant(body, 1),
                Collections.<Value>emptyList()));
        ExecuteEvent offset = loop.getBody().add(new ExecuteEvent(deps()));
        PrimitiveEvent apply = offset.add(PrimitiveEvent.affineApply(
                deps(loop.getInductionVar())));
        Value index = offset.terminate(apply.getResult(0)).get(0);
        DmaMemcpyEvent transfer = dmaAt(loop.getBody(), buf, index, src);
        loop.terminate();

        InductionTrace trace =
                DependencyTracer.traceDependentInductionVar(transfer);
        assertEquals(deps(loop.getInductionVar()), trace.getSources());
        assertTrue(trace.getHistory().contains(offset));

        DependencyTracer.traceTileIndices(
                DependencyTracer.getPartialRegions(transfer), transfer);
        assertEquals(deps(offset.getAsyncToken()),
                transfer.getAsyncDependencies());
    }

    @Test
    public void summarizesExecuteAccesses() {
        Value a = Value.buffer(2, MemorySpace.L1);
        Value b = Value.buffer(2, MemorySpace.L1);
        Value c = Value.buffer(2, MemorySpace.L1);
        ExecuteEvent e = new ExecuteEvent(deps());
        e.add(PrimitiveEvent.linalg("matmul", deps(a, b), deps(c)));
        e.terminate();

        AccessSummary summary = DependencyTracer.getPartialRegions(e);

        assertEquals(3, summary.getReads().size());
        assertEquals(1, summary.getWrites().size());
        assertSame(c, summary.getWrites().get(0).getBuffer());
    }

    @Test
    public void reconnectsLoopCarriedTokens() {
        Function f = function("reconnect");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        WaitAllEvent init = body.add(new WaitAllEvent(deps()));
        ForLoopEvent loop = body.add(new ForLoopEvent(constant(body, 0),
                constant(body, 4), constant(body, 1),
                deps(init.getAsyncToken())));
        DmaMemcpyEvent inner = dma(loop.getBody(), buf, buf);
        WaitAllEvent join = loop.getBody().add(new WaitAllEvent(deps()));
        loop.terminate(join.getAsyncToken());

        DependencyTracer.reconnectLoopCarriedDependencyFromOp(inner);

        assertEquals(deps(loop.getRegionIterArgs().get(0)),
                inner.getAsyncDependencies());
        assertEquals(deps(inner.getAsyncToken()), join.getAsyncDependencies());
    }

    @Test
    public void findsControlTokensBehindDataDependencies() {
        Function f = function("control");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        WaitAllEvent barrier = body.add(new WaitAllEvent(deps()));
        DmaMemcpyEvent a = dma(body, buf, buf, barrier.getAsyncToken());
        DmaMemcpyEvent b = dma(body, buf, buf, a.getAsyncToken());

        assertEquals(deps(barrier.getAsyncToken()),
                DependencyTracer.traceDependentControlToken(b));
        assertTrue(DependencyTracer.traceDependentControlToken(barrier)
                .isEmpty());
    }

    @Test
    public void findsParallelInitValuesOfAncestors() {
        Function f = function("parallel_control");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent p = dma(body, buf, buf);
        ParallelLoopEvent loop = body.add(new ParallelLoopEvent(
                deps(constant(body, 0)), deps(constant(body, 2)),
                deps(constant(body, 1)), deps(p.getAsyncToken())));
        DmaMemcpyEvent a = dma(loop.getBody(), buf, buf, p.getAsyncToken());
        DmaMemcpyEvent b = dma(loop.getBody(), buf, buf, a.getAsyncToken());
        loop.terminate(b.getAsyncToken());

        assertEquals(deps(p.getAsyncToken()),
                DependencyTracer.traceDependentControlToken(b));
        // outside the loop the same token orders nothing
        DmaMemcpyEvent c = dma(body, buf, buf, p.getAsyncToken());
        assertTrue(DependencyTracer.traceDependentControlToken(c).isEmpty());
    }

}
