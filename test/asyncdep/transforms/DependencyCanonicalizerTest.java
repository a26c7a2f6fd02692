package asyncdep.transforms;

import asyncdep.exec.Driver;
import asyncdep.hir.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static asyncdep.ProgramFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class DependencyCanonicalizerTest {

    private static DependencyCanonicalizer canonicalize(Function f) {
        DependencyCanonicalizer pass =
                new DependencyCanonicalizer(f.getProgram());
        TransformPass.run(pass);
        return pass;
    }

    @Test
    public void reducesTracedDependencies() {
        Function f = function("abc");
        Value src = f.addBufferArgument(1, MemorySpace.L3);
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Value dst = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dma(body, buf, src);
        DmaMemcpyEvent b = dma(body, buf, src);
        DmaMemcpyEvent c = dma(body, dst, buf);

        TransformPass.run(new TraceDependencies(f.getProgram()));
        assertEquals(deps(a.getAsyncToken(), b.getAsyncToken()),
                c.getAsyncDependencies());

        DependencyCanonicalizer pass = canonicalize(f);
        assertEquals(deps(), a.getAsyncDependencies());
        assertEquals(deps(a.getAsyncToken()), b.getAsyncDependencies());
        assertEquals(deps(b.getAsyncToken()), c.getAsyncDependencies());
        assertTrue(pass.getGraphs().containsKey(f));
        assertEquals(3, pass.getGraphs().get(f).getReduced().getEdgeCount());

        // a second run changes nothing
        canonicalize(f);
        assertEquals(deps(a.getAsyncToken()), b.getAsyncDependencies());
        assertEquals(deps(b.getAsyncToken()), c.getAsyncDependencies());
    }

    @Test
    public void rewritesEdgesThroughLoops() {
        Function f = function("loop");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        WaitAllEvent init = body.add(new WaitAllEvent(deps()));
        ForLoopEvent loop = body.add(new ForLoopEvent(constant(body, 0),
                constant(body, 4), constant(body, 1),
                deps(init.getAsyncToken())));
        Value carried = loop.getRegionIterArgs().get(0);
        DmaMemcpyEvent d = dma(loop.getBody(), buf, buf, carried,
                init.getAsyncToken());
        loop.terminate(d.getAsyncToken());
        DmaMemcpyEvent c = dma(body, buf, buf, loop.getResult(0),
                init.getAsyncToken());

        canonicalize(f);

        assertEquals(deps(carried), d.getAsyncDependencies());
        assertEquals(deps(loop.getResult(0)), c.getAsyncDependencies());
        assertSame(body, init.getParent());
        assertFalse(init.hasId());
    }

    @Test
    public void collapsesSingleInputWaitAll() {
        Function f = function("collapse");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dma(body, buf, buf);
        WaitAllEvent w = body.add(new WaitAllEvent(deps(a.getAsyncToken())));
        DmaMemcpyEvent b = dma(body, buf, buf, w.getAsyncToken());

        canonicalize(f);

        assertNull(w.getParent());
        assertEquals(deps(a.getAsyncToken()), b.getAsyncDependencies());
    }

    @Test
    public void forwardsWaitAllInputToTerminator() {
        Function f = function("forward");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        WaitAllEvent init = body.add(new WaitAllEvent(deps()));
        ForLoopEvent loop = body.add(new ForLoopEvent(constant(body, 0),
                constant(body, 4), constant(body, 1),
                deps(init.getAsyncToken())));
        DmaMemcpyEvent a = dma(loop.getBody(), buf, buf,
                loop.getRegionIterArgs().get(0));
        WaitAllEvent w = loop.getBody().add(
                new WaitAllEvent(deps(a.getAsyncToken())));
        YieldEvent yield = loop.terminate(w.getAsyncToken());

        canonicalize(f);

        assertNull(w.getParent());
        assertEquals(Arrays.asList(a.getAsyncToken()), yield.getOperands());
    }

    @Test
    public void removesUnusedExecute() {
        Function f = function("unused");
        Value buf = f.addBufferArgument(1, MemorySpace.L2);
        Block body = f.getBody();
        ExecuteEvent unused = alloc(body, 1, MemorySpace.L1);
        ExecuteEvent used = alloc(body, 1, MemorySpace.L1);
        DmaMemcpyEvent b = dma(body, allocated(used), buf,
                unused.getAsyncToken(), used.getAsyncToken());

        canonicalize(f);

        assertNull(unused.getParent());
        assertSame(body, used.getParent());
        assertEquals(deps(used.getAsyncToken()), b.getAsyncDependencies());
    }

    @Test
    public void keepsOnlyControlTokensOnHerds() {
        Function f = function("hierarchy");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        WaitAllEvent w0 = body.add(new WaitAllEvent(deps()));
        HierarchyEvent launch = hierarchy(body, HierarchyLevel.LAUNCH,
                deps(w0.getAsyncToken()), buf);
        Block launch_body = launch.getBody();
        Value arg = launch.getKernelArguments().get(0);
        DmaMemcpyEvent p = dma(launch_body, arg, arg);
        WaitAllEvent barrier = launch_body.add(new WaitAllEvent(deps()));
        HierarchyEvent herd = hierarchy(launch_body, HierarchyLevel.HERD,
                deps(p.getAsyncToken(), barrier.getAsyncToken()));
        herd.terminate();
        launch.terminate();

        DependencyCanonicalizer pass = canonicalize(f);

        assertEquals(deps(barrier.getAsyncToken()),
                herd.getAsyncDependencies());
        assertEquals(deps(w0.getAsyncToken()), launch.getAsyncDependencies());
        List<Value> dropped = pass.getDroppedDependencies().get(herd);
        assertEquals(deps(p.getAsyncToken()), dropped);
        assertFalse(pass.getDroppedDependencies().containsKey(launch));
        assertSame(launch_body, barrier.getParent());
        assertEquals(1, launch.getNumKernelOperands());
    }

    @Test
    public void erasesUnusedKernelOperandsInOrder() {
        Function f = function("args");
        Value x = f.addBufferArgument(1, MemorySpace.L3);
        Value y = f.addBufferArgument(1, MemorySpace.L3);
        Value z = f.addBufferArgument(1, MemorySpace.L3);
        HierarchyEvent herd = hierarchy(f.getBody(), HierarchyLevel.HERD,
                deps(), x, y, z);
        Value arg0 = herd.getKernelArguments().get(0);
        Value arg2 = herd.getKernelArguments().get(2);
        dma(herd.getBody(), arg0, arg2);
        herd.terminate();

        canonicalize(f);

        assertEquals(Arrays.asList(x, z), herd.getKernelOperands());
        assertEquals(Arrays.asList(arg0, arg2), herd.getKernelArguments());
        assertEquals(2, arg2.getArgNumber());
    }

    @Test
    public void removesRepeatedTokens() {
        Function f = function("repeat");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dma(body, buf, buf);
        WaitAllEvent w = body.add(new WaitAllEvent(deps()));
        DmaMemcpyEvent b = dma(body, buf, buf, a.getAsyncToken(),
                a.getAsyncToken(), w.getAsyncToken(), a.getAsyncToken());

        TransformPass.run(new RemoveDepListRepetition(f.getProgram()));

        assertEquals(deps(a.getAsyncToken(), w.getAsyncToken()),
                b.getAsyncDependencies());
    }

    @Test
    public void skipsListedFunctions() {
        Function f = function("skipped");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dma(body, buf, buf);
        DmaMemcpyEvent b = dma(body, buf, buf, a.getAsyncToken(),
                a.getAsyncToken());
        Driver.setOptionValue("skip-functions", "other,skipped");
        try {
            canonicalize(f);
        } finally {
            Driver.resetOptions();
        }
        assertEquals(2, b.getAsyncDependencies().size());
    }

    @Test
    public void liftsSourcesOutOfConditionals() {
        Function f = function("branch");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        ConditionalEvent cond = body.add(new ConditionalEvent(
                constant(body, 1), 1));
        DmaMemcpyEvent a = dma(cond.getThenBlock(), buf, buf);
        DmaMemcpyEvent b = dma(cond.getThenBlock(), buf, buf,
                a.getAsyncToken());
        cond.terminateThen(b.getAsyncToken());
        DmaMemcpyEvent e = dma(cond.getElseBlock(), buf, buf);
        cond.terminateElse(e.getAsyncToken());
        DmaMemcpyEvent after = dma(body, buf, buf, cond.getResult(0));

        canonicalize(f);

        // same branch: the sink keeps the token of its sibling
        assertEquals(deps(a.getAsyncToken()), b.getAsyncDependencies());
        // outside: both branch ends collapse into the conditional result
        assertEquals(deps(cond.getResult(0)), after.getAsyncDependencies());
        assertEquals(Arrays.asList(b.getAsyncToken()),
                cond.getThenYield().getOperands());
    }

    @Test
    public void rewritesEdgesThroughParallelLoops() {
        Function f = function("parallel");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        WaitAllEvent init = body.add(new WaitAllEvent(deps()));
        ParallelLoopEvent loop = body.add(new ParallelLoopEvent(
                deps(constant(body, 0)), deps(constant(body, 2)),
                deps(constant(body, 1)), deps(init.getAsyncToken())));
        DmaMemcpyEvent inner = dma(loop.getBody(), buf, buf,
                init.getAsyncToken());
        loop.terminate(inner.getAsyncToken());
        DmaMemcpyEvent c = dma(body, buf, buf, loop.getResult(0),
                init.getAsyncToken());

        canonicalize(f);

        assertEquals(deps(init.getAsyncToken()), inner.getAsyncDependencies());
        assertEquals(deps(loop.getResult(0)), c.getAsyncDependencies());
        assertSame(body, init.getParent());
    }

    @Test
    public void removesUnconsumedJoins() {
        Function f = function("joins");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dma(body, buf, buf);
        DmaMemcpyEvent b = dma(body, buf, buf);
        WaitAllEvent w0 = body.add(new WaitAllEvent(
                deps(a.getAsyncToken(), b.getAsyncToken())));
        WaitAllEvent w1 = body.add(new WaitAllEvent(
                deps(w0.getAsyncToken(), a.getAsyncToken())));

        TransformPass.run(new RemoveUnusedEvents(f.getProgram()));

        assertNull(w1.getParent());
        assertNull(w0.getParent());
        assertEquals(Arrays.<Event>asList(a, b), body.getEvents());
    }

}
