package asyncdep.utils;

import asyncdep.hir.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static asyncdep.ProgramFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class DependencyUtilsTest {

    @Test
    public void pairsChannelsAcrossFunctions() {
        Function producer = function("producer");
        Function consumer = producer.getProgram().addFunction(
                new Function("consumer"));
        Value src = producer.addBufferArgument(1, MemorySpace.L3);
        Value dst = consumer.addBufferArgument(1, MemorySpace.L1);
        ChannelPutEvent put = producer.getBody().add(
                new ChannelPutEvent(deps(), "c", src));
        ChannelGetEvent get0 = consumer.getBody().add(
                new ChannelGetEvent(deps(), "c", dst));
        ChannelGetEvent get1 = consumer.getBody().add(
                new ChannelGetEvent(deps(), "c", dst));
        consumer.getBody().add(new ChannelGetEvent(deps(), "d", dst));

        List<ChannelEvent> gets = DependencyUtils.getTheOtherChannelEvents(put);
        assertEquals(Arrays.<ChannelEvent>asList(get0, get1), gets);
        assertEquals(Arrays.<ChannelEvent>asList(put),
                DependencyUtils.getTheOtherChannelEvents(get1));

        ChannelPutEvent detached = new ChannelPutEvent(deps(), "c", src);
        assertThrows(InternalError.class, () ->
                DependencyUtils.getTheOtherChannelEvents(detached));
    }

    @Test
    public void channelWithoutCounterpartIsFatal() {
        Function f = function("lonely");
        Value dst = f.addBufferArgument(1, MemorySpace.L1);
        ChannelGetEvent get = f.getBody().add(
                new ChannelGetEvent(deps(), "nobody", dst));

        assertThrows(InternalError.class, () ->
                DependencyUtils.getTheOtherChannelEvents(get));
    }

    @Test
    public void selectsTheDependencyListOfEachKind() {
        Function f = function("lists");
        Value buf = f.addBufferArgument(1, null);
        Block body = f.getBody();
        WaitAllEvent init = body.add(new WaitAllEvent(deps()));
        ForLoopEvent loop = body.add(new ForLoopEvent(constant(body, 0),
                constant(body, 4), constant(body, 1),
                deps(init.getAsyncToken())));
        DmaMemcpyEvent inner = dma(loop.getBody(), buf, buf,
                loop.getRegionIterArgs().get(0));
        YieldEvent yield = loop.terminate(inner.getAsyncToken());

        assertSame(inner.getAsyncDependencies(),
                DependencyUtils.getDependencyList(inner));
        assertEquals(deps(init.getAsyncToken()),
                DependencyUtils.getDependencyList(loop));
        assertEquals(deps(inner.getAsyncToken()),
                DependencyUtils.getDependencyList(yield));
        assertNull(DependencyUtils.getDependencyList(
                body.getEvents().get(1)));

        assertSame(loop, DependencyUtils.getForIterArgOwner(
                loop.getRegionIterArgs().get(0)));
        assertNull(DependencyUtils.getForIterArgOwner(loop.getInductionVar()));
        assertNull(DependencyUtils.getParallelInitValOwner(inner,
                init.getAsyncToken()));
        assertEquals("L3", DependencyUtils.getMemorySpaceAsString(buf));
    }

}
