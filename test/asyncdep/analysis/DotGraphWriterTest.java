package asyncdep.analysis;

import asyncdep.hir.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static asyncdep.ProgramFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class DotGraphWriterTest {

    @TempDir
    Path tmp;

    // host -> launch -> herd, with a channel from the launch to the herd
    private static ScopeGraph buildNest() {
        Function f = function("nest");
        f.getProgram().addChannel(new ChannelDeclaration("c",
                Arrays.asList(1)));
        Value buf = f.addBufferArgument(1, MemorySpace.L2);
        Block body = f.getBody();
        HierarchyEvent launch = hierarchy(body, HierarchyLevel.LAUNCH, deps(),
                buf);
        Value arg = launch.getKernelArguments().get(0);
        launch.getBody().add(new ChannelPutEvent(deps(), "c", arg));
        HierarchyEvent herd = hierarchy(launch.getBody(), HierarchyLevel.HERD,
                deps());
        ExecuteEvent local = alloc(herd.getBody(), 1, MemorySpace.L1);
        herd.getBody().add(new ChannelGetEvent(deps(local.getAsyncToken()),
                "c", allocated(local)));
        herd.terminate();
        launch.terminate();
        return TransitiveReduction.canonicalizeGraphs(
                new GraphBuilder(new DependencyContext()).build(f))
                .getReduced();
    }

    @Test
    public void writesOneFilePerGraph() {
        ScopeGraph host = buildNest();
        String dir = tmp.resolve("out").toString();

        List<File> files = DotGraphWriter.dumpGraphs(host, dir, "built_");

        assertEquals(3, files.size());
        assertTrue(new File(dir, "built_host.dot").isFile());
        assertTrue(new File(dir, "built_launch_0.dot").isFile());
        assertTrue(new File(dir, "built_herd_0_0.dot").isFile());
    }

    @Test
    public void flatGraphHasClustersAndChannelEdges() throws IOException {
        ScopeGraph host = buildNest();
        File file = DotGraphWriter.dumpFlatGraph(host, tmp.toString());

        assertNotNull(file);
        assertEquals("graph.dot", file.getName());
        String dot = new String(Files.readAllBytes(file.toPath()), "UTF-8");
        assertTrue(dot.startsWith("digraph G {"));
        assertTrue(dot.contains("rankdir=LR;"));
        assertTrue(dot.contains("subgraph cluster_launch0 {"));
        assertTrue(dot.contains("subgraph cluster_herd0 {"));
        assertTrue(dot.contains("label=\"herd0\";"));
        assertTrue(dot.contains("[style=\"dashed\"];"));
        assertEquals(dot, DotGraphWriter.toFlatDot(host));
    }

    @Test
    public void unusableDirectoryFallsBack() throws IOException {
        File blocker = tmp.resolve("file").toFile();
        assertTrue(blocker.createNewFile());

        assertNull(DotGraphWriter.getOutputDirectory(
                new File(blocker, "sub").getPath()));
        assertNull(DotGraphWriter.getOutputDirectory(""));
        File dir = DotGraphWriter.getOutputDirectory(
                tmp.resolve("a/b").toString());
        assertNotNull(dir);
        assertTrue(dir.isDirectory());
    }

    @Test
    public void vertexDotEscapesLabels() {
        ScopeGraph host = buildNest();
        String dot = host.getSubgraphs().get(0).toDot("launch_0");
        assertTrue(dot.startsWith("digraph launch_0 {"));
        assertTrue(dot.contains("label=\"ChannelPutOp@c(L2-->L1)\""));

        GraphVertex v = host.addVertex(VertexType.WAIT_ALL, "a \"b\"\nc",
                "crimson", "oval", 9, null, null);
        assertEquals("n [label=\"a \\\"b\\\"\\nc\", color=\"crimson\", "
                + "shape=\"oval\", style=\"filled\"]", v.toDot("n"));
    }

}
