package asyncdep.exec;

import asyncdep.hir.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;

import static asyncdep.ProgramFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class DriverTest {

    @TempDir
    Path tmp;

    @BeforeAll
    public static void keepRunning() {
        Tools.exitThrowsException(true);
    }

    @AfterEach
    public void restoreOptions() {
        Driver.resetOptions();
    }

    @Test
    public void parsesOptions() {
        Driver driver = new Driver();
        driver.parseCommandLine(new String[] {"-verbosity=0", "-dump-graphs",
                "-canonicalize=0", "-skip-functions=f, g,", "-no-such-option",
                "plain"});

        assertEquals("0", Driver.getOptionValue("verbosity"));
        assertTrue(Driver.isEnabled("dump-graphs"));
        assertFalse(Driver.isEnabled("canonicalize"));
        assertFalse(Driver.isEnabled("trace-deps"));
        assertEquals(new HashSet<String>(Arrays.asList("f", "g")),
                Driver.getSkipFunctionSet());
        assertNull(Driver.getOptionValue("no-such-option"));
    }

    @Test
    public void resetRestoresDefaults() {
        Driver.setOptionValue("outdir", "elsewhere");
        Driver.setOptionValue("trace-deps", "1");
        Driver.resetOptions();

        assertEquals("asyncdep_output", Driver.getOptionValue("outdir"));
        assertEquals("1", Driver.getOptionValue("canonicalize"));
        assertNull(Driver.getOptionValue("trace-deps"));
        assertTrue(Driver.getSkipFunctionSet().isEmpty());
    }

    @Test
    public void helpExits() {
        assertThrows(RuntimeException.class, () ->
                new Driver().parseCommandLine(new String[] {"-help"}));
        assertNull(Driver.getOptionValue("help"));
    }

    @Test
    public void dumpsAndLoadsOptionFiles() throws IOException {
        Driver driver = new Driver();
        File dumped = tmp.resolve("options.asyncdep").toFile();
        driver.dumpOptionsFile(dumped);
        String contents = new String(Files.readAllBytes(dumped.toPath()),
                "UTF-8");
        assertTrue(contents.contains("#Option: trace-deps"));
        assertTrue(contents.contains("verbosity=0"));
        assertTrue(contents.contains("#dump-graphs"));

        File custom = tmp.resolve("custom.asyncdep").toFile();
        Files.write(custom.toPath(), Arrays.asList("# comment",
                "outdir=graphs", "trace-deps", ""));
        driver.loadOptionsFile(custom);
        assertEquals("graphs", Driver.getOptionValue("outdir"));
        assertTrue(Driver.isEnabled("trace-deps"));

        assertThrows(RuntimeException.class, () ->
                driver.loadOptionsFile(tmp.resolve("missing").toFile()));
    }

    @Test
    public void runsTheConfiguredPasses() {
        Function f = function("abc");
        Value src = f.addBufferArgument(1, MemorySpace.L3);
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Value dst = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dma(body, buf, src);
        DmaMemcpyEvent b = dma(body, buf, src);
        DmaMemcpyEvent c = dma(body, dst, buf);

        new Driver().run(new String[] {"-trace-deps"}, f.getProgram());

        assertEquals(deps(), a.getAsyncDependencies());
        assertEquals(deps(a.getAsyncToken()), b.getAsyncDependencies());
        assertEquals(deps(b.getAsyncToken()), c.getAsyncDependencies());
    }

    @Test
    public void analysisOnlyRunDumpsGraphs() {
        Function f = function("dumped");
        Value buf = f.addBufferArgument(1, MemorySpace.L3);
        Block body = f.getBody();
        DmaMemcpyEvent a = dma(body, buf, buf);
        DmaMemcpyEvent b = dma(body, buf, buf, a.getAsyncToken(),
                a.getAsyncToken());
        String outdir = tmp.resolve("out").toString();

        new Driver().run(new String[] {"-canonicalize=0", "-dump-graphs",
                "-dump-flat-graph", "-outdir=" + outdir}, f.getProgram());

        File dir = new File(outdir, "dumped");
        assertTrue(new File(dir, "built_host.dot").isFile());
        assertTrue(new File(dir, "host.dot").isFile());
        assertTrue(new File(dir, "graph.dot").isFile());
        // the dependency lists are left as they are
        assertEquals(2, b.getAsyncDependencies().size());
    }

}
