package org.pncover;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.pncover.graph.DotGraphComparator;
import org.pncover.utils.StringFileIO;

public class TestReachabilityTreeGenerator {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        PrintStream out = new PrintStream(outBytes, true, "UTF-8");
        PrintStream err = new PrintStream(errBytes, true, "UTF-8");
        return new ReachabilityTreeGenerator().run(args, out, err);
    }

    private String copyResource(String name) throws Exception {
        File file = new File(folder.getRoot(), new File(name).getName());
        StringFileIO.writeStringToFile(StringFileIO.readResourceAsString(name), file.getPath());
        return file.getPath();
    }

    @Test(timeout = 30000)
    public void printsDotToStdout() throws Exception {
        Assert.assertEquals(0, run(copyResource("nets/two-cycle.json")));
        String dot = outBytes.toString("UTF-8");
        Assert.assertTrue(dot.startsWith("digraph G {"));
        Assert.assertTrue(dot.contains("m_0 [label=\"m_0\\n[1, 0]\"];"));
        Assert.assertTrue(dot.contains("m_1 -> m_0 [label=\"t1\"];"));
    }

    @Test(timeout = 30000)
    public void writesOutputFile() throws Exception {
        File output = new File(folder.getRoot(), "out/unbounded.dot");
        Assert.assertEquals(0, run(copyResource("nets/unbounded.json"), output.getPath()));
        String dot = StringFileIO.readFileAsString(output.getPath());
        Assert.assertTrue(DotGraphComparator.extractNodeMarkings(dot).contains("[1, ω]"));
        Assert.assertEquals("", outBytes.toString("UTF-8"));
    }

    @Test(timeout = 30000)
    public void sequentialAndConcurrentAgree() throws Exception {
        String input = copyResource("nets/mutex.json");
        File concurrent = new File(folder.getRoot(), "concurrent.dot");
        File sequential = new File(folder.getRoot(), "sequential.dot");
        Assert.assertEquals(0, run(input, concurrent.getPath()));
        Assert.assertEquals(0, run("--sequential", input, sequential.getPath()));
        Assert.assertTrue(DotGraphComparator.sameNodeMarkings(StringFileIO.readFileAsString(concurrent.getPath()),
                StringFileIO.readFileAsString(sequential.getPath())));
    }

    @Test(timeout = 30000)
    public void acceptsPnmlAndSettingsFile() throws Exception {
        File settings = new File(folder.getRoot(), "settings.xml");
        StringFileIO.writeStringToFile("<ReachabilitySettings><EngineSettings><nodePrefix>s</nodePrefix>"
                + "<includeRevisitEdges>false</includeRevisitEdges></EngineSettings></ReachabilitySettings>",
                settings.getPath());
        Assert.assertEquals(0, run(copyResource("nets/two-cycle.pnml"), "--settings", settings.getPath()));
        String dot = outBytes.toString("UTF-8");
        Assert.assertTrue(dot.contains("s0 -> s1 [label=\"t0\"];"));
        Assert.assertFalse(dot.contains("s1 -> s0"));
    }

    @Test
    public void usageErrors() throws Exception {
        Assert.assertEquals(1, run());
        Assert.assertEquals(1, run("a.json", "b.dot", "c"));
        Assert.assertEquals(1, run("a.json", "--settings"));
        Assert.assertEquals(1, run("a.json", "--parallel"));
        Assert.assertTrue(errBytes.toString("UTF-8").contains("Usage:"));
    }

    @Test
    public void inputAndNetErrorsExitWithOne() throws Exception {
        Assert.assertEquals(1, run(new File(folder.getRoot(), "absent.json").getPath()));
        Assert.assertTrue(errBytes.toString("UTF-8").contains("INPUT_ERROR"));
        Assert.assertEquals(1, run(copyResource("nets/unowned-transition.json")));
        Assert.assertTrue(errBytes.toString("UTF-8").contains("INVALID_NET"));
    }

    @Test
    public void parsesFlagsInAnyPosition() {
        ReachabilityTreeGenerator generator = new ReachabilityTreeGenerator();
        Assert.assertTrue(generator.parseArguments(new String[] { "--settings", "s.xml", "net.json", "--sequential" }));
        Assert.assertTrue(generator.isSequential());
        Assert.assertEquals("s.xml", generator.getSettingsPath());
        Assert.assertNull(generator.getOutputPath());
    }
}
