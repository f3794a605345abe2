package org.pncover;

import java.io.IOException;
import java.io.PrintStream;

import org.apache.log4j.Logger;
import org.pncover.engine.EngineSettings;
import org.pncover.engine.ReachabilityCoordinator;
import org.pncover.engine.ReachabilityEngine;
import org.pncover.engine.SequentialReachabilityEngine;
import org.pncover.exceptions.ReachabilityException;
import org.pncover.graph.ReachabilityGraph;
import org.pncover.io.NetInput;
import org.pncover.io.NetInputParser;
import org.pncover.io.PnmlNetConverter;
import org.pncover.utils.StringFileIO;

/**
 * Command line entry point: loads a net, builds its coverability graph and
 * writes it as DOT.
 *
 * <pre>
 * ReachabilityTreeGenerator &lt;net.json|net.pnml&gt; [output.dot] [--sequential] [--settings &lt;file.xml&gt;]
 * </pre>
 */
public class ReachabilityTreeGenerator {

    private static final Logger logger = Logger.getLogger(ReachabilityTreeGenerator.class);

    static final String USAGE =
            "Usage: ReachabilityTreeGenerator <net.json|net.pnml> [output.dot] [--sequential] [--settings <file.xml>]";

    private String inputPath;
    private String outputPath;
    private String settingsPath;
    private boolean sequential;

    public static void main(String[] args) {
        int exitCode = new ReachabilityTreeGenerator().run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * @return process exit code, 0 on success and 1 on usage, input, net or exploration errors
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        if (!parseArguments(args)) {
            logger.error(USAGE);
            err.println(USAGE);
            return 1;
        }

        logger.info("=== REACHABILITY TREE GENERATOR ===");
        logger.info("Input: " + inputPath);
        try {
            EngineSettings settings = settingsPath == null ? EngineSettings.load()
                    : EngineSettings.loadFile(settingsPath);
            NetInput input = loadInput(inputPath);

            ReachabilityEngine engine = sequential
                    ? new SequentialReachabilityEngine(input.getNet(), settings)
                    : new ReachabilityCoordinator(input.decompose(), settings);
            logger.info("Engine: " + engine.getName());

            ReachabilityGraph graph = engine.explore();
            String dot = settings.newDotWriter().write(graph);

            if (outputPath == null) {
                out.print(dot);
                out.flush();
            } else {
                StringFileIO.writeStringToFile(dot, outputPath);
                logger.info("Wrote " + graph.getNodeCount() + " nodes to " + outputPath);
            }
            logger.info("=== GENERATION COMPLETE: " + graph.getNodeCount() + " nodes, "
                    + graph.getEdgeCount() + " edges ===");
            return 0;
        } catch (ReachabilityException e) {
            logger.error("Generation failed: " + e);
            err.println(e.toString());
            return 1;
        } catch (IOException e) {
            logger.error("Cannot write output " + outputPath, e);
            err.println("Cannot write output " + outputPath + ": " + e.getMessage());
            return 1;
        }
    }

    boolean parseArguments(String[] args) {
        inputPath = null;
        outputPath = null;
        settingsPath = null;
        sequential = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--sequential".equals(arg)) {
                sequential = true;
            } else if ("--settings".equals(arg)) {
                if (i + 1 >= args.length) {
                    return false;
                }
                settingsPath = args[++i];
            } else if (arg.startsWith("--")) {
                return false;
            } else if (inputPath == null) {
                inputPath = arg;
            } else if (outputPath == null) {
                outputPath = arg;
            } else {
                return false;
            }
        }
        return inputPath != null;
    }

    static NetInput loadInput(String path) throws ReachabilityException {
        if (path.toLowerCase().endsWith(".pnml") || path.toLowerCase().endsWith(".xml")) {
            return new PnmlNetConverter().convertFile(path);
        }
        return new NetInputParser().parseFile(path);
    }

    boolean isSequential() {
        return sequential;
    }

    String getOutputPath() {
        return outputPath;
    }

    String getSettingsPath() {
        return settingsPath;
    }
}
