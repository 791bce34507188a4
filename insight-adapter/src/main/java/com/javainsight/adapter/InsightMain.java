package com.javainsight.adapter;

import com.javainsight.adapter.config.InsightConfig;
import com.javainsight.adapter.config.InsightConfigReader;
import com.javainsight.adapter.navigation.DefinitionLocator;
import com.javainsight.adapter.navigation.SourceLocation;
import com.javainsight.adapter.report.ReportWriter;
import com.javainsight.adapter.workspace.WorkspaceAnalyzer;
import com.javainsight.engine.CancellationSignal;
import com.javainsight.engine.SourceDocument;
import com.javainsight.engine.model.InsightModel.ClassSummary;
import com.javainsight.engine.model.InsightModel.LifecycleEntry;
import com.javainsight.engine.model.InsightModel.LifecycleTimeline;
import com.javainsight.engine.model.InsightModel.MethodCallGraph;
import com.javainsight.engine.model.InsightModel.MethodRef;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar insight-adapter.jar summary    --file <java-file>
 *   java -jar insight-adapter.jar call-graph --file <java-file> (--offset <n> | --line <n>) [--text]
 *   java -jar insight-adapter.jar locks      --file <java-file>
 *   java -jar insight-adapter.jar services   --root <dir>
 *   java -jar insight-adapter.jar lifecycle  --root <dir> [--text]
 *   java -jar insight-adapter.jar definition --root <dir> --file <java-file> --line <n> --column <n>
 *
 * Every command also accepts {@code --config <json>}. Results go to stdout as JSON.
 */
public class InsightMain {

    private static final String USAGE = "Usage: java -jar insight-adapter.jar "
        + "<summary|call-graph|locks|services|lifecycle|definition> [flags] [--config <path>]";

    private static final Map<String, Set<String>> COMMAND_FLAGS = Map.of(
        "summary", Set.of("--file"),
        "call-graph", Set.of("--file", "--offset", "--line", "--text"),
        "locks", Set.of("--file"),
        "services", Set.of("--root"),
        "lifecycle", Set.of("--root", "--text"),
        "definition", Set.of("--root", "--file", "--line", "--column")
    );

    /** Flags that take no value. */
    private static final Set<String> SWITCHES = Set.of("--text");

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[java-insight] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[java-insight] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No command specified");
        }
        String command = args[0];
        Set<String> allowed = COMMAND_FLAGS.get(command);
        if (allowed == null) {
            throw new UsageException("Unknown command: " + command);
        }

        Map<String, String> flags = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String flag = args[i];
            if (!allowed.contains(flag) && !flag.equals("--config")) {
                throw new UsageException("Unknown flag for " + command + ": " + flag);
            }
            if (SWITCHES.contains(flag)) {
                flags.put(flag, "true");
            } else {
                flags.put(flag, requireNext(args, i++, flag));
            }
        }

        InsightConfig config = flags.containsKey("--config")
            ? new InsightConfigReader().read(Paths.get(flags.get("--config")))
            : InsightConfig.defaults();
        WorkspaceAnalyzer analyzer = new WorkspaceAnalyzer(config);
        ReportWriter report = new ReportWriter();
        boolean text = flags.containsKey("--text");

        switch (command) {
            case "summary" -> {
                Path file = requirePath(flags, "--file");
                ClassSummary summary = analyzer.summary(file)
                    .orElseThrow(() -> new IllegalStateException("No analysis available for " + file));
                report.write(summary, out);
            }
            case "call-graph" -> {
                Path file = requirePath(flags, "--file");
                Optional<MethodCallGraph> graph;
                if (flags.containsKey("--offset") == flags.containsKey("--line")) {
                    throw new UsageException("call-graph needs exactly one of --offset or --line");
                } else if (flags.containsKey("--offset")) {
                    graph = analyzer.callGraph(file, requireInt(flags, "--offset"));
                } else {
                    graph = analyzer.callGraphAtLine(file, requireInt(flags, "--line"));
                }
                if (text) {
                    printCallGraph(graph, out);
                } else {
                    report.write(graph.orElse(null), out);
                }
            }
            case "locks" -> report.write(analyzer.lockWarnings(requirePath(flags, "--file")), out);
            case "services" -> {
                Path root = requirePath(flags, "--root");
                System.err.println("[java-insight] Scanning for system services under: " + root);
                report.write(analyzer.findSystemServices(root, CancellationSignal.NONE), out);
            }
            case "lifecycle" -> {
                Path root = requirePath(flags, "--root");
                List<LifecycleTimeline> timelines = analyzer.buildLifecycleTimelines(root, CancellationSignal.NONE);
                if (text) {
                    printTimelines(timelines, out);
                } else {
                    report.write(timelines, out);
                }
            }
            case "definition" -> {
                Path root = requirePath(flags, "--root");
                Path file = requirePath(flags, "--file");
                int line = requireInt(flags, "--line");
                int column = requireInt(flags, "--column");
                SourceDocument document = WorkspaceAnalyzer.load(file)
                    .orElseThrow(() -> new IllegalStateException("Cannot read " + file));
                Optional<SourceLocation> location = new DefinitionLocator(analyzer.finder())
                    .locate(root, document, line, column, CancellationSignal.NONE);
                report.write(location.orElse(null), out);
            }
            default -> throw new UsageException("Unknown command: " + command);
        }
    }

    private static void printCallGraph(Optional<MethodCallGraph> graph, PrintStream out) {
        if (graph.isEmpty()) {
            out.println("No method at cursor");
            return;
        }
        out.println(graph.get().method());
        out.println("Callers:");
        for (MethodRef caller : graph.get().callers()) {
            out.println("  " + caller.displayLabel());
        }
        out.println("Callees:");
        for (MethodRef callee : graph.get().callees()) {
            out.println("  " + callee.displayLabel());
        }
    }

    private static void printTimelines(List<LifecycleTimeline> timelines, PrintStream out) {
        for (LifecycleTimeline timeline : timelines) {
            out.println(timeline.displayLabel());
            for (LifecycleEntry entry : timeline.entries()) {
                out.println("  " + entry.line() + ": " + entry.name());
            }
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static Path requirePath(Map<String, String> flags, String flag) {
        String value = flags.get(flag);
        if (value == null) {
            throw new UsageException(flag + " is required");
        }
        return Paths.get(value);
    }

    private static int requireInt(Map<String, String> flags, String flag) {
        String value = flags.get(flag);
        if (value == null) {
            throw new UsageException(flag + " is required");
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects a number, got: " + value);
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
