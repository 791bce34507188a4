package com.javainsight.adapter.workspace;

import com.javainsight.adapter.config.InsightConfig;
import com.javainsight.adapter.parse.JdtCstParser;
import com.javainsight.engine.CancellationSignal;
import com.javainsight.engine.JavaFileAnalyzer;
import com.javainsight.engine.SourceDocument;
import com.javainsight.engine.cache.AnalysisCache;
import com.javainsight.engine.call_graph.CallGraphBuilder;
import com.javainsight.engine.concurrency.LockHazardDetector;
import com.javainsight.engine.heuristics.LifecycleTimelineExtractor;
import com.javainsight.engine.model.InsightModel.ClassSummary;
import com.javainsight.engine.model.InsightModel.ConcurrencyWarning;
import com.javainsight.engine.model.InsightModel.JavaFileAnalysis;
import com.javainsight.engine.model.InsightModel.LifecycleTimeline;
import com.javainsight.engine.model.InsightModel.MethodCallGraph;
import com.javainsight.engine.model.InsightModel.SystemServiceSummary;
import com.javainsight.engine.parse.JavaGrammarParser;
import com.javainsight.engine.text.LineIndex;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Host-side scans over a workspace directory. All per-file analysis goes through one
 * {@link AnalysisCache}, so repeated scans only re-parse files whose content changed.
 */
public class WorkspaceAnalyzer {

    private static final String JAVA_EXTENSION = ".java";

    private final AnalysisCache cache;
    private final JavaSourceFinder finder;
    private final LifecycleTimelineExtractor lifecycleExtractor;
    private final CallGraphBuilder callGraphBuilder = new CallGraphBuilder();
    private final LockHazardDetector lockHazardDetector = new LockHazardDetector();

    public WorkspaceAnalyzer(InsightConfig config) {
        this(config, new JdtCstParser());
    }

    public WorkspaceAnalyzer(InsightConfig config, JavaGrammarParser parser) {
        this.cache = new AnalysisCache(new JavaFileAnalyzer(parser), config.getMaxParseBytes());
        this.finder = new JavaSourceFinder(config.getExcludedDirs());
        this.lifecycleExtractor =
            new LifecycleTimelineExtractor(config.getLifecycleFiles(), config.getLifecycleMethods());
    }

    public JavaSourceFinder finder() { return finder; }

    AnalysisCache cache() { return cache; }

    /**
     * Every system service declared under {@code root}, in path order. Returns what was found so
     * far when cancelled.
     */
    public List<SystemServiceSummary> findSystemServices(Path root, CancellationSignal signal) {
        List<SystemServiceSummary> services = new ArrayList<>();
        for (Path file : finder.findByExtension(root, JAVA_EXTENSION)) {
            if (signal.isCancellationRequested()) {
                System.err.println("[java-insight] System service scan cancelled after "
                    + services.size() + " services");
                return services;
            }
            Optional<JavaFileAnalysis> analysis = analyze(file, signal);
            if (analysis.isPresent() && analysis.get().systemService() != null) {
                services.add(analysis.get().systemService());
            }
        }
        return services;
    }

    /**
     * One timeline per lifecycle file found under {@code root}, grouped by configured file name
     * in configured order.
     */
    public List<LifecycleTimeline> buildLifecycleTimelines(Path root, CancellationSignal signal) {
        List<LifecycleTimeline> timelines = new ArrayList<>();
        for (String fileName : lifecycleExtractor.targetFiles()) {
            if (signal.isCancellationRequested()) {
                return timelines;
            }
            for (Path file : finder.findByFileName(root, fileName)) {
                if (signal.isCancellationRequested()) {
                    return timelines;
                }
                Optional<JavaFileAnalysis> analysis = analyze(file, signal);
                analysis.ifPresent(a -> timelines.add(lifecycleExtractor.extract(file.toString(), a)));
            }
        }
        return timelines;
    }

    public Optional<MethodCallGraph> callGraph(Path file, int cursorOffset) {
        Optional<SourceDocument> document = load(file);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        return cache.getAnalysis(document.get())
            .flatMap(analysis -> callGraphBuilder.build(analysis, file.toString(), cursorOffset));
    }

    /**
     * Call graph of the method at the first non-blank character of {@code line} (1-based).
     */
    public Optional<MethodCallGraph> callGraphAtLine(Path file, int line) {
        Optional<SourceDocument> document = load(file);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        String text = document.get().text();
        int offset = LineIndex.build(text).lineStartOffset(line);
        while (offset < text.length() && (text.charAt(offset) == ' ' || text.charAt(offset) == '\t')) {
            offset++;
        }
        return callGraph(file, offset);
    }

    public Optional<ClassSummary> summary(Path file) {
        return load(file).flatMap(cache::getAnalysis).map(JavaFileAnalysis::summary);
    }

    public List<ConcurrencyWarning> lockWarnings(Path file) {
        return load(file)
            .filter(SourceDocument::isJava)
            .map(document -> lockHazardDetector.detect(document.text()))
            .orElse(Collections.emptyList());
    }

    private Optional<JavaFileAnalysis> analyze(Path file, CancellationSignal signal) {
        return load(file).flatMap(document -> cache.getAnalysis(document, signal));
    }

    /**
     * Reads {@code file} as UTF-8. Unreadable files are reported and yield empty.
     */
    public static Optional<SourceDocument> load(Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(new SourceDocument(file.toUri().toString(), file.toString(), languageOf(file), text));
        } catch (IOException e) {
            System.err.println("[java-insight] Warning: skipping unreadable file " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    static String languageOf(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(JAVA_EXTENSION)) {
            return SourceDocument.JAVA_LANGUAGE;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : "plaintext";
    }
}
