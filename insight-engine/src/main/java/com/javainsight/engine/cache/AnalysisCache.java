package com.javainsight.engine.cache;

import com.javainsight.engine.CancellationSignal;
import com.javainsight.engine.JavaFileAnalyzer;
import com.javainsight.engine.SourceDocument;
import com.javainsight.engine.model.InsightModel.JavaFileAnalysis;
import com.javainsight.engine.parse.JavaGrammarParser.ParseFailedException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes {@link JavaFileAnalyzer} results per document identity, keyed by content size and
 * fingerprint. Entries are replaced whole on change and only removed through {@link #evict}
 * or {@link #clear}.
 *
 * Two threads missing on the same document may both analyze it; the later result wins.
 */
public class AnalysisCache {

    public static final long DEFAULT_MAX_PARSE_BYTES = 1024 * 1024;

    private record Entry(int hash, long size, JavaFileAnalysis analysis) {}

    private final JavaFileAnalyzer analyzer;
    private final long maxParseBytes;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public AnalysisCache(JavaFileAnalyzer analyzer) {
        this(analyzer, DEFAULT_MAX_PARSE_BYTES);
    }

    public AnalysisCache(JavaFileAnalyzer analyzer, long maxParseBytes) {
        this.analyzer = analyzer;
        this.maxParseBytes = maxParseBytes;
    }

    /**
     * Returns the analysis of {@code document}.
     * <ul>
     *   <li>non-Java documents: empty (not applicable)</li>
     *   <li>documents over the size limit: an empty analysis, without parsing</li>
     *   <li>unchanged content: the cached result</li>
     *   <li>cancellation or parse failure: empty (unavailable), nothing cached</li>
     * </ul>
     */
    public Optional<JavaFileAnalysis> getAnalysis(SourceDocument document, CancellationSignal signal) {
        if (!document.isJava()) {
            return Optional.empty();
        }
        String text = document.text();
        long size = ContentFingerprint.utf8Size(text);
        if (size > maxParseBytes) {
            System.err.println("[java-insight] Skipping " + document.fileName() + ": "
                + size + " bytes exceeds limit of " + maxParseBytes);
            return Optional.of(JavaFileAnalysis.empty(document.fallbackClassName()));
        }

        int hash = ContentFingerprint.hash(text);
        Entry cached = entries.get(document.identity());
        if (cached != null && cached.hash() == hash && cached.size() == size) {
            return Optional.of(cached.analysis());
        }

        if (signal.isCancellationRequested()) {
            return Optional.empty();
        }

        try {
            JavaFileAnalysis analysis = analyzer.analyze(text, document.fallbackClassName());
            entries.put(document.identity(), new Entry(hash, size, analysis));
            return Optional.of(analysis);
        } catch (ParseFailedException e) {
            System.err.println("[java-insight] Warning: analysis unavailable for "
                + document.fileName() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<JavaFileAnalysis> getAnalysis(SourceDocument document) {
        return getAnalysis(document, CancellationSignal.NONE);
    }

    public void evict(String identity) {
        entries.remove(identity);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
