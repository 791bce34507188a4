package com.javainsight.engine;

import com.javainsight.engine.cst.SyntaxNode;
import com.javainsight.engine.heuristics.SystemServiceDetector;
import com.javainsight.engine.invocation.InvocationScanner;
import com.javainsight.engine.model.InsightModel.ClassSummary;
import com.javainsight.engine.model.InsightModel.JavaFileAnalysis;
import com.javainsight.engine.model.InsightModel.MethodInvocation;
import com.javainsight.engine.model.InsightModel.SystemServiceSummary;
import com.javainsight.engine.parse.JavaGrammarParser;
import com.javainsight.engine.parse.JavaGrammarParser.ParseFailedException;
import com.javainsight.engine.structure.StructuralSummarizer;
import com.javainsight.engine.structure.StructuralSummarizer.StructuralSummary;
import com.javainsight.engine.text.LineIndex;

import java.util.List;

/**
 * Runs the single-file pipeline: parse, summarize structure, scan invocations, detect
 * system-service facts.
 */
public class JavaFileAnalyzer {

    private final JavaGrammarParser parser;
    private final StructuralSummarizer summarizer = new StructuralSummarizer();
    private final InvocationScanner invocationScanner = new InvocationScanner();
    private final SystemServiceDetector systemServiceDetector = new SystemServiceDetector();

    public JavaFileAnalyzer(JavaGrammarParser parser) {
        this.parser = parser;
    }

    /**
     * @throws ParseFailedException when the parser rejects {@code source}
     */
    public JavaFileAnalysis analyze(String source, String fallbackClassName) {
        SyntaxNode root = parser.parse(source);
        LineIndex lines = LineIndex.build(source);

        StructuralSummary structure = summarizer.summarize(root, source, lines, fallbackClassName);
        List<MethodInvocation> invocations =
            invocationScanner.scanMethodBodies(structure.methodDecls(), source, lines);
        SystemServiceSummary systemService = systemServiceDetector.detect(
            structure.summary().className(),
            structure.classHeader(),
            structure.methodDecls(),
            invocations,
            source,
            lines
        );

        return new JavaFileAnalysis(structure.summary(), structure.methodDecls(), invocations, systemService);
    }

    /**
     * Structure only. Unparseable text yields an empty summary named {@code fallbackClassName}.
     */
    public ClassSummary summarize(String source, String fallbackClassName) {
        try {
            SyntaxNode root = parser.parse(source);
            return summarizer.summarize(root, source, fallbackClassName).summary();
        } catch (ParseFailedException e) {
            System.err.println("[java-insight] Warning: could not parse " + fallbackClassName
                + ", using empty summary: " + e.getMessage());
            return ClassSummary.empty(fallbackClassName);
        }
    }
}
