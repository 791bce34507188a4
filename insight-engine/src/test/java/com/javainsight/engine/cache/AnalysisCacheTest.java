package com.javainsight.engine.cache;

import com.javainsight.engine.CountingParser;
import com.javainsight.engine.JavaFileAnalyzer;
import com.javainsight.engine.SourceDocument;
import com.javainsight.engine.model.InsightModel.JavaFileAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisCacheTest {

    private CountingParser parser;
    private AnalysisCache cache;

    @BeforeEach
    void setUp() {
        parser = new CountingParser();
        cache = new AnalysisCache(new JavaFileAnalyzer(parser));
    }

    private static SourceDocument java(String text) {
        return new SourceDocument("file:///src/Foo.java", "/src/Foo.java", "java", text);
    }

    @Test
    void identicalTextIsAnalyzedOnce() {
        JavaFileAnalysis first = cache.getAnalysis(java("class Foo {}")).orElseThrow();
        JavaFileAnalysis second = cache.getAnalysis(java("class Foo {}")).orElseThrow();
        assertSame(first, second);
        assertEquals(1, parser.calls());
    }

    @Test
    void whitespaceOnlyChangeIsANewKey() {
        cache.getAnalysis(java("class Foo {}"));
        cache.getAnalysis(java("class Foo  {}"));
        assertEquals(2, parser.calls());
    }

    @Test
    void sameLengthIdentifierChangeIsANewKey() {
        cache.getAnalysis(java("class Foo {}"));
        cache.getAnalysis(java("class Fob {}"));
        assertEquals(2, parser.calls());
    }

    @Test
    void changedContentReplacesTheEntry() {
        cache.getAnalysis(java("class Foo {}"));
        cache.getAnalysis(java("class Foo { }"));
        assertEquals(1, cache.size());
        cache.getAnalysis(java("class Foo { }"));
        assertEquals(2, parser.calls());
    }

    @Test
    void nonJavaDocumentIsNotApplicable() {
        SourceDocument kotlin = new SourceDocument("file:///src/Foo.kt", "/src/Foo.kt", "kotlin", "class Foo");
        assertTrue(cache.getAnalysis(kotlin).isEmpty());
        assertEquals(0, parser.calls());
    }

    @Test
    void oversizedDocumentSkipsTheParser() {
        AnalysisCache small = new AnalysisCache(new JavaFileAnalyzer(parser), 16);
        JavaFileAnalysis analysis = small.getAnalysis(java("class Foo { int a; int b; }")).orElseThrow();
        assertEquals(0, parser.calls());
        assertEquals("Foo", analysis.summary().className());
        assertEquals("", analysis.summary().packageName());
        assertTrue(analysis.methodDecls().isEmpty());
        assertTrue(analysis.methodInvocations().isEmpty());
        assertNull(analysis.systemService());
    }

    @Test
    void sizeLimitCountsUtf8Bytes() {
        // 8 chars, 16 bytes
        String text = "éééééééé";
        assertTrue(new AnalysisCache(new JavaFileAnalyzer(parser), 16).getAnalysis(java(text)).isPresent());
        assertEquals(1, parser.calls());
        new AnalysisCache(new JavaFileAnalyzer(parser), 15).getAnalysis(java(text));
        assertEquals(1, parser.calls());
    }

    @Test
    void parseFailureIsUnavailableAndNotCached() {
        Optional<JavaFileAnalysis> result = cache.getAnalysis(java("class Foo { #error }"));
        assertTrue(result.isEmpty());
        assertEquals(0, cache.size());
        cache.getAnalysis(java("class Foo { #error }"));
        assertEquals(2, parser.calls());
    }

    @Test
    void cancelledMissDoesNotParse() {
        assertTrue(cache.getAnalysis(java("class Foo {}"), () -> true).isEmpty());
        assertEquals(0, parser.calls());
    }

    @Test
    void cancelledHitStillReturnsCachedResult() {
        cache.getAnalysis(java("class Foo {}"));
        assertTrue(cache.getAnalysis(java("class Foo {}"), () -> true).isPresent());
        assertEquals(1, parser.calls());
    }

    @Test
    void evictAndClear() {
        cache.getAnalysis(java("class Foo {}"));
        cache.getAnalysis(new SourceDocument("file:///src/Bar.java", "/src/Bar.java", "java", "class Bar {}"));
        assertEquals(2, cache.size());

        cache.evict("file:///src/Foo.java");
        assertEquals(1, cache.size());
        cache.getAnalysis(java("class Foo {}"));
        assertEquals(3, parser.calls());

        cache.clear();
        assertEquals(0, cache.size());
    }
}
