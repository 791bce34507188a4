package com.javainsight.engine;

import com.javainsight.engine.cst.SyntaxNode;
import com.javainsight.engine.model.InsightModel.ClassSummary;
import com.javainsight.engine.model.InsightModel.JavaFileAnalysis;
import com.javainsight.engine.model.InsightModel.MethodInvocation;
import com.javainsight.engine.model.InsightModel.SystemServiceSummary;
import com.javainsight.engine.parse.JavaGrammarParser.ParseFailedException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaFileAnalyzerTest {

    private static final String SOURCE = String.join("\n",
        "public class FooService extends SystemService {",
        "    public void onStart() {",
        "        publishBinderService(\"foo\", new Binder());",
        "    }",
        "}");

    private static SyntaxNode fooServiceTree(String source) {
        CstBuilder b = new CstBuilder(source);
        return b.node("compilationUnit",
            b.node("normalClassDeclaration",
                b.tok("public"), b.tok("class"),
                b.node("typeIdentifier", b.tok("FooService")),
                b.node("superclass", b.tok("extends"), b.tok("SystemService")),
                b.node("classBody",
                    b.tok("{"),
                    b.node("methodDeclaration",
                        b.tok("public"),
                        b.node("result", b.tok("void")),
                        b.node("methodDeclarator", b.tok("onStart"), b.tok("("), b.tok(")")),
                        b.node("methodBody",
                            b.tok("{"),
                            b.tok("publishBinderService"), b.tok("("), b.tok("\"foo\""), b.tok(","),
                            b.tok("new"), b.tok("Binder"), b.tok("("), b.tok(")"), b.tok(")"), b.tok(";"),
                            b.tok("}"))),
                    b.tok("}"))));
    }

    @Test
    void analyzesSystemServiceEndToEnd() {
        JavaFileAnalyzer analyzer = new JavaFileAnalyzer(new CountingParser(JavaFileAnalyzerTest::fooServiceTree));
        JavaFileAnalysis analysis = analyzer.analyze(SOURCE, "Fallback");

        assertEquals("FooService", analysis.summary().className());
        assertEquals(1, analysis.methodDecls().size());

        List<MethodInvocation> invocations = analysis.methodInvocations();
        assertEquals(2, invocations.size());
        assertEquals("publishBinderService", invocations.get(0).name());
        assertEquals(2, invocations.get(0).argsCount());
        assertEquals(3, invocations.get(0).line());
        assertEquals("Binder", invocations.get(1).name());
        assertEquals(0, invocations.get(1).argsCount());

        SystemServiceSummary service = analysis.systemService();
        assertNotNull(service);
        assertEquals("FooService", service.serviceClass());
        assertEquals(2, service.onStartLine());
        assertEquals(1, service.binderServices().size());
        assertEquals("foo", service.binderServices().get(0).name());
        assertEquals(3, service.binderServices().get(0).line());
    }

    @Test
    void analyzePropagatesParseFailure() {
        JavaFileAnalyzer analyzer = new JavaFileAnalyzer(new CountingParser());
        assertThrows(ParseFailedException.class, () -> analyzer.analyze("class A { #error }", "A"));
    }

    @Test
    void summarizeDegradesToEmptySummary() {
        JavaFileAnalyzer analyzer = new JavaFileAnalyzer(new CountingParser());
        ClassSummary summary = analyzer.summarize("class A { #error }", "A");
        assertEquals(ClassSummary.empty("A"), summary);
    }

    @Test
    void summarizeReturnsStructure() {
        JavaFileAnalyzer analyzer = new JavaFileAnalyzer(new CountingParser(JavaFileAnalyzerTest::fooServiceTree));
        ClassSummary summary = analyzer.summarize(SOURCE, "Fallback");
        assertEquals("FooService", summary.className());
        assertEquals("onStart", summary.methods().get(0).name());
    }
}
