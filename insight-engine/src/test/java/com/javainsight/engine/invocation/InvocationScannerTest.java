package com.javainsight.engine.invocation;

import com.javainsight.engine.model.InsightModel.MethodDecl;
import com.javainsight.engine.model.InsightModel.MethodInvocation;
import com.javainsight.engine.model.Visibility;
import com.javainsight.engine.text.LineIndex;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InvocationScannerTest {

    private final InvocationScanner scanner = new InvocationScanner();

    private List<MethodInvocation> scan(String text) {
        return scanner.scan(text, 0, LineIndex.build(text));
    }

    private MethodInvocation only(String text, String name) {
        return scan(text).stream()
            .filter(i -> i.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No invocation of " + name + " in: " + text));
    }

    // --- Argument counting ---

    @Test
    void nestedCallArgumentsDoNotCount() {
        assertEquals(3, only("f(a, b.g(c, d), e);", "f").argsCount());
        assertEquals(2, only("f(a, b.g(c, d), e);", "g").argsCount());
    }

    @Test
    void emptyArgumentListIsZero() {
        assertEquals(0, only("f();", "f").argsCount());
        assertEquals(0, only("f(   );", "f").argsCount());
    }

    @Test
    void arrayInitializerIsOneArgument() {
        assertEquals(1, only("f(new int[]{1,2,3});", "f").argsCount());
    }

    @Test
    void genericTypeArgumentsDoNotCount() {
        assertEquals(1, InvocationScanner.countArguments("Map<String, Integer> m"));
        assertEquals(2, InvocationScanner.countArguments("Map<String, List<Integer>> m, int n"));
    }

    @Test
    void strayClosersDoNotGoNegative() {
        assertEquals(2, InvocationScanner.countArguments("a), b"));
        assertEquals(3, InvocationScanner.countArguments("a >> 1, b ] , c"));
    }

    // --- Matching parentheses ---

    @Test
    void parenthesesInStringsAreIgnored() {
        String text = "log(\")\", x); after();";
        assertEquals(2, only(text, "log").argsCount());
        assertEquals(text.indexOf("after"), only(text, "after").startOffset());
    }

    @Test
    void escapedQuoteStaysInsideString() {
        assertEquals(2, only("log(\"say \\\")\", x);", "log").argsCount());
        assertEquals(1, only("put(')');", "put").argsCount());
    }

    @Test
    void unbalancedCallIsDropped() {
        assertTrue(scan("broken(a, b").isEmpty());
    }

    // --- Keywords ---

    @Test
    void controlFlowKeywordsAreNotCalls() {
        String text = "if (a) { while (b) { synchronized (c) { run(); } } } return (x); super(y); this(z);";
        List<String> names = scan(text).stream().map(MethodInvocation::name).collect(Collectors.toList());
        assertEquals(List.of("run"), names);
    }

    @Test
    void constructorCallReportsTypeName() {
        assertEquals(List.of("Binder"),
            scan("new Binder();").stream().map(MethodInvocation::name).collect(Collectors.toList()));
    }

    // --- Offsets and lines ---

    @Test
    void offsetsAreShiftedByBase() {
        String file = "class A {\n  void m() {\n    call(1);\n  }\n}";
        int bodyStart = file.indexOf("{", file.indexOf("m()"));
        int bodyEnd = file.lastIndexOf("}", file.length() - 2) + 1;
        List<MethodInvocation> found =
            scanner.scan(file.substring(bodyStart, bodyEnd), bodyStart, LineIndex.build(file));
        assertEquals(1, found.size());
        assertEquals(file.indexOf("call"), found.get(0).startOffset());
        assertEquals(3, found.get(0).line());
    }

    @Test
    void scanMethodBodiesSkipsBodilessAndDuplicates() {
        String file = "void outer() { new Runnable() { public void run() { work(); } }; }";
        int outerStart = file.indexOf("{");
        int innerStart = file.indexOf("{", file.indexOf("run()"));
        int innerEnd = file.indexOf("}") + 1;
        MethodDecl outer = new MethodDecl("outer", 0, Visibility.PACKAGE, false, 1, "void outer()",
            0, file.length(), outerStart, file.length());
        MethodDecl inner = new MethodDecl("run", 0, Visibility.PUBLIC, false, 1, "void run()",
            file.indexOf("public"), innerEnd, innerStart, innerEnd);
        MethodDecl bodiless = new MethodDecl("tick", 0, Visibility.PACKAGE, false, 1, "void tick()",
            0, 5, null, null);

        List<MethodInvocation> found =
            scanner.scanMethodBodies(List.of(outer, inner, bodiless), file, LineIndex.build(file));
        List<String> names = found.stream().map(MethodInvocation::name).collect(Collectors.toList());
        assertEquals(List.of("Runnable", "run", "work"), names);
    }
}
