package com.javainsight.engine.heuristics;

import com.javainsight.engine.model.InsightModel.BinderService;
import com.javainsight.engine.model.InsightModel.MethodDecl;
import com.javainsight.engine.model.InsightModel.MethodInvocation;
import com.javainsight.engine.model.InsightModel.SystemServiceSummary;
import com.javainsight.engine.model.Visibility;
import com.javainsight.engine.text.LineIndex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SystemServiceDetectorTest {

    private final SystemServiceDetector detector = new SystemServiceDetector();

    private static MethodDecl method(String name, int line) {
        return new MethodDecl(name, 0, Visibility.PUBLIC, false, line, "void " + name + "()",
            0, 1, null, null);
    }

    private SystemServiceSummary detect(String header, List<MethodDecl> methods,
                                        List<MethodInvocation> invocations, String source) {
        return detector.detect("Foo", header, methods, invocations, source, LineIndex.build(source));
    }

    @Test
    void classWithoutSystemServiceBaseProducesNothing() {
        assertNull(detect("class Foo", List.of(method("onStart", 1)), List.of(), "class Foo { void onStart() {} }"));
    }

    @Test
    void missingClassProducesNothing() {
        assertNull(detect(null, List.of(method("onStart", 1)), List.of(), ""));
    }

    @Test
    void similarlyNamedBaseClassIsNotASystemService() {
        assertNull(detect("class Foo extends SystemServiceManager", List.of(), List.of(), ""));
    }

    @Test
    void systemServiceWithOnlyOnStart() {
        SystemServiceSummary summary = detect("class Foo extends SystemService",
            List.of(method("onStart", 1)), List.of(), "class Foo extends SystemService { void onStart() {} }");
        assertNotNull(summary);
        assertEquals("Foo", summary.serviceClass());
        assertEquals(1, summary.onStartLine());
        assertTrue(summary.onBootPhases().isEmpty());
        assertTrue(summary.binderServices().isEmpty());
    }

    @Test
    void headerMatchToleratesLineBreaks() {
        assertNotNull(detect("public final class Foo extends\n        SystemService", List.of(), List.of(), ""));
    }

    @Test
    void bootPhasesAreCollectedInOrder() {
        SystemServiceSummary summary = detect("class Foo extends SystemService",
            List.of(method("onBootPhase", 12), method("onStart", 4), method("onBootPhase", 30)), List.of(), "");
        assertEquals(4, summary.onStartLine());
        assertEquals(List.of(12, 30), summary.onBootPhases());
    }

    @Test
    void firstOnStartWins() {
        SystemServiceSummary summary = detect("class Foo extends SystemService",
            List.of(method("onStart", 4), method("onStart", 9)), List.of(), "");
        assertEquals(4, summary.onStartLine());
    }

    @Test
    void binderServiceNamesComeFromTheCallLine() {
        String source = String.join("\n",
            "class Foo extends SystemService {",
            "  void onStart() {",
            "    publishBinderService(Context.FOO_SERVICE, mBinder);",
            "    ServiceManager.addService(\"foo_native\", mNative);",
            "    helper(\"ignored\");",
            "  }",
            "}");
        List<MethodInvocation> invocations = List.of(
            new MethodInvocation("publishBinderService", 2, source.indexOf("publishBinderService"), 3),
            new MethodInvocation("addService", 2, source.indexOf("addService"), 4),
            new MethodInvocation("helper", 1, source.indexOf("helper"), 5));

        SystemServiceSummary summary = detect("class Foo extends SystemService",
            List.of(method("onStart", 2)), invocations, source);
        assertEquals(List.of(new BinderService("<unknown>", 3), new BinderService("foo_native", 4)),
            summary.binderServices());
    }
}
