package com.javainsight.engine.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Value types produced by the analysis engine. All are immutable and created fresh per request.
 */
public final class InsightModel {

    private InsightModel() {}

    /** Half-open char range [startOffset, endOffset). */
    public record TextRange(int startOffset, int endOffset) {
        public TextRange {
            if (startOffset < 0 || endOffset < startOffset) {
                throw new IllegalArgumentException("Invalid range [" + startOffset + ", " + endOffset + ")");
            }
        }
    }

    public record FieldSummary(
        String name,
        String type,
        Visibility visibility,
        boolean isStatic,
        int startLine
    ) {}

    public record MethodSummary(
        String name,
        int paramsCount,
        Visibility visibility,
        boolean isStatic,
        int startLine
    ) {}

    /**
     * A method declaration with its source offsets. Body offsets are either both present
     * or both null (abstract and native methods).
     */
    public record MethodDecl(
        String name,
        int paramsCount,
        Visibility visibility,
        boolean isStatic,
        int startLine,
        String signature,
        int startOffset,
        int endOffset,
        Integer bodyStartOffset,
        Integer bodyEndOffset
    ) {
        public MethodDecl {
            if (endOffset < startOffset) {
                throw new IllegalArgumentException("Method " + name + " ends before it starts");
            }
            if ((bodyStartOffset == null) != (bodyEndOffset == null)) {
                throw new IllegalArgumentException("Method " + name + " has only one body offset");
            }
            if (bodyStartOffset != null && bodyEndOffset < bodyStartOffset) {
                throw new IllegalArgumentException("Method " + name + " body ends before it starts");
            }
        }

        public boolean hasBody() { return bodyStartOffset != null; }

        /** Body start when there is a body, declaration start otherwise. */
        public int scopeStartOffset() { return hasBody() ? bodyStartOffset : startOffset; }

        public int scopeEndOffset() { return hasBody() ? bodyEndOffset : endOffset; }

        public MethodSummary toSummary() {
            return new MethodSummary(name, paramsCount, visibility, isStatic, startLine);
        }
    }

    /** A call-like site found in a method body. Not resolved to any declaration. */
    public record MethodInvocation(
        String name,
        int argsCount,
        int startOffset,
        int line
    ) {}

    public record MethodRef(
        String className,
        String methodName,
        String filePath,
        int line
    ) {
        /** {@code Class.method · File.java:line} */
        public String displayLabel() {
            Path fileName = Path.of(filePath).getFileName();
            String file = fileName != null ? fileName.toString() : filePath;
            return className + "." + methodName + " · " + file + ":" + line;
        }
    }

    public record MethodCallGraph(
        String method,
        List<MethodRef> callers,
        List<MethodRef> callees
    ) {
        public MethodCallGraph {
            callers = List.copyOf(callers);
            callees = List.copyOf(callees);
        }
    }

    public record ClassSummary(
        String className,
        String packageName,
        List<FieldSummary> fields,
        List<MethodSummary> methods,
        List<String> innerClasses
    ) {
        public ClassSummary {
            fields = List.copyOf(fields);
            methods = List.copyOf(methods);
            innerClasses = List.copyOf(innerClasses);
        }

        public static ClassSummary empty(String className) {
            return new ClassSummary(className, "", List.of(), List.of(), List.of());
        }
    }

    public record BinderService(String name, int line) {}

    /** Lifecycle facts of a class that extends SystemService. {@code onStartLine} may be null. */
    public record SystemServiceSummary(
        String serviceClass,
        Integer onStartLine,
        List<Integer> onBootPhases,
        List<BinderService> binderServices
    ) {
        public SystemServiceSummary {
            onBootPhases = List.copyOf(onBootPhases);
            binderServices = List.copyOf(binderServices);
        }
    }

    public record LifecycleEntry(String name, int line) {}

    /** Well-known startup methods of one file, sorted by line. */
    public record LifecycleTimeline(
        String filePath,
        String className,
        List<LifecycleEntry> entries
    ) {
        public LifecycleTimeline {
            entries = List.copyOf(entries);
        }

        /** {@code Class (File.java)} */
        public String displayLabel() {
            Path fileName = Path.of(filePath).getFileName();
            return className + " (" + (fileName != null ? fileName.toString() : filePath) + ")";
        }
    }

    /**
     * A hazard found inside a synchronized block. {@code range} runs from the
     * {@code synchronized} keyword through the block's closing brace.
     */
    public record ConcurrencyWarning(
        TextRange range,
        int line,
        String message
    ) {}

    /** Everything the engine derives from one file. {@code systemService} may be null. */
    public record JavaFileAnalysis(
        ClassSummary summary,
        List<MethodDecl> methodDecls,
        List<MethodInvocation> methodInvocations,
        SystemServiceSummary systemService
    ) {
        public JavaFileAnalysis {
            methodDecls = List.copyOf(methodDecls);
            methodInvocations = List.copyOf(methodInvocations);
        }

        /** Result for a file that was not parsed: fallback name, no members. */
        public static JavaFileAnalysis empty(String fallbackClassName) {
            return new JavaFileAnalysis(ClassSummary.empty(fallbackClassName), List.of(), List.of(), null);
        }
    }
}
