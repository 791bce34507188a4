package com.javainsight.engine.call_graph;

import com.javainsight.engine.model.InsightModel.JavaFileAnalysis;
import com.javainsight.engine.model.InsightModel.MethodCallGraph;
import com.javainsight.engine.model.InsightModel.MethodDecl;
import com.javainsight.engine.model.InsightModel.MethodInvocation;
import com.javainsight.engine.model.InsightModel.MethodRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the callers and callees of the method under a cursor, within a single file.
 *
 * Invocations resolve to declarations by name and argument count only: overloads with the same
 * arity and inherited methods are not told apart.
 */
public class CallGraphBuilder {

    public Optional<MethodCallGraph> build(JavaFileAnalysis analysis, String filePath, int cursorOffset) {
        return build(
            analysis.methodDecls(),
            analysis.methodInvocations(),
            analysis.summary().className(),
            filePath,
            cursorOffset
        );
    }

    /**
     * @return the graph, or empty when no declaration contains {@code cursorOffset}
     */
    public Optional<MethodCallGraph> build(
            List<MethodDecl> methods,
            List<MethodInvocation> invocations,
            String className,
            String filePath,
            int cursorOffset
    ) {
        MethodDecl current = findMethodAt(methods, cursorOffset);
        if (current == null) {
            return Optional.empty();
        }
        String label = className + "." + current.name() + "(" + current.paramsCount() + ")";
        return Optional.of(new MethodCallGraph(
            label,
            findCallers(current, methods, invocations, className, filePath),
            findCallees(current, methods, invocations, className, filePath)
        ));
    }

    /** First declaration whose [start, end] range contains the offset. */
    static MethodDecl findMethodAt(List<MethodDecl> methods, int offset) {
        for (MethodDecl method : methods) {
            if (offset >= method.startOffset() && offset <= method.endOffset()) {
                return method;
            }
        }
        return null;
    }

    /** First declaration whose body range (declaration range when bodiless) contains the offset. */
    static MethodDecl findEnclosingMethod(List<MethodDecl> methods, int offset) {
        for (MethodDecl method : methods) {
            if (offset >= method.scopeStartOffset() && offset <= method.scopeEndOffset()) {
                return method;
            }
        }
        return null;
    }

    private List<MethodRef> findCallees(
            MethodDecl current,
            List<MethodDecl> methods,
            List<MethodInvocation> invocations,
            String className,
            String filePath
    ) {
        List<MethodRef> callees = new ArrayList<>();
        for (MethodInvocation invocation : invocations) {
            if (invocation.startOffset() < current.scopeStartOffset()
                    || invocation.startOffset() > current.scopeEndOffset()) {
                continue;
            }
            MethodDecl target = resolve(methods, invocation);
            if (target != null) {
                callees.add(new MethodRef(className, target.name(), filePath, target.startLine()));
            }
        }
        return callees;
    }

    private List<MethodRef> findCallers(
            MethodDecl current,
            List<MethodDecl> methods,
            List<MethodInvocation> invocations,
            String className,
            String filePath
    ) {
        List<MethodRef> callers = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (MethodInvocation invocation : invocations) {
            if (!invocation.name().equals(current.name()) || invocation.argsCount() != current.paramsCount()) {
                continue;
            }
            MethodDecl caller = findEnclosingMethod(methods, invocation.startOffset());
            if (caller == null) {
                continue;
            }
            // One entry per calling method, however many times it calls.
            if (!seen.add(caller.name() + ":" + caller.startLine())) {
                continue;
            }
            callers.add(new MethodRef(className, caller.name(), filePath, caller.startLine()));
        }
        return callers;
    }

    private MethodDecl resolve(List<MethodDecl> methods, MethodInvocation invocation) {
        for (MethodDecl decl : methods) {
            if (decl.name().equals(invocation.name()) && decl.paramsCount() == invocation.argsCount()) {
                return decl;
            }
        }
        return null;
    }
}
