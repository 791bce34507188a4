package com.javainsight.engine.heuristics;

import com.javainsight.engine.model.InsightModel.BinderService;
import com.javainsight.engine.model.InsightModel.MethodDecl;
import com.javainsight.engine.model.InsightModel.MethodInvocation;
import com.javainsight.engine.model.InsightModel.SystemServiceSummary;
import com.javainsight.engine.text.LineIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes classes whose header says {@code extends SystemService} and reports their
 * lifecycle hooks and published binder services. Naming heuristic only: no type resolution.
 */
public class SystemServiceDetector {

    static final String UNKNOWN_SERVICE = "<unknown>";

    private static final Pattern EXTENDS_SYSTEM_SERVICE = Pattern.compile("extends\\s+SystemService\\b");
    private static final Pattern QUOTED_TEXT = Pattern.compile("\"([^\"]+)\"");
    private static final Set<String> PUBLISH_CALLS = Set.of("publishBinderService", "addService");

    /**
     * @param classHeader primary class header text, or null when the file has no class
     * @return the summary, or null when the header does not extend SystemService
     */
    public SystemServiceSummary detect(
            String className,
            String classHeader,
            List<MethodDecl> methods,
            List<MethodInvocation> invocations,
            String source,
            LineIndex lines
    ) {
        if (classHeader == null || !EXTENDS_SYSTEM_SERVICE.matcher(classHeader).find()) {
            return null;
        }

        Integer onStartLine = null;
        List<Integer> bootPhases = new ArrayList<>();
        for (MethodDecl method : methods) {
            if (onStartLine == null && method.name().equals("onStart")) {
                onStartLine = method.startLine();
            } else if (method.name().equals("onBootPhase")) {
                bootPhases.add(method.startLine());
            }
        }

        List<BinderService> binderServices = new ArrayList<>();
        for (MethodInvocation invocation : invocations) {
            if (!PUBLISH_CALLS.contains(invocation.name())) {
                continue;
            }
            Matcher quoted = QUOTED_TEXT.matcher(lines.lineText(source, invocation.line()));
            String name = quoted.find() ? quoted.group(1) : UNKNOWN_SERVICE;
            binderServices.add(new BinderService(name, invocation.line()));
        }

        return new SystemServiceSummary(className, onStartLine, bootPhases, binderServices);
    }
}
