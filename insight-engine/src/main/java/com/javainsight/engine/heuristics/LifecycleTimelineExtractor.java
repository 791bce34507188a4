package com.javainsight.engine.heuristics;

import com.javainsight.engine.model.InsightModel.JavaFileAnalysis;
import com.javainsight.engine.model.InsightModel.LifecycleEntry;
import com.javainsight.engine.model.InsightModel.LifecycleTimeline;
import com.javainsight.engine.model.InsightModel.MethodDecl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Orders the well-known startup methods of framework entry files (ZygoteInit, SystemServer)
 * by source line.
 */
public class LifecycleTimelineExtractor {

    public static final List<String> DEFAULT_TARGET_FILES = List.of("ZygoteInit.java", "SystemServer.java");

    public static final List<String> DEFAULT_LIFECYCLE_METHODS =
        List.of("main", "startBootstrapServices", "startCoreServices", "startOtherServices");

    private final List<String> targetFiles;
    private final Set<String> lifecycleMethods;

    public LifecycleTimelineExtractor() {
        this(DEFAULT_TARGET_FILES, DEFAULT_LIFECYCLE_METHODS);
    }

    public LifecycleTimelineExtractor(List<String> targetFiles, List<String> lifecycleMethods) {
        this.targetFiles = List.copyOf(targetFiles);
        this.lifecycleMethods = Set.copyOf(lifecycleMethods);
    }

    public List<String> targetFiles() { return targetFiles; }

    public LifecycleTimeline extract(String filePath, JavaFileAnalysis analysis) {
        List<LifecycleEntry> entries = new ArrayList<>();
        for (MethodDecl method : analysis.methodDecls()) {
            if (lifecycleMethods.contains(method.name())) {
                entries.add(new LifecycleEntry(method.name(), method.startLine()));
            }
        }
        entries.sort(Comparator.comparingInt(LifecycleEntry::line));
        return new LifecycleTimeline(filePath, analysis.summary().className(), entries);
    }
}
