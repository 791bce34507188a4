package com.javainsight.adapter.config;

import com.google.gson.annotations.SerializedName;
import com.javainsight.engine.cache.AnalysisCache;
import com.javainsight.engine.heuristics.LifecycleTimelineExtractor;

import java.util.List;

/**
 * Deserialized form of the optional insight config JSON. Absent keys fall back to defaults.
 */
public class InsightConfig {

    static final List<String> DEFAULT_EXCLUDED_DIRS = List.of("out", "build", ".gradle", "node_modules");

    /** Files larger than this many UTF-8 bytes are not parsed. */
    @SerializedName("max_parse_bytes")
    private Long maxParseBytes;

    /** Directory names skipped by workspace scans, at any depth. */
    @SerializedName("excluded_dirs")
    private List<String> excludedDirs;

    @SerializedName("lifecycle_files")
    private List<String> lifecycleFiles;

    @SerializedName("lifecycle_methods")
    private List<String> lifecycleMethods;

    public static InsightConfig defaults() {
        return new InsightConfig();
    }

    public long getMaxParseBytes() {
        return maxParseBytes != null ? maxParseBytes : AnalysisCache.DEFAULT_MAX_PARSE_BYTES;
    }

    public List<String> getExcludedDirs() {
        return excludedDirs != null ? excludedDirs : DEFAULT_EXCLUDED_DIRS;
    }

    public List<String> getLifecycleFiles() {
        return lifecycleFiles != null ? lifecycleFiles : LifecycleTimelineExtractor.DEFAULT_TARGET_FILES;
    }

    public List<String> getLifecycleMethods() {
        return lifecycleMethods != null ? lifecycleMethods : LifecycleTimelineExtractor.DEFAULT_LIFECYCLE_METHODS;
    }
}
