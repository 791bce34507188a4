package com.javainsight.adapter.navigation;

import java.nio.file.Path;

/**
 * @param line   1-based
 * @param column 0-based
 */
public record SourceLocation(Path path, int line, int column) {}
