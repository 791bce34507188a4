package com.javainsight.engine;

import java.nio.file.Path;

/**
 * Document handed over by the host.
 *
 * @param identity   cache key, typically a URI string
 * @param fileName   path or name of the backing file
 * @param languageId language marker; only {@value #JAVA_LANGUAGE} is analyzed
 * @param text       full current content
 */
public record SourceDocument(
    String identity,
    String fileName,
    String languageId,
    String text
) {
    public static final String JAVA_LANGUAGE = "java";

    public boolean isJava() {
        return JAVA_LANGUAGE.equals(languageId);
    }

    /** File base name without the {@code .java} extension. */
    public String fallbackClassName() {
        Path name = Path.of(fileName).getFileName();
        String base = name != null ? name.toString() : fileName;
        return base.endsWith(".java") ? base.substring(0, base.length() - ".java".length()) : base;
    }
}
