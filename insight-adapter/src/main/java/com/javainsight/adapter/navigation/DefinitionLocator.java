package com.javainsight.adapter.navigation;

import com.javainsight.adapter.workspace.JavaSourceFinder;
import com.javainsight.engine.CancellationSignal;
import com.javainsight.engine.SourceDocument;
import com.javainsight.engine.text.LineIndex;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Jumps from Java framework code to the non-Java files that declare the same thing:
 * service names to {@code service_contexts} and init {@code .rc} files, native methods to
 * their JNI C++ implementation. Purely textual; the first match wins.
 */
public class DefinitionLocator {

    private static final Pattern PUBLISH_CALL = Pattern.compile("publishBinderService|addService");
    private static final Pattern INIT_REFERENCE = Pattern.compile("start|ctl\\.start|init");
    private static final Pattern NATIVE_KEYWORD = Pattern.compile("\\bnative\\b");

    private final JavaSourceFinder finder;

    public DefinitionLocator(JavaSourceFinder finder) {
        this.finder = finder;
    }

    /**
     * @param line   1-based line of the cursor in {@code document}
     * @param column 0-based column of the cursor
     */
    public Optional<SourceLocation> locate(Path root, SourceDocument document, int line, int column,
                                           CancellationSignal signal) {
        if (!document.isJava()) {
            return Optional.empty();
        }
        LineIndex lines = LineIndex.build(document.text());
        if (line < 1 || line > lines.lineCount()) {
            return Optional.empty();
        }
        String lineText = lines.lineText(document.text(), line);

        String literal = quotedTextAt(lineText, column);
        if (literal != null) {
            if (PUBLISH_CALL.matcher(lineText).find()) {
                return findServiceContext(root, literal, signal);
            }
            if (INIT_REFERENCE.matcher(lineText).find()) {
                return findInitService(root, literal, signal);
            }
        }

        if (NATIVE_KEYWORD.matcher(lineText).find()) {
            String word = wordAt(lineText, column);
            if (word != null) {
                return findJniMethod(root, word, signal);
            }
        }
        return Optional.empty();
    }

    /**
     * Content of the quoted string around {@code column}, or null when the cursor is not inside
     * one. A cursor on the opening quote counts as inside.
     */
    static String quotedTextAt(String lineText, int column) {
        int open = lineText.lastIndexOf('"', column);
        if (open < 0) {
            return null;
        }
        int close = lineText.indexOf('"', open + 1);
        if (close < 0 || column > close) {
            return null;
        }
        return lineText.substring(open + 1, close);
    }

    /** Word of {@code [A-Za-z0-9_]} characters touching {@code column}, or null. */
    static String wordAt(String lineText, int column) {
        int at = Math.min(Math.max(column, 0), lineText.length());
        int start = at;
        while (start > 0 && isWordChar(lineText.charAt(start - 1))) {
            start--;
        }
        int end = at;
        while (end < lineText.length() && isWordChar(lineText.charAt(end))) {
            end++;
        }
        return start < end ? lineText.substring(start, end) : null;
    }

    private static boolean isWordChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }

    private Optional<SourceLocation> findServiceContext(Path root, String serviceName, CancellationSignal signal) {
        return firstMatchingLine(finder.findByFileName(root, "service_contexts"), serviceName, false, signal);
    }

    private Optional<SourceLocation> findInitService(Path root, String serviceName, CancellationSignal signal) {
        return firstMatchingLine(finder.findByExtension(root, ".rc"), serviceName, true, signal);
    }

    private Optional<SourceLocation> findJniMethod(Path root, String methodName, CancellationSignal signal) {
        for (Path file : finder.findByExtensionUnder(root, "jni", ".cpp")) {
            if (signal.isCancellationRequested()) {
                return Optional.empty();
            }
            String text = read(file);
            int index = text != null ? text.indexOf(methodName) : -1;
            if (index >= 0) {
                LineIndex lines = LineIndex.build(text);
                int line = lines.offsetToLine(index);
                return Optional.of(new SourceLocation(file, line, index - lines.lineStartOffset(line)));
            }
        }
        return Optional.empty();
    }

    private Optional<SourceLocation> firstMatchingLine(List<Path> files, String needle, boolean serviceLinesOnly,
                                                       CancellationSignal signal) {
        for (Path file : files) {
            if (signal.isCancellationRequested()) {
                return Optional.empty();
            }
            String text = read(file);
            if (text == null) {
                continue;
            }
            String[] lines = text.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                if (serviceLinesOnly && !line.startsWith("service ")) {
                    continue;
                }
                int column = line.indexOf(needle);
                if (column >= 0) {
                    return Optional.of(new SourceLocation(file, i + 1, column));
                }
            }
        }
        return Optional.empty();
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("[java-insight] Warning: skipping unreadable file " + file + ": " + e.getMessage());
            return null;
        }
    }
}
