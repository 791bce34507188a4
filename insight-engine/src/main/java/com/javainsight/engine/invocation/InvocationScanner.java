package com.javainsight.engine.invocation;

import com.javainsight.engine.model.InsightModel.MethodDecl;
import com.javainsight.engine.model.InsightModel.MethodInvocation;
import com.javainsight.engine.text.LineIndex;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds call-like {@code name(...)} sites in source text and counts their top-level arguments.
 * Purely textual: nothing is resolved to a declaration here.
 */
public class InvocationScanner {

    private static final Pattern CALL_SITE = Pattern.compile("\\b([A-Za-z_$][\\w$]*)\\s*\\(");

    /** Words that can precede '(' without being a call. */
    private static final Set<String> NON_CALL_KEYWORDS = Set.of(
        "if", "for", "while", "switch", "catch", "synchronized", "new", "return",
        "throw", "try", "else", "do", "case", "super", "this", "assert"
    );

    /**
     * Scans the body of every method that has one. An invocation inside a nested body (an anonymous
     * class method) is reported once, at its first discovery.
     */
    public List<MethodInvocation> scanMethodBodies(List<MethodDecl> methods, String source, LineIndex lines) {
        List<MethodInvocation> invocations = new ArrayList<>();
        Set<Integer> seenOffsets = new HashSet<>();
        for (MethodDecl method : methods) {
            if (!method.hasBody()) {
                continue;
            }
            int start = Math.min(method.bodyStartOffset(), source.length());
            int end = Math.min(method.bodyEndOffset(), source.length());
            for (MethodInvocation invocation : scan(source.substring(start, end), start, lines)) {
                if (seenOffsets.add(invocation.startOffset())) {
                    invocations.add(invocation);
                }
            }
        }
        return invocations;
    }

    /**
     * @param text       span to scan
     * @param baseOffset offset of {@code text} within the file
     * @param lines      line index of the whole file
     */
    public List<MethodInvocation> scan(String text, int baseOffset, LineIndex lines) {
        List<MethodInvocation> invocations = new ArrayList<>();
        Matcher matcher = CALL_SITE.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (NON_CALL_KEYWORDS.contains(name)) {
                continue;
            }
            int openParen = matcher.end() - 1;
            int closeParen = findMatchingParen(text, openParen);
            if (closeParen == -1) {
                continue;
            }
            int startOffset = baseOffset + matcher.start();
            invocations.add(new MethodInvocation(
                name,
                countArguments(text.substring(openParen + 1, closeParen)),
                startOffset,
                lines.offsetToLine(startOffset)
            ));
        }
        return invocations;
    }

    /**
     * Index of the ')' balancing the '(' at {@code openIndex}, or -1. Parentheses inside
     * single- or double-quoted literals are ignored; a backslash skips the next char in a literal.
     */
    static int findMatchingParen(String text, int openIndex) {
        int depth = 0;
        char inString = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString != 0) {
                if (ch == '\\' && i + 1 < text.length()) {
                    i++;
                } else if (ch == inString) {
                    inString = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                inString = ch;
            } else if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Top-level comma count + 1, or 0 for blank text. Commas nested in (), <>, [] or {} do not
     * count; each depth is clamped at zero so stray closers cannot go negative.
     */
    public static int countArguments(String argumentText) {
        String trimmed = argumentText.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        int parenDepth = 0;
        int angleDepth = 0;
        int bracketDepth = 0;
        int braceDepth = 0;
        int count = 1;
        for (int i = 0; i < trimmed.length(); i++) {
            switch (trimmed.charAt(i)) {
                case '(' -> parenDepth++;
                case ')' -> parenDepth = Math.max(0, parenDepth - 1);
                case '<' -> angleDepth++;
                case '>' -> angleDepth = Math.max(0, angleDepth - 1);
                case '[' -> bracketDepth++;
                case ']' -> bracketDepth = Math.max(0, bracketDepth - 1);
                case '{' -> braceDepth++;
                case '}' -> braceDepth = Math.max(0, braceDepth - 1);
                case ',' -> {
                    if (parenDepth == 0 && angleDepth == 0 && bracketDepth == 0 && braceDepth == 0) {
                        count++;
                    }
                }
                default -> { }
            }
        }
        return count;
    }
}
