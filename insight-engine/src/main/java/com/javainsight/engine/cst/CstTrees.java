package com.javainsight.engine.cst;

import com.javainsight.engine.model.InsightModel.TextRange;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Generic traversal helpers over a concrete syntax tree.
 * Nothing here knows what a node or token means; Java-specific logic lives in the callers.
 */
public final class CstTrees {

    private static final Comparator<SyntaxToken> BY_START = Comparator.comparingInt(SyntaxToken::startOffset);

    private CstTrees() {}

    /**
     * Depth-first collection of every token under {@code node}, in slot order.
     * Slot order is not necessarily source order; use {@link #sortedBySource} when it matters.
     */
    public static List<SyntaxToken> collectTokens(SyntaxNode node) {
        List<SyntaxToken> out = new ArrayList<>();
        collectTokens(node, out);
        return out;
    }

    public static void collectTokens(SyntaxNode node, List<SyntaxToken> out) {
        for (List<SyntaxElement> slot : node.children().values()) {
            for (SyntaxElement element : slot) {
                if (element instanceof SyntaxToken) {
                    out.add((SyntaxToken) element);
                } else if (element instanceof SyntaxNode) {
                    collectTokens((SyntaxNode) element, out);
                }
            }
        }
    }

    /**
     * Pre-order search for the first node named {@code name}, including {@code node} itself.
     *
     * @return the node, or null when absent
     */
    public static SyntaxNode findFirstNode(SyntaxNode node, String name) {
        if (node.name().equals(name)) {
            return node;
        }
        for (List<SyntaxElement> slot : node.children().values()) {
            for (SyntaxElement element : slot) {
                if (element instanceof SyntaxNode) {
                    SyntaxNode found = findFirstNode((SyntaxNode) element, name);
                    if (found != null) {
                        return found;
                    }
                }
            }
        }
        return null;
    }

    /**
     * Pre-order collection of every node named {@code name}. Matches nested inside other
     * matches are included.
     */
    public static List<SyntaxNode> findAllNodes(SyntaxNode node, String name) {
        List<SyntaxNode> out = new ArrayList<>();
        findAllNodes(node, name, out);
        return out;
    }

    public static void findAllNodes(SyntaxNode node, String name, List<SyntaxNode> out) {
        if (node.name().equals(name)) {
            out.add(node);
        }
        for (List<SyntaxElement> slot : node.children().values()) {
            for (SyntaxElement element : slot) {
                if (element instanceof SyntaxNode) {
                    findAllNodes((SyntaxNode) element, name, out);
                }
            }
        }
    }

    /**
     * Slices {@code source} from the earliest token start to the latest token end and trims it.
     * Returns an empty string for no tokens.
     */
    public static String tokensToText(List<SyntaxToken> tokens, String source) {
        TextRange range = tokenRange(tokens);
        if (range == null) {
            return "";
        }
        int end = Math.min(range.endOffset(), source.length());
        int start = Math.min(range.startOffset(), end);
        return source.substring(start, end).trim();
    }

    /** Source-ordered copy of {@code tokens}. */
    public static List<SyntaxToken> sortedBySource(List<SyntaxToken> tokens) {
        List<SyntaxToken> sorted = new ArrayList<>(tokens);
        sorted.sort(BY_START);
        return sorted;
    }

    /**
     * Range covered by a node's tokens, end exclusive.
     *
     * @return the range, or null when the node holds no tokens
     */
    public static TextRange nodeRange(SyntaxNode node) {
        return tokenRange(collectTokens(node));
    }

    private static TextRange tokenRange(List<SyntaxToken> tokens) {
        if (tokens.isEmpty()) {
            return null;
        }
        List<SyntaxToken> sorted = sortedBySource(tokens);
        SyntaxToken first = sorted.get(0);
        SyntaxToken last = sorted.get(sorted.size() - 1);
        return new TextRange(first.startOffset(), Math.max(first.startOffset(), last.effectiveEndOffset() + 1));
    }
}
