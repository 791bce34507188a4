package com.javainsight.engine.cst;

/**
 * Leaf token of a concrete syntax tree.
 *
 * Offsets are 0-based char positions into the original source. {@code endOffset} is inclusive
 * and may be null, in which case the token is a single character ending where it starts.
 */
public record SyntaxToken(
    String image,
    int startOffset,
    Integer endOffset
) implements SyntaxElement {

    public SyntaxToken {
        if (image == null) {
            throw new IllegalArgumentException("Token image must not be null");
        }
        if (endOffset != null && endOffset < startOffset) {
            throw new IllegalArgumentException(
                "Token end " + endOffset + " precedes start " + startOffset + " for '" + image + "'");
        }
    }

    /** Inclusive end offset, falling back to the start offset for single-character tokens. */
    public int effectiveEndOffset() {
        return endOffset != null ? endOffset : startOffset;
    }
}
