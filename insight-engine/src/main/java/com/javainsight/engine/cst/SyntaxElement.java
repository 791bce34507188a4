package com.javainsight.engine.cst;

/**
 * A child of a {@link SyntaxNode}: either another node or a leaf {@link SyntaxToken}.
 */
public interface SyntaxElement {
}
