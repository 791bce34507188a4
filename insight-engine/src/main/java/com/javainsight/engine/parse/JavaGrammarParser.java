package com.javainsight.engine.parse;

import com.javainsight.engine.cst.SyntaxNode;

/**
 * Turns Java source text into a concrete syntax tree. Implementations live outside the engine.
 */
public interface JavaGrammarParser {

    /**
     * @throws ParseFailedException if the text is not well-formed Java
     */
    SyntaxNode parse(String source);

    class ParseFailedException extends RuntimeException {
        public ParseFailedException(String message) { super(message); }
        public ParseFailedException(String message, Throwable cause) { super(message, cause); }
    }
}
