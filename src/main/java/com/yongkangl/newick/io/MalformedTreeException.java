package com.yongkangl.newick.io;

/**
 * Thrown when the separators of a Newick string do not describe a single well-formed tree.
 */
public class MalformedTreeException extends IllegalArgumentException {
    private final int tokenIndex;

    public MalformedTreeException(String message, int tokenIndex) {
        super(message + " (token " + tokenIndex + ")");
        this.tokenIndex = tokenIndex;
    }

    public int getTokenIndex() {
        return tokenIndex;
    }
}
