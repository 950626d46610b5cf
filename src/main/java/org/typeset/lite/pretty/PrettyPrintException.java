package org.typeset.lite.pretty;

/**
 * Exception thrown when a syntax tree cannot be printed.
 * 
 * Every well-formed tree has a rendering, so this is only raised when the
 * caller opted into a nesting limit and a tree exceeds it.
 */
public class PrettyPrintException extends RuntimeException {

    private final int depth;

    public PrettyPrintException(String message, int depth) {
        super(message + " (depth " + depth + ")");
        this.depth = depth;
    }

    public int getDepth() {
        return depth;
    }
}
