package org.javelin;

/**
 * Raised by a text rewriter when the source cannot be rewritten, typically because of
 * unbalanced delimiters. The position is always in original-source coordinates.
 */
public class SyntaxRewriteException extends JavelinException {

    private final String rewriter;
    private final int line;
    private final int column;

    public SyntaxRewriteException(String rewriter, String message, int line, int column) {
        super(rewriter + ": " + message + " at " + line + ":" + column);
        this.rewriter = rewriter;
        this.line = line;
        this.column = column;
    }

    public String getRewriter() {
        return rewriter;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
