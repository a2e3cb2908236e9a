package com.spocparser;

/**
 * Thrown when the input can't be parsed. There is no error recovery:
 * the first malformed construct aborts parsing of the whole file.
 */
public class SyntaxException extends RuntimeException {

    private final String expectation;
    private final int line;
    private final String fileName;
    private final String context;

    public SyntaxException(String expectation, int line, String fileName, String context) {
        super("Syntax error: " + expectation + " at line " + line + " of " + fileName
            + ", near \"" + context + "\"");
        this.expectation = expectation;
        this.line = line;
        this.fileName = fileName;
        this.context = context;
    }

    /**
     * What the parser expected, e.g. "Interface name expected".
     */
    public String getExpectation() {
        return expectation;
    }

    /**
     * 1-based line number.
     */
    public int getLine() {
        return line;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Source text around the error position with the marker {@code <--HERE-->}.
     */
    public String getContext() {
        return context;
    }
}
